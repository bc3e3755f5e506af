package com.dview.profiler.service.session;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import com.dview.profiler.dto.profile.ProfileReport;
import com.dview.profiler.dto.source.DatabaseConnectionRequest;
import com.dview.profiler.dto.source.SheetInfo;

import lombok.Getter;

/**
 * A connected data source plus the state of its latest profiling run. Source fields are fixed at
 * creation; run state is written by the background job and read by status polls, so every
 * transition is synchronized.
 */
@Getter
public class ProfilingSession {

  public enum SourceKind {
    FILE,
    DATABASE
  }

  private final String sessionId;
  private final SourceKind sourceKind;
  private final Path filePath;
  private final String fileName;
  private final DatabaseConnectionRequest connection;
  private final List<SheetInfo> structure;
  private final LocalDateTime createdAt = LocalDateTime.now();

  private ProfilingStatus status = ProfilingStatus.NOT_STARTED;
  private int progress;
  private String error;
  private String taskId;
  private ProfileReport results;

  private ProfilingSession(
      String sessionId,
      SourceKind sourceKind,
      Path filePath,
      String fileName,
      DatabaseConnectionRequest connection,
      List<SheetInfo> structure) {
    this.sessionId = sessionId;
    this.sourceKind = sourceKind;
    this.filePath = filePath;
    this.fileName = fileName;
    this.connection = connection;
    this.structure = List.copyOf(structure);
  }

  static ProfilingSession forFile(
      String sessionId, Path filePath, String fileName, List<SheetInfo> structure) {
    return new ProfilingSession(sessionId, SourceKind.FILE, filePath, fileName, null, structure);
  }

  static ProfilingSession forDatabase(
      String sessionId, DatabaseConnectionRequest connection, List<SheetInfo> structure) {
    return new ProfilingSession(sessionId, SourceKind.DATABASE, null, null, connection, structure);
  }

  /**
   * Moves the session into {@link ProfilingStatus#RUNNING}, clearing the previous run.
   *
   * @throws IllegalStateException if a run is already in progress
   */
  public synchronized void start(String taskId) {
    if (status == ProfilingStatus.RUNNING) {
      throw new IllegalStateException("Profiling is already running for session " + sessionId);
    }
    this.taskId = taskId;
    this.status = ProfilingStatus.RUNNING;
    this.progress = 0;
    this.error = null;
    this.results = null;
  }

  /** Progress never moves backwards within a run. */
  public synchronized void updateProgress(int percent) {
    if (status == ProfilingStatus.RUNNING) {
      progress = Math.max(progress, Math.min(100, Math.max(0, percent)));
    }
  }

  public synchronized void complete(ProfileReport report) {
    this.results = report;
    this.status = ProfilingStatus.COMPLETED;
    this.progress = 100;
  }

  public synchronized void fail(String message) {
    this.status = ProfilingStatus.ERROR;
    this.error = message;
  }

  public synchronized ProfilingStatus getStatus() {
    return status;
  }

  public synchronized int getProgress() {
    return progress;
  }

  public synchronized String getError() {
    return error;
  }

  public synchronized String getTaskId() {
    return taskId;
  }

  public synchronized ProfileReport getResults() {
    return results;
  }

  public synchronized boolean isResultsAvailable() {
    return results != null;
  }
}
