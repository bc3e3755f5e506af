package com.dview.profiler.service.session;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.config.CoreConfig;
import com.dview.profiler.dto.profile.ProfileReport;
import com.dview.profiler.exception.ConfigurationException;
import com.dview.profiler.exception.DataSourceException;
import com.dview.profiler.service.profiling.ProfileOrchestrator;
import com.dview.profiler.service.source.DatabaseConnectorService;
import com.dview.profiler.service.source.FileConnectorService;
import com.dview.profiler.service.source.TableSource;

import lombok.extern.slf4j.Slf4j;

/** Runs profiling for a session in the background and records progress and results on it. */
@Slf4j
@Service
public class ProfilingJobService {

  static final String SESSION_MDC_KEY = "sessionId";

  private final SessionRegistry sessionRegistry;
  private final ProfileOrchestrator profileOrchestrator;
  private final FileConnectorService fileConnectorService;
  private final DatabaseConnectorService databaseConnectorService;
  private final ApplicationProperties properties;
  private final TaskExecutor taskExecutor;

  public ProfilingJobService(
      SessionRegistry sessionRegistry,
      ProfileOrchestrator profileOrchestrator,
      FileConnectorService fileConnectorService,
      DatabaseConnectorService databaseConnectorService,
      ApplicationProperties properties,
      @Qualifier(CoreConfig.PROFILING_TASK_EXECUTOR) TaskExecutor taskExecutor) {
    this.sessionRegistry = sessionRegistry;
    this.profileOrchestrator = profileOrchestrator;
    this.fileConnectorService = fileConnectorService;
    this.databaseConnectorService = databaseConnectorService;
    this.properties = properties;
    this.taskExecutor = taskExecutor;
  }

  /**
   * Starts profiling {@code tables} for a session.
   *
   * @param maxRecords row cap per table; {@code profiler.default-max-records} when {@code null}
   * @return the task id recorded on the session
   * @throws ConfigurationException if {@code maxRecords} is not positive
   * @throws IllegalStateException if the session is already profiling
   */
  public String start(String sessionId, List<String> tables, Integer maxRecords) {
    ProfilingSession session = sessionRegistry.get(sessionId);
    if (tables == null) {
      throw new IllegalArgumentException("tables must not be null");
    }
    int rowCap = maxRecords != null ? maxRecords : properties.getDefaultMaxRecords();
    if (rowCap <= 0) {
      throw new ConfigurationException("max_records must be positive, was " + rowCap);
    }

    String taskId = UUID.randomUUID().toString();
    session.start(taskId);
    List<String> requested = new ArrayList<>(tables);
    log.info(
        "Starting profiling task {} for session {}: {} table(s), max records {}",
        taskId,
        sessionId,
        requested.size(),
        rowCap);

    try {
      taskExecutor.execute(() -> run(session, requested, rowCap));
    } catch (RuntimeException e) {
      session.fail("Could not schedule profiling: " + e.getMessage());
      throw e;
    }
    return taskId;
  }

  /** Row count of one table of the session's source. */
  public long countRecords(String sessionId, String tableName) throws DataSourceException {
    ProfilingSession session = sessionRegistry.get(sessionId);
    if (session.getSourceKind() == ProfilingSession.SourceKind.FILE) {
      return fileConnectorService.getRecordCount(session.getFilePath(), tableName);
    }
    return databaseConnectorService.getRecordCount(session.getConnection(), tableName);
  }

  void run(ProfilingSession session, List<String> tables, int rowCap) {
    MDC.put(SESSION_MDC_KEY, session.getSessionId());
    try (TableSource source = openSource(session)) {
      ProfileReport report =
          profileOrchestrator.profile(tables, rowCap, source, session::updateProgress);
      session.complete(report);
      log.info("Profiling task {} completed: {} table(s)", session.getTaskId(), report.size());
    } catch (DataSourceException | ConfigurationException e) {
      log.warn("Profiling task {} failed: {}", session.getTaskId(), e.getMessage());
      session.fail(e.getMessage());
    } catch (RuntimeException e) {
      log.error("Profiling task {} failed unexpectedly", session.getTaskId(), e);
      session.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    } finally {
      sessionRegistry.releaseIfRemoved(session);
      MDC.remove(SESSION_MDC_KEY);
    }
  }

  private TableSource openSource(ProfilingSession session) throws DataSourceException {
    if (session.getSourceKind() == ProfilingSession.SourceKind.FILE) {
      return fileConnectorService.tableSource(session.getFilePath());
    }
    return databaseConnectorService.tableSource(session.getConnection());
  }
}
