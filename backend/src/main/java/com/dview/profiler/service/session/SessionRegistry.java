package com.dview.profiler.service.session;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Service;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.dto.source.DatabaseConnectionRequest;
import com.dview.profiler.dto.source.SheetInfo;
import com.dview.profiler.exception.ResourceNotFoundException;
import com.dview.profiler.service.source.FileConnectorService;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalNotification;

import lombok.extern.slf4j.Slf4j;

/**
 * In-memory session store backed by a Guava cache. Idle sessions expire after {@code
 * profiler.session.expire-after-access-minutes} and the least recently used are evicted past {@code
 * profiler.session.max-sessions}. The upload behind a removed file session is deleted, or once its
 * running profiling task ends.
 */
@Slf4j
@Service
public class SessionRegistry {

  private final Cache<String, ProfilingSession> sessions;
  private final FileConnectorService fileConnectorService;

  public SessionRegistry(
      ApplicationProperties properties, FileConnectorService fileConnectorService) {
    this.fileConnectorService = fileConnectorService;
    ApplicationProperties.Session config = properties.getSession();
    this.sessions =
        CacheBuilder.newBuilder()
            .maximumSize(config.getMaxSessions())
            .expireAfterAccess(config.getExpireAfterAccessMinutes(), TimeUnit.MINUTES)
            .removalListener(this::onRemoval)
            .build();
  }

  public ProfilingSession createFileSession(
      Path filePath, String fileName, List<SheetInfo> sheets) {
    ProfilingSession session = ProfilingSession.forFile(newId(), filePath, fileName, sheets);
    sessions.put(session.getSessionId(), session);
    log.info("Opened file session {} for '{}'", session.getSessionId(), fileName);
    return session;
  }

  public ProfilingSession createDatabaseSession(
      DatabaseConnectionRequest connection, List<SheetInfo> tables) {
    ProfilingSession session = ProfilingSession.forDatabase(newId(), connection, tables);
    sessions.put(session.getSessionId(), session);
    log.info(
        "Opened {} session {} for database '{}'",
        connection.getConnectionType(),
        session.getSessionId(),
        connection.getDatabase());
    return session;
  }

  public Optional<ProfilingSession> find(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sessions.getIfPresent(sessionId));
  }

  /**
   * @throws ResourceNotFoundException if the session never existed or has expired
   */
  public ProfilingSession get(String sessionId) {
    return find(sessionId)
        .orElseThrow(() -> new ResourceNotFoundException("Session not found: " + sessionId));
  }

  public void remove(String sessionId) {
    sessions.invalidate(sessionId);
  }

  public long size() {
    sessions.cleanUp();
    return sessions.size();
  }

  private void onRemoval(RemovalNotification<String, ProfilingSession> notification) {
    ProfilingSession session = notification.getValue();
    log.debug("Session {} removed ({})", notification.getKey(), notification.getCause());
    if (session == null || session.getFilePath() == null) {
      return;
    }
    if (session.getStatus() == ProfilingStatus.RUNNING) {
      log.info(
          "Session {} removed while profiling; keeping {} until the run ends",
          notification.getKey(),
          session.getFilePath());
      return;
    }
    fileConnectorService.delete(session.getFilePath());
  }

  /** Deletes the upload of a file session that was removed while its profiling run was active. */
  void releaseIfRemoved(ProfilingSession session) {
    if (session.getFilePath() != null && sessions.getIfPresent(session.getSessionId()) == null) {
      log.info("Releasing upload of removed session {}", session.getSessionId());
      fileConnectorService.delete(session.getFilePath());
    }
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }
}
