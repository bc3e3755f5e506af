package com.dview.profiler.service.profiling;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Service;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.dto.profile.ColumnResult;
import com.dview.profiler.dto.profile.ProfileError;
import com.dview.profiler.dto.profile.ProfileReport;
import com.dview.profiler.dto.profile.TableProfile;
import com.dview.profiler.dto.profile.TableResult;
import com.dview.profiler.dto.table.Column;
import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.ColumnProfilingException;
import com.dview.profiler.exception.ConfigurationException;
import com.dview.profiler.exception.DataSourceException;
import com.dview.profiler.exception.TableProfilingException;
import com.dview.profiler.service.source.TableSource;
import com.dview.profiler.util.MdcPropagation;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Profiles a batch of tables with a two-level fan-out: tables on one bounded pool, and the columns
 * of each table on a second pool created for that table. Both pools are sized by {@code
 * profiler.max-threads}, read once per call.
 *
 * <p>A failing table or column is recorded as a {@link ProfileError} in place of its profile and
 * never affects its siblings. Only invalid settings abort the call, with a {@link
 * ConfigurationException}.
 *
 * <p>Report entries are in completion order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileOrchestrator {

  private final ColumnProfiler columnProfiler;
  private final ApplicationProperties properties;

  public ProfileReport profile(List<String> tables, Integer rowCap, TableSource source) {
    return profile(tables, rowCap, source, ProgressListener.NONE);
  }

  public ProfileReport profile(
      List<String> tables, Integer rowCap, TableSource source, ProgressListener listener) {
    int maxThreads = properties.getMaxThreads();
    validate(tables, rowCap, source, maxThreads);
    ProgressListener sink = listener != null ? listener : ProgressListener.NONE;

    Set<String> distinctTables = new LinkedHashSet<>(tables);
    ProgressTracker progress = new ProgressTracker(distinctTables.size(), sink);
    if (distinctTables.isEmpty()) {
      progress.finishEmpty();
      return ProfileReport.empty();
    }

    log.info(
        "[ORCHESTRATOR] Profiling {} table(s), row cap {}, max threads {}",
        distinctTables.size(),
        rowCap,
        maxThreads);

    ExecutorService tablePool =
        Executors.newFixedThreadPool(
            Math.min(maxThreads, distinctTables.size()), threadFactory("profile-table-%d"));
    Map<String, TableResult> results = new LinkedHashMap<>();
    try {
      CompletionService<TableOutcome> completion = new ExecutorCompletionService<>(tablePool);
      Map<Future<TableOutcome>, String> pending = new LinkedHashMap<>();
      for (String table : distinctTables) {
        Future<TableOutcome> future =
            completion.submit(
                MdcPropagation.wrapCallable(
                    () -> profileTableSafely(table, rowCap, source, maxThreads)));
        pending.put(future, table);
      }

      while (!pending.isEmpty()) {
        Future<TableOutcome> done;
        try {
          done = completion.take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          log.warn("[ORCHESTRATOR] Interrupted with {} table(s) outstanding", pending.size());
          for (String table : pending.values()) {
            results.put(table, new ProfileError("Profiling interrupted"));
            progress.tableCompleted();
          }
          break;
        }
        String table = pending.remove(done);
        results.put(table, outcomeOf(table, done));
        progress.tableCompleted();
      }
    } finally {
      tablePool.shutdownNow();
    }

    log.info("[ORCHESTRATOR] Profiling finished for {} table(s)", results.size());
    return new ProfileReport(results);
  }

  private static TableResult outcomeOf(String table, Future<TableOutcome> done) {
    try {
      return done.get().getResult();
    } catch (ExecutionException e) {
      log.error("[ORCHESTRATOR] Unexpected failure for table '{}'", table, e.getCause());
      return ProfileError.of(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new ProfileError("Profiling interrupted");
    }
  }

  private TableOutcome profileTableSafely(
      String tableName, Integer rowCap, TableSource source, int maxThreads) {
    try {
      return new TableOutcome(profileTable(tableName, rowCap, source, maxThreads));
    } catch (TableProfilingException e) {
      log.warn("[ORCHESTRATOR] Table '{}' failed: {}", tableName, e.getMessage());
      return new TableOutcome(ProfileError.of(e));
    }
  }

  TableProfile profileTable(
      String tableName, Integer rowCap, TableSource source, int maxThreads) {
    Table table;
    try {
      table = source.fetch(tableName, rowCap);
    } catch (DataSourceException e) {
      throw new TableProfilingException(tableName, e.getMessage(), e);
    } catch (RuntimeException e) {
      throw new TableProfilingException(tableName, messageOf(e), e);
    }
    if (table == null) {
      throw new TableProfilingException(tableName, "No data returned for table " + tableName, null);
    }

    Map<String, ColumnResult> columns;
    try {
      columns = profileColumns(table, maxThreads);
    } catch (RuntimeException e) {
      throw new TableProfilingException(tableName, messageOf(e), e);
    }

    return TableProfile.builder()
        .tableName(tableName)
        .totalRecords(table.getRowCount())
        .totalColumns(table.getColumnCount())
        .profiledAt(LocalDateTime.now())
        .columns(columns)
        .build();
  }

  private Map<String, ColumnResult> profileColumns(Table table, int maxThreads) {
    List<Column> columns = table.getColumns();
    Map<String, ColumnResult> results = new LinkedHashMap<>();
    if (columns.isEmpty()) {
      return results;
    }

    ExecutorService columnPool =
        Executors.newFixedThreadPool(
            Math.min(maxThreads, columns.size()),
            threadFactory("profile-column-%d"));
    try {
      CompletionService<Map.Entry<String, ColumnResult>> completion =
          new ExecutorCompletionService<>(columnPool);
      List<Future<Map.Entry<String, ColumnResult>>> futures = new ArrayList<>(columns.size());
      for (Column column : columns) {
        futures.add(completion.submit(MdcPropagation.wrapCallable(() -> profileColumn(column))));
      }
      for (int i = 0; i < futures.size(); i++) {
        Map.Entry<String, ColumnResult> entry = completion.take().get();
        results.put(entry.getKey(), entry.getValue());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TableProfilingException(table.getName(), "Column profiling interrupted", e);
    } catch (ExecutionException e) {
      throw new TableProfilingException(table.getName(), messageOf(e.getCause()), e.getCause());
    } finally {
      columnPool.shutdownNow();
    }
    return results;
  }

  private Map.Entry<String, ColumnResult> profileColumn(Column column) {
    try {
      return Map.entry(column.getName(), columnProfiler.profile(column));
    } catch (ColumnProfilingException e) {
      log.warn("[PROFILER] Column '{}' failed: {}", column.getName(), e.getMessage());
      return Map.entry(column.getName(), ProfileError.of(e));
    }
  }

  private static void validate(
      List<String> tables, Integer rowCap, TableSource source, int maxThreads) {
    if (tables == null) {
      throw new ConfigurationException("Table list must not be null");
    }
    if (source == null) {
      throw new ConfigurationException("Table source must not be null");
    }
    if (maxThreads <= 0) {
      throw new ConfigurationException("max_threads must be positive, was " + maxThreads);
    }
    if (rowCap != null && rowCap <= 0) {
      throw new ConfigurationException("Row cap must be positive, was " + rowCap);
    }
  }

  private static String messageOf(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private static ThreadFactory threadFactory(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }

  private static final class TableOutcome {
    private final TableResult result;

    private TableOutcome(TableResult result) {
      this.result = result;
    }

    private TableResult getResult() {
      return result;
    }
  }

  /** Serializes progress updates; the counter and the listener call share one lock. */
  static final class ProgressTracker {
    private final ReentrantLock lock = new ReentrantLock();
    private final int total;
    private final ProgressListener listener;
    private int completed;
    private int lastReported = -1;

    ProgressTracker(int total, ProgressListener listener) {
      this.total = total;
      this.listener = listener;
    }

    void tableCompleted() {
      lock.lock();
      try {
        completed++;
        int percent =
            completed >= total ? 100 : (int) Math.min(99, Math.round(completed * 100.0 / total));
        percent = Math.max(percent, lastReported);
        lastReported = percent;
        notifyListener(percent);
      } finally {
        lock.unlock();
      }
    }

    void finishEmpty() {
      lock.lock();
      try {
        lastReported = 100;
        notifyListener(100);
      } finally {
        lock.unlock();
      }
    }

    private void notifyListener(int percent) {
      try {
        listener.onProgress(percent);
      } catch (RuntimeException e) {
        log.warn("[ORCHESTRATOR] Progress listener failed at {}%: {}", percent, e.getMessage());
      }
    }
  }
}
