package com.dview.profiler.service.source;

import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.DataSourceException;

/**
 * Materializes named tables for profiling. Implementations must be safe for concurrent {@link
 * #fetch} calls. Sources that hold resources release them in {@link #close()}.
 */
@FunctionalInterface
public interface TableSource extends AutoCloseable {

  /**
   * Loads a table.
   *
   * @param tableName table, sheet or file section to read
   * @param rowCap hard upper bound on returned rows, or {@code null} for all rows
   * @throws DataSourceException if the table does not exist or the source cannot be read
   */
  Table fetch(String tableName, Integer rowCap) throws DataSourceException;

  @Override
  default void close() {}
}
