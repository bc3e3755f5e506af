package com.dview.profiler.exception;

import lombok.Getter;

/** Fetching or profiling one table failed. Recorded in place of that table's profile. */
@Getter
public class TableProfilingException extends RuntimeException {

  private final String tableName;

  public TableProfilingException(String tableName, String message, Throwable cause) {
    super(message, cause);
    this.tableName = tableName;
  }
}
