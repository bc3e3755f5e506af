package com.dview.profiler.exception;

import lombok.Getter;

/** Statistics computation failed for one column. Recorded in place of that column's profile. */
@Getter
public class ColumnProfilingException extends RuntimeException {

  private final String columnName;

  public ColumnProfilingException(String columnName, String message, Throwable cause) {
    super(message, cause);
    this.columnName = columnName;
  }
}
