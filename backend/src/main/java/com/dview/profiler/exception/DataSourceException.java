package com.dview.profiler.exception;

/** Raised by a table source when a table is missing or the underlying file/database fails. */
public class DataSourceException extends Exception {

  public DataSourceException(String message) {
    super(message);
  }

  public DataSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
