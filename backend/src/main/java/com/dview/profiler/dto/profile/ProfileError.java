package com.dview.profiler.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

/** Error marker recorded in place of a column or table whose profiling failed. */
@Value
public class ProfileError implements ColumnResult, TableResult {

  @JsonProperty("error")
  String error;

  public static ProfileError of(Throwable cause) {
    String message = cause.getMessage();
    return new ProfileError(message != null ? message : cause.getClass().getSimpleName());
  }
}
