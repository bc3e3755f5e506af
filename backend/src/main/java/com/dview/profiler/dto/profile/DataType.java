package com.dview.profiler.dto.profile;

import com.fasterxml.jackson.annotation.JsonValue;

/** Dominant semantic type of a column, as reported in a {@link ColumnProfile}. */
public enum DataType {
  INTEGER("integer"),
  FLOAT("float"),
  STRING("string"),
  DATETIME("datetime"),
  BOOLEAN("boolean");

  private final String label;

  DataType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }

  @Override
  public String toString() {
    return label;
  }
}
