package com.dview.profiler.dto.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Getter;
import lombok.ToString;

/** One named column of cell values. Any cell may be {@code null}. */
@Getter
@ToString(exclude = "values")
public class Column {

  private final String name;
  private final StorageType storageType;
  private final List<Object> values;

  public Column(String name, StorageType storageType, List<?> values) {
    this.name = name;
    this.storageType = storageType != null ? storageType : StorageType.TEXT;
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public int size() {
    return values.size();
  }

  public List<Object> nonNullValues() {
    List<Object> nonNull = new ArrayList<>(values.size());
    for (Object value : values) {
      if (value != null) {
        nonNull.add(value);
      }
    }
    return nonNull;
  }
}
