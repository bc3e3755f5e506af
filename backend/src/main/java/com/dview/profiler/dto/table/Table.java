package com.dview.profiler.dto.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Getter;
import lombok.ToString;

/**
 * A fully materialized table handed to the profiler by a {@code TableSource}. All columns share the
 * same row count and column names are unique, since the profile report is keyed by name.
 */
@Getter
@ToString
public class Table {

  private final String name;
  private final List<Column> columns;

  public Table(String name, List<Column> columns) {
    this.name = name;
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    int expected = this.columns.isEmpty() ? 0 : this.columns.get(0).size();
    Set<String> names = new HashSet<>();
    for (Column column : this.columns) {
      if (!names.add(column.getName())) {
        throw new IllegalArgumentException(
            String.format("Duplicate column name '%s' in table '%s'", column.getName(), name));
      }
      if (column.size() != expected) {
        throw new IllegalArgumentException(
            String.format(
                "Column '%s' of table '%s' has %d values, expected %d",
                column.getName(), name, column.size(), expected));
      }
    }
  }

  public int getRowCount() {
    return columns.isEmpty() ? 0 : columns.get(0).size();
  }

  public int getColumnCount() {
    return columns.size();
  }
}
