package com.dview.profiler.dto.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Result of one profiling batch: table name to {@link TableProfile} or {@link ProfileError}.
 * Entries are kept in completion order; callers that need request order must re-sort.
 */
@ToString
@EqualsAndHashCode
public class ProfileReport {

  private final Map<String, TableResult> tables;

  public ProfileReport(Map<String, TableResult> tables) {
    this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
  }

  public static ProfileReport empty() {
    return new ProfileReport(Collections.emptyMap());
  }

  @JsonValue
  public Map<String, TableResult> getTables() {
    return tables;
  }

  public TableResult get(String tableName) {
    return tables.get(tableName);
  }

  public boolean contains(String tableName) {
    return tables.containsKey(tableName);
  }

  public int size() {
    return tables.size();
  }

  /** Subset of this report restricted to the given tables, in the order given. */
  public ProfileReport select(Iterable<String> tableNames) {
    Map<String, TableResult> selected = new LinkedHashMap<>();
    for (String name : tableNames) {
      TableResult result = tables.get(name);
      if (result != null) {
        selected.put(name, result);
      }
    }
    return new ProfileReport(selected);
  }
}
