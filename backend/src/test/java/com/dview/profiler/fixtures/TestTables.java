package com.dview.profiler.fixtures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.dto.table.Column;
import com.dview.profiler.dto.table.StorageType;
import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.DataSourceException;
import com.dview.profiler.service.source.TableSource;

/** Small tables and in-memory sources shared by the profiling tests. */
public final class TestTables {

  private TestTables() {}

  public static Column text(String name, Object... values) {
    return new Column(name, StorageType.TEXT, Arrays.asList(values));
  }

  public static Column integers(String name, Object... values) {
    return new Column(name, StorageType.INTEGER, Arrays.asList(values));
  }

  public static Column floats(String name, Object... values) {
    return new Column(name, StorageType.FLOAT, Arrays.asList(values));
  }

  public static Column booleans(String name, Object... values) {
    return new Column(name, StorageType.BOOLEAN, Arrays.asList(values));
  }

  public static Table table(String name, Column... columns) {
    return new Table(name, Arrays.asList(columns));
  }

  /** id, name, score and active columns over five rows, one null name. */
  public static Table customers() {
    return table(
        "customers",
        integers("id", 1, 2, 3, 4, 5),
        text("name", "Ann", "Bob", null, "Dee", "Eve"),
        floats("score", 1.5, 2.5, 3.5, 4.5, 5.5),
        booleans("active", true, false, true, true, false));
  }

  /** Sequential integer ids under the column name {@code id}. */
  public static Table numbered(String name, int rows) {
    List<Object> ids = new ArrayList<>(rows);
    for (int i = 1; i <= rows; i++) {
      ids.add(i);
    }
    return new Table(name, List.of(new Column("id", StorageType.INTEGER, ids)));
  }

  public static ApplicationProperties properties() {
    return new ApplicationProperties();
  }

  public static InMemorySource source(Table... tables) {
    InMemorySource source = new InMemorySource();
    for (Table table : tables) {
      source.put(table);
    }
    return source;
  }

  /** Serves registered tables and truncates them to the row cap. */
  public static final class InMemorySource implements TableSource {

    private final Map<String, Table> tables = new LinkedHashMap<>();
    private final Map<String, RuntimeException> failures = new LinkedHashMap<>();
    private final List<String> fetched = new ArrayList<>();
    private boolean closed;

    public InMemorySource put(Table table) {
      tables.put(table.getName(), table);
      return this;
    }

    public InMemorySource failOn(String tableName, RuntimeException failure) {
      failures.put(tableName, failure);
      return this;
    }

    @Override
    public synchronized Table fetch(String tableName, Integer rowCap) throws DataSourceException {
      fetched.add(tableName);
      RuntimeException failure = failures.get(tableName);
      if (failure != null) {
        throw failure;
      }
      Table table = tables.get(tableName);
      if (table == null) {
        throw new DataSourceException("Table not found: " + tableName);
      }
      if (rowCap == null || rowCap >= table.getRowCount()) {
        return table;
      }
      List<Column> truncated = new ArrayList<>();
      for (Column column : table.getColumns()) {
        truncated.add(
            new Column(
                column.getName(),
                column.getStorageType(),
                column.getValues().subList(0, rowCap)));
      }
      return new Table(tableName, truncated);
    }

    @Override
    public void close() {
      closed = true;
    }

    public synchronized List<String> getFetched() {
      return new ArrayList<>(fetched);
    }

    public boolean isClosed() {
      return closed;
    }
  }
}
