package com.dview.profiler.service.source;

import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

import com.dview.profiler.dto.table.Column;
import com.dview.profiler.dto.table.StorageType;
import com.dview.profiler.dto.table.Table;

/** Converts JDBC result sets into {@link Table}s, mapping {@link Types} to storage types. */
public final class JdbcTableReader {

  private JdbcTableReader() {}

  /**
   * Reads at most {@code rowCap} rows (all rows when {@code null}) from the cursor's current
   * position.
   */
  public static Table read(String tableName, ResultSet rs, Integer rowCap) throws SQLException {
    ResultSetMetaData metaData = rs.getMetaData();
    int columnCount = metaData.getColumnCount();

    StorageType[] storageTypes = new StorageType[columnCount];
    List<List<Object>> values = new ArrayList<>(columnCount);
    for (int i = 1; i <= columnCount; i++) {
      storageTypes[i - 1] =
          storageTypeOf(metaData.getColumnType(i), metaData.getPrecision(i), metaData.getScale(i));
      values.add(new ArrayList<>());
    }

    int rows = 0;
    while ((rowCap == null || rows < rowCap) && rs.next()) {
      for (int i = 1; i <= columnCount; i++) {
        values.get(i - 1).add(readValue(rs, i, storageTypes[i - 1]));
      }
      rows++;
    }

    List<String> names = ColumnNames.deduplicate(columnLabels(metaData));
    List<Column> columns = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      columns.add(new Column(names.get(i), storageTypes[i], values.get(i)));
    }
    return new Table(tableName, columns);
  }

  static StorageType storageTypeOf(int sqlType, int precision, int scale) {
    switch (sqlType) {
      case Types.TINYINT:
      case Types.SMALLINT:
      case Types.INTEGER:
      case Types.BIGINT:
        return StorageType.INTEGER;
      case Types.NUMERIC:
      case Types.DECIMAL:
        // Oracle NUMBER(p) columns come back as NUMERIC with scale 0
        return precision > 0 && scale == 0 ? StorageType.INTEGER : StorageType.FLOAT;
      case Types.REAL:
      case Types.FLOAT:
      case Types.DOUBLE:
        return StorageType.FLOAT;
      case Types.DATE:
      case Types.TIMESTAMP:
      case Types.TIMESTAMP_WITH_TIMEZONE:
        return StorageType.DATETIME;
      case Types.BIT:
      case Types.BOOLEAN:
        return StorageType.BOOLEAN;
      default:
        return StorageType.TEXT;
    }
  }

  private static Object readValue(ResultSet rs, int index, StorageType storageType)
      throws SQLException {
    if (storageType != StorageType.TEXT) {
      return rs.getObject(index);
    }
    Object value = rs.getObject(index);
    if (value == null) {
      return null;
    }
    if (value instanceof Clob) {
      Clob clob = (Clob) value;
      return clob.getSubString(1, (int) Math.min(clob.length(), Integer.MAX_VALUE));
    }
    if (value instanceof byte[]) {
      return rs.getString(index);
    }
    return value.toString();
  }

  private static List<String> columnLabels(ResultSetMetaData metaData) throws SQLException {
    List<String> labels = new ArrayList<>(metaData.getColumnCount());
    for (int i = 1; i <= metaData.getColumnCount(); i++) {
      labels.add(metaData.getColumnLabel(i));
    }
    return labels;
  }
}
