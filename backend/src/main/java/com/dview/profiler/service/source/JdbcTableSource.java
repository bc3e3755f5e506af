package com.dview.profiler.service.source;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.dview.profiler.dto.source.SheetInfo;
import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.DataSourceException;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link TableSource} over a relational database. Every call opens its own connection, so
 * concurrent fetches from the table pool never share JDBC state.
 */
@Slf4j
public class JdbcTableSource implements TableSource {

  private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE"};

  private final String description;
  private final ConnectionFactory connectionFactory;
  private final String schemaPattern;

  /**
   * @param description label used in error messages, e.g. {@code oracle://host:1521/ORCL}
   * @param schemaPattern schema filter for table discovery, or {@code null} for all schemas
   */
  public JdbcTableSource(
      String description, ConnectionFactory connectionFactory, String schemaPattern) {
    this.description = description;
    this.connectionFactory = connectionFactory;
    this.schemaPattern = schemaPattern;
  }

  @Override
  public Table fetch(String tableName, Integer rowCap) throws DataSourceException {
    try (Connection connection = connectionFactory.open();
        Statement statement = connection.createStatement()) {
      if (rowCap != null) {
        statement.setMaxRows(rowCap);
      }
      String query = "SELECT * FROM " + quote(connection, tableName);
      try (ResultSet rs = statement.executeQuery(query)) {
        Table table = JdbcTableReader.read(tableName, rs, rowCap);
        log.debug("Fetched {} rows from '{}' on {}", table.getRowCount(), tableName, description);
        return table;
      }
    } catch (SQLException e) {
      throw new DataSourceException(
          String.format(
              "Failed to read table '%s' from %s: %s", tableName, description, e.getMessage()),
          e);
    }
  }

  public long countRows(String tableName) throws DataSourceException {
    try (Connection connection = connectionFactory.open();
        Statement statement = connection.createStatement();
        ResultSet rs =
            statement.executeQuery("SELECT COUNT(*) FROM " + quote(connection, tableName))) {
      return rs.next() ? rs.getLong(1) : 0L;
    } catch (SQLException e) {
      throw new DataSourceException(
          String.format(
              "Failed to count rows of '%s' on %s: %s", tableName, description, e.getMessage()),
          e);
    }
  }

  /** Lists user tables with their columns and database type names. */
  public List<SheetInfo> listTables() throws DataSourceException {
    try (Connection connection = connectionFactory.open()) {
      DatabaseMetaData metaData = connection.getMetaData();
      List<String> names = new ArrayList<>();
      try (ResultSet tables = metaData.getTables(null, schemaPattern, "%", TABLE_TYPES)) {
        while (tables.next()) {
          if (!isSystemSchema(tables.getString("TABLE_SCHEM"))) {
            names.add(tables.getString("TABLE_NAME"));
          }
        }
      }

      List<SheetInfo> sheets = new ArrayList<>(names.size());
      for (String name : names) {
        Map<String, String> columnTypes = new LinkedHashMap<>();
        try (ResultSet columns = metaData.getColumns(null, schemaPattern, name, "%")) {
          while (columns.next()) {
            columnTypes.put(columns.getString("COLUMN_NAME"), columns.getString("TYPE_NAME"));
          }
        }
        List<String> columnNames = new ArrayList<>(columnTypes.keySet());
        sheets.add(
            SheetInfo.builder()
                .name(name)
                .columns(columnNames)
                .columnCount(columnNames.size())
                .columnTypes(columnTypes)
                .build());
      }
      log.info("Found {} user tables on {}", sheets.size(), description);
      return sheets;
    } catch (SQLException e) {
      throw new DataSourceException("Database connection error: " + e.getMessage(), e);
    }
  }

  public String getDescription() {
    return description;
  }

  private static boolean isSystemSchema(String schema) {
    return "INFORMATION_SCHEMA".equalsIgnoreCase(schema) || "sys".equalsIgnoreCase(schema);
  }

  private static String quote(Connection connection, String identifier) throws SQLException {
    String quote = connection.getMetaData().getIdentifierQuoteString();
    if (quote == null || quote.isBlank()) {
      return identifier;
    }
    quote = quote.trim();
    return quote + identifier.replace(quote, quote + quote) + quote;
  }
}
