package com.dview.profiler.service.source;

import java.sql.DriverManager;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.dview.profiler.dto.source.DatabaseConnectionRequest;
import com.dview.profiler.dto.source.SheetInfo;
import com.dview.profiler.exception.DataSourceException;

import lombok.extern.slf4j.Slf4j;

/** Connects to Oracle, SQL Server or H2 databases over JDBC. */
@Slf4j
@Service
public class DatabaseConnectorService {

  public static final String ORACLE = "oracle";
  public static final String SQL_SERVER = "sqlserver";
  public static final String H2 = "h2";

  public List<SheetInfo> connectAndListTables(DatabaseConnectionRequest connection)
      throws DataSourceException {
    log.info(
        "Connecting to {} database {} at {}:{}",
        connection.getConnectionType(),
        connection.getDatabase(),
        connection.getHost(),
        connection.getPort());
    return tableSource(connection).listTables();
  }

  public long getRecordCount(DatabaseConnectionRequest connection, String tableName)
      throws DataSourceException {
    return tableSource(connection).countRows(tableName);
  }

  public JdbcTableSource tableSource(DatabaseConnectionRequest connection) {
    String url = buildJdbcUrl(connection);
    String username = connection.getUsername();
    String password = connection.getPassword();
    return new JdbcTableSource(
        describe(connection),
        () -> DriverManager.getConnection(url, username, password),
        schemaPattern(connection));
  }

  /**
   * @throws IllegalArgumentException for an unsupported connection type
   */
  public static String buildJdbcUrl(DatabaseConnectionRequest connection) {
    String host = connection.getHost();
    Integer port = connection.getPort();
    String database = connection.getDatabase();
    switch (normalizedType(connection)) {
      case ORACLE:
        return String.format("jdbc:oracle:thin:@//%s:%d/%s", host, port, database);
      case SQL_SERVER:
        return String.format(
            "jdbc:sqlserver://%s:%d;databaseName=%s;trustServerCertificate=true",
            host, port, database);
      case H2:
        return String.format("jdbc:h2:tcp://%s:%d/%s", host, port, database);
      default:
        throw new IllegalArgumentException(
            "Unsupported database type: " + connection.getConnectionType());
    }
  }

  private static String schemaPattern(DatabaseConnectionRequest connection) {
    // Oracle lists every schema the user can see; restrict discovery to the user's own
    if (ORACLE.equals(normalizedType(connection)) && connection.getUsername() != null) {
      return connection.getUsername().toUpperCase(Locale.ROOT);
    }
    return null;
  }

  private static String describe(DatabaseConnectionRequest connection) {
    return String.format(
        "%s://%s:%d/%s",
        normalizedType(connection),
        connection.getHost(),
        connection.getPort(),
        connection.getDatabase());
  }

  private static String normalizedType(DatabaseConnectionRequest connection) {
    String type = connection.getConnectionType();
    return type == null ? "" : type.trim().toLowerCase(Locale.ROOT);
  }
}
