package com.dview.profiler.service.source;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

import com.dview.profiler.exception.DataSourceException;

import lombok.extern.slf4j.Slf4j;

/**
 * A private in-memory H2 database populated from an uploaded {@code .sql} script. The database
 * lives until {@link #close()}; a keep-alive connection holds it open between fetches.
 */
@Slf4j
public class SqlScriptDatabase extends JdbcTableSource {

  private static final String URL_TEMPLATE =
      "jdbc:h2:mem:%s;DB_CLOSE_DELAY=0;MODE=MySQL;DATABASE_TO_LOWER=TRUE";
  private static final String USER = "sa";
  private static final String PASSWORD = "";

  private final Connection keepAlive;

  private SqlScriptDatabase(String url, Connection keepAlive, String scriptName) {
    super("sql script " + scriptName, () -> DriverManager.getConnection(url, USER, PASSWORD), null);
    this.keepAlive = keepAlive;
  }

  public static SqlScriptDatabase load(Path script) throws DataSourceException {
    String name = "dview_" + UUID.randomUUID().toString().replace("-", "");
    String url = String.format(URL_TEMPLATE, name);
    Connection keepAlive;
    try {
      keepAlive = DriverManager.getConnection(url, USER, PASSWORD);
    } catch (SQLException e) {
      throw new DataSourceException("Could not start in-memory database: " + e.getMessage(), e);
    }

    try (Reader reader = Files.newBufferedReader(script, StandardCharsets.UTF_8)) {
      new SqlScriptRunner(keepAlive).run(reader);
    } catch (SQLException | IOException e) {
      closeQuietly(keepAlive, e);
      throw new DataSourceException("Failed to execute SQL script: " + e.getMessage(), e);
    }
    return new SqlScriptDatabase(url, keepAlive, String.valueOf(script.getFileName()));
  }

  @Override
  public void close() {
    try (Statement statement = keepAlive.createStatement()) {
      statement.execute("SHUTDOWN");
    } catch (SQLException e) {
      log.warn("Failed to shut down database for {}: {}", getDescription(), e.getMessage());
    } finally {
      closeQuietly(keepAlive, null);
    }
  }

  private static void closeQuietly(Connection connection, Exception primary) {
    try {
      connection.close();
    } catch (SQLException e) {
      if (primary != null) {
        primary.addSuppressed(e);
      } else {
        log.debug("Keep-alive connection already closed: {}", e.getMessage());
      }
    }
  }
}
