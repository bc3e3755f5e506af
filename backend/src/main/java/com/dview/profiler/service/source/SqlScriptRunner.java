package com.dview.profiler.service.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes uploaded SQL dump scripts against a connection. Comments and MySQL session statements
 * are skipped, {@code DELIMITER} switches are honoured, and a failing statement is logged and
 * skipped unless the error looks fatal for the connection.
 */
@Slf4j
public class SqlScriptRunner {

  private static final Pattern DELIMITER_COMMAND =
      Pattern.compile("^\\s*DELIMITER\\s+(\\S+)\\s*$", Pattern.CASE_INSENSITIVE);
  private static final String DEFAULT_DELIMITER = ";";
  private static final int LOG_TRUNCATE_LENGTH = 100;

  private static final Set<String> SKIPPED_PREFIXES =
      Set.of(
          "CREATE DATABASE",
          "CREATE SCHEMA",
          "USE ",
          "LOCK TABLES",
          "UNLOCK TABLES",
          "SET FOREIGN_KEY_CHECKS",
          "SET SQL_MODE",
          "SET NAMES",
          "SET CHARACTER_SET",
          "SET TIME_ZONE",
          "/*!");

  private static final Set<String> FATAL_ERROR_FRAGMENTS = Set.of("connection", "closed");

  private final Connection connection;

  public SqlScriptRunner(Connection connection) {
    this.connection = connection;
  }

  public Result run(Reader script) throws SQLException, IOException {
    return execute(split(script));
  }

  /** Splits a script into statements with comments and delimiters removed. */
  static List<String> split(Reader script) throws IOException {
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    String delimiter = DEFAULT_DELIMITER;
    boolean inBlockComment = false;

    try (BufferedReader reader = new BufferedReader(script)) {
      String line;
      while ((line = reader.readLine()) != null) {
        line = line.trim();
        if (inBlockComment) {
          inBlockComment = !line.contains("*/");
          continue;
        }
        if (line.isEmpty() || line.startsWith("--") || line.startsWith("#")) {
          continue;
        }
        if (line.startsWith("/*") && !line.startsWith("/*!")) {
          inBlockComment = !line.contains("*/");
          continue;
        }

        Matcher delimiterCommand = DELIMITER_COMMAND.matcher(line);
        if (delimiterCommand.matches()) {
          flush(current, statements);
          delimiter = delimiterCommand.group(1);
          continue;
        }

        if (current.length() > 0) {
          current.append('\n');
        }
        current.append(line);
        if (line.endsWith(delimiter)) {
          current.setLength(current.length() - delimiter.length());
          flush(current, statements);
        }
      }
    }
    flush(current, statements);
    return statements;
  }

  private Result execute(List<String> statements) throws SQLException {
    int executed = 0;
    int skipped = 0;
    int failed = 0;

    try (Statement statement = connection.createStatement()) {
      for (String sql : statements) {
        if (isSkipped(sql)) {
          log.debug("Skipping statement: {}", truncate(sql));
          skipped++;
          continue;
        }
        try {
          statement.execute(sql);
          executed++;
        } catch (SQLException e) {
          failed++;
          log.warn("Statement failed: {}. Error: {}", truncate(sql), e.getMessage());
          if (isFatal(e)) {
            throw e;
          }
        }
      }
    }

    log.info("SQL script executed: {} ok, {} skipped, {} failed", executed, skipped, failed);
    if (executed == 0 && failed > 0) {
      throw new SQLException("All SQL statements failed to execute");
    }
    return new Result(executed, skipped, failed);
  }

  private static void flush(StringBuilder current, List<String> statements) {
    String statement = current.toString().trim();
    if (!statement.isEmpty()) {
      statements.add(statement);
    }
    current.setLength(0);
  }

  private static boolean isSkipped(String sql) {
    String upper = sql.toUpperCase(Locale.ROOT);
    return SKIPPED_PREFIXES.stream().anyMatch(upper::startsWith);
  }

  private static boolean isFatal(SQLException e) {
    String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
    return FATAL_ERROR_FRAGMENTS.stream().anyMatch(message::contains);
  }

  private static String truncate(String sql) {
    return sql.length() <= LOG_TRUNCATE_LENGTH
        ? sql
        : sql.substring(0, LOG_TRUNCATE_LENGTH) + "...";
  }

  @Value
  public static class Result {
    int executed;
    int skipped;
    int failed;
  }
}
