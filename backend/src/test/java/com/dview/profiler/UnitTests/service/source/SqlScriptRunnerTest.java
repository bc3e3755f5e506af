package com.dview.profiler.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.StringReader;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SQL Script Runner Tests")
class SqlScriptRunnerTest {

  @Mock private Connection connection;

  @Mock private Statement statement;

  private SqlScriptRunner sqlScriptRunner;

  @BeforeEach
  void setUp() throws SQLException {
    lenient().when(connection.createStatement()).thenReturn(statement);
    sqlScriptRunner = new SqlScriptRunner(connection);
  }

  @Nested
  @DisplayName("Splitting")
  class SplittingTests {

    @Test
    @DisplayName("Should drop comments and trailing delimiters")
    void shouldDropCommentsAndDelimiters() throws Exception {
      // Given
      String script =
          """
          -- table for users
          # mysql style comment
          /* block
             comment */
          CREATE TABLE users (
            id INT,
            name VARCHAR(50)
          );
          INSERT INTO users VALUES (1, 'John');
          """;

      // When
      List<String> statements = SqlScriptRunner.split(new StringReader(script));

      // Then
      assertThat(statements)
          .containsExactly(
              "CREATE TABLE users (\nid INT,\nname VARCHAR(50)\n)",
              "INSERT INTO users VALUES (1, 'John')");
    }

    @Test
    @DisplayName("Should honour DELIMITER switches")
    void shouldHonourDelimiterSwitches() throws Exception {
      // Given
      String script =
          """
          DELIMITER $$
          CREATE PROCEDURE p() BEGIN SELECT 1; END$$
          DELIMITER ;
          INSERT INTO t VALUES (1);
          """;

      // When
      List<String> statements = SqlScriptRunner.split(new StringReader(script));

      // Then
      assertThat(statements)
          .containsExactly("CREATE PROCEDURE p() BEGIN SELECT 1; END", "INSERT INTO t VALUES (1)");
    }

    @Test
    @DisplayName("Should keep a final statement without delimiter")
    void shouldKeepUnterminatedFinalStatement() throws Exception {
      List<String> statements =
          SqlScriptRunner.split(new StringReader("INSERT INTO t VALUES (1);\nSELECT 1"));

      assertThat(statements).containsExactly("INSERT INTO t VALUES (1)", "SELECT 1");
    }
  }

  @Nested
  @DisplayName("Execution")
  class ExecutionTests {

    @Test
    @DisplayName("Should execute statements and skip session settings")
    void shouldSkipSessionStatements() throws Exception {
      // Given
      String script =
          """
          SET NAMES utf8mb4;
          /*!40101 SET @OLD_CHARACTER_SET_CLIENT=@@CHARACTER_SET_CLIENT */;
          CREATE DATABASE shop;
          USE shop;
          LOCK TABLES users WRITE;
          CREATE TABLE users (id INT);
          INSERT INTO users VALUES (1);
          UNLOCK TABLES;
          """;

      // When
      SqlScriptRunner.Result result = sqlScriptRunner.run(new StringReader(script));

      // Then
      assertThat(result.getExecuted()).isEqualTo(2);
      assertThat(result.getSkipped()).isEqualTo(6);
      assertThat(result.getFailed()).isZero();
      verify(statement, times(2)).execute(anyString());
      verify(statement).execute("CREATE TABLE users (id INT)");
      verify(statement, never()).execute("USE shop");
    }

    @Test
    @DisplayName("Should continue past a failing statement")
    void shouldContinuePastFailure() throws Exception {
      // Given
      when(statement.execute(anyString()))
          .thenThrow(new SQLException("Syntax error in SQL statement"))
          .thenReturn(false);

      // When
      SqlScriptRunner.Result result =
          sqlScriptRunner.run(new StringReader("BROKEN STATEMENT;\nCREATE TABLE t (id INT);"));

      // Then
      assertThat(result.getFailed()).isEqualTo(1);
      assertThat(result.getExecuted()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail when every statement fails")
    void shouldFailWhenEverythingFails() throws Exception {
      when(statement.execute(anyString())).thenThrow(new SQLException("Syntax error"));

      assertThatThrownBy(() -> sqlScriptRunner.run(new StringReader("BAD ONE;\nBAD TWO;")))
          .isInstanceOf(SQLException.class)
          .hasMessage("All SQL statements failed to execute");
    }

    @Test
    @DisplayName("Should stop on connection errors")
    void shouldStopOnFatalError() throws Exception {
      when(statement.execute(anyString())).thenThrow(new SQLException("Connection is closed"));

      assertThatThrownBy(
              () -> sqlScriptRunner.run(new StringReader("CREATE TABLE a (id INT);\nSELECT 1;")))
          .isInstanceOf(SQLException.class)
          .hasMessage("Connection is closed");
      verify(statement, times(1)).execute(anyString());
    }

    @Test
    @DisplayName("Should close the statement")
    void shouldCloseStatement() throws Exception {
      sqlScriptRunner.run(new StringReader("CREATE TABLE a (id INT);"));

      verify(statement).close();
    }
  }
}
