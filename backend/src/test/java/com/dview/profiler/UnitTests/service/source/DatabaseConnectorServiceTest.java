package com.dview.profiler.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.dview.profiler.dto.source.DatabaseConnectionRequest;

class DatabaseConnectorServiceTest {

  private final DatabaseConnectorService databaseConnectorService = new DatabaseConnectorService();

  private static DatabaseConnectionRequest request(String type, int port) {
    return DatabaseConnectionRequest.builder()
        .connectionType(type)
        .host("db.local")
        .port(port)
        .database("sales")
        .username("scott")
        .password("tiger")
        .build();
  }

  @Test
  void shouldBuildOracleUrl() {
    assertThat(DatabaseConnectorService.buildJdbcUrl(request("oracle", 1521)))
        .isEqualTo("jdbc:oracle:thin:@//db.local:1521/sales");
  }

  @Test
  void shouldBuildSqlServerUrl() {
    assertThat(DatabaseConnectorService.buildJdbcUrl(request("SQLServer", 1433)))
        .isEqualTo(
            "jdbc:sqlserver://db.local:1433;databaseName=sales;trustServerCertificate=true");
  }

  @Test
  void shouldBuildH2Url() {
    assertThat(DatabaseConnectorService.buildJdbcUrl(request("h2", 9092)))
        .isEqualTo("jdbc:h2:tcp://db.local:9092/sales");
  }

  @Test
  @DisplayName("unsupported connection types are rejected before connecting")
  void shouldRejectUnsupportedType() {
    assertThatThrownBy(() -> databaseConnectorService.tableSource(request("mysql", 3306)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unsupported database type: mysql");
  }

  @Test
  void shouldDescribeSourceWithoutCredentials() {
    JdbcTableSource source = databaseConnectorService.tableSource(request("oracle", 1521));

    assertThat(source.getDescription()).isEqualTo("oracle://db.local:1521/sales");
    assertThat(request("oracle", 1521).toString()).doesNotContain("tiger");
  }
}
