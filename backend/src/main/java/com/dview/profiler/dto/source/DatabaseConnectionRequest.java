package com.dview.profiler.dto.source;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "password")
public class DatabaseConnectionRequest {

  /** {@code oracle}, {@code sqlserver} or {@code h2}. */
  @NotBlank
  @JsonProperty("connection_type")
  private String connectionType;

  @NotBlank
  @JsonProperty("host")
  private String host;

  @NotNull
  @Min(1)
  @Max(65535)
  @JsonProperty("port")
  private Integer port;

  @NotBlank
  @JsonProperty("database")
  private String database;

  @JsonProperty("username")
  private String username;

  @JsonProperty(value = "password", access = JsonProperty.Access.WRITE_ONLY)
  private String password;
}
