package com.dview.profiler.dto.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfilingRequest {

  @NotBlank
  @JsonProperty("session_id")
  private String sessionId;

  @NotNull
  @JsonProperty("tables")
  private List<String> tables;

  /** Row cap per table; the configured default applies when absent. */
  @Positive
  @JsonProperty("max_records")
  private Integer maxRecords;
}
