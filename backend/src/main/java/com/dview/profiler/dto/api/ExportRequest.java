package com.dview.profiler.dto.api;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportRequest {

  @NotBlank
  @JsonProperty("session_id")
  private String sessionId;

  /** {@code json}, {@code csv}, {@code html} or {@code xlsx}. */
  @NotBlank
  @JsonProperty("export_format")
  private String exportFormat;

  @NotNull
  @JsonProperty("tables")
  private List<String> tables;
}
