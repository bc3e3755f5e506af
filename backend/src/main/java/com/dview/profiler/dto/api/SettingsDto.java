package com.dview.profiler.dto.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Runtime-adjustable settings. On update, absent fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SettingsDto {

  @Positive
  @JsonProperty("max_threads")
  private Integer maxThreads;

  @Positive
  @JsonProperty("default_max_records")
  private Integer defaultMaxRecords;

  @Positive
  @JsonProperty("chunk_size")
  private Integer chunkSize;
}
