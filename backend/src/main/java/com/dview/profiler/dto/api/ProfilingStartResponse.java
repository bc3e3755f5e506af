package com.dview.profiler.dto.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfilingStartResponse {

  @JsonProperty("task_id")
  private String taskId;

  @JsonProperty("status")
  private String status;

  @JsonProperty("message")
  private String message;
}
