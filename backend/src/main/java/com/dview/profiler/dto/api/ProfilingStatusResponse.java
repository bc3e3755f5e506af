package com.dview.profiler.dto.api;

import com.dview.profiler.service.session.ProfilingStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfilingStatusResponse {

  @JsonProperty("status")
  private ProfilingStatus status;

  @JsonProperty("progress")
  private int progress;

  @JsonProperty("error")
  private String error;

  @JsonProperty("results_available")
  private boolean resultsAvailable;
}
