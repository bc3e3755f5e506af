package com.dview.profiler.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A structural pattern such as {@code AAA-9999} with its frequency and sample values. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternSummary {

  @JsonProperty("pattern")
  private String pattern;

  @JsonProperty("count")
  private long count;

  @JsonProperty("percentage")
  private double percentage;

  @JsonProperty("examples")
  private List<String> examples;
}
