package com.dview.profiler.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValueFrequency {

  @JsonProperty("value")
  private String value;

  @JsonProperty("count")
  private long count;

  @JsonProperty("percentage")
  private double percentage;
}
