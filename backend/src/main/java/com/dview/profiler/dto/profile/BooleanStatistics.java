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
public class BooleanStatistics implements ColumnStatistics {

  @JsonProperty("true_count")
  private long trueCount;

  @JsonProperty("false_count")
  private long falseCount;

  @JsonProperty("true_percentage")
  private double truePercentage;

  @JsonProperty("false_percentage")
  private double falsePercentage;
}
