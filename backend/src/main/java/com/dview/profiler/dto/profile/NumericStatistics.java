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
public class NumericStatistics implements ColumnStatistics {

  @JsonProperty("min_value")
  private Double minValue;

  @JsonProperty("max_value")
  private Double maxValue;

  @JsonProperty("average")
  private Double average;

  @JsonProperty("median")
  private Double median;

  @JsonProperty("standard_deviation")
  private Double standardDeviation;

  @JsonProperty("quartile_25")
  private Double quartile25;

  @JsonProperty("quartile_75")
  private Double quartile75;

  @JsonProperty("zero_count")
  private Long zeroCount;

  @JsonProperty("negative_count")
  private Long negativeCount;

  @JsonProperty("positive_count")
  private Long positiveCount;

  /** Block used when no value survives numeric coercion. */
  public static NumericStatistics empty() {
    return new NumericStatistics();
  }
}
