package com.dview.profiler.dto.profile;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StringStatistics implements ColumnStatistics {

  @JsonProperty("avg_length")
  private double avgLength;

  @JsonProperty("min_length")
  private int minLength;

  @JsonProperty("max_length")
  private int maxLength;

  @Builder.Default
  @JsonProperty("most_common_values")
  private List<ValueFrequency> mostCommonValues = new ArrayList<>();

  @Builder.Default
  @JsonProperty("patterns")
  private List<PatternSummary> patterns = new ArrayList<>();
}
