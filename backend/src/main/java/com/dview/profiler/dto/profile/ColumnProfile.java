package com.dview.profiler.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Profile of a single column. Percentages are relative to {@code totalValues}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnProfile implements ColumnResult {

  @JsonProperty("column_name")
  private String columnName;

  @JsonProperty("data_type")
  private DataType dataType;

  @JsonProperty("total_values")
  private long totalValues;

  @JsonProperty("null_count")
  private long nullCount;

  @JsonProperty("null_percentage")
  private double nullPercentage;

  @JsonProperty("blank_count")
  private long blankCount;

  @JsonProperty("blank_percentage")
  private double blankPercentage;

  @JsonProperty("non_null_count")
  private long nonNullCount;

  @JsonProperty("distinct_count")
  private long distinctCount;

  @JsonProperty("distinct_percentage")
  private double distinctPercentage;

  @JsonProperty("statistics")
  private ColumnStatistics statistics;

  @JsonProperty("quality_score")
  private double qualityScore;

  @JsonProperty("completeness_percentage")
  private double completenessPercentage;

  @JsonProperty("uniqueness_percentage")
  private double uniquenessPercentage;

  @JsonProperty("potential_issues")
  private List<String> potentialIssues;
}
