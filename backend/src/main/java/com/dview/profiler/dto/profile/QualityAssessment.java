package com.dview.profiler.dto.profile;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/** Output of the quality scorer, folded into the owning {@link ColumnProfile}. */
@Value
@Builder
public class QualityAssessment {

  public static final String HIGH_NULL_PERCENTAGE = "High null percentage";
  public static final String HIGH_BLANK_PERCENTAGE = "High blank percentage";
  public static final String LOW_DATA_DIVERSITY = "Low data diversity";

  double qualityScore;
  double completenessPercentage;
  double uniquenessPercentage;
  List<String> potentialIssues;
}
