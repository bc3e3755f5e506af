package com.dview.profiler.service.profiling.quality;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.dview.profiler.dto.profile.QualityAssessment;
import com.dview.profiler.util.ProfileMath;

/**
 * Derives a quality score and issue flags from null, blank and distinct counts.
 *
 * <p>The score starts at 100, loses up to 30 points for nulls and up to 20 for blanks, gains 5 for
 * diversity above 80% and loses 10 for diversity below 10%. Only a floor of 0 is applied, so a
 * fully populated, fully distinct column scores 105.
 *
 * <p>A column with no values scores 100 with completeness 100, uniqueness 0 and no issues.
 */
@Component
public class QualityScorer {

  static final double MAX_NULL_PENALTY = 30.0;
  static final double MAX_BLANK_PENALTY = 20.0;
  static final double DIVERSITY_BONUS = 5.0;
  static final double LOW_DIVERSITY_PENALTY = 10.0;

  public QualityAssessment score(
      long nullCount, long blankCount, long distinctCount, long totalValues) {
    if (totalValues == 0) {
      return QualityAssessment.builder()
          .qualityScore(100.0)
          .completenessPercentage(100.0)
          .uniquenessPercentage(0.0)
          .potentialIssues(new ArrayList<>())
          .build();
    }

    double nullPercentage = ProfileMath.ratio(nullCount, totalValues);
    double blankPercentage = ProfileMath.ratio(blankCount, totalValues);
    double diversity = ProfileMath.ratio(distinctCount, totalValues);

    double score = 100.0;
    score -= Math.min(nullPercentage, MAX_NULL_PENALTY);
    score -= Math.min(blankPercentage, MAX_BLANK_PENALTY);
    if (diversity > 80.0) {
      score += DIVERSITY_BONUS;
    } else if (diversity < 10.0) {
      score -= LOW_DIVERSITY_PENALTY;
    }

    List<String> issues = new ArrayList<>();
    if (nullPercentage > 50.0) {
      issues.add(QualityAssessment.HIGH_NULL_PERCENTAGE);
    }
    if (blankPercentage > 20.0) {
      issues.add(QualityAssessment.HIGH_BLANK_PERCENTAGE);
    }
    if (diversity < 5.0) {
      issues.add(QualityAssessment.LOW_DATA_DIVERSITY);
    }

    return QualityAssessment.builder()
        .qualityScore(Math.max(0.0, ProfileMath.round(score, 1)))
        .completenessPercentage(ProfileMath.percentage(totalValues - nullCount, totalValues))
        .uniquenessPercentage(ProfileMath.percentage(distinctCount, totalValues))
        .potentialIssues(issues)
        .build();
  }
}
