package com.dview.profiler.service.profiling;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.dview.profiler.dto.profile.ColumnProfile;
import com.dview.profiler.dto.profile.ColumnStatistics;
import com.dview.profiler.dto.profile.QualityAssessment;
import com.dview.profiler.dto.table.Column;
import com.dview.profiler.dto.table.StorageType;
import com.dview.profiler.exception.ColumnProfilingException;
import com.dview.profiler.service.profiling.inference.TypeInference;
import com.dview.profiler.service.profiling.inference.TypeInferencer;
import com.dview.profiler.service.profiling.quality.QualityScorer;
import com.dview.profiler.service.profiling.statistics.BooleanStatisticsCalculator;
import com.dview.profiler.service.profiling.statistics.DateTimeStatisticsCalculator;
import com.dview.profiler.service.profiling.statistics.NumericStatisticsCalculator;
import com.dview.profiler.service.profiling.statistics.StringStatisticsCalculator;
import com.dview.profiler.util.ProfileMath;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the {@link ColumnProfile} of one column: counts, inferred type, the statistics block for
 * that type and the quality assessment.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColumnProfiler {

  private final TypeInferencer typeInferencer;
  private final NumericStatisticsCalculator numericStatistics;
  private final StringStatisticsCalculator stringStatistics;
  private final DateTimeStatisticsCalculator dateTimeStatistics;
  private final BooleanStatisticsCalculator booleanStatistics;
  private final QualityScorer qualityScorer;

  /**
   * @throws ColumnProfilingException if any step fails; the caller records it against this column
   *     only
   */
  public ColumnProfile profile(Column column) {
    try {
      return doProfile(column);
    } catch (ColumnProfilingException e) {
      throw e;
    } catch (RuntimeException e) {
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      throw new ColumnProfilingException(column.getName(), message, e);
    }
  }

  private ColumnProfile doProfile(Column column) {
    long total = column.size();
    List<Object> nonNull = column.nonNullValues();
    long nullCount = total - nonNull.size();
    long blankCount = countBlanks(column, nonNull);
    long distinctCount = countDistinct(nonNull);

    TypeInference inference = typeInferencer.infer(column);
    ColumnStatistics statistics = statisticsFor(inference, nonNull);
    QualityAssessment quality = qualityScorer.score(nullCount, blankCount, distinctCount, total);

    log.debug(
        "[PROFILER] Column '{}' profiled as {} ({} values, {} nulls)",
        column.getName(),
        inference.getDataType(),
        total,
        nullCount);

    return ColumnProfile.builder()
        .columnName(column.getName())
        .dataType(inference.getDataType())
        .totalValues(total)
        .nullCount(nullCount)
        .nullPercentage(ProfileMath.percentage(nullCount, total))
        .blankCount(blankCount)
        .blankPercentage(ProfileMath.percentage(blankCount, total))
        .nonNullCount(nonNull.size())
        .distinctCount(distinctCount)
        .distinctPercentage(ProfileMath.percentage(distinctCount, total))
        .statistics(statistics)
        .qualityScore(quality.getQualityScore())
        .completenessPercentage(quality.getCompletenessPercentage())
        .uniquenessPercentage(quality.getUniquenessPercentage())
        .potentialIssues(quality.getPotentialIssues())
        .build();
  }

  private ColumnStatistics statisticsFor(TypeInference inference, List<Object> nonNull) {
    switch (inference.getDataType()) {
      case INTEGER:
      case FLOAT:
        return numericStatistics.calculate(nonNull);
      case DATETIME:
        return dateTimeStatistics.calculate(nonNull, inference.getDateFormat());
      case BOOLEAN:
        return booleanStatistics.calculate(nonNull);
      case STRING:
        return stringStatistics.calculate(nonNull);
      default:
        throw new IllegalStateException("Unhandled data type: " + inference.getDataType());
    }
  }

  private static long countBlanks(Column column, List<Object> nonNull) {
    if (column.getStorageType() != StorageType.TEXT) {
      return 0;
    }
    long blanks = 0;
    for (Object value : nonNull) {
      if (value.toString().trim().isEmpty()) {
        blanks++;
      }
    }
    return blanks;
  }

  private static long countDistinct(List<Object> nonNull) {
    Set<Object> distinct = new HashSet<>(nonNull);
    return distinct.size();
  }
}
