package com.dview.profiler.service.profiling.statistics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Component;

import com.dview.profiler.dto.profile.NumericStatistics;
import com.dview.profiler.service.profiling.inference.Coercion;
import com.dview.profiler.service.profiling.inference.NumericCoercion;
import com.dview.profiler.util.ProfileMath;

/**
 * Summary statistics for integer and float columns. Values that do not coerce to a number are
 * dropped; when nothing is left every field is {@code null}.
 */
@Component
public class NumericStatisticsCalculator {

  private static final int MEAN_PLACES = 6;

  public NumericStatistics calculate(List<Object> nonNullValues) {
    List<Double> numbers = new ArrayList<>(nonNullValues.size());
    for (Object value : nonNullValues) {
      Coercion<Double> coerced = NumericCoercion.toDouble(value);
      if (coerced.isSuccess()) {
        numbers.add(coerced.getValue());
      }
    }
    if (numbers.isEmpty()) {
      return NumericStatistics.empty();
    }

    Collections.sort(numbers);
    int n = numbers.size();

    double sum = 0.0;
    long zeros = 0;
    long negatives = 0;
    long positives = 0;
    for (double number : numbers) {
      sum += number;
      if (number == 0.0) {
        zeros++;
      } else if (number < 0.0) {
        negatives++;
      } else {
        positives++;
      }
    }
    double mean = sum / n;

    double squaredDeviations = 0.0;
    for (double number : numbers) {
      double deviation = number - mean;
      squaredDeviations += deviation * deviation;
    }
    double standardDeviation = Math.sqrt(squaredDeviations / n);

    return NumericStatistics.builder()
        .minValue(numbers.get(0))
        .maxValue(numbers.get(n - 1))
        .average(ProfileMath.round(mean, MEAN_PLACES))
        .median(quantile(numbers, 0.5))
        .standardDeviation(ProfileMath.round(standardDeviation, MEAN_PLACES))
        .quartile25(quantile(numbers, 0.25))
        .quartile75(quantile(numbers, 0.75))
        .zeroCount(zeros)
        .negativeCount(negatives)
        .positiveCount(positives)
        .build();
  }

  /** Linear interpolation between closest ranks over an ascending list. */
  static double quantile(List<Double> sorted, double q) {
    double position = (sorted.size() - 1) * q;
    int lower = (int) Math.floor(position);
    int upper = (int) Math.ceil(position);
    double lowerValue = sorted.get(lower);
    if (lower == upper) {
      return lowerValue;
    }
    return lowerValue + (sorted.get(upper) - lowerValue) * (position - lower);
  }
}
