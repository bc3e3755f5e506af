package com.dview.profiler.service.profiling.statistics;

import java.util.List;

import org.springframework.stereotype.Component;

import com.dview.profiler.dto.profile.BooleanStatistics;
import com.dview.profiler.service.profiling.inference.BooleanCoercion;
import com.dview.profiler.service.profiling.inference.Coercion;
import com.dview.profiler.util.ProfileMath;

import lombok.extern.slf4j.Slf4j;

/** True/false split of a boolean column. Any value that fails coercion zeroes the whole block. */
@Slf4j
@Component
public class BooleanStatisticsCalculator {

  public BooleanStatistics calculate(List<Object> nonNullValues) {
    long trueCount = 0;
    for (Object value : nonNullValues) {
      Coercion<Boolean> coerced = BooleanCoercion.toBoolean(value);
      if (coerced.isFailure()) {
        log.debug("Boolean coercion failed: {}", coerced.getFailureReason());
        return BooleanStatistics.builder().build();
      }
      if (coerced.getValue()) {
        trueCount++;
      }
    }

    long n = nonNullValues.size();
    long falseCount = n - trueCount;
    return BooleanStatistics.builder()
        .trueCount(trueCount)
        .falseCount(falseCount)
        .truePercentage(ProfileMath.percentage(trueCount, n))
        .falsePercentage(ProfileMath.percentage(falseCount, n))
        .build();
  }
}
