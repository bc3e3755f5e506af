package com.dview.profiler.service.profiling.statistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.dto.profile.StringStatistics;
import com.dview.profiler.dto.profile.ValueFrequency;
import com.dview.profiler.service.profiling.pattern.PatternMiner;
import com.dview.profiler.util.ProfileMath;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class StringStatisticsCalculator {

  private final PatternMiner patternMiner;
  private final ApplicationProperties properties;

  public StringStatistics calculate(List<Object> nonNullValues) {
    if (nonNullValues.isEmpty()) {
      return StringStatistics.builder().build();
    }

    List<String> rendered = new ArrayList<>(nonNullValues.size());
    FrequencyCounter<String> frequencies = new FrequencyCounter<>();
    long totalLength = 0;
    int minLength = Integer.MAX_VALUE;
    int maxLength = 0;
    for (Object value : nonNullValues) {
      String text = value.toString();
      rendered.add(text);
      frequencies.add(text);
      int length = text.codePointCount(0, text.length());
      totalLength += length;
      minLength = Math.min(minLength, length);
      maxLength = Math.max(maxLength, length);
    }

    int n = rendered.size();
    List<ValueFrequency> mostCommon = new ArrayList<>();
    for (Map.Entry<String, Long> entry : frequencies.top(properties.getTopValues())) {
      mostCommon.add(
          ValueFrequency.builder()
              .value(entry.getKey())
              .count(entry.getValue())
              .percentage(ProfileMath.percentage(entry.getValue(), n))
              .build());
    }

    return StringStatistics.builder()
        .avgLength(ProfileMath.round((double) totalLength / n, 2))
        .minLength(minLength)
        .maxLength(maxLength)
        .mostCommonValues(mostCommon)
        .patterns(patternMiner.mine(rendered))
        .build();
  }
}
