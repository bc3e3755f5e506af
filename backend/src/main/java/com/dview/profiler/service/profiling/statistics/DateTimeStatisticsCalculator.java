package com.dview.profiler.service.profiling.statistics;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.dto.profile.DateTimeStatistics;
import com.dview.profiler.service.profiling.inference.Coercion;
import com.dview.profiler.service.profiling.inference.DateTimeCoercion;

import lombok.RequiredArgsConstructor;

/**
 * Range and frequency statistics for date/time columns. Timestamps are rendered as ISO-8601 local
 * date-times; values that fail to parse are dropped.
 */
@Component
@RequiredArgsConstructor
public class DateTimeStatisticsCalculator {

  private final ApplicationProperties properties;

  /**
   * @param format format detected during inference, or {@code null} to use the default formats
   */
  public DateTimeStatistics calculate(List<Object> nonNullValues, DateTimeFormatter format) {
    List<LocalDateTime> timestamps = new ArrayList<>(nonNullValues.size());
    FrequencyCounter<LocalDateTime> frequencies = new FrequencyCounter<>();
    LocalDateTime min = null;
    LocalDateTime max = null;
    for (Object value : nonNullValues) {
      Coercion<LocalDateTime> coerced = DateTimeCoercion.toDateTime(value, format);
      if (coerced.isFailure()) {
        continue;
      }
      LocalDateTime timestamp = coerced.getValue();
      timestamps.add(timestamp);
      frequencies.add(timestamp);
      if (min == null || timestamp.isBefore(min)) {
        min = timestamp;
      }
      if (max == null || timestamp.isAfter(max)) {
        max = timestamp;
      }
    }

    if (timestamps.isEmpty()) {
      return DateTimeStatistics.builder().build();
    }

    List<String> mostCommon = new ArrayList<>();
    for (Map.Entry<LocalDateTime, Long> entry : frequencies.top(properties.getTopDates())) {
      mostCommon.add(iso(entry.getKey()));
    }

    return DateTimeStatistics.builder()
        .minDate(iso(min))
        .maxDate(iso(max))
        .dateRangeDays(Duration.between(min, max).toDays())
        .mostCommonDates(mostCommon)
        .build();
  }

  private static String iso(LocalDateTime timestamp) {
    return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(timestamp);
  }
}
