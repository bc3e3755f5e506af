package com.dview.profiler.service.profiling.inference;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.cobber.fta.TextAnalysisResult;
import com.cobber.fta.TextAnalyzer;
import com.dview.profiler.config.ApplicationProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Uses FTA to discover the date/time format of a text column whose values do not match any of the
 * default formats, e.g. {@code dd.MM.yyyy} or {@code MMM d, yyyy}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DateFormatDetector {

  private static final Set<String> TEMPORAL_TYPES =
      Set.of("LOCALDATE", "LOCALDATETIME", "OFFSETDATETIME", "ZONEDDATETIME");

  private final ApplicationProperties properties;

  public Optional<DateTimeFormatter> detect(String columnName, List<String> values) {
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }

    try {
      TextAnalyzer analyzer = new TextAnalyzer(columnName != null ? columnName : "column");
      analyzer.setLocale(Locale.US);
      int limit = Math.max(1, properties.getDateDetectionSampleSize());
      int trained = 0;
      for (String value : values) {
        analyzer.train(value);
        if (++trained >= limit) {
          break;
        }
      }

      TextAnalysisResult result = analyzer.getResult();
      String baseType = result.getType() != null ? result.getType().toString() : null;
      String format = result.getTypeModifier();
      if (baseType == null || !TEMPORAL_TYPES.contains(baseType)) {
        return Optional.empty();
      }
      if (format == null || format.isBlank() || format.contains("?")) {
        log.debug(
            "Column '{}': FTA reported {} with unresolved format '{}'",
            columnName,
            baseType,
            format);
        return Optional.empty();
      }

      log.debug("Column '{}': FTA detected {} format '{}'", columnName, baseType, format);
      return Optional.of(DateTimeFormatter.ofPattern(format, Locale.US));
    } catch (IllegalArgumentException e) {
      log.debug("Column '{}': FTA format is not a valid pattern: {}", columnName, e.getMessage());
      return Optional.empty();
    } catch (Exception e) {
      log.warn("Column '{}': FTA date detection failed: {}", columnName, e.getMessage());
      return Optional.empty();
    }
  }
}
