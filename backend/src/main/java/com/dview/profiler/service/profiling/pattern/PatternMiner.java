package com.dview.profiler.service.profiling.pattern;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.dto.profile.PatternSummary;
import com.dview.profiler.util.ProfileMath;

import lombok.RequiredArgsConstructor;

/**
 * Reduces string values to structural patterns ({@code 9} for any digit, {@code A} for ASCII
 * letters; everything else is kept) and ranks them by frequency. Only the first {@code
 * patternSampleSize} values are scanned, so results on long columns are approximate.
 */
@Component
@RequiredArgsConstructor
public class PatternMiner {

  public static final char DIGIT_PLACEHOLDER = '9';
  public static final char LETTER_PLACEHOLDER = 'A';
  private static final int MAX_EXAMPLES = 3;

  private final ApplicationProperties properties;

  public List<PatternSummary> mine(List<String> values) {
    return mine(values, properties.getMaxPatterns());
  }

  public List<PatternSummary> mine(List<String> values, int maxPatterns) {
    if (values == null || values.isEmpty() || maxPatterns <= 0) {
      return new ArrayList<>();
    }

    int sampleSize = Math.min(values.size(), Math.max(1, properties.getPatternSampleSize()));
    Map<String, PatternAccumulator> byPattern = new LinkedHashMap<>();
    for (int i = 0; i < sampleSize; i++) {
      String value = values.get(i);
      String pattern = toPattern(value);
      byPattern.computeIfAbsent(pattern, PatternAccumulator::new).add(value);
    }

    List<PatternAccumulator> ranked = new ArrayList<>(byPattern.values());
    // stable sort keeps first-seen order for equal counts
    ranked.sort((a, b) -> Long.compare(b.count, a.count));

    List<PatternSummary> summaries = new ArrayList<>(Math.min(maxPatterns, ranked.size()));
    for (PatternAccumulator accumulator : ranked.subList(0, Math.min(maxPatterns, ranked.size()))) {
      summaries.add(
          PatternSummary.builder()
              .pattern(accumulator.pattern)
              .count(accumulator.count)
              .percentage(ProfileMath.percentage(accumulator.count, sampleSize))
              .examples(accumulator.examples)
              .build());
    }
    return summaries;
  }

  public static String toPattern(String value) {
    if (value == null) {
      return "";
    }
    StringBuilder pattern = new StringBuilder(value.length());
    value
        .codePoints()
        .forEach(
            cp -> {
              if (Character.isDigit(cp)) {
                pattern.append(DIGIT_PLACEHOLDER);
              } else if (isAsciiLetter(cp)) {
                pattern.append(LETTER_PLACEHOLDER);
              } else {
                pattern.appendCodePoint(cp);
              }
            });
    return pattern.toString();
  }

  private static boolean isAsciiLetter(int cp) {
    return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z');
  }

  private static final class PatternAccumulator {
    private final String pattern;
    private final List<String> examples = new ArrayList<>(MAX_EXAMPLES);
    private long count;

    private PatternAccumulator(String pattern) {
      this.pattern = pattern;
    }

    private void add(String value) {
      count++;
      if (examples.size() < MAX_EXAMPLES) {
        examples.add(value);
      }
    }
  }
}
