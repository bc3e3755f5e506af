package com.dview.profiler.service.profiling.statistics;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.dview.profiler.dto.profile.BooleanStatistics;

class BooleanStatisticsCalculatorTest {

  private final BooleanStatisticsCalculator calculator = new BooleanStatisticsCalculator();

  @Test
  void shouldSplitTrueAndFalse() {
    BooleanStatistics stats = calculator.calculate(List.of(true, false, true, "yes"));

    assertThat(stats.getTrueCount()).isEqualTo(3);
    assertThat(stats.getFalseCount()).isEqualTo(1);
    assertThat(stats.getTruePercentage()).isEqualTo(75.0);
    assertThat(stats.getFalsePercentage()).isEqualTo(25.0);
  }

  @Test
  void shouldZeroEverythingWhenAnyValueFailsCoercion() {
    BooleanStatistics stats = calculator.calculate(List.of("true", "maybe"));

    assertThat(stats.getTrueCount()).isZero();
    assertThat(stats.getFalseCount()).isZero();
    assertThat(stats.getTruePercentage()).isZero();
  }
}
