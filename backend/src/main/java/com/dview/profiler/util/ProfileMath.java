package com.dview.profiler.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Rounding and ratio helpers shared by the profiling components. */
public final class ProfileMath {

  private ProfileMath() {}

  public static double round(double value, int places) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return value;
    }
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }

  /** {@code count / total * 100} rounded to 2 decimals; 0 when {@code total == 0}. */
  public static double percentage(long count, long total) {
    if (total == 0) {
      return 0.0;
    }
    return round(ratio(count, total), 2);
  }

  /** Unrounded {@code count / total * 100}; 0 when {@code total == 0}. */
  public static double ratio(long count, long total) {
    if (total == 0) {
      return 0.0;
    }
    return (double) count / total * 100.0;
  }
}
