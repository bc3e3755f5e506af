package com.dview.profiler.service.profiling.inference;

import java.util.Locale;
import java.util.Set;

/** Best-effort conversion of cell values to {@code boolean}. */
public final class BooleanCoercion {

  private static final Set<String> TRUE_TOKENS = Set.of("true", "t", "yes", "y", "1");
  private static final Set<String> FALSE_TOKENS = Set.of("false", "f", "no", "n", "0");

  private BooleanCoercion() {}

  public static Coercion<Boolean> toBoolean(Object value) {
    if (value == null) {
      return Coercion.failure("null value");
    }
    if (value instanceof Boolean) {
      return Coercion.success((Boolean) value);
    }
    if (value instanceof Number) {
      double number = ((Number) value).doubleValue();
      return Double.isNaN(number) ? Coercion.failure("NaN") : Coercion.success(number != 0.0);
    }

    String token = value.toString().trim().toLowerCase(Locale.ROOT);
    if (TRUE_TOKENS.contains(token)) {
      return Coercion.success(Boolean.TRUE);
    }
    if (FALSE_TOKENS.contains(token)) {
      return Coercion.success(Boolean.FALSE);
    }
    return Coercion.failure("not a boolean: " + value);
  }
}
