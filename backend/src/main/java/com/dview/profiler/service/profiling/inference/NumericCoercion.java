package com.dview.profiler.service.profiling.inference;

import java.math.BigDecimal;

/** Converts cell values to {@code double}. Text is trimmed and parsed as a decimal literal. */
public final class NumericCoercion {

  private NumericCoercion() {}

  public static Coercion<Double> toDouble(Object value) {
    if (value == null) {
      return Coercion.failure("null value");
    }
    if (value instanceof Boolean) {
      return Coercion.failure("boolean is not numeric");
    }
    if (value instanceof Number) {
      double number = ((Number) value).doubleValue();
      return Double.isNaN(number) ? Coercion.failure("NaN") : Coercion.success(number);
    }

    String text = value.toString().trim();
    if (text.isEmpty()) {
      return Coercion.failure("blank text");
    }
    try {
      return Coercion.success(new BigDecimal(text).doubleValue());
    } catch (NumberFormatException e) {
      return Coercion.failure("not a number: " + text);
    }
  }
}
