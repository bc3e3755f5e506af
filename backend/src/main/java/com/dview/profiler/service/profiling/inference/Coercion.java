package com.dview.profiler.service.profiling.inference;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Outcome of converting one cell value to a target type. Failures carry a reason instead of an
 * exception so callers can branch on them without try/catch.
 */
public final class Coercion<T> {

  private final T value;
  private final String failureReason;

  private Coercion(T value, String failureReason) {
    this.value = value;
    this.failureReason = failureReason;
  }

  public static <T> Coercion<T> success(T value) {
    return new Coercion<>(value, null);
  }

  public static <T> Coercion<T> failure(String reason) {
    return new Coercion<>(null, reason != null ? reason : "coercion failed");
  }

  public boolean isSuccess() {
    return failureReason == null;
  }

  public boolean isFailure() {
    return failureReason != null;
  }

  public T getValue() {
    if (isFailure()) {
      throw new NoSuchElementException("No value present: " + failureReason);
    }
    return value;
  }

  public String getFailureReason() {
    return failureReason;
  }

  public Optional<T> toOptional() {
    return isSuccess() ? Optional.ofNullable(value) : Optional.empty();
  }

  @Override
  public String toString() {
    return isSuccess() ? "Coercion[" + value + "]" : "Coercion.failure[" + failureReason + "]";
  }
}
