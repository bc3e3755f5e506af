package com.dview.profiler.util;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

/**
 * Carries the submitting thread's SLF4J MDC ({@code sessionId}, {@code correlationId}) into worker
 * threads. MDC is thread-local, so profiling workers would otherwise log without the request's
 * identifiers.
 */
public final class MdcPropagation {

  private MdcPropagation() {}

  /** Captures the current MDC now and installs it around {@code task} when it runs. */
  public static Runnable wrapRunnable(Runnable task) {
    Map<String, String> contextMap = copyMdc();
    return () -> {
      setMdc(contextMap);
      try {
        task.run();
      } finally {
        clearMdc(contextMap);
      }
    };
  }

  /** Callable variant of {@link #wrapRunnable(Runnable)}. */
  public static <T> Callable<T> wrapCallable(Callable<T> task) {
    Map<String, String> contextMap = copyMdc();
    return () -> {
      setMdc(contextMap);
      try {
        return task.call();
      } finally {
        clearMdc(contextMap);
      }
    };
  }

  /** Copy of the current thread's MDC; never {@code null}. */
  public static Map<String, String> copyMdc() {
    Map<String, String> map = MDC.getCopyOfContextMap();
    return map == null ? Collections.emptyMap() : map;
  }

  private static void setMdc(Map<String, String> contextMap) {
    contextMap.forEach(MDC::put);
  }

  private static void clearMdc(Map<String, String> contextMap) {
    contextMap.keySet().forEach(MDC::remove);
  }
}
