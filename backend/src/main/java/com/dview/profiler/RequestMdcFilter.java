package com.dview.profiler;

import java.io.IOException;

import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/** Puts the caller's session and correlation ids into the MDC for the duration of a request. */
@Component
@Order(1)
public class RequestMdcFilter extends OncePerRequestFilter {

  static final String SESSION_ID_MDC_KEY = "sessionId";
  static final String SESSION_ID_HEADER = "X-Session-Id";
  static final String CORRELATION_ID_MDC_KEY = "correlationId";
  static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      putIfPresent(SESSION_ID_MDC_KEY, request.getHeader(SESSION_ID_HEADER));
      putIfPresent(CORRELATION_ID_MDC_KEY, request.getHeader(CORRELATION_ID_HEADER));
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(SESSION_ID_MDC_KEY);
      MDC.remove(CORRELATION_ID_MDC_KEY);
    }
  }

  private static void putIfPresent(String key, String value) {
    if (value != null && !value.isEmpty()) {
      MDC.put(key, value);
    }
  }
}
