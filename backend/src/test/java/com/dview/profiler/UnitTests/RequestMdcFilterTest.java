package com.dview.profiler;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

class RequestMdcFilterTest {

  private final RequestMdcFilter filter = new RequestMdcFilter();
  private final Map<String, String> seen = new HashMap<>();

  @AfterEach
  void tearDown() {
    MDC.clear();
  }

  @Test
  void putsHeadersIntoMdcForTheRequestOnly() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    request.addHeader(RequestMdcFilter.SESSION_ID_HEADER, "session-1");
    request.addHeader(RequestMdcFilter.CORRELATION_ID_HEADER, "corr-1");

    filter.doFilter(request, new MockHttpServletResponse(), capturingChain());

    assertThat(seen)
        .containsEntry(RequestMdcFilter.SESSION_ID_MDC_KEY, "session-1")
        .containsEntry(RequestMdcFilter.CORRELATION_ID_MDC_KEY, "corr-1");
    assertThat(MDC.get(RequestMdcFilter.SESSION_ID_MDC_KEY)).isNull();
    assertThat(MDC.get(RequestMdcFilter.CORRELATION_ID_MDC_KEY)).isNull();
  }

  @Test
  void skipsMissingOrEmptyHeaders() throws Exception {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/health");
    request.addHeader(RequestMdcFilter.SESSION_ID_HEADER, "");

    filter.doFilter(request, new MockHttpServletResponse(), capturingChain());

    assertThat(seen).doesNotContainKeys(
        RequestMdcFilter.SESSION_ID_MDC_KEY, RequestMdcFilter.CORRELATION_ID_MDC_KEY);
  }

  private MockFilterChain capturingChain() {
    return new MockFilterChain(
        new HttpServlet() {
          @Override
          protected void service(HttpServletRequest req, HttpServletResponse resp) {
            Map<String, String> context = MDC.getCopyOfContextMap();
            if (context != null) {
              seen.putAll(context);
            }
          }
        });
  }
}
