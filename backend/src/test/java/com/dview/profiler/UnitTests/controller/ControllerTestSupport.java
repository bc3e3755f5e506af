package com.dview.profiler.controller;

import org.springframework.http.converter.ByteArrayHttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.dview.profiler.config.CoreConfig;
import com.dview.profiler.exception.GlobalExceptionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Standalone MockMvc wired with the application's ObjectMapper and exception handler. */
final class ControllerTestSupport {

  static final ObjectMapper OBJECT_MAPPER = new CoreConfig().objectMapper();

  private ControllerTestSupport() {}

  static MockMvc mockMvc(Object controller) {
    return MockMvcBuilders.standaloneSetup(controller)
        .setControllerAdvice(new GlobalExceptionHandler())
        .setMessageConverters(
            new ByteArrayHttpMessageConverter(),
            new StringHttpMessageConverter(),
            new MappingJackson2HttpMessageConverter(OBJECT_MAPPER))
        .build();
  }
}
