package com.dview.profiler.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import com.fasterxml.jackson.databind.ObjectMapper;

class CoreConfigTest {

  private final CoreConfig coreConfig = new CoreConfig();
  private ThreadPoolTaskExecutor executor;

  @AfterEach
  void tearDown() {
    MDC.clear();
    if (executor != null) {
      executor.shutdown();
    }
  }

  @Test
  void objectMapperWritesDatesAsIsoText() throws Exception {
    ObjectMapper mapper = coreConfig.objectMapper();

    String json = mapper.writeValueAsString(Map.of("at", LocalDateTime.of(2024, 1, 2, 3, 4, 5)));

    assertThat(json).contains("\"2024-01-02T03:04:05\"");
  }

  @Test
  void objectMapperIgnoresUnknownProperties() throws Exception {
    ObjectMapper mapper = coreConfig.objectMapper();

    Sample sample = mapper.readValue("{\"name\":\"a\",\"extra\":1}", Sample.class);

    assertThat(sample.name).isEqualTo("a");
  }

  @Test
  void profilingExecutorPropagatesMdc() throws Exception {
    executor = coreConfig.profilingTaskExecutor();
    MDC.put("sessionId", "s-42");

    Future<String> seen = executor.submit(() -> MDC.get("sessionId"));

    assertThat(seen.get(5, TimeUnit.SECONDS)).isEqualTo("s-42");
    assertThat(executor.getThreadNamePrefix()).isEqualTo("profiling-job-");
  }

  static class Sample {
    public String name;
  }
}
