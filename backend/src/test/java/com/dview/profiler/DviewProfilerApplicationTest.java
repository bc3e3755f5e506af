package com.dview.profiler;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import com.dview.profiler.controller.ProfilingController;
import com.dview.profiler.service.session.SessionRegistry;

@SpringBootTest
@TestPropertySource(properties = {"spring.profiles.active=test", "server.port=0"})
class DviewProfilerApplicationTest {

  @Autowired private ProfilingController profilingController;

  @Autowired private SessionRegistry sessionRegistry;

  @Test
  void contextLoads() {
    assertThat(profilingController).isNotNull();
    assertThat(sessionRegistry.size()).isZero();
  }
}
