package com.dview.profiler.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;

class WebConfigTest {

  private CorsProperties corsProperties;
  private WebConfig webConfig;
  private CorsRegistry registry;
  private CorsRegistration registration;

  @BeforeEach
  void setUp() {
    corsProperties = new CorsProperties();
    webConfig = new WebConfig(corsProperties);
    registry = mock(CorsRegistry.class);
    registration = mock(CorsRegistration.class);

    when(registry.addMapping("/**")).thenReturn(registration);
    when(registration.allowedOriginPatterns(any(String[].class))).thenReturn(registration);
    when(registration.allowedMethods(any(String[].class))).thenReturn(registration);
    when(registration.allowedHeaders(any(String[].class))).thenReturn(registration);
    when(registration.exposedHeaders(any(String[].class))).thenReturn(registration);
    when(registration.allowCredentials(anyBoolean())).thenReturn(registration);
    when(registration.maxAge(anyLong())).thenReturn(registration);
  }

  @Test
  void rootRedirectsToSwaggerUi() {
    ViewControllerRegistry viewRegistry = mock(ViewControllerRegistry.class);

    webConfig.addViewControllers(viewRegistry);

    verify(viewRegistry).addRedirectViewController("/", "/swagger-ui/index.html");
    verify(viewRegistry).setOrder(1);
  }

  @Test
  void configuredOriginsAreUsed() {
    corsProperties.setAllowedOrigins(List.of("http://localhost:3000", " https://app.test "));

    webConfig.addCorsMappings(registry);

    verify(registration)
        .allowedOriginPatterns(new String[] {"http://localhost:3000", "https://app.test"});
    verify(registration).allowedMethods(new String[] {"GET", "POST", "OPTIONS"});
    verify(registration).allowedHeaders(new String[] {"*"});
    verify(registration).exposedHeaders(new String[] {"Content-Disposition"});
    verify(registration).allowCredentials(true);
    verify(registration).maxAge(1800L);
  }

  @Test
  void anyOriginIsAllowedWhenNoneConfigured() {
    corsProperties.setAllowedOrigins(List.of(" ", ""));

    assertThat(webConfig.originPatterns()).containsExactly("*");
  }

  @Test
  void bindsCommaSeparatedOrigins() {
    new ApplicationContextRunner()
        .withUserConfiguration(CorsPropertiesConfig.class)
        .withPropertyValues(
            "cors.allowed-origins=http://localhost:3000,http://localhost:5173",
            "cors.max-age-seconds=60")
        .run(
            context -> {
              CorsProperties bound = context.getBean(CorsProperties.class);
              assertThat(bound.getAllowedOrigins())
                  .containsExactly("http://localhost:3000", "http://localhost:5173");
              assertThat(bound.getAllowedMethods()).containsExactly("GET", "POST", "OPTIONS");
              assertThat(bound.getMaxAgeSeconds()).isEqualTo(60L);
            });
  }

  @Configuration
  @EnableConfigurationProperties(CorsProperties.class)
  static class CorsPropertiesConfig {}
}
