package com.dview.profiler.config;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import lombok.RequiredArgsConstructor;

/**
 * Sends the bare root to the API documentation and opens the API to the configured front-end
 * origins. Downloads expose {@code Content-Disposition} so browsers can read the file name.
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

  static final String API_DOCS_PAGE = "/swagger-ui/index.html";

  private final CorsProperties corsProperties;

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", API_DOCS_PAGE);
    registry.setOrder(1);
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/**")
        .allowedOriginPatterns(originPatterns().toArray(new String[0]))
        .allowedMethods(corsProperties.getAllowedMethods().toArray(new String[0]))
        .allowedHeaders(CorsConfiguration.ALL)
        .exposedHeaders(HttpHeaders.CONTENT_DISPOSITION)
        .allowCredentials(true)
        .maxAge(corsProperties.getMaxAgeSeconds());
  }

  // Patterns rather than plain origins, since credentials are allowed.
  List<String> originPatterns() {
    List<String> configured =
        corsProperties.getAllowedOrigins().stream()
            .map(String::trim)
            .filter(origin -> !origin.isEmpty())
            .collect(Collectors.toList());
    return configured.isEmpty() ? List.of(CorsConfiguration.ALL) : configured;
  }
}
