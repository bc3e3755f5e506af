package com.dview.profiler.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/** Cross-origin settings for the browser front end. */
@Data
@Component
@ConfigurationProperties(prefix = "cors")
public class CorsProperties {

  /** Origin patterns allowed to call the API; any origin when empty. */
  private List<String> allowedOrigins = new ArrayList<>();

  private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "OPTIONS"));

  /** How long browsers may cache a preflight response. */
  private long maxAgeSeconds = 1800;
}
