package com.dview.profiler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "profiler")
public class ApplicationProperties {

  /** Bound of both the table pool and the per-table column pool. */
  private int maxThreads = 4;

  private int defaultMaxRecords = 10000;
  private int chunkSize = 1000;

  private int patternSampleSize = 1000;
  private int maxPatterns = 20;
  private int topValues = 10;
  private int topDates = 5;
  private int dateDetectionSampleSize = 200;

  private String tempDir = "temp";
  private long maxFileSize = 100L * 1024 * 1024;

  private Session session = new Session();

  @Data
  public static class Session {
    private long expireAfterAccessMinutes = 120;
    private long maxSessions = 500;
  }
}
