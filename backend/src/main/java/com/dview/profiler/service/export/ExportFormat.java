package com.dview.profiler.service.export;

import java.util.Locale;

import org.springframework.http.MediaType;

public enum ExportFormat {
  JSON("json", MediaType.APPLICATION_JSON),
  CSV("csv", new MediaType("text", "csv")),
  HTML("html", MediaType.TEXT_HTML),
  XLSX(
      "xlsx",
      new MediaType("application", "vnd.openxmlformats-officedocument.spreadsheetml.sheet"));

  private final String extension;
  private final MediaType mediaType;

  ExportFormat(String extension, MediaType mediaType) {
    this.extension = extension;
    this.mediaType = mediaType;
  }

  public String getExtension() {
    return extension;
  }

  public MediaType getMediaType() {
    return mediaType;
  }

  /**
   * @throws IllegalArgumentException for anything other than {@code json}, {@code csv}, {@code
   *     html} or {@code xlsx}
   */
  public static ExportFormat fromName(String name) {
    if (name != null) {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      for (ExportFormat format : values()) {
        if (format.extension.equals(normalized)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Invalid export format: " + name);
  }
}
