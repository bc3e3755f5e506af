package com.dview.profiler.controller;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.dto.api.SettingsDto;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service liveness plus the settings that may change at runtime. Updates apply to profiling runs
 * started afterwards.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Settings", description = "Health check and runtime settings")
public class SettingsController {

  static final String UPDATED_MESSAGE = "Settings updated successfully";

  private final ApplicationProperties properties;

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the profiling service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(
        Map.of(
            "status", "UP",
            "message", "DView Data Profiling API",
            "timestamp", System.currentTimeMillis()));
  }

  @GetMapping(value = "/settings", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get settings", description = "Current profiling settings")
  public ResponseEntity<SettingsDto> getSettings() {
    return ResponseEntity.ok(
        SettingsDto.builder()
            .maxThreads(properties.getMaxThreads())
            .defaultMaxRecords(properties.getDefaultMaxRecords())
            .chunkSize(properties.getChunkSize())
            .build());
  }

  @PostMapping(
      value = "/settings",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Update settings", description = "Change any of the profiling settings")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Settings updated"),
        @ApiResponse(responseCode = "400", description = "Non-positive value")
      })
  public ResponseEntity<Map<String, String>> updateSettings(
      @Valid @RequestBody SettingsDto settings) {
    if (settings.getMaxThreads() != null) {
      properties.setMaxThreads(settings.getMaxThreads());
    }
    if (settings.getDefaultMaxRecords() != null) {
      properties.setDefaultMaxRecords(settings.getDefaultMaxRecords());
    }
    if (settings.getChunkSize() != null) {
      properties.setChunkSize(settings.getChunkSize());
    }
    log.info(
        "[CONTROLLER] Settings updated: max_threads={}, default_max_records={}, chunk_size={}",
        properties.getMaxThreads(),
        properties.getDefaultMaxRecords(),
        properties.getChunkSize());
    return ResponseEntity.ok(Map.of("message", UPDATED_MESSAGE));
  }
}
