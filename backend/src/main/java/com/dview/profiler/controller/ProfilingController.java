package com.dview.profiler.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dview.profiler.dto.api.ProfilingRequest;
import com.dview.profiler.dto.api.ProfilingStartResponse;
import com.dview.profiler.dto.api.ProfilingStatusResponse;
import com.dview.profiler.dto.profile.ProfileReport;
import com.dview.profiler.exception.ResourceNotFoundException;
import com.dview.profiler.service.session.ProfilingJobService;
import com.dview.profiler.service.session.ProfilingSession;
import com.dview.profiler.service.session.SessionRegistry;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Profiling", description = "Start profiling runs and read their results")
public class ProfilingController {

  static final String STARTED = "started";
  static final String STARTED_MESSAGE = "Profiling started in background";

  private final ProfilingJobService profilingJobService;
  private final SessionRegistry sessionRegistry;

  @PostMapping(
      value = "/profile-data",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Start profiling",
      description = "Profile the selected tables of a session in the background")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Profiling scheduled",
            content = @Content(schema = @Schema(implementation = ProfilingStartResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(responseCode = "404", description = "Session not found", content = @Content),
        @ApiResponse(
            responseCode = "409",
            description = "Session is already profiling",
            content = @Content)
      })
  public ResponseEntity<ProfilingStartResponse> profileData(
      @Valid @RequestBody ProfilingRequest request) {
    log.info(
        "[CONTROLLER] Profiling requested for session {}: {}",
        request.getSessionId(),
        request.getTables());
    String taskId =
        profilingJobService.start(
            request.getSessionId(), request.getTables(), request.getMaxRecords());
    return ResponseEntity.ok(
        ProfilingStartResponse.builder()
            .taskId(taskId)
            .status(STARTED)
            .message(STARTED_MESSAGE)
            .build());
  }

  @GetMapping(
      value = "/profiling-status/{sessionId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Profiling status", description = "Status and progress of the latest run")
  public ResponseEntity<ProfilingStatusResponse> getStatus(@PathVariable String sessionId) {
    ProfilingSession session = sessionRegistry.get(sessionId);
    return ResponseEntity.ok(
        ProfilingStatusResponse.builder()
            .status(session.getStatus())
            .progress(session.getProgress())
            .error(session.getError())
            .resultsAvailable(session.isResultsAvailable())
            .build());
  }

  @GetMapping(
      value = "/profiling-results/{sessionId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Profiling results",
      description = "Per-table results of the latest completed run")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Results keyed by table name"),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown session or no results yet",
            content = @Content)
      })
  public ResponseEntity<ProfileReport> getResults(@PathVariable String sessionId) {
    ProfilingSession session = sessionRegistry.get(sessionId);
    if (!session.isResultsAvailable()) {
      throw new ResourceNotFoundException("No profiling results available");
    }
    return ResponseEntity.ok(session.getResults());
  }
}
