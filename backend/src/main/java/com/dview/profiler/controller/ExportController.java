package com.dview.profiler.controller;

import java.io.IOException;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dview.profiler.dto.api.ExportRequest;
import com.dview.profiler.exception.ResourceNotFoundException;
import com.dview.profiler.service.export.ExportedFile;
import com.dview.profiler.service.export.ProfileExportService;
import com.dview.profiler.service.session.ProfilingSession;
import com.dview.profiler.service.session.SessionRegistry;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
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
@Tag(name = "Export", description = "Download profiling results as JSON, CSV, HTML or Excel")
public class ExportController {

  private final ProfileExportService profileExportService;
  private final SessionRegistry sessionRegistry;

  @PostMapping(value = "/export", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Export results",
      description = "Render the selected tables of the latest run as a downloadable file")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "File attachment"),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid export format",
            content = @Content),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown session or nothing to export",
            content = @Content)
      })
  public ResponseEntity<byte[]> exportResults(@Valid @RequestBody ExportRequest request)
      throws IOException {
    log.info(
        "[CONTROLLER] Export requested for session {} as {}",
        request.getSessionId(),
        request.getExportFormat());
    ProfilingSession session = sessionRegistry.get(request.getSessionId());
    if (!session.isResultsAvailable()) {
      throw new ResourceNotFoundException("No profiling results to export");
    }

    ExportedFile file =
        profileExportService.export(
            session.getResults(), request.getExportFormat(), request.getTables());
    return ResponseEntity.ok()
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(file.getFileName()).build().toString())
        .contentType(file.getMediaType())
        .contentLength(file.getContent().length)
        .body(file.getContent());
  }
}
