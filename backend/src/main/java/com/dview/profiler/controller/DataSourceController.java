package com.dview.profiler.controller;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.dview.profiler.dto.api.DatabaseConnectionResponse;
import com.dview.profiler.dto.api.RecordCountResponse;
import com.dview.profiler.dto.api.UploadResponse;
import com.dview.profiler.dto.source.DatabaseConnectionRequest;
import com.dview.profiler.dto.source.FileStructure;
import com.dview.profiler.dto.source.SheetInfo;
import com.dview.profiler.exception.DataSourceException;
import com.dview.profiler.service.session.ProfilingJobService;
import com.dview.profiler.service.session.ProfilingSession;
import com.dview.profiler.service.session.SessionRegistry;
import com.dview.profiler.service.source.DatabaseConnectorService;
import com.dview.profiler.service.source.FileConnectorService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
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
@Tag(name = "Data Sources", description = "File upload and database connection endpoints")
public class DataSourceController {

  private final FileConnectorService fileConnectorService;
  private final DatabaseConnectorService databaseConnectorService;
  private final SessionRegistry sessionRegistry;
  private final ProfilingJobService profilingJobService;

  @PostMapping(
      value = "/upload-file",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Upload a data file",
      description = "Store a CSV, JSON or SQL file and open a profiling session for it")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "File stored and structure analyzed",
            content = @Content(schema = @Schema(implementation = UploadResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Empty, oversized, unsupported or unreadable file",
            content = @Content)
      })
  public ResponseEntity<UploadResponse> uploadFile(
      @Parameter(description = "CSV, JSON or SQL file", required = true) @RequestParam("file")
          MultipartFile file)
      throws IOException, DataSourceException {
    log.info(
        "[CONTROLLER] Upload received: {} ({} bytes)", file.getOriginalFilename(), file.getSize());

    Path stored = fileConnectorService.store(file);
    FileStructure structure;
    try {
      structure = fileConnectorService.analyzeStructure(stored);
    } catch (DataSourceException | RuntimeException e) {
      fileConnectorService.delete(stored);
      throw e;
    }

    String fileName =
        Paths.get(String.valueOf(file.getOriginalFilename())).getFileName().toString();
    structure.setFileName(fileName);
    ProfilingSession session =
        sessionRegistry.createFileSession(stored, fileName, structure.getSheets());

    return ResponseEntity.ok(
        UploadResponse.builder()
            .sessionId(session.getSessionId())
            .filename(fileName)
            .structure(structure)
            .build());
  }

  @PostMapping(
      value = "/connect-database",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Connect to a database",
      description = "Open a profiling session on an Oracle, SQL Server or H2 database")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Connected; tables listed",
            content =
                @Content(schema = @Schema(implementation = DatabaseConnectionResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid connection parameters or connection failure",
            content = @Content)
      })
  public ResponseEntity<DatabaseConnectionResponse> connectDatabase(
      @Valid @RequestBody DatabaseConnectionRequest request) throws DataSourceException {
    log.info(
        "[CONTROLLER] Database connection requested: {} {}:{}/{}",
        request.getConnectionType(),
        request.getHost(),
        request.getPort(),
        request.getDatabase());

    List<SheetInfo> tables = databaseConnectorService.connectAndListTables(request);
    ProfilingSession session = sessionRegistry.createDatabaseSession(request, tables);
    return ResponseEntity.ok(
        DatabaseConnectionResponse.builder()
            .sessionId(session.getSessionId())
            .tables(tables)
            .build());
  }

  @GetMapping(
      value = "/session/{sessionId}/record-count",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Count records", description = "Row count of one table of a session")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Row count"),
        @ApiResponse(responseCode = "400", description = "Unknown table", content = @Content),
        @ApiResponse(responseCode = "404", description = "Session not found", content = @Content)
      })
  public ResponseEntity<RecordCountResponse> getRecordCount(
      @PathVariable String sessionId,
      @Parameter(description = "Table, sheet or JSON key", required = true)
          @RequestParam("table_name")
          String tableName)
      throws DataSourceException {
    long count = profilingJobService.countRecords(sessionId, tableName);
    return ResponseEntity.ok(
        RecordCountResponse.builder().tableName(tableName).recordCount(count).build());
  }
}
