package com.dview.profiler.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.dview.profiler.dto.profile.ProfileError;
import com.dview.profiler.dto.profile.ProfileReport;
import com.dview.profiler.dto.source.DatabaseConnectionRequest;
import com.dview.profiler.dto.source.SheetInfo;
import com.dview.profiler.fixtures.TestTables;
import com.dview.profiler.service.export.ExportedFile;
import com.dview.profiler.service.export.ProfileExportService;
import com.dview.profiler.service.session.ProfilingSession;
import com.dview.profiler.service.session.SessionRegistry;
import com.dview.profiler.service.source.FileConnectorService;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExportController Unit Tests")
class ExportControllerTest {

  @Mock private ProfileExportService profileExportService;

  private ProfilingSession session;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    SessionRegistry sessionRegistry =
        new SessionRegistry(TestTables.properties(), mock(FileConnectorService.class));
    session =
        sessionRegistry.createDatabaseSession(
            DatabaseConnectionRequest.builder()
                .connectionType("h2")
                .host("localhost")
                .port(9092)
                .database("shop")
                .build(),
            List.of(SheetInfo.of("users", List.of("id"))));
    mockMvc =
        ControllerTestSupport.mockMvc(new ExportController(profileExportService, sessionRegistry));
  }

  @Test
  void returnsFileAsAttachment() throws Exception {
    ProfileReport report = new ProfileReport(Map.of("users", new ProfileError("boom")));
    session.start("task-1");
    session.complete(report);
    byte[] csv = "\"Table Name\"\n".getBytes(StandardCharsets.UTF_8);
    when(profileExportService.export(eq(report), eq("csv"), any()))
        .thenReturn(
            new ExportedFile(
                "data_profile_20240301_123045.csv", new MediaType("text", "csv"), csv));

    mockMvc
        .perform(
            post("/api/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"session_id\":\""
                        + session.getSessionId()
                        + "\",\"export_format\":\"csv\",\"tables\":[\"users\"]}"))
        .andExpect(status().isOk())
        .andExpect(
            header()
                .string(
                    HttpHeaders.CONTENT_DISPOSITION,
                    "attachment; filename=\"data_profile_20240301_123045.csv\""))
        .andExpect(content().contentType("text/csv"))
        .andExpect(content().bytes(csv));
  }

  @Test
  void invalidFormatIsBadRequest() throws Exception {
    session.start("task-1");
    session.complete(ProfileReport.empty());
    when(profileExportService.export(any(), eq("pdf"), any()))
        .thenThrow(new IllegalArgumentException("Invalid export format: pdf"));

    mockMvc
        .perform(
            post("/api/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"session_id\":\""
                        + session.getSessionId()
                        + "\",\"export_format\":\"pdf\",\"tables\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid export format: pdf"));
  }

  @Test
  void nothingToExportIsNotFound() throws Exception {
    mockMvc
        .perform(
            post("/api/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"session_id\":\""
                        + session.getSessionId()
                        + "\",\"export_format\":\"json\",\"tables\":[]}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("No profiling results to export"));

    verifyNoInteractions(profileExportService);
  }
}
