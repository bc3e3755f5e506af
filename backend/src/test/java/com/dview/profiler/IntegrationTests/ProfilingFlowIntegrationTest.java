package com.dview.profiler.IntegrationTests;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Upload, profile, poll and export a small CSV through the HTTP API. */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {"spring.profiles.active=test", "server.port=0"})
class ProfilingFlowIntegrationTest {

  private static final String CSV =
      "id,name,age,joined\n"
          + "1,Ann,34,2023-01-05\n"
          + "2,Bob,,2023-02-11\n"
          + "3,Cid,29,2023-03-17\n"
          + "4,Dee,41,2023-04-23\n";

  @Autowired private MockMvc mockMvc;

  @Autowired private ObjectMapper objectMapper;

  @Test
  @DisplayName("CSV upload can be profiled and exported end to end")
  void uploadProfileAndExport() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile(
            "file", "people.csv", "text/csv", CSV.getBytes(StandardCharsets.UTF_8));
    JsonNode upload =
        readJson(
            mockMvc
                .perform(multipart("/api/upload-file").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.structure.sheets[0].name").value("CSV_Data"))
                .andExpect(jsonPath("$.structure.sheets[0].column_count").value(4))
                .andReturn()
                .getResponse()
                .getContentAsString());
    String sessionId = upload.get("session_id").asText();

    mockMvc
        .perform(
            get("/api/session/" + sessionId + "/record-count").param("table_name", "CSV_Data"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.record_count").value(4));

    mockMvc
        .perform(
            post("/api/profile-data")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"session_id\":\""
                        + sessionId
                        + "\",\"tables\":[\"CSV_Data\",\"missing\"],\"max_records\":100}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("started"));

    JsonNode status = awaitCompletion(sessionId);
    assertThat(status.get("progress").asInt()).isEqualTo(100);
    assertThat(status.get("results_available").asBoolean()).isTrue();

    JsonNode results =
        readJson(
            mockMvc
                .perform(get("/api/profiling-results/" + sessionId))
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString());
    JsonNode columns = results.get("CSV_Data").get("columns");
    assertThat(results.get("CSV_Data").get("total_records").asLong()).isEqualTo(4);
    assertThat(columns.get("id").get("data_type").asText()).isEqualTo("integer");
    assertThat(columns.get("age").get("null_count").asLong()).isEqualTo(1);
    assertThat(columns.get("name").get("data_type").asText()).isEqualTo("string");
    assertThat(results.get("missing").has("error")).isTrue();

    mockMvc
        .perform(
            post("/api/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"session_id\":\""
                        + sessionId
                        + "\",\"export_format\":\"html\",\"tables\":[\"CSV_Data\"]}"))
        .andExpect(status().isOk())
        .andExpect(
            header().string(HttpHeaders.CONTENT_DISPOSITION, endsWith(".html\"")));
  }

  private JsonNode awaitCompletion(String sessionId) throws Exception {
    long deadline = System.currentTimeMillis() + 20_000;
    while (true) {
      JsonNode status =
          readJson(
              mockMvc
                  .perform(get("/api/profiling-status/" + sessionId))
                  .andExpect(status().isOk())
                  .andReturn()
                  .getResponse()
                  .getContentAsString());
      String state = status.get("status").asText();
      if (!"running".equals(state)) {
        assertThat(state).isEqualTo("completed");
        return status;
      }
      assertThat(System.currentTimeMillis()).isLessThan(deadline);
      Thread.sleep(50);
    }
  }

  private JsonNode readJson(String body) throws Exception {
    return objectMapper.readTree(body);
  }
}
