package com.dview.profiler.dto.api;

import com.dview.profiler.dto.source.FileStructure;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {

  @JsonProperty("session_id")
  private String sessionId;

  @JsonProperty("filename")
  private String filename;

  @JsonProperty("structure")
  private FileStructure structure;
}
