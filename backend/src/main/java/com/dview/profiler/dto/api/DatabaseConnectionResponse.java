package com.dview.profiler.dto.api;

import java.util.List;

import com.dview.profiler.dto.source.SheetInfo;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseConnectionResponse {

  @JsonProperty("session_id")
  private String sessionId;

  @JsonProperty("tables")
  private List<SheetInfo> tables;
}
