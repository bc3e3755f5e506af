package com.dview.profiler.dto.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordCountResponse {

  @JsonProperty("table_name")
  private String tableName;

  @JsonProperty("record_count")
  private long recordCount;
}
