package com.dview.profiler.dto.profile;

import java.time.LocalDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableProfile implements TableResult {

  @JsonProperty("table_name")
  private String tableName;

  @JsonProperty("total_records")
  private long totalRecords;

  @JsonProperty("total_columns")
  private int totalColumns;

  @JsonProperty("profiled_at")
  @JsonFormat(shape = JsonFormat.Shape.STRING)
  private LocalDateTime profiledAt;

  /** Column name to profile or error marker, in completion order. */
  @JsonProperty("columns")
  private Map<String, ColumnResult> columns;
}
