package com.dview.profiler.dto.source;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A profilable table discovered in a file or database, with its column names. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SheetInfo {

  @JsonProperty("name")
  private String name;

  @JsonProperty("columns")
  private List<String> columns;

  @JsonProperty("column_count")
  private int columnCount;

  /** Database type name per column; only populated for database tables. */
  @JsonProperty("column_types")
  private Map<String, String> columnTypes;

  public static SheetInfo of(String name, List<String> columns) {
    return SheetInfo.builder().name(name).columns(columns).columnCount(columns.size()).build();
  }
}
