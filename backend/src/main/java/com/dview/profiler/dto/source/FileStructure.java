package com.dview.profiler.dto.source;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileStructure {

  /** Lower-case extension including the dot, e.g. {@code .csv}. */
  @JsonProperty("file_type")
  private String fileType;

  @JsonProperty("file_name")
  private String fileName;

  @JsonProperty("sheets")
  private List<SheetInfo> sheets;
}
