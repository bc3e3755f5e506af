package com.dview.profiler.service.profiling.inference;

import java.time.format.DateTimeFormatter;

import com.dview.profiler.dto.profile.DataType;

import lombok.Value;

/**
 * Inferred type of a column. For text columns classified as {@link DataType#DATETIME}, {@code
 * dateFormat} holds the detected format when the default formats were not enough.
 */
@Value
public class TypeInference {

  DataType dataType;
  DateTimeFormatter dateFormat;

  public static TypeInference of(DataType dataType) {
    return new TypeInference(dataType, null);
  }

  public static TypeInference dateTime(DateTimeFormatter dateFormat) {
    return new TypeInference(DataType.DATETIME, dateFormat);
  }
}
