package com.dview.profiler.service.profiling.inference;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

import com.dview.profiler.dto.profile.DataType;
import com.dview.profiler.dto.table.Column;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies the dominant semantic type of a column. Native storage tags win; text columns go
 * through all-or-nothing numeric and then date/time coercion trials, and fall back to {@link
 * DataType#STRING}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TypeInferencer {

  private final DateFormatDetector dateFormatDetector;

  public TypeInference infer(Column column) {
    switch (column.getStorageType()) {
      case INTEGER:
        return TypeInference.of(DataType.INTEGER);
      case FLOAT:
        return TypeInference.of(DataType.FLOAT);
      case DATETIME:
        return TypeInference.of(DataType.DATETIME);
      case BOOLEAN:
        return TypeInference.of(DataType.BOOLEAN);
      case TEXT:
      default:
        return inferFromText(column);
    }
  }

  private TypeInference inferFromText(Column column) {
    List<Object> values = column.nonNullValues();
    if (values.isEmpty()) {
      return TypeInference.of(DataType.STRING);
    }

    if (allCoerce(values, value -> NumericCoercion.toDouble(value).isSuccess())) {
      return TypeInference.of(DataType.FLOAT);
    }

    if (allCoerce(values, value -> DateTimeCoercion.toDateTime(value).isSuccess())) {
      return TypeInference.dateTime(null);
    }

    Optional<DateTimeFormatter> detected =
        dateFormatDetector.detect(column.getName(), asStrings(values));
    if (detected.isPresent()) {
      DateTimeFormatter format = detected.get();
      if (allCoerce(values, value -> DateTimeCoercion.toDateTime(value, format).isSuccess())) {
        return TypeInference.dateTime(format);
      }
      log.debug("Column '{}': detected date format did not cover every value", column.getName());
    }

    return TypeInference.of(DataType.STRING);
  }

  private static boolean allCoerce(List<Object> values, Predicate<Object> test) {
    for (Object value : values) {
      if (!test.test(value)) {
        return false;
      }
    }
    return true;
  }

  private static List<String> asStrings(List<Object> values) {
    List<String> strings = new ArrayList<>(values.size());
    for (Object value : values) {
      strings.add(value.toString());
    }
    return strings;
  }
}
