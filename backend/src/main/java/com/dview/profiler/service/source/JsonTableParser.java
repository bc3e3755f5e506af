package com.dview.profiler.service.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.dview.profiler.dto.source.SheetInfo;
import com.dview.profiler.dto.table.Column;
import com.dview.profiler.dto.table.StorageType;
import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.DataSourceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;

/**
 * Reads tables out of a JSON document. A top-level array of objects is the table {@value
 * #ARRAY_TABLE_NAME}; for a top-level object, each member holding a non-empty array of objects is
 * a table named after the member. Columns are the union of record keys in first-seen order.
 */
@Component
@RequiredArgsConstructor
public class JsonTableParser {

  public static final String ARRAY_TABLE_NAME = "JSON_Array";

  private final ObjectMapper objectMapper;

  public JsonNode readTree(Path file) throws DataSourceException {
    try {
      return objectMapper.readTree(file.toFile());
    } catch (IOException e) {
      throw new DataSourceException("Error reading JSON file: " + e.getMessage(), e);
    }
  }

  public List<SheetInfo> sheets(JsonNode root) {
    List<SheetInfo> sheets = new ArrayList<>();
    for (Map.Entry<String, JsonNode> entry : records(root).entrySet()) {
      sheets.add(SheetInfo.of(entry.getKey(), new ArrayList<>(keys(entry.getValue()))));
    }
    return sheets;
  }

  public long countRows(JsonNode root, String tableName) throws DataSourceException {
    return recordsOf(root, tableName).size();
  }

  public Table read(JsonNode root, String tableName, Integer rowCap) throws DataSourceException {
    JsonNode records = recordsOf(root, tableName);
    int rows = rowCap == null ? records.size() : Math.min(rowCap, records.size());

    List<Column> columns = new ArrayList<>();
    for (String key : keys(records)) {
      List<Object> values = new ArrayList<>(rows);
      for (int i = 0; i < rows; i++) {
        values.add(toValue(records.get(i).get(key)));
      }
      columns.add(typedColumn(key, values));
    }
    return new Table(tableName, columns);
  }

  private static Map<String, JsonNode> records(JsonNode root) {
    Map<String, JsonNode> tables = new LinkedHashMap<>();
    if (root == null) {
      return tables;
    }
    if (isRecordArray(root)) {
      tables.put(ARRAY_TABLE_NAME, root);
    } else if (root.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (isRecordArray(field.getValue())) {
          tables.put(field.getKey(), field.getValue());
        }
      }
    }
    return tables;
  }

  private static JsonNode recordsOf(JsonNode root, String tableName) throws DataSourceException {
    JsonNode records = records(root).get(tableName);
    if (records == null) {
      throw new DataSourceException("Table '" + tableName + "' not found in JSON file");
    }
    return records;
  }

  private static boolean isRecordArray(JsonNode node) {
    return node.isArray() && node.size() > 0 && node.get(0).isObject();
  }

  private static Set<String> keys(JsonNode records) {
    Set<String> keys = new LinkedHashSet<>();
    for (JsonNode record : records) {
      record.fieldNames().forEachRemaining(keys::add);
    }
    return keys;
  }

  private static Object toValue(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return node.longValue();
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      return node.textValue();
    }
    return node.toString();
  }

  private static Column typedColumn(String name, List<Object> values) {
    StorageType storageType = null;
    for (Object value : values) {
      if (value == null) {
        continue;
      }
      StorageType valueType = storageTypeOf(value);
      if (storageType == null) {
        storageType = valueType;
      } else if (storageType != valueType) {
        storageType = widen(storageType, valueType);
      }
    }
    if (storageType == null || storageType == StorageType.TEXT) {
      List<Object> text = new ArrayList<>(values.size());
      for (Object value : values) {
        text.add(value == null ? null : value.toString());
      }
      return new Column(name, StorageType.TEXT, text);
    }
    if (storageType == StorageType.FLOAT) {
      List<Object> doubles = new ArrayList<>(values.size());
      for (Object value : values) {
        doubles.add(value == null ? null : ((Number) value).doubleValue());
      }
      return new Column(name, StorageType.FLOAT, doubles);
    }
    return new Column(name, storageType, values);
  }

  private static StorageType storageTypeOf(Object value) {
    if (value instanceof Boolean) {
      return StorageType.BOOLEAN;
    }
    if (value instanceof Long) {
      return StorageType.INTEGER;
    }
    if (value instanceof Double) {
      return StorageType.FLOAT;
    }
    return StorageType.TEXT;
  }

  private static StorageType widen(StorageType a, StorageType b) {
    boolean numeric =
        (a == StorageType.INTEGER || a == StorageType.FLOAT)
            && (b == StorageType.INTEGER || b == StorageType.FLOAT);
    return numeric ? StorageType.FLOAT : StorageType.TEXT;
  }
}
