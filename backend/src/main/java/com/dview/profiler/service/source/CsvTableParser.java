package com.dview.profiler.service.source;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.dview.profiler.dto.table.Column;
import com.dview.profiler.dto.table.StorageType;
import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.DataSourceException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads a CSV file as the single table {@value #TABLE_NAME}. Empty cells are {@code null}; rows
 * whose width differs from the header are skipped. Each column gets a native storage type when all
 * of its values read as integers, decimals or {@code true/false}.
 */
@Slf4j
@Component
public class CsvTableParser {

  public static final String TABLE_NAME = "CSV_Data";

  public List<String> readHeader(Path file) throws DataSourceException {
    try (CSVReader reader = open(file)) {
      return ColumnNames.deduplicate(Arrays.asList(header(reader)));
    } catch (IOException | CsvValidationException e) {
      throw new DataSourceException("Error reading CSV header: " + e.getMessage(), e);
    }
  }

  public long countRows(Path file) throws DataSourceException {
    try (CSVReader reader = open(file)) {
      header(reader);
      long count = 0;
      while (reader.readNext() != null) {
        count++;
      }
      return count;
    } catch (IOException | CsvValidationException e) {
      throw new DataSourceException("Error counting CSV rows: " + e.getMessage(), e);
    }
  }

  public Table read(Path file, Integer rowCap) throws DataSourceException {
    try (CSVReader reader = open(file)) {
      String[] headers = header(reader);
      List<List<String>> cells = new ArrayList<>(headers.length);
      for (int i = 0; i < headers.length; i++) {
        cells.add(new ArrayList<>());
      }

      int rows = 0;
      String[] row;
      while ((rowCap == null || rows < rowCap) && (row = reader.readNext()) != null) {
        if (row.length != headers.length) {
          log.debug("Skipping row with {} cells, header has {}", row.length, headers.length);
          continue;
        }
        for (int i = 0; i < headers.length; i++) {
          cells.get(i).add(row[i].isEmpty() ? null : row[i]);
        }
        rows++;
      }

      List<String> names = ColumnNames.deduplicate(Arrays.asList(headers));
      List<Column> columns = new ArrayList<>(headers.length);
      for (int i = 0; i < headers.length; i++) {
        columns.add(typedColumn(names.get(i), cells.get(i)));
      }
      return new Table(TABLE_NAME, columns);
    } catch (IOException | CsvValidationException e) {
      throw new DataSourceException("Error reading CSV data: " + e.getMessage(), e);
    }
  }

  static Column typedColumn(String name, List<String> cells) {
    StorageType storageType = detectStorageType(cells);
    if (storageType == StorageType.TEXT) {
      return new Column(name, StorageType.TEXT, cells);
    }
    List<Object> values = new ArrayList<>(cells.size());
    for (String cell : cells) {
      values.add(cell == null ? null : convert(cell.trim(), storageType));
    }
    return new Column(name, storageType, values);
  }

  private static StorageType detectStorageType(List<String> cells) {
    boolean sawValue = false;
    boolean allLong = true;
    boolean allDouble = true;
    boolean allBoolean = true;
    for (String cell : cells) {
      if (cell == null) {
        continue;
      }
      sawValue = true;
      String trimmed = cell.trim();
      allLong = allLong && isLong(trimmed);
      allDouble = allDouble && isDouble(trimmed);
      allBoolean = allBoolean && isBoolean(trimmed);
      if (!allLong && !allDouble && !allBoolean) {
        return StorageType.TEXT;
      }
    }
    if (!sawValue) {
      return StorageType.TEXT;
    }
    if (allLong) {
      return StorageType.INTEGER;
    }
    return allDouble ? StorageType.FLOAT : StorageType.BOOLEAN;
  }

  private static Object convert(String cell, StorageType storageType) {
    switch (storageType) {
      case INTEGER:
        return Long.parseLong(cell);
      case FLOAT:
        return Double.parseDouble(cell);
      case BOOLEAN:
        return Boolean.parseBoolean(cell);
      default:
        return cell;
    }
  }

  private static boolean isLong(String cell) {
    try {
      Long.parseLong(cell);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean isDouble(String cell) {
    if (cell.isEmpty() || !Character.isDigit(cell.charAt(cell.length() - 1))) {
      // rejects "NaN", "Infinity" and trailing type suffixes such as "1d"
      return false;
    }
    try {
      Double.parseDouble(cell);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static boolean isBoolean(String cell) {
    String lower = cell.toLowerCase(Locale.ROOT);
    return "true".equals(lower) || "false".equals(lower);
  }

  private static CSVReader open(Path file) throws IOException {
    Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
    return new CSVReader(reader);
  }

  private static String[] header(CSVReader reader)
      throws IOException, CsvValidationException, DataSourceException {
    String[] headers = reader.readNext();
    if (headers == null || headers.length == 0) {
      throw new DataSourceException("CSV file has no headers");
    }
    return headers;
  }
}
