package com.dview.profiler.service.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import com.dview.profiler.config.ApplicationProperties;
import com.dview.profiler.dto.source.FileStructure;
import com.dview.profiler.dto.source.SheetInfo;
import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.DataSourceException;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Stores uploaded files and exposes their tables for structure discovery and profiling. */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileConnectorService {

  public static final Set<String> SUPPORTED_EXTENSIONS =
      Set.of(".csv", ".json", ".xlsx", ".xls", ".sql");

  private final CsvTableParser csvTableParser;
  private final JsonTableParser jsonTableParser;
  private final ApplicationProperties properties;

  /**
   * Copies an upload into {@code profiler.temp-dir} under a unique name.
   *
   * @throws IllegalArgumentException if the file is empty, too large or of an unsupported type
   */
  public Path store(MultipartFile file) throws IOException {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    if (file.getSize() > properties.getMaxFileSize()) {
      throw new IllegalArgumentException(
          String.format(
              "File size %d exceeds the maximum of %d bytes",
              file.getSize(), properties.getMaxFileSize()));
    }
    String originalName =
        Paths.get(String.valueOf(file.getOriginalFilename())).getFileName().toString();
    requireSupported(originalName);

    Path directory = Paths.get(properties.getTempDir());
    Files.createDirectories(directory);
    Path target = directory.resolve(UUID.randomUUID() + "_" + originalName);
    try (InputStream in = file.getInputStream()) {
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    }
    log.info("Stored upload '{}' ({} bytes) at {}", originalName, file.getSize(), target);
    return target;
  }

  public FileStructure analyzeStructure(Path file) throws DataSourceException {
    String extension = requireSupported(file.getFileName().toString());
    List<SheetInfo> sheets;
    switch (extension) {
      case ".csv":
        sheets = List.of(SheetInfo.of(CsvTableParser.TABLE_NAME, csvTableParser.readHeader(file)));
        break;
      case ".json":
        sheets = jsonTableParser.sheets(jsonTableParser.readTree(file));
        break;
      case ".xlsx":
      case ".xls":
        try (ExcelWorkbookSource workbook = ExcelWorkbookSource.open(file)) {
          sheets = workbook.listSheets();
        }
        break;
      case ".sql":
        try (SqlScriptDatabase database = SqlScriptDatabase.load(file)) {
          sheets = new ArrayList<>(database.listTables());
        }
        break;
      default:
        throw new IllegalArgumentException("Unsupported file type: " + extension);
    }
    return FileStructure.builder()
        .fileType(extension)
        .fileName(file.getFileName().toString())
        .sheets(sheets)
        .build();
  }

  public long getRecordCount(Path file, String tableName) throws DataSourceException {
    String extension = requireSupported(file.getFileName().toString());
    switch (extension) {
      case ".csv":
        requireCsvTable(tableName);
        return csvTableParser.countRows(file);
      case ".json":
        return jsonTableParser.countRows(jsonTableParser.readTree(file), tableName);
      case ".xlsx":
      case ".xls":
        try (ExcelWorkbookSource workbook = ExcelWorkbookSource.open(file)) {
          return workbook.countRows(tableName);
        }
      case ".sql":
        try (SqlScriptDatabase database = SqlScriptDatabase.load(file)) {
          return database.countRows(tableName);
        }
      default:
        throw new IllegalArgumentException("Unsupported file type: " + extension);
    }
  }

  /** Opens a {@link TableSource} over the file. The caller closes it when profiling is done. */
  public TableSource tableSource(Path file) throws DataSourceException {
    String extension = requireSupported(file.getFileName().toString());
    switch (extension) {
      case ".csv":
        return (tableName, rowCap) -> {
          requireCsvTable(tableName);
          return csvTableParser.read(file, rowCap);
        };
      case ".json":
        JsonNode root = jsonTableParser.readTree(file);
        return (tableName, rowCap) -> jsonTableParser.read(root, tableName, rowCap);
      case ".xlsx":
      case ".xls":
        return ExcelWorkbookSource.open(file);
      case ".sql":
        return SqlScriptDatabase.load(file);
      default:
        throw new IllegalArgumentException("Unsupported file type: " + extension);
    }
  }

  public Table readTable(Path file, String tableName, Integer rowCap) throws DataSourceException {
    try (TableSource source = tableSource(file)) {
      return source.fetch(tableName, rowCap);
    }
  }

  public void delete(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete uploaded file {}: {}", file, e.getMessage());
    }
  }

  static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
  }

  private static String requireSupported(String fileName) {
    String extension = extensionOf(fileName);
    if (!SUPPORTED_EXTENSIONS.contains(extension)) {
      throw new IllegalArgumentException(
          "Unsupported file type: " + (extension.isEmpty() ? fileName : extension));
    }
    return extension;
  }

  private static void requireCsvTable(String tableName) throws DataSourceException {
    if (!CsvTableParser.TABLE_NAME.equals(tableName)) {
      throw new DataSourceException(
          String.format(
              "Table '%s' not found; CSV files only contain %s",
              tableName, CsvTableParser.TABLE_NAME));
    }
  }
}
