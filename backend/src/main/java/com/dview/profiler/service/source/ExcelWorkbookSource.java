package com.dview.profiler.service.source;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import com.dview.profiler.dto.source.SheetInfo;
import com.dview.profiler.dto.table.Column;
import com.dview.profiler.dto.table.StorageType;
import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.DataSourceException;

import lombok.extern.slf4j.Slf4j;

/**
 * An uploaded {@code .xlsx} or {@code .xls} workbook opened read-only. Each sheet is a table whose
 * first row holds the column names. Blank cells are {@code null} and rows without any value are
 * skipped. The workbook stays open until {@link #close()}.
 *
 * <p>A column keeps a native storage type when all of its values agree: whole numbers are {@link
 * StorageType#INTEGER}, other numbers {@link StorageType#FLOAT}, date-formatted cells {@link
 * StorageType#DATETIME} and booleans {@link StorageType#BOOLEAN}. Anything else is read as text.
 */
@Slf4j
public class ExcelWorkbookSource implements TableSource {

  // largest magnitude below which every whole double converts to a long exactly
  private static final double MAX_EXACT_WHOLE = 0x1p53;

  private final Workbook workbook;
  private final String fileName;
  private final DataFormatter formatter = new DataFormatter();

  private ExcelWorkbookSource(Workbook workbook, String fileName) {
    this.workbook = workbook;
    this.fileName = fileName;
  }

  public static ExcelWorkbookSource open(Path file) throws DataSourceException {
    try {
      Workbook workbook = WorkbookFactory.create(file.toFile(), null, true);
      log.debug("Opened workbook {} with {} sheet(s)", file, workbook.getNumberOfSheets());
      return new ExcelWorkbookSource(workbook, String.valueOf(file.getFileName()));
    } catch (IOException | EncryptedDocumentException | IllegalArgumentException e) {
      throw new DataSourceException("Error reading Excel file: " + e.getMessage(), e);
    }
  }

  public synchronized List<SheetInfo> listSheets() {
    List<SheetInfo> sheets = new ArrayList<>(workbook.getNumberOfSheets());
    for (Sheet sheet : workbook) {
      sheets.add(SheetInfo.of(sheet.getSheetName(), headers(sheet)));
    }
    return sheets;
  }

  public synchronized long countRows(String sheetName) throws DataSourceException {
    Sheet sheet = sheet(sheetName);
    int width = headers(sheet).size();
    long count = 0;
    for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
      if (hasValues(sheet.getRow(r), width)) {
        count++;
      }
    }
    return count;
  }

  @Override
  public synchronized Table fetch(String sheetName, Integer rowCap) throws DataSourceException {
    Sheet sheet = sheet(sheetName);
    List<String> names = headers(sheet);
    List<List<Object>> cells = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      cells.add(new ArrayList<>());
    }

    int rows = 0;
    for (int r = sheet.getFirstRowNum() + 1;
        r <= sheet.getLastRowNum() && (rowCap == null || rows < rowCap);
        r++) {
      Row row = sheet.getRow(r);
      if (!hasValues(row, names.size())) {
        continue;
      }
      for (int c = 0; c < names.size(); c++) {
        cells.get(c).add(valueOf(row.getCell(c)));
      }
      rows++;
    }

    List<Column> columns = new ArrayList<>(names.size());
    for (int c = 0; c < names.size(); c++) {
      columns.add(typedColumn(names.get(c), cells.get(c)));
    }
    return new Table(sheetName, columns);
  }

  @Override
  public synchronized void close() {
    try {
      workbook.close();
    } catch (IOException e) {
      log.warn("Could not close workbook {}: {}", fileName, e.getMessage());
    }
  }

  private Sheet sheet(String sheetName) throws DataSourceException {
    Sheet sheet = sheetName == null ? null : workbook.getSheet(sheetName);
    if (sheet == null) {
      throw new DataSourceException(
          String.format("Sheet '%s' not found in %s", sheetName, fileName));
    }
    return sheet;
  }

  private List<String> headers(Sheet sheet) {
    Row header =
        sheet.getPhysicalNumberOfRows() == 0 ? null : sheet.getRow(sheet.getFirstRowNum());
    int width = header == null ? 0 : Math.max(0, header.getLastCellNum());
    List<String> raw = new ArrayList<>(width);
    for (int c = 0; c < width; c++) {
      Cell cell = header.getCell(c);
      raw.add(cell == null ? null : formatter.formatCellValue(cell));
    }
    return ColumnNames.deduplicate(raw);
  }

  private static boolean hasValues(Row row, int width) {
    if (row == null) {
      return false;
    }
    for (int c = 0; c < width; c++) {
      if (valueOf(row.getCell(c)) != null) {
        return true;
      }
    }
    return false;
  }

  static Object valueOf(Cell cell) {
    if (cell == null) {
      return null;
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
      case NUMERIC:
        if (DateUtil.isCellDateFormatted(cell)) {
          return cell.getLocalDateTimeCellValue();
        }
        return cell.getNumericCellValue();
      case STRING:
        String text = cell.getStringCellValue();
        return text.isEmpty() ? null : text;
      case BOOLEAN:
        return cell.getBooleanCellValue();
      default:
        return null;
    }
  }

  static Column typedColumn(String name, List<Object> values) {
    StorageType storageType = detectStorageType(values);
    List<Object> converted = new ArrayList<>(values.size());
    for (Object value : values) {
      converted.add(value == null ? null : convert(value, storageType));
    }
    return new Column(name, storageType, converted);
  }

  private static StorageType detectStorageType(List<Object> values) {
    boolean sawValue = false;
    boolean allWhole = true;
    boolean allNumeric = true;
    boolean allDateTime = true;
    boolean allBoolean = true;
    for (Object value : values) {
      if (value == null) {
        continue;
      }
      sawValue = true;
      boolean numeric = value instanceof Double;
      allNumeric = allNumeric && numeric;
      allWhole = allWhole && numeric && isWhole((Double) value);
      allDateTime = allDateTime && value instanceof LocalDateTime;
      allBoolean = allBoolean && value instanceof Boolean;
    }
    if (!sawValue) {
      return StorageType.TEXT;
    }
    if (allWhole) {
      return StorageType.INTEGER;
    }
    if (allNumeric) {
      return StorageType.FLOAT;
    }
    if (allDateTime) {
      return StorageType.DATETIME;
    }
    return allBoolean ? StorageType.BOOLEAN : StorageType.TEXT;
  }

  private static Object convert(Object value, StorageType storageType) {
    switch (storageType) {
      case INTEGER:
        return ((Double) value).longValue();
      case TEXT:
        if (value instanceof Double && isWhole((Double) value)) {
          return String.valueOf(((Double) value).longValue());
        }
        return value.toString();
      default:
        return value;
    }
  }

  private static boolean isWhole(double value) {
    return !Double.isInfinite(value)
        && value == Math.rint(value)
        && Math.abs(value) <= MAX_EXACT_WHOLE;
  }
}
