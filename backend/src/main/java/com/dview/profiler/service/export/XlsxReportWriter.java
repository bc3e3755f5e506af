package com.dview.profiler.service.export;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import com.dview.profiler.dto.profile.ColumnProfile;
import com.dview.profiler.dto.profile.ColumnResult;
import com.dview.profiler.dto.profile.NumericStatistics;
import com.dview.profiler.dto.profile.ProfileError;
import com.dview.profiler.dto.profile.ProfileReport;
import com.dview.profiler.dto.profile.TableProfile;
import com.dview.profiler.dto.profile.TableResult;

/**
 * Writes a report as an Excel workbook: a {@value #SUMMARY_SHEET} sheet with one row per table,
 * followed by a detail sheet per table with one row per column. Percentages are stored as
 * fractions under a percent format.
 */
@Component
public class XlsxReportWriter {

  static final String SUMMARY_SHEET = "Summary";
  static final int MAX_SHEET_NAME_LENGTH = 31;

  static final String[] SUMMARY_HEADER = {
    "Table Name", "Total Records", "Total Columns", "Profiled At", "Status"
  };
  static final String[] DETAIL_HEADER = {
    "Column Name",
    "Data Type",
    "Total Values",
    "Null Count",
    "Null %",
    "Blank Count",
    "Blank %",
    "Distinct Count",
    "Distinct %",
    "Quality Score",
    "Completeness",
    "Min Value",
    "Max Value",
    "Average"
  };

  private static final String NOT_AVAILABLE = "N/A";

  public byte[] write(ProfileReport report) throws IOException {
    try (Workbook workbook = new XSSFWorkbook();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      Styles styles = new Styles(workbook);
      Set<String> usedNames = new HashSet<>();
      usedNames.add(SUMMARY_SHEET.toLowerCase(Locale.ROOT));

      writeSummary(workbook.createSheet(SUMMARY_SHEET), report, styles);
      for (Map.Entry<String, TableResult> table : report.getTables().entrySet()) {
        Sheet sheet = workbook.createSheet(sheetName(table.getKey(), usedNames));
        writeDetail(sheet, table.getValue(), styles);
      }

      workbook.write(out);
      return out.toByteArray();
    }
  }

  private static void writeSummary(Sheet sheet, ProfileReport report, Styles styles) {
    header(sheet, SUMMARY_HEADER, styles);
    int r = 1;
    for (Map.Entry<String, TableResult> entry : report.getTables().entrySet()) {
      Row row = sheet.createRow(r++);
      row.createCell(0).setCellValue(entry.getKey());
      if (entry.getValue() instanceof ProfileError) {
        row.createCell(1).setCellValue(NOT_AVAILABLE);
        row.createCell(2).setCellValue(NOT_AVAILABLE);
        row.createCell(3).setCellValue(NOT_AVAILABLE);
        row.createCell(4).setCellValue("Error: " + ((ProfileError) entry.getValue()).getError());
        continue;
      }
      TableProfile table = (TableProfile) entry.getValue();
      row.createCell(1).setCellValue(table.getTotalRecords());
      row.createCell(2).setCellValue(table.getTotalColumns());
      row.createCell(3).setCellValue(String.valueOf(table.getProfiledAt()));
      row.createCell(4).setCellValue("Success");
    }
    sheet.setColumnWidth(0, 20 * 256);
    sheet.setColumnWidth(3, 20 * 256);
  }

  private static void writeDetail(Sheet sheet, TableResult result, Styles styles) {
    header(sheet, DETAIL_HEADER, styles);
    if (result instanceof ProfileError) {
      Row row = sheet.createRow(1);
      row.createCell(0).setCellValue("Error: " + ((ProfileError) result).getError());
      return;
    }

    int r = 1;
    for (Map.Entry<String, ColumnResult> entry :
        ((TableProfile) result).getColumns().entrySet()) {
      Row row = sheet.createRow(r++);
      row.createCell(0).setCellValue(entry.getKey());
      if (entry.getValue() instanceof ProfileError) {
        row.createCell(1).setCellValue("Error: " + ((ProfileError) entry.getValue()).getError());
        continue;
      }
      ColumnProfile column = (ColumnProfile) entry.getValue();
      row.createCell(1).setCellValue(column.getDataType().getLabel());
      row.createCell(2).setCellValue(column.getTotalValues());
      row.createCell(3).setCellValue(column.getNullCount());
      percent(row, 4, column.getNullPercentage(), styles);
      row.createCell(5).setCellValue(column.getBlankCount());
      percent(row, 6, column.getBlankPercentage(), styles);
      row.createCell(7).setCellValue(column.getDistinctCount());
      percent(row, 8, column.getDistinctPercentage(), styles);
      number(row, 9, column.getQualityScore(), styles);
      percent(row, 10, column.getCompletenessPercentage(), styles);
      if (column.getStatistics() instanceof NumericStatistics) {
        NumericStatistics numeric = (NumericStatistics) column.getStatistics();
        number(row, 11, numeric.getMinValue(), styles);
        number(row, 12, numeric.getMaxValue(), styles);
        number(row, 13, numeric.getAverage(), styles);
      }
    }
    for (int c = 0; c < DETAIL_HEADER.length; c++) {
      sheet.setColumnWidth(c, 12 * 256);
    }
  }

  private static void header(Sheet sheet, String[] titles, Styles styles) {
    Row row = sheet.createRow(0);
    for (int c = 0; c < titles.length; c++) {
      Cell cell = row.createCell(c);
      cell.setCellValue(titles[c]);
      cell.setCellStyle(styles.header);
    }
    sheet.createFreezePane(0, 1);
  }

  private static void percent(Row row, int index, double value, Styles styles) {
    Cell cell = row.createCell(index);
    cell.setCellValue(value / 100.0);
    cell.setCellStyle(styles.percent);
  }

  private static void number(Row row, int index, Double value, Styles styles) {
    if (value == null) {
      return;
    }
    Cell cell = row.createCell(index);
    cell.setCellValue(value);
    cell.setCellStyle(styles.number);
  }

  /**
   * Excel-safe, workbook-unique sheet name: characters Excel forbids become {@code _}, names
   * longer than 31 characters are cut to 28 plus {@code ...}, and clashes get a {@code (n)}
   * suffix. Comparison is case-insensitive, as in Excel.
   */
  static String sheetName(String tableName, Set<String> usedNames) {
    String cleaned = tableName == null ? "" : tableName.replaceAll("[\\\\/*?:\\[\\]]", "_");
    if (cleaned.startsWith("'")) {
      cleaned = "_" + cleaned.substring(1);
    }
    if (cleaned.endsWith("'")) {
      cleaned = cleaned.substring(0, cleaned.length() - 1) + "_";
    }
    if (cleaned.isBlank()) {
      cleaned = "Table";
    }
    String base = truncate(cleaned, MAX_SHEET_NAME_LENGTH);
    String name = base;
    for (int n = 2; !usedNames.add(name.toLowerCase(Locale.ROOT)); n++) {
      String suffix = " (" + n + ")";
      name = truncate(cleaned, MAX_SHEET_NAME_LENGTH - suffix.length()) + suffix;
    }
    return name;
  }

  private static String truncate(String name, int maxLength) {
    if (name.length() <= maxLength) {
      return name;
    }
    return name.substring(0, maxLength - 3) + "...";
  }

  private static final class Styles {
    private final CellStyle header;
    private final CellStyle percent;
    private final CellStyle number;

    private Styles(Workbook workbook) {
      Font bold = workbook.createFont();
      bold.setBold(true);
      bold.setColor(IndexedColors.WHITE.getIndex());
      header = workbook.createCellStyle();
      header.setFont(bold);
      header.setFillForegroundColor(IndexedColors.ROYAL_BLUE.getIndex());
      header.setFillPattern(FillPatternType.SOLID_FOREGROUND);

      percent = workbook.createCellStyle();
      percent.setDataFormat(workbook.createDataFormat().getFormat("0.00%"));
      number = workbook.createCellStyle();
      number.setDataFormat(workbook.createDataFormat().getFormat("0.00"));
    }
  }
}
