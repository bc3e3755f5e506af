package com.dview.profiler.service.export;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import com.dview.profiler.dto.profile.ProfileError;
import com.dview.profiler.dto.profile.ProfileReport;
import com.dview.profiler.dto.profile.TableResult;

class XlsxReportWriterTest {

  private final XlsxReportWriter writer = new XlsxReportWriter();

  @Test
  void sheetNamesReplaceCharactersExcelForbids() {
    assertThat(XlsxReportWriter.sheetName("sales/2024:q1[eu]?*", new HashSet<>()))
        .isEqualTo("sales_2024_q1_eu___");
    assertThat(XlsxReportWriter.sheetName("'quoted'", new HashSet<>())).isEqualTo("_quoted_");
    assertThat(XlsxReportWriter.sheetName(" ", new HashSet<>())).isEqualTo("Table");
  }

  @Test
  void longSheetNamesAreCutToThirtyOneCharacters() {
    String name =
        XlsxReportWriter.sheetName("customer_transactions_archive_2023_full", new HashSet<>());

    assertThat(name).hasSize(31).isEqualTo("customer_transactions_archiv...");
  }

  @Test
  void clashingSheetNamesGetNumberedSuffixes() {
    Set<String> used = new HashSet<>();
    used.add("summary");
    String prefix = "customer_transactions_archive_";

    assertThat(XlsxReportWriter.sheetName("SUMMARY", used)).isEqualTo("SUMMARY (2)");
    assertThat(XlsxReportWriter.sheetName(prefix + "2023", used))
        .isEqualTo("customer_transactions_archiv...");
    assertThat(XlsxReportWriter.sheetName(prefix + "2024", used))
        .hasSize(31)
        .isEqualTo("customer_transactions_ar... (2)");
  }

  @Test
  void writesOneDetailSheetPerTableEvenWhenNamesCollide() throws Exception {
    Map<String, TableResult> tables = new LinkedHashMap<>();
    tables.put("orders_by_region_and_quarter_2023", new ProfileError("timeout"));
    tables.put("orders_by_region_and_quarter_2024", new ProfileError("timeout"));
    tables.put("Summary", new ProfileError("timeout"));

    byte[] content = writer.write(new ProfileReport(tables));

    try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(content))) {
      assertThat(workbook.getNumberOfSheets()).isEqualTo(4);
      assertThat(workbook.getSheetName(1)).isEqualTo("orders_by_region_and_quarter...");
      assertThat(workbook.getSheetName(2)).isEqualTo("orders_by_region_and_qua... (2)");
      assertThat(workbook.getSheetName(3)).isEqualTo("Summary (2)");
      assertThat(workbook.getSheet("Summary").getLastRowNum()).isEqualTo(3);
    }
  }
}
