package com.dview.profiler.service.export;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.dview.profiler.dto.profile.ColumnProfile;
import com.dview.profiler.dto.profile.ColumnResult;
import com.dview.profiler.dto.profile.NumericStatistics;
import com.dview.profiler.dto.profile.ProfileError;
import com.dview.profiler.dto.profile.ProfileReport;
import com.dview.profiler.dto.profile.TableProfile;
import com.dview.profiler.dto.profile.TableResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;
import com.opencsv.CSVWriter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Renders a {@link ProfileReport} as a downloadable JSON, CSV, HTML or Excel file. Error entries
 * are rendered as errors, never skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileExportService {

  static final String EXPORT_VERSION = "1.0";
  static final String[] CSV_HEADER = {
    "Table Name",
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
    "Completeness %",
    "Uniqueness %",
    "Potential Issues",
    "Min Value",
    "Max Value",
    "Average",
    "Error"
  };

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
  private static final DateTimeFormatter DISPLAY_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  private static final Escaper HTML = HtmlEscapers.htmlEscaper();

  private final ObjectMapper objectMapper;
  private final XlsxReportWriter xlsxReportWriter;

  /**
   * Exports the requested tables that exist in {@code report}, in request order.
   *
   * @throws IllegalArgumentException if {@code format} is not supported
   */
  public ExportedFile export(ProfileReport report, String format, List<String> tables)
      throws IOException {
    ExportFormat exportFormat = ExportFormat.fromName(format);
    ProfileReport selected = tables == null ? report : report.select(tables);
    LocalDateTime now = LocalDateTime.now();

    byte[] content;
    switch (exportFormat) {
      case JSON:
        content = toJson(selected, now);
        break;
      case CSV:
        content = toCsv(selected).getBytes(StandardCharsets.UTF_8);
        break;
      case HTML:
        content = toHtml(selected, now).getBytes(StandardCharsets.UTF_8);
        break;
      case XLSX:
        content = xlsxReportWriter.write(selected);
        break;
      default:
        throw new IllegalArgumentException("Invalid export format: " + format);
    }

    String fileName =
        "data_profile_" + FILE_TIMESTAMP.format(now) + "." + exportFormat.getExtension();
    log.info("Exported {} table(s) as {} ({} bytes)", selected.size(), fileName, content.length);
    return new ExportedFile(fileName, exportFormat.getMediaType(), content);
  }

  byte[] toJson(ProfileReport report, LocalDateTime exportedAt) throws IOException {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("exported_at", exportedAt.toString());
    metadata.put("total_tables", report.size());
    metadata.put("export_format", "json");
    metadata.put("version", EXPORT_VERSION);

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("export_metadata", metadata);
    document.put("tables", report);
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  String toCsv(ProfileReport report) throws IOException {
    StringWriter out = new StringWriter();
    try (CSVWriter writer = new CSVWriter(out)) {
      writer.writeNext(CSV_HEADER);
      for (Map.Entry<String, TableResult> table : report.getTables().entrySet()) {
        if (table.getValue() instanceof ProfileError) {
          writer.writeNext(errorRow(table.getKey(), "", ((ProfileError) table.getValue())));
          continue;
        }
        TableProfile profile = (TableProfile) table.getValue();
        for (Map.Entry<String, ColumnResult> column : profile.getColumns().entrySet()) {
          if (column.getValue() instanceof ProfileError) {
            writer.writeNext(
                errorRow(table.getKey(), column.getKey(), (ProfileError) column.getValue()));
          } else {
            writer.writeNext(columnRow(table.getKey(), (ColumnProfile) column.getValue()));
          }
        }
      }
    }
    return out.toString();
  }

  private static String[] columnRow(String tableName, ColumnProfile column) {
    NumericStatistics numeric =
        column.getStatistics() instanceof NumericStatistics
            ? (NumericStatistics) column.getStatistics()
            : null;
    return new String[] {
      tableName,
      column.getColumnName(),
      column.getDataType().getLabel(),
      String.valueOf(column.getTotalValues()),
      String.valueOf(column.getNullCount()),
      String.valueOf(column.getNullPercentage()),
      String.valueOf(column.getBlankCount()),
      String.valueOf(column.getBlankPercentage()),
      String.valueOf(column.getDistinctCount()),
      String.valueOf(column.getDistinctPercentage()),
      String.valueOf(column.getQualityScore()),
      String.valueOf(column.getCompletenessPercentage()),
      String.valueOf(column.getUniquenessPercentage()),
      String.join("; ", column.getPotentialIssues()),
      numeric == null ? "" : text(numeric.getMinValue()),
      numeric == null ? "" : text(numeric.getMaxValue()),
      numeric == null ? "" : text(numeric.getAverage()),
      ""
    };
  }

  private static String[] errorRow(String tableName, String columnName, ProfileError error) {
    String[] row = new String[CSV_HEADER.length];
    Arrays.fill(row, "");
    row[0] = tableName;
    row[1] = columnName;
    row[row.length - 1] = error.getError();
    return row;
  }

  String toHtml(ProfileReport report, LocalDateTime generatedAt) {
    StringBuilder html = new StringBuilder(8192);
    html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n")
        .append("<meta charset=\"UTF-8\">\n<title>Data Profile Report</title>\n")
        .append("<style>\n")
        .append("body { font-family: 'Segoe UI', sans-serif; margin: 20px; color: #333; }\n")
        .append(".summary { display: flex; gap: 20px; margin-bottom: 30px; }\n")
        .append(".card { border: 1px solid #ddd; border-radius: 8px; padding: 15px; }\n")
        .append(".table-section { margin-bottom: 30px; }\n")
        .append("table { border-collapse: collapse; width: 100%; }\n")
        .append("th, td { border: 1px solid #ddd; padding: 6px 8px; text-align: left; }\n")
        .append("th { background: #667eea; color: white; }\n")
        .append(".quality-high { color: #2e7d32; }\n")
        .append(".quality-medium { color: #f9a825; }\n")
        .append(".quality-low { color: #c62828; }\n")
        .append(".error { color: #c62828; }\n")
        .append("</style>\n</head>\n<body>\n")
        .append("<h1>Data Profile Report</h1>\n")
        .append("<p>Generated on: ")
        .append(DISPLAY_TIMESTAMP.format(generatedAt))
        .append("</p>\n");

    appendSummary(html, report);
    for (Map.Entry<String, TableResult> table : report.getTables().entrySet()) {
      appendTable(html, table.getKey(), table.getValue());
    }
    html.append("</body>\n</html>\n");
    return html.toString();
  }

  private static void appendSummary(StringBuilder html, ProfileReport report) {
    long records = 0;
    long columns = 0;
    List<Double> scores = new ArrayList<>();
    for (TableResult result : report.getTables().values()) {
      if (result instanceof TableProfile) {
        TableProfile table = (TableProfile) result;
        records += table.getTotalRecords();
        columns += table.getTotalColumns();
        for (ColumnResult column : table.getColumns().values()) {
          if (column instanceof ColumnProfile) {
            scores.add(((ColumnProfile) column).getQualityScore());
          }
        }
      }
    }
    double averageScore = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

    html.append("<div class=\"summary\">\n");
    card(html, String.valueOf(report.size()), "Tables");
    card(html, String.valueOf(records), "Records");
    card(html, String.valueOf(columns), "Columns");
    card(html, String.format("%.1f", averageScore), "Average Quality Score");
    html.append("</div>\n");
  }

  private static void card(StringBuilder html, String value, String label) {
    html.append("<div class=\"card\"><h3>")
        .append(HTML.escape(value))
        .append("</h3><p>")
        .append(HTML.escape(label))
        .append("</p></div>\n");
  }

  private static void appendTable(StringBuilder html, String tableName, TableResult result) {
    html.append("<div class=\"table-section\">\n<h2>")
        .append(HTML.escape(tableName))
        .append("</h2>\n");
    if (result instanceof ProfileError) {
      html.append("<p class=\"error\">Error: ")
          .append(HTML.escape(((ProfileError) result).getError()))
          .append("</p>\n</div>\n");
      return;
    }

    TableProfile table = (TableProfile) result;
    html.append("<p>Records: ")
        .append(table.getTotalRecords())
        .append(" | Columns: ")
        .append(table.getTotalColumns())
        .append(" | Profiled at: ")
        .append(HTML.escape(String.valueOf(table.getProfiledAt())))
        .append("</p>\n");
    html.append("<table>\n<tr><th>Column</th><th>Data Type</th><th>Null %</th>")
        .append("<th>Distinct %</th><th>Quality Score</th><th>Potential Issues</th></tr>\n");
    for (Map.Entry<String, ColumnResult> entry : table.getColumns().entrySet()) {
      html.append("<tr><td>").append(HTML.escape(entry.getKey())).append("</td>");
      if (entry.getValue() instanceof ProfileError) {
        html.append("<td colspan=\"5\" class=\"error\">Error: ")
            .append(HTML.escape(((ProfileError) entry.getValue()).getError()))
            .append("</td></tr>\n");
        continue;
      }
      ColumnProfile column = (ColumnProfile) entry.getValue();
      html.append("<td>")
          .append(column.getDataType().getLabel())
          .append("</td><td>")
          .append(column.getNullPercentage())
          .append("</td><td>")
          .append(column.getDistinctPercentage())
          .append("</td><td class=\"")
          .append(qualityClass(column.getQualityScore()))
          .append("\">")
          .append(column.getQualityScore())
          .append("</td><td>");
      if (column.getPotentialIssues().isEmpty()) {
        html.append("None");
      } else {
        html.append("<ul>");
        for (String issue : column.getPotentialIssues()) {
          html.append("<li>").append(HTML.escape(issue)).append("</li>");
        }
        html.append("</ul>");
      }
      html.append("</td></tr>\n");
    }
    html.append("</table>\n</div>\n");
  }

  static String qualityClass(double score) {
    if (score >= 80.0) {
      return "quality-high";
    }
    return score >= 60.0 ? "quality-medium" : "quality-low";
  }

  private static String text(Double value) {
    return value == null ? "" : String.valueOf(value);
  }
}
