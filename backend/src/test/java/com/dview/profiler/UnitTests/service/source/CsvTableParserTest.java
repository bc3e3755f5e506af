package com.dview.profiler.service.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dview.profiler.dto.table.Column;
import com.dview.profiler.dto.table.StorageType;
import com.dview.profiler.dto.table.Table;
import com.dview.profiler.exception.DataSourceException;

class CsvTableParserTest {

  @TempDir Path tempDir;

  private final CsvTableParser csvTableParser = new CsvTableParser();

  private Path write(String content) throws Exception {
    Path file = tempDir.resolve("data.csv");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  @Test
  void shouldReadTypedColumns() throws Exception {
    Path file =
        write("id,name,score,active\n1,Ann,1.5,true\n2,,2.5,false\n3,\"Smith, J\",x,TRUE\n");

    Table table = csvTableParser.read(file, null);

    assertThat(table.getName()).isEqualTo(CsvTableParser.TABLE_NAME);
    assertThat(table.getRowCount()).isEqualTo(3);
    Column id = table.getColumns().get(0);
    assertThat(id.getStorageType()).isEqualTo(StorageType.INTEGER);
    assertThat(id.getValues()).containsExactly(1L, 2L, 3L);
    Column name = table.getColumns().get(1);
    assertThat(name.getStorageType()).isEqualTo(StorageType.TEXT);
    assertThat(name.getValues()).containsExactly("Ann", null, "Smith, J");
    assertThat(table.getColumns().get(2).getStorageType()).isEqualTo(StorageType.TEXT);
    Column active = table.getColumns().get(3);
    assertThat(active.getStorageType()).isEqualTo(StorageType.BOOLEAN);
    assertThat(active.getValues()).containsExactly(true, false, true);
  }

  @Test
  void shouldDetectFloatColumns() {
    Column column = CsvTableParser.typedColumn("price", Arrays.asList("1", "2.5", null));

    assertThat(column.getStorageType()).isEqualTo(StorageType.FLOAT);
    assertThat(column.getValues()).containsExactly(1.0, 2.5, null);
  }

  @Test
  void shouldKeepSpecialFloatLiteralsAsText() {
    Column column = CsvTableParser.typedColumn("value", Arrays.asList("1.0", "NaN"));

    assertThat(column.getStorageType()).isEqualTo(StorageType.TEXT);
  }

  @Test
  void shouldSkipRowsWithWrongWidthAndApplyRowCap() throws Exception {
    Path file = write("a,b\n1,2\n3\n4,5\n6,7\n");

    Table table = csvTableParser.read(file, 2);

    assertThat(table.getRowCount()).isEqualTo(2);
    assertThat(table.getColumns().get(0).getValues()).containsExactly(1L, 4L);
  }

  @Test
  void shouldDeduplicateHeaders() throws Exception {
    Path file = write("a,a,,b\n1,2,3,4\n");

    assertThat(csvTableParser.readHeader(file)).containsExactly("a", "a.1", "Unnamed: 2", "b");
  }

  @Test
  void shouldCountDataRows() throws Exception {
    Path file = write("a,b\n1,2\n3,4\n5,6\n");

    assertThat(csvTableParser.countRows(file)).isEqualTo(3);
  }

  @Test
  void shouldRejectFileWithoutHeader() throws Exception {
    Path file = write("");

    assertThatThrownBy(() -> csvTableParser.read(file, null))
        .isInstanceOf(DataSourceException.class)
        .hasMessageContaining("no headers");
  }
}
