package com.mof.tool.report;

import com.mof.tool.model.ResultRow;
import com.mof.tool.model.ResultTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvResultWriterTest {

    private static final List<String> COLUMNS = List.of("MOF", "CO2", "Note");

    private static ResultRow row(Object mof, Object co2, Object note) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("MOF", mof);
        values.put("CO2", co2);
        values.put("Note", note);
        return new ResultRow(COLUMNS, values);
    }

    @Test
    void shouldWriteHeaderOnlyForEmptyTable() throws IOException {
        StringWriter out = new StringWriter();

        new CsvResultWriter().write(ResultTable.empty(COLUMNS), out);

        assertThat(out.toString()).isEqualTo("MOF,CO2,Note\r\n");
    }

    @Test
    void shouldFormatNumbersAndLeaveMissingCellsEmpty() throws IOException {
        ResultTable table = new ResultTable(COLUMNS, List.of(
            row("ZIF-8", 0.15, null),
            row("A,B", 10.0, "x")
        ));
        StringWriter out = new StringWriter();

        new CsvResultWriter().write(table, out);

        assertThat(out.toString()).isEqualTo(
            "MOF,CO2,Note\r\n"
                + "ZIF-8,0.15,\r\n"
                + "\"A,B\",10.0,x\r\n");
    }

    @Test
    void shouldWriteNonFiniteNumbersAsEmptyCells() throws IOException {
        ResultTable table = new ResultTable(COLUMNS, List.of(
            row("ZIF-8", Double.NaN, "x"),
            row("MOF-5", Double.POSITIVE_INFINITY, "y")
        ));
        StringWriter out = new StringWriter();

        new CsvResultWriter().write(table, out);

        assertThat(out.toString()).isEqualTo(
            "MOF,CO2,Note\r\n"
                + "ZIF-8,,x\r\n"
                + "MOF-5,,y\r\n");
    }

    @Test
    void shouldCreateParentDirectoriesForFileOutput(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("out").resolve(CsvResultWriter.DEFAULT_FILE_NAME);
        ResultTable table = new ResultTable(COLUMNS, List.of(row("HKUST-1", 0.15, "Cu")));

        new CsvResultWriter().write(table, file);

        assertThat(Files.readAllLines(file, StandardCharsets.UTF_8))
            .containsExactly("MOF,CO2,Note", "HKUST-1,0.15,Cu");
    }
}
