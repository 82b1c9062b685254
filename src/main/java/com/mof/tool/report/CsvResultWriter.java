package com.mof.tool.report;

import com.mof.tool.model.CellValues;
import com.mof.tool.model.ResultRow;
import com.mof.tool.model.ResultTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link ResultTable} as CSV with a header row.
 * The header is written for empty tables too; missing and non-finite values are empty cells.
 */
public class CsvResultWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvResultWriter.class);

    public static final String DEFAULT_FILE_NAME = "mof_matches.csv";

    /**
     * Writes the table to an open output. The output is flushed but not closed.
     */
    public void write(ResultTable table, Appendable out) throws IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
            .setHeader(table.getColumns().toArray(new String[0]))
            .build();

        CSVPrinter printer = new CSVPrinter(out, csvFormat);
        for (ResultRow row : table.getRows()) {
            printer.printRecord(toCells(row));
        }
        printer.flush();
    }

    public void write(ResultTable table, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(table, writer);
        }
        log.info("Wrote {} result rows to {}", table.size(), path);
    }

    static List<String> toCells(ResultRow row) {
        List<String> cells = new ArrayList<>();
        for (Object value : row.getValues()) {
            cells.add(isBlank(value) ? "" : CellValues.asText(value));
        }
        return cells;
    }

    // NaN and infinities export as empty cells, as in the JSON output
    private static boolean isBlank(Object value) {
        return value == null || (value instanceof Double d && (d.isNaN() || d.isInfinite()));
    }
}
