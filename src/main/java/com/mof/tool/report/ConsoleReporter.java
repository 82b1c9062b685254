package com.mof.tool.report;

import com.mof.tool.match.UnknownColumnException;
import com.mof.tool.model.CellValues;
import com.mof.tool.model.Dataset;
import com.mof.tool.model.MofRecord;
import com.mof.tool.model.ResultRow;
import com.mof.tool.model.ResultTable;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Console reporter for match results and dataset previews.
 */
public class ConsoleReporter {

    private static final String SEPARATOR = "=".repeat(80);
    private static final String THIN_SEPARATOR = "-".repeat(80);
    private static final DateTimeFormatter DT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int MAX_CELL_WIDTH = 24;

    private final boolean quiet;
    private final PrintWriter out;

    public ConsoleReporter(boolean quiet, PrintWriter out) {
        this.quiet = quiet;
        this.out = out;
    }

    public void printMatchHeader(String datasetSource, Dataset dataset, Map<String, ?> criteria) {
        if (quiet) return;

        out.println();
        out.println(SEPARATOR);
        out.println("              MOF Adsorption Matching Tool");
        out.println(SEPARATOR);
        out.println();
        out.printf("Dataset:         %s%n", datasetSource);
        out.printf("Records:         %,d%n", dataset.size());
        out.printf("Started:         %s%n", LocalDateTime.now().format(DT_FORMAT));
        out.println();
        out.println("Criteria (numeric values match within ±2%):");
        for (Map.Entry<String, ?> entry : criteria.entrySet()) {
            if (entry.getValue() == null || entry.getValue().toString().isBlank()) {
                continue;
            }
            out.printf("  %-24s %s%n", entry.getKey(), entry.getValue());
        }
        out.println();
        out.flush();
    }

    public void printResults(ResultTable table) {
        if (table.isEmpty()) {
            if (!quiet) {
                out.println("No matching MOF records were found for the specified criteria.");
            }
            out.flush();
            return;
        }

        if (!quiet) {
            out.printf("Found %d matching MOF record(s).%n", table.size());
            out.println();
        }
        printTable(table.getColumns(), toCells(table));

        if (!quiet) {
            out.println();
            out.printf("Completed:       %s%n", LocalDateTime.now().format(DT_FORMAT));
            out.println(SEPARATOR);
        }
        out.flush();
    }

    public void printResultsCsv(ResultTable table) {
        try {
            new CsvResultWriter().write(table, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        out.flush();
    }

    public void printResultsJson(ResultTable table) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\n  \"columns\": [");
        List<String> columns = table.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append('"').append(escape(columns.get(i))).append('"');
        }
        sb.append("],\n  \"results\": [\n");

        List<ResultRow> rows = table.getRows();
        for (int r = 0; r < rows.size(); r++) {
            ResultRow row = rows.get(r);
            sb.append("    {\n");
            for (int c = 0; c < columns.size(); c++) {
                String column = columns.get(c);
                sb.append(String.format("      \"%s\": %s", escape(column), jsonValue(row.get(column))));
                if (c < columns.size() - 1) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append("    }");
            if (r < rows.size() - 1) {
                sb.append(",");
            }
            sb.append("\n");
        }

        sb.append("  ],\n");
        sb.append(String.format("  \"count\": %d\n", rows.size()));
        sb.append("}\n");

        out.print(sb);
        out.flush();
    }

    public void printInvalidCriteria(String message) {
        out.println("WARNING: " + message);
        out.flush();
    }

    public void printColumnError(UnknownColumnException e) {
        out.println("Column error: " + e.getMessage());
        out.flush();
    }

    public void printExported(String file, int rows) {
        if (quiet) return;
        out.printf("Results written to %s (%d row(s)).%n", file, rows);
        out.flush();
    }

    public void printPreview(String datasetSource, Dataset dataset, List<String> missingInputColumns, int rowCount) {
        if (!quiet) {
            out.println();
            out.println(SEPARATOR);
            out.println("              MOF Dataset Preview");
            out.println(SEPARATOR);
            out.println();
            out.printf("Dataset:         %s%n", datasetSource);
            out.printf("Records:         %,d%n", dataset.size());
            out.printf("Columns:         %d%n", dataset.getColumns().size());
            for (String column : dataset.getColumns()) {
                out.printf("  %s%n", column);
            }
            if (!missingInputColumns.isEmpty()) {
                out.println();
                out.println("WARNING: Search columns missing from dataset:");
                for (String column : missingInputColumns) {
                    out.printf("  %s%n", column);
                }
            }
            out.println();
            out.println(THIN_SEPARATOR);
            out.printf("First %d record(s):%n", Math.min(rowCount, dataset.size()));
            out.println();
        }

        List<List<String>> cells = new ArrayList<>();
        for (MofRecord record : dataset.head(rowCount)) {
            List<String> line = new ArrayList<>();
            for (String column : dataset.getColumns()) {
                line.add(format(record.get(column)));
            }
            cells.add(line);
        }
        printTable(dataset.getColumns(), cells);
        out.flush();
    }

    private List<List<String>> toCells(ResultTable table) {
        List<List<String>> cells = new ArrayList<>();
        for (ResultRow row : table.getRows()) {
            List<String> line = new ArrayList<>();
            for (Object value : row.getValues()) {
                line.add(format(value));
            }
            cells.add(line);
        }
        return cells;
    }

    private void printTable(List<String> columns, List<List<String>> cells) {
        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = Math.min(columns.get(c).length(), MAX_CELL_WIDTH);
            for (List<String> line : cells) {
                widths[c] = Math.max(widths[c], Math.min(line.get(c).length(), MAX_CELL_WIDTH));
            }
        }

        out.println(formatLine(columns, widths));
        StringBuilder rule = new StringBuilder();
        for (int c = 0; c < widths.length; c++) {
            if (c > 0) rule.append("-+-");
            rule.append("-".repeat(widths[c]));
        }
        out.println(rule);
        for (List<String> line : cells) {
            out.println(formatLine(line, widths));
        }
    }

    private String formatLine(List<String> values, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < widths.length; c++) {
            if (c > 0) sb.append(" | ");
            String value = values.get(c);
            if (value.length() > widths[c]) {
                value = value.substring(0, widths[c] - 1) + "~";
            }
            sb.append(String.format("%-" + widths[c] + "s", value));
        }
        return sb.toString().stripTrailing();
    }

    private String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d) {
            return CellValues.formatNumber(d);
        }
        return value.toString();
    }

    private String jsonValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return "null";
            }
            return CellValues.formatNumber(d);
        }
        return "\"" + escape(value.toString()) + "\"";
    }

    private String escape(String str) {
        if (str == null) return "";
        return str.replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
    }
}
