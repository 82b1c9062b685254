package com.mof.tool.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of a match: the fixed output columns and one row per matched MOF.
 * An empty table still carries the full column list.
 */
public final class ResultTable {

    private final List<String> columns;
    private final List<ResultRow> rows;

    public ResultTable(List<String> columns, List<ResultRow> rows) {
        this.columns = List.copyOf(columns);
        for (ResultRow row : rows) {
            if (!row.getColumns().equals(this.columns)) {
                throw new IllegalArgumentException("Row columns " + row.getColumns()
                    + " do not match table columns " + this.columns);
            }
        }
        this.rows = List.copyOf(rows);
    }

    public static ResultTable empty(List<String> columns) {
        return new ResultTable(columns, List.of());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<ResultRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns all values of one column, top to bottom.
     */
    public List<Object> column(String name) {
        if (!columns.contains(name)) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            values.add(row.get(name));
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultTable that = (ResultTable) o;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "ResultTable{columns=" + columns.size() + ", rows=" + rows.size() + '}';
    }
}
