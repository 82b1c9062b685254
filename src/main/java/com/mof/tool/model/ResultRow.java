package com.mof.tool.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One aggregated output row, holding a value for every output column in schema order.
 * Columns the source records did not provide hold null.
 */
public final class ResultRow {

    private final Map<String, Object> values;

    /**
     * Projects the given values onto the output columns.
     *
     * @param columns the output columns, in order
     * @param values  the available values; columns missing here become null
     */
    public ResultRow(List<String> columns, Map<String, ?> values) {
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String column : columns) {
            projected.put(column, CellValues.normalize(values.get(column)));
        }
        this.values = Collections.unmodifiableMap(projected);
    }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Returns the value of a column coerced to a number, or null.
     */
    public Double getNumber(String column) {
        return CellValues.toNumber(values.get(column));
    }

    public List<String> getColumns() {
        return new ArrayList<>(values.keySet());
    }

    /**
     * Returns the values in column order.
     */
    public List<Object> getValues() {
        return new ArrayList<>(values.values());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResultRow that = (ResultRow) o;
        return getColumns().equals(that.getColumns()) && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ResultRow" + values;
    }
}
