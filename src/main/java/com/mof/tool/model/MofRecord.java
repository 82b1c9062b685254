package com.mof.tool.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the MOF dataset: an observation of a single framework under specific
 * gas conditions.
 *
 * <p>Values are text, numbers ({@link Double}) or null for a missing cell.
 * Column order follows the dataset header. Instances are immutable.
 */
public final class MofRecord {

    private final Map<String, Object> values;

    public MofRecord(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            copy.put(entry.getKey(), CellValues.normalize(entry.getValue()));
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the value of a column, or null if the cell is empty or the column is absent.
     */
    public Object get(String column) {
        return values.get(column);
    }

    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public Set<String> getColumns() {
        return values.keySet();
    }

    /**
     * Returns an unmodifiable view of the column values in header order.
     */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MofRecord that = (MofRecord) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "MofRecord" + values;
    }
}
