package com.mof.tool.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered, immutable collection of {@link MofRecord}s sharing one column schema.
 *
 * <p>Every record carries exactly the dataset's columns; a record built with fewer
 * values is padded with nulls.
 */
public final class Dataset {

    private final List<String> columns;
    private final Set<String> columnSet;
    private final List<MofRecord> records;

    public Dataset(List<String> columns, List<MofRecord> records) {
        this.columns = List.copyOf(columns);
        this.columnSet = Set.copyOf(columns);
        if (columnSet.size() != this.columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }

        List<MofRecord> aligned = new ArrayList<>(records.size());
        for (MofRecord record : records) {
            aligned.add(align(record));
        }
        this.records = Collections.unmodifiableList(aligned);
    }

    private MofRecord align(MofRecord record) {
        Set<String> unknown = new HashSet<>(record.getColumns());
        unknown.removeAll(columnSet);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Record has columns outside the dataset schema: " + unknown);
        }
        if (record.getColumns().size() == columns.size()
                && new ArrayList<>(record.getColumns()).equals(columns)) {
            return record;
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (String column : columns) {
            values.put(column, record.get(column));
        }
        return new MofRecord(values);
    }

    public static Dataset empty(List<String> columns) {
        return new Dataset(columns, List.of());
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columnSet.contains(column);
    }

    public List<MofRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Returns the first {@code n} records, or all of them if the dataset is smaller.
     */
    public List<MofRecord> head(int n) {
        return records.subList(0, Math.min(Math.max(n, 0), records.size()));
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns.size() + ", records=" + records.size() + '}';
    }

    /**
     * Builds a dataset row by row, values given in column order.
     */
    public static final class Builder {

        private final List<String> columns;
        private final List<MofRecord> records = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = List.copyOf(columns);
        }

        public Builder addRow(Object... values) {
            if (values.length > columns.size()) {
                throw new IllegalArgumentException("Row has " + values.length
                    + " values but the dataset has " + columns.size() + " columns");
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < values.length ? values[i] : null);
            }
            records.add(new MofRecord(row));
            return this;
        }

        public Builder addRecord(MofRecord record) {
            records.add(record);
            return this;
        }

        public Dataset build() {
            return new Dataset(columns, records);
        }
    }
}
