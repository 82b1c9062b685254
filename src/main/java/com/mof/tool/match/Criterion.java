package com.mof.tool.match;

import java.util.Objects;

/**
 * A single normalized search criterion.
 *
 * @param column the trimmed column name
 * @param type   whether the value is compared numerically or as text
 * @param text   the trimmed text value, null for numeric criteria
 * @param number the numeric value, NaN for text criteria
 */
public record Criterion(String column, CriterionType type, String text, double number) {

    public Criterion {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(type, "type");
        if (type == CriterionType.TEXT) {
            Objects.requireNonNull(text, "text");
        }
    }

    public static Criterion numeric(String column, double value) {
        return new Criterion(column, CriterionType.NUMERIC, null, value);
    }

    public static Criterion text(String column, String value) {
        return new Criterion(column, CriterionType.TEXT, value, Double.NaN);
    }

    public boolean isNumeric() {
        return type == CriterionType.NUMERIC;
    }

    /**
     * Returns the criterion value as supplied: a {@link Double} or a {@link String}.
     */
    public Object value() {
        return isNumeric() ? Double.valueOf(number) : text;
    }

    @Override
    public String toString() {
        return column + "=" + (isNumeric() ? String.valueOf(number) : "'" + text + "'");
    }
}
