package com.mof.tool.model;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Coercion and formatting rules for dataset cell values.
 *
 * <p>A cell holds either text ({@link String}), a number ({@link Double}) or nothing ({@code null}).
 * These helpers are pure and never modify their input.
 */
public final class CellValues {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern SPECIAL = Pattern.compile("[+-]?(nan|inf|infinity)", Pattern.CASE_INSENSITIVE);

    private CellValues() {
    }

    /**
     * Parses a decimal literal.
     * Accepts an optional sign, fraction and exponent, plus nan/inf/infinity in any case.
     * Hex literals and Java type suffixes ("1d", "2f") are not numbers.
     *
     * @param text the text to parse, surrounding whitespace is ignored
     * @return the parsed value, or null if the text is not a number
     */
    public static Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (DECIMAL.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        if (SPECIAL.matcher(trimmed).matches()) {
            boolean negative = trimmed.startsWith("-");
            String body = trimmed.replaceFirst("^[+-]", "").toLowerCase();
            if (body.equals("nan")) {
                return Double.NaN;
            }
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return null;
    }

    /**
     * Coerces a cell value to a number: numbers as-is, numeric text parsed, anything else null.
     */
    public static Double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            return parseNumber(text);
        }
        return null;
    }

    /**
     * Renders a cell value as text. Missing values have no text form.
     */
    public static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return formatNumber(number.doubleValue());
        }
        return value.toString();
    }

    /**
     * Formats a number the way a decimal float prints: integral values keep one
     * fractional digit ("10.0"), magnitudes in [1e-4, 1e16) use plain notation.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        double abs = Math.abs(value);
        if (value == Math.rint(value) && abs < 1e16) {
            return BigDecimal.valueOf(value).setScale(1).toPlainString();
        }
        if (abs >= 1e-4 && abs < 1e16) {
            return BigDecimal.valueOf(value).toPlainString();
        }
        return Double.toString(value);
    }

    /**
     * Normalizes a raw value for storage in a record: numbers become {@link Double},
     * text is kept, null stays null.
     *
     * @throws IllegalArgumentException for any other type
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Double) {
            return value;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException("Unsupported cell value type: " + value.getClass().getName());
    }
}
