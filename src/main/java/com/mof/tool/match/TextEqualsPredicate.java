package com.mof.tool.match;

import com.mof.tool.model.CellValues;
import com.mof.tool.model.MofRecord;

import java.util.Locale;

/**
 * Matches records whose column value, trimmed and lower-cased, equals the expected text.
 * Missing values never match. Numbers are compared through their decimal text ("10.0").
 *
 * @param column   the column to read
 * @param expected the folded value to compare against
 */
public record TextEqualsPredicate(String column, String expected) implements ColumnPredicate {

    public static TextEqualsPredicate of(String column, String value) {
        return new TextEqualsPredicate(column, fold(value));
    }

    @Override
    public boolean test(MofRecord record) {
        String text = CellValues.asText(record.get(column));
        if (text == null) {
            return false;
        }
        return fold(text).equals(expected);
    }

    static String fold(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
