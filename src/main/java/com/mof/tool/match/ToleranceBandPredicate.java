package com.mof.tool.match;

import com.mof.tool.model.CellValues;
import com.mof.tool.model.MofRecord;

/**
 * Matches records whose column value lies in the inclusive band [0.98·target, 1.02·target].
 *
 * <p>Values that do not coerce to a number never match. For a negative target the
 * lower bound exceeds the upper bound, so nothing matches.
 *
 * @param column the column to read
 * @param target the criterion value
 */
public record ToleranceBandPredicate(String column, double target) implements ColumnPredicate {

    public static final double LOWER_FACTOR = 0.98;
    public static final double UPPER_FACTOR = 1.02;

    public double lower() {
        return target * LOWER_FACTOR;
    }

    public double upper() {
        return target * UPPER_FACTOR;
    }

    @Override
    public boolean test(MofRecord record) {
        Double value = CellValues.toNumber(record.get(column));
        if (value == null) {
            return false;
        }
        return value >= lower() && value <= upper();
    }
}
