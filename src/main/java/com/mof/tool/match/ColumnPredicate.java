package com.mof.tool.match;

import com.mof.tool.model.MofRecord;

import java.util.function.Predicate;

/**
 * A matching rule over a single dataset column.
 */
public interface ColumnPredicate extends Predicate<MofRecord> {

    /**
     * The column this predicate reads.
     */
    String column();
}
