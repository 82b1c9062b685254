package com.mof.tool.match;

import com.mof.tool.model.MofRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the records that satisfy every predicate, in their original order.
 */
public class RecordFilter {

    public List<MofRecord> apply(List<MofRecord> records, List<ColumnPredicate> predicates) {
        List<MofRecord> matched = new ArrayList<>();
        for (MofRecord record : records) {
            if (matchesAll(record, predicates)) {
                matched.add(record);
            }
        }
        return matched;
    }

    private boolean matchesAll(MofRecord record, List<ColumnPredicate> predicates) {
        for (ColumnPredicate predicate : predicates) {
            if (!predicate.test(record)) {
                return false;
            }
        }
        return true;
    }
}
