package com.mof.tool.match;

/**
 * How a criterion value is compared against a record.
 */
public enum CriterionType {
    NUMERIC,    // within the tolerance band around the value
    TEXT        // trimmed, case-insensitive equality
}
