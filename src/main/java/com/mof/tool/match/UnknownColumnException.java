package com.mof.tool.match;

import java.util.List;

/**
 * Thrown when criteria name columns the dataset does not have.
 * All offending columns are reported at once.
 */
public class UnknownColumnException extends MatchException {

    private final List<String> missingColumns;

    public UnknownColumnException(List<String> missingColumns) {
        super("Missing columns in dataset: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
