package com.mof.tool.match;

import com.mof.tool.model.ResultRow;
import com.mof.tool.model.ResultTable;

import java.util.List;

/**
 * Collects aggregated rows into a table with the fixed output column order.
 */
public class OutputAssembler {

    private final List<String> outputColumns;

    public OutputAssembler(List<String> outputColumns) {
        this.outputColumns = List.copyOf(outputColumns);
    }

    public ResultTable assemble(List<ResultRow> rows) {
        return new ResultTable(outputColumns, rows);
    }

    public ResultTable empty() {
        return ResultTable.empty(outputColumns);
    }
}
