package com.mof.tool.match;

import com.mof.tool.model.MatchSchema;
import com.mof.tool.model.MofRecord;
import com.mof.tool.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces each {@link EntityGroup} to a single {@link ResultRow}.
 *
 * <p>A single-record group is projected as-is. For larger groups the representative
 * record (highest gas uptake) supplies the operating conditions and every other
 * output column is the mean of the group's numeric values.
 */
public class GroupAggregator {

    private static final Logger log = LoggerFactory.getLogger(GroupAggregator.class);

    private final MatchSchema schema;

    public GroupAggregator(MatchSchema schema) {
        this.schema = schema;
    }

    /**
     * Groups the matched records and aggregates every group.
     *
     * @param matched records that passed the filter, in dataset order
     * @return one row per distinct identity, in ascending identity order
     */
    public List<ResultRow> aggregateAll(List<MofRecord> matched) {
        List<EntityGroup> groups = EntityGroup.groupByIdentity(matched, schema.entityColumn());
        log.debug("Grouped {} matched records into {} groups", matched.size(), groups.size());

        List<ResultRow> rows = new ArrayList<>(groups.size());
        for (EntityGroup group : groups) {
            rows.add(aggregate(group));
        }
        return rows;
    }

    /**
     * Aggregates one group into an output row.
     */
    public ResultRow aggregate(EntityGroup group) {
        List<String> outputColumns = schema.outputColumns();

        if (group.size() == 1) {
            return new ResultRow(outputColumns, group.getRecords().get(0).asMap());
        }

        MofRecord representative = group.representative(schema.rankingColumn());
        Map<String, Object> values = new HashMap<>();

        for (String column : outputColumns) {
            if (column.equals(schema.entityColumn())) {
                continue;
            }
            if (schema.isOperatingCondition(column)) {
                values.put(column, representative.get(column));
            } else {
                values.put(column, group.mean(column));
            }
        }
        values.put(schema.entityColumn(), group.getIdentity());

        log.debug("Aggregated {} records for {}", group.size(), group.getIdentity());
        return new ResultRow(outputColumns, values);
    }
}
