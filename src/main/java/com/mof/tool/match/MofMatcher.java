package com.mof.tool.match;

import com.mof.tool.model.Dataset;
import com.mof.tool.model.MatchSchema;
import com.mof.tool.model.MofRecord;
import com.mof.tool.model.ResultRow;
import com.mof.tool.model.ResultTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Matches partial search criteria against a MOF dataset and returns one aggregated
 * row per matching framework.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>{@link QueryNormalizer}: trim, drop blanks, classify numeric vs text</li>
 *   <li>{@link PredicateBuilder}: check columns, build one rule per criterion</li>
 *   <li>{@link RecordFilter}: keep records satisfying every rule</li>
 *   <li>{@link GroupAggregator}: one row per MOF</li>
 *   <li>{@link OutputAssembler}: fixed output column order</li>
 * </ol>
 *
 * <p>A matcher holds no mutable state and never modifies the dataset, so one instance
 * can serve concurrent requests.
 */
public class MofMatcher {

    private static final Logger log = LoggerFactory.getLogger(MofMatcher.class);

    private final MatchSchema schema;
    private final QueryNormalizer normalizer = new QueryNormalizer();
    private final PredicateBuilder predicateBuilder = new PredicateBuilder();
    private final RecordFilter recordFilter = new RecordFilter();
    private final GroupAggregator aggregator;
    private final OutputAssembler assembler;

    public MofMatcher() {
        this(MatchSchema.mofAdsorption());
    }

    public MofMatcher(MatchSchema schema) {
        this.schema = schema;
        this.aggregator = new GroupAggregator(schema);
        this.assembler = new OutputAssembler(schema.outputColumns());
    }

    /**
     * Runs a match.
     *
     * @param dataset     the records to search, left untouched
     * @param rawCriteria column name to raw value; blank values are ignored
     * @return the result table, empty (with all output columns) if nothing matched
     * @throws InvalidCriteriaException if no non-blank criterion was supplied
     * @throws UnknownColumnException   if criteria name columns the dataset lacks
     */
    public ResultTable match(Dataset dataset, Map<String, ?> rawCriteria) {
        List<Criterion> criteria = normalizer.normalize(rawCriteria);
        List<ColumnPredicate> predicates = predicateBuilder.build(criteria, dataset.getColumns());

        List<MofRecord> matched = recordFilter.apply(dataset.getRecords(), predicates);
        log.debug("{} of {} records matched {}", matched.size(), dataset.size(), criteria);

        if (matched.isEmpty()) {
            return assembler.empty();
        }

        List<ResultRow> rows = aggregator.aggregateAll(matched);
        return assembler.assemble(rows);
    }

    public MatchSchema getSchema() {
        return schema;
    }
}
