package com.mof.tool.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds one {@link ColumnPredicate} per criterion after checking every criterion
 * column against the dataset schema.
 */
public class PredicateBuilder {

    private static final Logger log = LoggerFactory.getLogger(PredicateBuilder.class);

    /**
     * @param criteria      normalized criteria
     * @param schemaColumns the dataset's columns
     * @return predicates in criteria order
     * @throws UnknownColumnException naming every criterion column missing from the schema
     */
    public List<ColumnPredicate> build(List<Criterion> criteria, List<String> schemaColumns) {
        Set<String> known = new HashSet<>(schemaColumns);

        List<String> missing = new ArrayList<>();
        for (Criterion criterion : criteria) {
            if (!known.contains(criterion.column())) {
                missing.add(criterion.column());
            }
        }
        if (!missing.isEmpty()) {
            throw new UnknownColumnException(missing);
        }

        List<ColumnPredicate> predicates = new ArrayList<>(criteria.size());
        for (Criterion criterion : criteria) {
            predicates.add(forCriterion(criterion));
        }

        log.debug("Built {} predicates: {}", predicates.size(), predicates);
        return predicates;
    }

    private ColumnPredicate forCriterion(Criterion criterion) {
        return switch (criterion.type()) {
            case NUMERIC -> new ToleranceBandPredicate(criterion.column(), criterion.number());
            case TEXT -> TextEqualsPredicate.of(criterion.column(), criterion.text());
        };
    }
}
