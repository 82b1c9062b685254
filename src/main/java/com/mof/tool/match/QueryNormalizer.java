package com.mof.tool.match;

import com.mof.tool.model.CellValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw, user-entered criteria into typed {@link Criterion} values.
 *
 * <p>Rules:
 * <ol>
 *   <li>column names are trimmed</li>
 *   <li>null, empty and blank values are dropped</li>
 *   <li>numbers stay numeric; text that parses as a number becomes numeric</li>
 *   <li>everything else is kept as trimmed text</li>
 * </ol>
 * If two raw keys trim to the same column, the later one wins.
 */
public class QueryNormalizer {

    private static final Logger log = LoggerFactory.getLogger(QueryNormalizer.class);

    /**
     * Normalizes raw criteria.
     *
     * @param rawCriteria column name to raw value (text, number or null)
     * @return the criteria in input order
     * @throws InvalidCriteriaException if no criterion remains
     */
    public List<Criterion> normalize(Map<String, ?> rawCriteria) {
        Map<String, Criterion> normalized = new LinkedHashMap<>();

        if (rawCriteria != null) {
            for (Map.Entry<String, ?> entry : rawCriteria.entrySet()) {
                if (entry.getKey() == null) {
                    continue;
                }
                String column = entry.getKey().trim();
                Criterion criterion = classify(column, entry.getValue());
                if (criterion != null) {
                    normalized.put(column, criterion);
                }
            }
        }

        if (normalized.isEmpty()) {
            throw new InvalidCriteriaException("Please provide at least one non-empty input before searching.");
        }

        log.debug("Normalized {} raw criteria into {}", rawCriteria.size(), normalized.values());
        return new ArrayList<>(normalized.values());
    }

    private Criterion classify(String column, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return Criterion.numeric(column, number.doubleValue());
        }

        String trimmed = value.toString().trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        Double number = CellValues.parseNumber(trimmed);
        if (number != null) {
            return Criterion.numeric(column, number);
        }
        return Criterion.text(column, trimmed);
    }
}
