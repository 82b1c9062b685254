package com.mof.tool.match;

import com.mof.tool.model.CellValues;
import com.mof.tool.model.MofRecord;

import java.util.*;

/**
 * Groups matched records by entity identity (the MOF name).
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Filter the dataset down to matching records</li>
 *   <li>Group records by identity using this class, keeping filtered order inside each group</li>
 *   <li>Iterate groups in ascending identity order</li>
 *   <li>Pick the representative record (highest ranking value, first one on ties)</li>
 *   <li>Average the remaining numeric columns across the group</li>
 * </ol>
 */
public class EntityGroup {

    /**
     * Ascending identity order: numbers first (numerically), then text (lexicographically).
     */
    public static final Comparator<Object> IDENTITY_ORDER = (a, b) -> {
        boolean aNumber = a instanceof Number;
        boolean bNumber = b instanceof Number;
        if (aNumber && bNumber) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (aNumber != bNumber) {
            return aNumber ? -1 : 1;
        }
        return a.toString().compareTo(b.toString());
    };

    private final Object identity;
    private final List<MofRecord> records = new ArrayList<>();

    public EntityGroup(Object identity) {
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    public void addRecord(MofRecord record) {
        records.add(record);
    }

    /**
     * Returns the identity value shared by every record in this group.
     */
    public Object getIdentity() {
        return identity;
    }

    /**
     * Returns an unmodifiable list of the records in filtered order.
     */
    public List<MofRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    /**
     * Selects the record with the highest numeric value in the ranking column.
     * The first record wins ties. Records whose value is missing or not numeric are
     * skipped; if no record has a numeric value the first record is returned.
     *
     * @param rankingColumn the column to rank by
     * @return the representative record
     * @throws IllegalStateException if the group is empty
     */
    public MofRecord representative(String rankingColumn) {
        if (records.isEmpty()) {
            throw new IllegalStateException("Group " + identity + " has no records");
        }

        int bestIndex = -1;
        double best = 0.0;
        for (int i = 0; i < records.size(); i++) {
            Double value = CellValues.toNumber(records.get(i).get(rankingColumn));
            if (value == null || value.isNaN()) {
                continue;
            }
            if (bestIndex < 0 || value > best) {
                bestIndex = i;
                best = value;
            }
        }
        return records.get(Math.max(bestIndex, 0));
    }

    /**
     * Calculates the mean of a column over the records whose value is numeric.
     *
     * @param column the column to average
     * @return the mean, or null if no record has a numeric value
     */
    public Double mean(String column) {
        double sum = 0.0;
        int count = 0;
        for (MofRecord record : records) {
            Double value = CellValues.toNumber(record.get(column));
            if (value == null || value.isNaN()) {
                continue;
            }
            sum += value;
            count++;
        }
        return count == 0 ? null : sum / count;
    }

    @Override
    public String toString() {
        return "EntityGroup{" +
                "identity='" + identity + '\'' +
                ", records=" + records.size() +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityGroup that = (EntityGroup) o;
        return Objects.equals(identity, that.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity);
    }

    /**
     * Groups records by the value of the entity column.
     * Records without an identity (missing or NaN) belong to no group.
     *
     * @param records      the matched records, in filtered order
     * @param entityColumn the identity column
     * @return the groups in ascending identity order
     */
    public static List<EntityGroup> groupByIdentity(List<MofRecord> records, String entityColumn) {
        Map<Object, EntityGroup> groups = new TreeMap<>(IDENTITY_ORDER);

        for (MofRecord record : records) {
            Object identity = record.get(entityColumn);
            if (isMissing(identity)) {
                continue;
            }
            groups.computeIfAbsent(identity, EntityGroup::new).addRecord(record);
        }

        return new ArrayList<>(groups.values());
    }

    private static boolean isMissing(Object identity) {
        return identity == null || (identity instanceof Double d && d.isNaN());
    }
}
