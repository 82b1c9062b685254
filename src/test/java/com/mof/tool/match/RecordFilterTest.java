package com.mof.tool.match;

import com.mof.tool.model.Dataset;
import com.mof.tool.model.MofRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordFilterTest {

    private static final List<String> COLUMNS = List.of("MOF", "CO2", "Gas Temperature (°C)");

    private final Dataset dataset = Dataset.builder(COLUMNS)
        .addRow("ZIF-8", 0.15, 25)
        .addRow("MOF-5", 0.15, 45)
        .addRow("HKUST-1", 0.50, 25)
        .addRow("UiO-66", 0.15, 25)
        .build();

    private final RecordFilter filter = new RecordFilter();

    @Test
    void shouldRequireEveryPredicate() {
        List<ColumnPredicate> predicates = List.of(
            new ToleranceBandPredicate("CO2", 0.15),
            new ToleranceBandPredicate("Gas Temperature (°C)", 25)
        );

        List<MofRecord> matched = filter.apply(dataset.getRecords(), predicates);

        assertThat(matched).extracting(r -> r.get("MOF")).containsExactly("ZIF-8", "UiO-66");
    }

    @Test
    void shouldPreserveDatasetOrder() {
        List<MofRecord> matched = filter.apply(dataset.getRecords(),
            List.of(new ToleranceBandPredicate("Gas Temperature (°C)", 25)));

        assertThat(matched).extracting(r -> r.get("MOF")).containsExactly("ZIF-8", "HKUST-1", "UiO-66");
    }

    @Test
    void shouldReturnEmptyListWhenNothingMatches() {
        List<MofRecord> matched = filter.apply(dataset.getRecords(),
            List.of(TextEqualsPredicate.of("MOF", "MIL-101")));

        assertThat(matched).isEmpty();
    }

    @Test
    void shouldNotModifyInput() {
        List<MofRecord> before = List.copyOf(dataset.getRecords());

        filter.apply(dataset.getRecords(), List.of(new ToleranceBandPredicate("CO2", 0.5)));

        assertThat(dataset.getRecords()).isEqualTo(before);
    }
}
