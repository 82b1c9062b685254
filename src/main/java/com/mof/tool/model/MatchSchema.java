package com.mof.tool.model;

import java.util.List;
import java.util.Objects;

/**
 * Column roles used by the matcher.
 *
 * <p>The MOF adsorption schema ({@link #mofAdsorption()}) is the one the published
 * dataset uses:
 * <ul>
 *   <li>{@code MOF} identifies the framework; several records can share it</li>
 *   <li>{@code Gas uptake (mmol/g)} ranks records within one framework</li>
 *   <li>the operating-condition columns (gas mix, temperature, pressure, uptake) are
 *       taken from the best-ranked record, every other output column is averaged</li>
 * </ul>
 *
 * @param entityColumn              column identifying the entity a record belongs to
 * @param rankingColumn             numeric column used to pick the representative record
 * @param inputColumns              columns offered as search criteria, in display order
 * @param outputColumns             the fixed output schema, in order
 * @param operatingConditionColumns output columns carried over from the representative record
 */
public record MatchSchema(
    String entityColumn,
    String rankingColumn,
    List<String> inputColumns,
    List<String> outputColumns,
    List<String> operatingConditionColumns
) {

    public static final String MOF = "MOF";
    public static final String GAS_UPTAKE = "Gas uptake (mmol/g)";

    public static final List<String> MOF_INPUT_COLUMNS = List.of(
        MOF, "N2", "CO2", "CH4", "Gas Temperature (°C)", "Gas Pressure (bar)",
        GAS_UPTAKE, "Void Fraction", "MSA (m²/g)", "VSA (m²/cm³)",
        "PLD (Å)", "LCD (Å)"
    );

    public static final List<String> MOF_OUTPUT_COLUMNS = List.of(
        MOF, "KH (mmol/bar.g)", "W 0.1 (mmol/g)", "W 0.2 (mmol/g)", "W 0.3 (mmol/g)",
        "W 0.4 (mmol/g)", "W 0.5 (mmol/g)", "W 0.6 (mmol/g)", "W 0.7 (mmol/g)",
        "W 0.8 (mmol/g)", "W 0.9 (mmol/g)",
        "N2", "CO2", "CH4", "Gas Temperature (°C)", "Gas Pressure (bar)",
        GAS_UPTAKE, "Void Fraction", "MSA (m²/g)", "VSA (m²/cm³)",
        "PLD (Å)", "LCD (Å)"
    );

    public static final List<String> MOF_OPERATING_CONDITION_COLUMNS = List.of(
        "N2", "CO2", "CH4", "Gas Temperature (°C)", "Gas Pressure (bar)", GAS_UPTAKE
    );

    private static final MatchSchema MOF_ADSORPTION = new MatchSchema(
        MOF, GAS_UPTAKE, MOF_INPUT_COLUMNS, MOF_OUTPUT_COLUMNS, MOF_OPERATING_CONDITION_COLUMNS);

    public MatchSchema {
        Objects.requireNonNull(entityColumn, "entityColumn");
        Objects.requireNonNull(rankingColumn, "rankingColumn");
        inputColumns = List.copyOf(inputColumns);
        outputColumns = List.copyOf(outputColumns);
        operatingConditionColumns = List.copyOf(operatingConditionColumns);
        if (!outputColumns.contains(entityColumn)) {
            throw new IllegalArgumentException("Output columns must contain the entity column: " + entityColumn);
        }
    }

    public static MatchSchema mofAdsorption() {
        return MOF_ADSORPTION;
    }

    /**
     * Returns true if the output column is carried over from the representative record.
     */
    public boolean isOperatingCondition(String column) {
        return operatingConditionColumns.contains(column);
    }

    /**
     * Returns the input columns that the given dataset does not provide.
     */
    public List<String> missingInputColumns(Dataset dataset) {
        return inputColumns.stream()
            .filter(c -> !dataset.hasColumn(c))
            .toList();
    }
}
