package projectpsi.validation;

import lombok.extern.slf4j.Slf4j;
import projectpsi.domain.scenario.Scenario;
import projectpsi.domain.table.Columns;
import projectpsi.domain.table.ScenarioTable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Comprueba el contrato de entrada de un escenario antes de que entre en el motor.
 * <p>
 * El motor asume una entrada validada: las violaciones se lanzan aquí como
 * {@link ScenarioValidationException} y abortan sólo el escenario afectado.
 */
@Slf4j
public class ScenarioTableValidator {

    private final List<String> requiredColumns;

    public ScenarioTableValidator() {
        this(Columns.REQUIRED);
    }

    public ScenarioTableValidator(List<String> requiredColumns) {
        this.requiredColumns = List.copyOf(requiredColumns);
    }

    /**
     * Columnas obligatorias que faltan en la tabla (lista vacía si están todas).
     */
    public List<String> missingColumns(ScenarioTable table) {
        return requiredColumns.stream()
                .filter(column -> !table.hasColumn(column))
                .collect(Collectors.toList());
    }

    /**
     * Valida la tabla de un escenario.
     *
     * @throws ScenarioValidationException si la tabla es nula, está vacía, le faltan columnas
     *                                     o contiene valores infinitos.
     */
    public void validate(Scenario scenario, ScenarioTable table) {
        String key = scenario.key();
        if (table == null) {
            throw new ScenarioValidationException(key, "La tabla del escenario es nula.");
        }
        if (table.isEmpty()) {
            throw new ScenarioValidationException(key, "La tabla del escenario está vacía.");
        }

        List<String> missing = missingColumns(table);
        if (!missing.isEmpty()) {
            throw new ScenarioValidationException(key, "Faltan columnas obligatorias: " + missing
                    + ". Columnas encontradas: " + table.columnNames());
        }

        for (String column : requiredColumns) {
            if (!table.numericColumnNames().contains(column)) {
                throw new ScenarioValidationException(key, "La columna " + column + " no es numérica.");
            }
            double[] values = table.numeric(column);
            for (int i = 0; i < values.length; i++) {
                if (Double.isInfinite(values[i])) {
                    throw new ScenarioValidationException(key,
                            "Valor infinito en la columna " + column + ", fila " + i + ".");
                }
            }
        }

        Map<String, Integer> missingValues = missingValueCounts(table);
        int totalNan = missingValues.values().stream().mapToInt(Integer::intValue).sum();
        if (totalNan > 0) {
            log.warn("Escenario {}: {} valores ausentes (NaN) en columnas obligatorias {}", key, totalNan, missingValues);
        }
    }

    /**
     * Valores ausentes (NaN) por columna obligatoria. Sólo aparecen las columnas con algún NaN.
     */
    public Map<String, Integer> missingValueCounts(ScenarioTable table) {
        return nanCounts(table, requiredColumns.stream()
                .filter(table.numericColumnNames()::contains)
                .collect(Collectors.toList()));
    }

    public DataQualityReport qualityReport(ScenarioTable table) {
        boolean hasExpected = Columns.CLASSIFICATION_INPUTS.stream().allMatch(table::hasColumn);
        return new DataQualityReport(
                table.rowCount(),
                table.columnNames().size(),
                missingColumns(table),
                nanCounts(table, table.numericColumnNames()),
                hasExpected);
    }

    private static Map<String, Integer> nanCounts(ScenarioTable table, Collection<String> columns) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String column : columns) {
            int nan = 0;
            for (double v : table.numeric(column)) {
                if (Double.isNaN(v)) nan++;
            }
            if (nan > 0) {
                counts.put(column, nan);
            }
        }
        return counts;
    }
}
