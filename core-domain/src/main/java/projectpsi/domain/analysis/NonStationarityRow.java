package projectpsi.domain.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Índices de no estacionariedad de un escenario, una entrada por columna evaluada.
 * Un valor vacío indica índice indefinido (varianza global nula o serie más corta que la ventana).
 */
public record NonStationarityRow(String scenario, Map<String, OptionalDouble> scores) {

    public NonStationarityRow {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public OptionalDouble score(String column) {
        return scores.getOrDefault(column, OptionalDouble.empty());
    }
}
