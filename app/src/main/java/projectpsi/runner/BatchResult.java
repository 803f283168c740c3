package projectpsi.runner;

import projectpsi.domain.analysis.ScenarioAnalysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resultado de un lote: análisis completados (en el orden de entrada) y, por clave de
 * escenario, el motivo de cada fallo.
 */
public record BatchResult(List<ScenarioAnalysis> analyses, Map<String, String> failures) {

    public BatchResult {
        analyses = List.copyOf(analyses);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Añade fallos ocurridos antes del lote (ej: al cargar los datos). Se listan primero.
     */
    public BatchResult withEarlierFailures(Map<String, String> earlier) {
        Map<String, String> merged = new LinkedHashMap<>(earlier);
        merged.putAll(failures);
        return new BatchResult(analyses, merged);
    }
}
