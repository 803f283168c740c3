package projectpsi.domain.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import projectpsi.domain.scenario.Scenario;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.validation.DataQualityReport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Resultado completo del análisis de un escenario. La tabla enriquecida se exporta aparte
 * (CSV), por eso no forma parte del informe JSON.
 */
public record ScenarioAnalysis(
        Scenario scenario,
        @JsonIgnore ScenarioTable enrichedTable,
        DataQualityReport dataQuality,
        ComplianceSummary compliance,
        NonStationarityRow nonStationarity,
        RecoveryAnalysis recovery,
        Map<String, SummaryStatistics> statistics,
        Map<String, OptionalDouble> coefficientOfVariation,
        Map<String, OptionalDouble> exceedanceProbability
) {
    public ScenarioAnalysis {
        statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
        coefficientOfVariation = Collections.unmodifiableMap(new LinkedHashMap<>(coefficientOfVariation));
        exceedanceProbability = Collections.unmodifiableMap(new LinkedHashMap<>(exceedanceProbability));
    }
}
