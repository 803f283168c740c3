package projectpsi.io;

import projectpsi.analysis.TrailingRunPolicy;
import projectpsi.config.AnalysisConfig;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.analysis.ScenarioAnalysis;
import projectpsi.runner.BatchResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Informe JSON de una ejecución: parámetros usados, resultados por escenario y escenarios fallidos.
 */
public record AnalysisReport(
        Instant generatedAt,
        ComplianceLimits limits,
        double timeStepDays,
        int rollingWindow,
        TrailingRunPolicy trailingRunPolicy,
        List<ScenarioAnalysis> scenarios,
        Map<String, String> failures
) {
    public static AnalysisReport of(AnalysisConfig config, BatchResult result) {
        return new AnalysisReport(
                Instant.now(),
                config.getLimits(),
                config.getTimeStepDays(),
                config.getRollingWindow(),
                config.getTrailingRunPolicy(),
                result.analyses(),
                result.failures());
    }
}
