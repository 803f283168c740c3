package projectpsi.analysis;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.AnalysisConfig;
import projectpsi.domain.analysis.ComplianceSummary;
import projectpsi.domain.analysis.NonStationarityRow;
import projectpsi.domain.analysis.RecoveryAnalysis;
import projectpsi.domain.analysis.ScenarioAnalysis;
import projectpsi.domain.analysis.SummaryStatistics;
import projectpsi.domain.scenario.Scenario;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.metrics.pipeline.CompliancePipeline;
import projectpsi.validation.ScenarioTableValidator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Punto de entrada del motor para un escenario: enriquece la tabla y deriva todos los
 * resúmenes (cumplimiento, no estacionariedad, recuperación y estadística descriptiva).
 * <p>
 * No guarda estado entre llamadas, así que una misma instancia puede compartirse entre hilos.
 */
@Slf4j
public class ScenarioAnalyzer {

    private final AnalysisConfig config;
    private final ScenarioTableValidator validator;
    private final CompliancePipeline pipeline;
    private final RecoveryTimeAnalyzer recoveryAnalyzer;
    private final NonStationarityScorer nonStationarityScorer;
    private final SeriesStatistics seriesStatistics;
    private final ComplianceSummarizer summarizer;

    public ScenarioAnalyzer(AnalysisConfig config) {
        this.config = config;
        this.validator = new ScenarioTableValidator();
        this.pipeline = new CompliancePipeline(config.getLimits(), validator, CompliancePipeline.defaultStages());
        this.recoveryAnalyzer = new RecoveryTimeAnalyzer(config.getTimeStepDays(), config.getTrailingRunPolicy());
        this.nonStationarityScorer = new NonStationarityScorer(config.getRollingWindow());
        this.seriesStatistics = new SeriesStatistics();
        this.summarizer = new ComplianceSummarizer();
    }

    /**
     * @throws projectpsi.validation.ScenarioValidationException si la tabla viola el contrato de entrada.
     */
    public ScenarioAnalysis analyse(Scenario scenario, ScenarioTable raw) {
        ScenarioTable enriched = pipeline.process(scenario, raw);

        ComplianceSummary compliance = summarizer.summarise(scenario.key(), enriched);
        NonStationarityRow nonStationarity = nonStationarityScorer.scoreColumns(
                scenario.key(), enriched, config.getNonStationarityColumns());
        RecoveryAnalysis recovery = recoveryAnalyzer.analyse(scenario.key(), enriched);

        Map<String, SummaryStatistics> statistics = seriesStatistics.summarise(enriched);
        Map<String, OptionalDouble> cv = new LinkedHashMap<>();
        statistics.forEach((column, stats) -> cv.put(column, stats.coefficientOfVariation()));

        log.info("Escenario {}: {} de {} filas conformes, {} episodios de recuperación.",
                scenario.key(), compliance.compliant(), compliance.totalRows(), recovery.eventCount());

        return new ScenarioAnalysis(
                scenario,
                enriched,
                validator.qualityReport(raw),
                compliance,
                nonStationarity,
                recovery,
                statistics,
                cv,
                seriesStatistics.exceedance(enriched));
    }
}
