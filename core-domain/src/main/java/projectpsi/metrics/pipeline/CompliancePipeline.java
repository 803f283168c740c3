package projectpsi.metrics.pipeline;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.scenario.Scenario;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.metrics.i.ITableStage;
import projectpsi.metrics.impl.DeviationReductionCalculator;
import projectpsi.metrics.impl.FailureClassifier;
import projectpsi.metrics.impl.LinearisationTransformer;
import projectpsi.metrics.impl.PsiCalculator;
import projectpsi.metrics.impl.ThresholdCalculator;
import projectpsi.validation.ScenarioTableValidator;

import java.util.List;

/**
 * Orquestador del enriquecimiento de un escenario.
 * <p>
 * Valida el contrato de entrada y encadena las etapas en el orden obligatorio:
 * Umbrales, Linealización, Desviación/Reducción, PSI y Clasificación.
 * Cada etapa consume columnas que produce la anterior.
 */
@Slf4j
public class CompliancePipeline {

    private final ComplianceLimits limits;
    private final ScenarioTableValidator validator;
    private final List<ITableStage> stages;

    public CompliancePipeline(ComplianceLimits limits) {
        this(limits, new ScenarioTableValidator(), defaultStages());
    }

    public CompliancePipeline(ComplianceLimits limits, ScenarioTableValidator validator, List<ITableStage> stages) {
        this.limits = limits;
        this.validator = validator;
        this.stages = List.copyOf(stages);
    }

    public static List<ITableStage> defaultStages() {
        return List.of(
                new ThresholdCalculator(),
                new LinearisationTransformer(),
                new DeviationReductionCalculator(),
                new PsiCalculator(),
                new FailureClassifier()
        );
    }

    /**
     * Valida y enriquece la tabla de un escenario.
     *
     * @return Tabla nueva con las columnas originales más todas las derivadas.
     * @throws projectpsi.validation.ScenarioValidationException si la entrada viola el contrato.
     */
    public ScenarioTable process(Scenario scenario, ScenarioTable raw) {
        validator.validate(scenario, raw);

        long start = System.currentTimeMillis();
        ScenarioTable table = raw;
        for (ITableStage stage : stages) {
            table = stage.apply(table, limits);
            log.debug("[{}] Etapa {} aplicada ({}).", scenario.key(), stage.getName(), stage.getDescription());
        }
        log.info("Escenario {} procesado: {} filas, {} columnas en {} ms.",
                scenario.key(), table.rowCount(), table.columnNames().size(), System.currentTimeMillis() - start);
        return table;
    }
}
