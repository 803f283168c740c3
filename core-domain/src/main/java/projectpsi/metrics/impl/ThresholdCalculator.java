package projectpsi.metrics.impl;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.compliance.Pollutant;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.metrics.i.ITableStage;

/**
 * Deriva los umbrales superior/inferior de DBO y DQO de cada fila.
 * <p>
 * Los umbrales son los límites regulatorios en mg/L replicados fila a fila. Si el afluente
 * de una fila es NaN, los umbrales de ese contaminante en esa fila también lo son
 * (no se rellena con ceros).
 */
@Slf4j
public class ThresholdCalculator implements ITableStage {

    @Override
    public String getName() {
        return "Thresholds";
    }

    @Override
    public String getDescription() {
        return "Límites regulatorios por fila: BODut, BODlt, CODut, CODlt [mg/L]";
    }

    @Override
    public ScenarioTable apply(ScenarioTable table, ComplianceLimits limits) {
        ScenarioTable result = table;
        for (Pollutant pollutant : Pollutant.values()) {
            double[] influent = table.numeric(pollutant.influentColumn());
            result = result
                    .withNumeric(pollutant.upperThresholdColumn(),
                            broadcast(influent, pollutant.upperLimit(limits)))
                    .withNumeric(pollutant.lowerThresholdColumn(),
                            broadcast(influent, pollutant.lowerLimit(limits)));
        }
        log.debug("Umbrales calculados para {} filas.", table.rowCount());
        return result;
    }

    /**
     * Replica el límite en cada fila, propagando NaN donde falte el afluente.
     */
    static double[] broadcast(double[] influent, double limit) {
        double[] thresholds = new double[influent.length];
        for (int i = 0; i < influent.length; i++) {
            thresholds[i] = Double.isNaN(influent[i]) ? Double.NaN : limit;
        }
        return thresholds;
    }
}
