package projectpsi.metrics.impl;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.compliance.Pollutant;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.metrics.i.ITableStage;

/**
 * Calcula las holguras de cada umbral, la reducción lograda frente al afluente
 * y los flags de cumplimiento de cada criterio.
 * <ul>
 * <li><b>Desviación:</b> {@code umbral - efluente}. Positivo = el efluente queda por debajo.</li>
 * <li><b>Reducción:</b> {@code (afluente - efluente) / afluente}; 0.0 si el afluente es cero.</li>
 * <li><b>Margen de reducción (bodp/codp):</b> {@code reducción - pc}. Es el término {@code pc} de los PSI.</li>
 * <li><b>Flags:</b> true cuando el criterio se cumple (holgura &ge; 0, reducción &ge; pc).</li>
 * </ul>
 */
@Slf4j
public class DeviationReductionCalculator implements ITableStage {

    @Override
    public String getName() {
        return "Deviation/Reduction";
    }

    @Override
    public String getDescription() {
        return "Holguras umbral-efluente, reducción fraccional y flags de cumplimiento";
    }

    @Override
    public ScenarioTable apply(ScenarioTable table, ComplianceLimits limits) {
        ScenarioTable result = table;
        for (Pollutant pollutant : Pollutant.values()) {
            double[] influent = table.numeric(pollutant.influentColumn());
            double[] effluent = table.numeric(pollutant.effluentColumn());
            double[] lowerThreshold = table.numeric(pollutant.lowerThresholdColumn());
            double[] upperThreshold = table.numeric(pollutant.upperThresholdColumn());
            double pc = pollutant.percentageFactor(limits);

            int n = table.rowCount();
            double[] lowerDeviation = new double[n];
            double[] upperDeviation = new double[n];
            double[] reduction = new double[n];
            double[] margin = new double[n];
            boolean[] lowerMet = new boolean[n];
            boolean[] upperMet = new boolean[n];
            boolean[] reductionMet = new boolean[n];

            for (int i = 0; i < n; i++) {
                lowerDeviation[i] = lowerThreshold[i] - effluent[i];
                upperDeviation[i] = upperThreshold[i] - effluent[i];
                reduction[i] = reduction(influent[i], effluent[i]);
                margin[i] = reduction[i] - pc;

                // NaN >= 0 es falso: una fila sin datos nunca "cumple" un criterio.
                lowerMet[i] = lowerDeviation[i] >= 0;
                upperMet[i] = upperDeviation[i] >= 0;
                reductionMet[i] = reduction[i] >= pc;
            }

            result = result
                    .withNumeric(pollutant.lowerDeviationColumn(), lowerDeviation)
                    .withNumeric(pollutant.upperDeviationColumn(), upperDeviation)
                    .withNumeric(pollutant.reductionColumn(), reduction)
                    .withNumeric(pollutant.reductionMarginColumn(), margin)
                    .withFlag(pollutant.lowerFlagColumn(), lowerMet)
                    .withFlag(pollutant.upperFlagColumn(), upperMet)
                    .withFlag(pollutant.reductionFlagColumn(), reductionMet);
        }
        log.debug("Desviaciones y reducciones calculadas para {} filas.", table.rowCount());
        return result;
    }

    /**
     * Reducción fraccional del efluente respecto al afluente.
     * Un afluente nulo no permite medir reducción y se define como 0.0 (ni NaN ni infinito).
     */
    public static double reduction(double influent, double effluent) {
        if (influent == 0.0) {
            return 0.0;
        }
        return (influent - effluent) / influent;
    }
}
