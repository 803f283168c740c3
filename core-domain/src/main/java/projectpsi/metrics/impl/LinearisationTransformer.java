package projectpsi.metrics.impl;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.compliance.Pollutant;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.metrics.i.ITableStage;

import java.util.Arrays;

/**
 * Linealiza (normalización min-max) las columnas de afluente y efluente de cada contaminante.
 * <p>
 * {@code LIN_x = (x - min(x)) / (max(x) - min(x))} sobre toda la serie del escenario.
 * <ul>
 * <li>Los NaN no participan en el min/max y se conservan como NaN.</li>
 * <li>Columna constante (max == min): todas las filas valen {@value #CONSTANT_COLUMN_VALUE}.</li>
 * </ul>
 */
@Slf4j
public class LinearisationTransformer implements ITableStage {

    public static final double CONSTANT_COLUMN_VALUE = 0.0;

    @Override
    public String getName() {
        return "Linearisation";
    }

    @Override
    public String getDescription() {
        return "Normalización min-max a [0, 1] de LIN_BODi, LIN_BODe, LIN_CODi y LIN_CODe";
    }

    @Override
    public ScenarioTable apply(ScenarioTable table, ComplianceLimits limits) {
        ScenarioTable result = table;
        for (Pollutant pollutant : Pollutant.values()) {
            result = result
                    .withNumeric(pollutant.linearisedInfluentColumn(),
                            linearise(table.numeric(pollutant.influentColumn())))
                    .withNumeric(pollutant.linearisedEffluentColumn(),
                            linearise(table.numeric(pollutant.effluentColumn())));
        }
        return result;
    }

    /**
     * Normaliza una serie a [0, 1] conservando el orden de sus valores.
     *
     * @param values Serie original (no se modifica).
     * @return Un array nuevo con la serie linealizada.
     */
    public static double[] linearise(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (Double.isNaN(v)) continue;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        double[] result = new double[values.length];
        // Sin ningún valor definido: todo NaN.
        if (min > max) {
            Arrays.fill(result, Double.NaN);
            return result;
        }

        double range = max - min;
        if (range == 0.0) {
            log.debug("Columna constante ({}): se aplica el valor de reserva {}.", min, CONSTANT_COLUMN_VALUE);
        }
        for (int i = 0; i < values.length; i++) {
            double v = values[i];
            if (Double.isNaN(v)) {
                result[i] = Double.NaN;
            } else if (range == 0.0) {
                result[i] = CONSTANT_COLUMN_VALUE;
            } else {
                result[i] = (v - min) / range;
            }
        }
        return result;
    }
}
