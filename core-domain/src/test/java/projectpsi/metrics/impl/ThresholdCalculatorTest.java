package projectpsi.metrics.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpsi.ObservationFixtures;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.compliance.Pollutant;
import projectpsi.domain.table.Columns;
import projectpsi.domain.table.ScenarioTable;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdCalculatorTest {

    private final ThresholdCalculator calculator = new ThresholdCalculator();

    @Test
    @DisplayName("Umbrales: cada fila recibe los límites absolutos en mg/L")
    void apply_shouldBroadcastLimits() {
        ScenarioTable table = ObservationFixtures.table(ObservationFixtures.COMPLIANT, ObservationFixtures.BOD_MAX);

        ScenarioTable result = calculator.apply(table, ComplianceLimits.defaults());

        assertArrayEquals(new double[]{50, 50}, result.numeric(Pollutant.BOD.upperThresholdColumn()));
        assertArrayEquals(new double[]{25, 25}, result.numeric(Pollutant.BOD.lowerThresholdColumn()));
        assertArrayEquals(new double[]{250, 250}, result.numeric(Pollutant.COD.upperThresholdColumn()));
        assertArrayEquals(new double[]{125, 125}, result.numeric(Pollutant.COD.lowerThresholdColumn()));
    }

    @Test
    @DisplayName("Inmutabilidad: la tabla de entrada conserva sus columnas originales")
    void apply_shouldKeepSourceColumnsAndNotMutateInput() {
        ScenarioTable table = ObservationFixtures.table(ObservationFixtures.COMPLIANT);

        ScenarioTable result = calculator.apply(table, ComplianceLimits.defaults());

        assertFalse(table.hasColumn(Pollutant.BOD.upperThresholdColumn()));
        assertArrayEquals(table.numeric(Columns.BOD_INFLUENT), result.numeric(Columns.BOD_INFLUENT));
    }

    @Test
    @DisplayName("NaN: un afluente ausente deja el umbral de esa fila en NaN, sin rellenar con ceros")
    void broadcast_shouldPropagateMissingInfluent() {
        double[] thresholds = ThresholdCalculator.broadcast(new double[]{100, Double.NaN, 80}, 50);

        assertEquals(50, thresholds[0]);
        assertTrue(Double.isNaN(thresholds[1]));
        assertEquals(50, thresholds[2]);
    }
}
