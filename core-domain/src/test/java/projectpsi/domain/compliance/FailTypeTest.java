package projectpsi.domain.compliance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailTypeTest {

    @Test
    @DisplayName("fromLabel: acepta las etiquetas sin distinguir mayúsculas")
    void fromLabel_shouldBeCaseInsensitive() {
        assertEquals(FailType.COMPLIANT, FailType.fromLabel("Compliant"));
        assertEquals(FailType.LUT_EXCEEDANCE, FailType.fromLabel("LUT exceedance"));
        assertEquals(FailType.MAX_LIMIT_FAILURE, FailType.fromLabel("max limit failure"));
        assertEquals(FailType.NO_DATA, FailType.fromLabel("No Data"));
        assertThrows(IllegalArgumentException.class, () -> FailType.fromLabel("Unknown"));
    }

    @Test
    @DisplayName("No Data: ni conforme ni clasificada")
    void noData_shouldBeUnclassified() {
        assertFalse(FailType.NO_DATA.isCompliant());
        assertFalse(FailType.NO_DATA.isClassified());
        assertTrue(FailType.MAX_LIMIT_FAILURE.isClassified());
    }

    @Test
    @DisplayName("FailSource.of: nulo si ningún contaminante falla, compuesto si fallan ambos")
    void failSourceOf_shouldCombinePollutants() {
        assertNull(FailSource.of(false, false));
        assertEquals(FailSource.BOD, FailSource.of(true, false));
        assertEquals(FailSource.COD, FailSource.of(false, true));
        assertEquals(FailSource.BOD_AND_COD, FailSource.of(true, true));
        assertEquals("BOD+COD", FailSource.BOD_AND_COD.label());
    }

    @Test
    @DisplayName("Pollutant: nombres de columnas derivadas")
    void pollutant_shouldDeriveColumnNames() {
        assertEquals("BODut", Pollutant.BOD.upperThresholdColumn());
        assertEquals("CODlt-CODeffl", Pollutant.COD.lowerDeviationColumn());
        assertEquals("LIN_BODe", Pollutant.BOD.linearisedEffluentColumn());
        assertEquals("flag_reduction_cod", Pollutant.COD.reductionFlagColumn());
        assertEquals("cod_psi_2", Pollutant.COD.psi2Column());
        assertEquals("bod_max_lim", Pollutant.BOD.maxLimitColumn());
    }
}
