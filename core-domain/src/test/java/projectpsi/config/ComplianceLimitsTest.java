package projectpsi.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpsi.analysis.TrailingRunPolicy;
import projectpsi.domain.table.Columns;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ComplianceLimitsTest {

    @Test
    @DisplayName("Defaults: límites de la directiva (DBO 25/50, DQO 125/250, 70% y 75%)")
    void defaults_shouldMatchRegulatoryValues() {
        ComplianceLimits limits = ComplianceLimits.defaults();

        assertEquals(50.0, limits.bodUpper());
        assertEquals(25.0, limits.bodLower());
        assertEquals(250.0, limits.codUpper());
        assertEquals(125.0, limits.codLower());
        assertEquals(0.7, limits.bodPc());
        assertEquals(0.75, limits.codPc());
    }

    @Test
    @DisplayName("Invariante: un límite inferior igual o mayor que el superior se rechaza")
    void constructor_shouldRejectLowerNotBelowUpper() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> ComplianceLimits.defaults().withBodLower(50.0));
        assertThat(ex.getMessage()).contains("DBO");

        assertThrows(IllegalArgumentException.class,
                () -> ComplianceLimits.defaults().withCodLower(300.0));
    }

    @Test
    @DisplayName("Invariante: los factores porcentuales deben estar en [0, 1]")
    void constructor_shouldRejectPercentageOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> ComplianceLimits.defaults().withBodPc(1.2));
        assertThrows(IllegalArgumentException.class, () -> ComplianceLimits.defaults().withCodPc(-0.1));
        assertThrows(IllegalArgumentException.class, () -> ComplianceLimits.defaults().withCodPc(Double.NaN));
    }

    @Test
    @DisplayName("Inmutabilidad: with* devuelve una copia y no altera el original")
    void with_shouldReturnModifiedCopy() {
        ComplianceLimits original = ComplianceLimits.defaults();
        ComplianceLimits stricter = original.withBodUpper(40.0);

        assertEquals(50.0, original.bodUpper());
        assertEquals(40.0, stricter.bodUpper());
    }

    @Test
    @DisplayName("Exportación: toMap usa las claves históricas en orden")
    void toMap_shouldUseLegacyKeys() {
        assertThat(ComplianceLimits.defaults().toMap())
                .containsExactly(
                        entry("bod_upper", 50.0),
                        entry("bod_lower", 25.0),
                        entry("cod_upper", 250.0),
                        entry("cod_lower", 125.0),
                        entry("bod_pc", 0.7),
                        entry("cod_pc", 0.75));
    }

    @Test
    @DisplayName("AnalysisConfig: valores por defecto y conversión del paso a minutos")
    void analysisConfigDefaults_shouldBeConsistent() {
        AnalysisConfig config = AnalysisConfig.defaults();

        assertEquals(ComplianceLimits.defaults(), config.getLimits());
        assertEquals(0.08, config.getTimeStepDays());
        assertEquals(30, config.getRollingWindow());
        assertEquals(TrailingRunPolicy.DROP, config.getTrailingRunPolicy());
        assertEquals(Columns.LINEARISED, config.getNonStationarityColumns());
        assertEquals(115.2, config.getTimeStepMinutes(), 1e-9);
    }
}
