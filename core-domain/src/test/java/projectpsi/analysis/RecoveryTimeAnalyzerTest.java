package projectpsi.analysis;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import projectpsi.ObservationFixtures;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.analysis.RecoveryAnalysis;
import projectpsi.domain.analysis.RecoveryEpisode;
import projectpsi.domain.compliance.FailType;
import projectpsi.domain.scenario.Scenario;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.metrics.pipeline.CompliancePipeline;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class RecoveryTimeAnalyzerTest {

    private static final double STEP = 0.08;

    private static List<FailType> sequence(String pattern) {
        List<FailType> types = new ArrayList<>();
        for (char c : pattern.toCharArray()) {
            switch (c) {
                case 'C':
                    types.add(FailType.COMPLIANT);
                    break;
                case 'L':
                    types.add(FailType.LUT_EXCEEDANCE);
                    break;
                case '?':
                    types.add(FailType.NO_DATA);
                    break;
                default:
                    types.add(FailType.MAX_LIMIT_FAILURE);
            }
        }
        return types;
    }

    @Test
    @DisplayName("Episodios: [C,C,N,N,N,C,C,N,C] con paso 0.08 días produce [0.24, 0.08]")
    void recoveryTimesDays_shouldMeasureClosedRuns() {
        RecoveryTimeAnalyzer analyzer = new RecoveryTimeAnalyzer(STEP, TrailingRunPolicy.DROP);

        List<Double> times = analyzer.recoveryTimesDays(sequence("CCNNNCCNC"));
        log.info("Tiempos de recuperación [días]: {}", times);

        assertThat(times).hasSize(2);
        assertThat(times.get(0)).isCloseTo(0.24, within(1e-9));
        assertThat(times.get(1)).isCloseTo(0.08, within(1e-9));
    }

    @Test
    @DisplayName("Agrupación: LUT y Max Limit Failure cuentan como el mismo episodio")
    void scanEpisodes_shouldMergeFailureKinds() {
        RecoveryTimeAnalyzer analyzer = new RecoveryTimeAnalyzer(STEP, TrailingRunPolicy.DROP);

        List<RecoveryEpisode> episodes = analyzer.scanEpisodes(sequence("CLNLC"));

        assertEquals(1, episodes.size());
        assertEquals(1, episodes.get(0).startIndex());
        assertEquals(3, episodes.get(0).length());
        assertTrue(episodes.get(0).closed());
    }

    @Test
    @DisplayName("Cola abierta: con DROP un N,N final no añade ninguna muestra")
    void trailingRun_dropPolicy_shouldBeIgnored() {
        RecoveryTimeAnalyzer analyzer = new RecoveryTimeAnalyzer(STEP, TrailingRunPolicy.DROP);

        assertEquals(analyzer.recoveryTimesDays(sequence("CCNNNCCNC")),
                analyzer.recoveryTimesDays(sequence("CCNNNCCNCNN")));
    }

    @Test
    @DisplayName("Cola abierta: con COUNT_AS_ONGOING se emite con la duración observada")
    void trailingRun_countPolicy_shouldEmitOpenEpisode() {
        RecoveryTimeAnalyzer analyzer = new RecoveryTimeAnalyzer(STEP, TrailingRunPolicy.COUNT_AS_ONGOING);

        List<RecoveryEpisode> episodes = analyzer.scanEpisodes(sequence("CCNNNCCNCNN"));

        assertEquals(3, episodes.size());
        RecoveryEpisode last = episodes.get(2);
        assertFalse(last.closed());
        assertEquals(9, last.startIndex());
        assertEquals(0.16, last.durationDays(), 1e-9);
    }

    @Test
    @DisplayName("Minutos: días x 24 x 60")
    void recoveryTimesMinutes_shouldConvertDays() {
        RecoveryTimeAnalyzer analyzer = new RecoveryTimeAnalyzer(STEP, TrailingRunPolicy.DROP);

        List<Double> minutes = analyzer.recoveryTimesMinutes(sequence("NNNC"));

        assertEquals(1, minutes.size());
        assertEquals(0.24 * 24 * 60, minutes.get(0), 1e-9);
    }

    @Test
    @DisplayName("Sin datos: la media de una serie sin episodios es vacía, no cero")
    void meanRecoveryTime_noEpisodes_shouldBeEmpty() {
        RecoveryTimeAnalyzer analyzer = new RecoveryTimeAnalyzer();

        assertTrue(analyzer.meanRecoveryTimeDays(sequence("CCCC")).isEmpty());
        assertTrue(analyzer.meanRecoveryTimeMinutes(List.of()).isEmpty());
        assertEquals(0.16, analyzer.meanRecoveryTimeDays(sequence("CNNNCNC")).getAsDouble(), 1e-9);
    }

    @Test
    @DisplayName("Resumen: recuento, media, desviación poblacional y extremos en minutos")
    void analyse_shouldSummariseClassifiedTable() {
        ScenarioTable classified = new CompliancePipeline(ComplianceLimits.defaults())
                .process(Scenario.of("baseline"), ObservationFixtures.fromPattern("CCNNNCCNC"));
        RecoveryTimeAnalyzer analyzer = new RecoveryTimeAnalyzer(STEP, TrailingRunPolicy.DROP);

        RecoveryAnalysis analysis = analyzer.analyse("baseline", classified);

        double first = 0.24 * 1440;
        double second = 0.08 * 1440;
        assertEquals(2, analysis.eventCount());
        assertEquals((first + second) / 2, analysis.meanMinutes().getAsDouble(), 1e-6);
        assertEquals((first - second) / 2, analysis.stdMinutes().getAsDouble(), 1e-6);
        assertEquals(second, analysis.minMinutes().getAsDouble(), 1e-6);
        assertEquals(first, analysis.maxMinutes().getAsDouble(), 1e-6);
    }

    @Test
    @DisplayName("Todo conforme: cero muestras y estadísticas vacías")
    void analyse_allCompliant_shouldHaveNoData() {
        ScenarioTable classified = new CompliancePipeline(ComplianceLimits.defaults())
                .process(Scenario.of("baseline"), ObservationFixtures.fromPattern("CCCCC"));

        RecoveryAnalysis analysis = new RecoveryTimeAnalyzer().analyse("baseline", classified);

        assertFalse(analysis.hasData());
        assertTrue(analysis.recoveryTimesMinutes().isEmpty());
        assertTrue(analysis.meanMinutes().isEmpty());
        assertTrue(analysis.maxMinutes().isEmpty());
    }

    @Test
    @DisplayName("Huecos: una fila No Data no cierra el episodio ni suma duración")
    void scanEpisodes_noDataGap_shouldKeepState() {
        RecoveryTimeAnalyzer analyzer = new RecoveryTimeAnalyzer(STEP, TrailingRunPolicy.DROP);

        List<RecoveryEpisode> episodes = analyzer.scanEpisodes(sequence("CNN?NC??C"));

        assertEquals(1, episodes.size());
        assertEquals(1, episodes.get(0).startIndex());
        assertEquals(3, episodes.get(0).length());
        assertTrue(analyzer.scanEpisodes(sequence("C??C")).isEmpty());
    }

    @Test
    @DisplayName("Huecos: una medida ausente dentro de un fallo da un único episodio en la tabla clasificada")
    void analyse_missingRowInsideRun_shouldYieldSingleEpisode() {
        ScenarioTable classified = new CompliancePipeline(ComplianceLimits.defaults()).process(
                Scenario.of("baseline"),
                ObservationFixtures.table(
                        ObservationFixtures.BOD_MAX,
                        ObservationFixtures.row(100, Double.NaN, 600, 60),
                        ObservationFixtures.BOD_MAX,
                        ObservationFixtures.COMPLIANT));

        RecoveryAnalysis analysis = new RecoveryTimeAnalyzer(STEP, TrailingRunPolicy.DROP)
                .analyse("baseline", classified);

        assertEquals(1, analysis.eventCount());
        assertThat(analysis.recoveryTimesMinutes().get(0)).isCloseTo(230.4, within(1e-6));
    }

    @Test
    @DisplayName("Configuración: el paso de tiempo debe ser positivo")
    void constructor_shouldRejectNonPositiveStep() {
        assertThrows(IllegalArgumentException.class, () -> new RecoveryTimeAnalyzer(0.0, TrailingRunPolicy.DROP));
        assertThrows(NullPointerException.class, () -> new RecoveryTimeAnalyzer(STEP, null));
    }
}
