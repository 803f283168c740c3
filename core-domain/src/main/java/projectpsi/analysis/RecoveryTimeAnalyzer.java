package projectpsi.analysis;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.AnalysisConfig;
import projectpsi.domain.analysis.RecoveryAnalysis;
import projectpsi.domain.analysis.RecoveryEpisode;
import projectpsi.domain.compliance.FailType;
import projectpsi.domain.table.Columns;
import projectpsi.domain.table.ScenarioTable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Mide la duración de cada episodio contiguo de incumplimiento.
 * <p>
 * Recorrido único hacia delante con estado explícito ({@link RecoveryState}) y un acumulador:
 * <ul>
 * <li>COMPLIANT → NON_COMPLIANT: primera fila no conforme, acumulador = 1.</li>
 * <li>NON_COMPLIANT → NON_COMPLIANT: acumulador + 1.</li>
 * <li>NON_COMPLIANT → COMPLIANT: se emite acumulador x paso de tiempo y se reinicia.</li>
 * <li>COMPLIANT → COMPLIANT: nada.</li>
 * </ul>
 * Las filas {@link FailType#NO_DATA} no cambian el estado ni suman al acumulador: un hueco
 * de datos dentro de un episodio no lo cierra, y su duración cuenta sólo las filas observadas.
 * El episodio abierto al final de la serie se trata según la {@link TrailingRunPolicy}.
 */
@Slf4j
public class RecoveryTimeAnalyzer {

    private final double timeStepDays;
    private final TrailingRunPolicy trailingRunPolicy;

    public RecoveryTimeAnalyzer() {
        this(AnalysisConfig.DEFAULT_TIME_STEP_DAYS, TrailingRunPolicy.DROP);
    }

    public RecoveryTimeAnalyzer(double timeStepDays, TrailingRunPolicy trailingRunPolicy) {
        if (!(timeStepDays > 0)) {
            throw new IllegalArgumentException("El paso de tiempo debe ser positivo: " + timeStepDays);
        }
        this.timeStepDays = timeStepDays;
        this.trailingRunPolicy = Objects.requireNonNull(trailingRunPolicy, "La política de cola no puede ser nula.");
    }

    /**
     * Recorre la secuencia ordenada y devuelve los episodios de incumplimiento detectados.
     */
    public List<RecoveryEpisode> scanEpisodes(List<FailType> sequence) {
        List<RecoveryEpisode> episodes = new ArrayList<>();
        RecoveryState state = RecoveryState.COMPLIANT;
        int accumulator = 0;
        int start = -1;

        for (int i = 0; i < sequence.size(); i++) {
            FailType type = Objects.requireNonNull(sequence.get(i), "Tipo de fallo nulo en la fila " + i);
            if (!type.isClassified()) {
                continue;
            }
            boolean nonCompliant = !type.isCompliant();

            if (state == RecoveryState.COMPLIANT) {
                if (nonCompliant) {
                    state = RecoveryState.NON_COMPLIANT;
                    accumulator = 1;
                    start = i;
                }
            } else if (nonCompliant) {
                accumulator++;
            } else {
                episodes.add(new RecoveryEpisode(start, accumulator, accumulator * timeStepDays, true));
                accumulator = 0;
                state = RecoveryState.COMPLIANT;
            }
        }

        if (state == RecoveryState.NON_COMPLIANT) {
            if (trailingRunPolicy == TrailingRunPolicy.COUNT_AS_ONGOING) {
                episodes.add(new RecoveryEpisode(start, accumulator, accumulator * timeStepDays, false));
            } else {
                log.debug("Episodio abierto al final de la serie descartado (inicio {}, {} filas).", start, accumulator);
            }
        }
        return episodes;
    }

    /**
     * Muestras de tiempo de recuperación en días, en orden de aparición.
     */
    public List<Double> recoveryTimesDays(List<FailType> sequence) {
        return scanEpisodes(sequence).stream()
                .map(RecoveryEpisode::durationDays)
                .collect(Collectors.toList());
    }

    /**
     * Muestras de tiempo de recuperación en minutos (días x 24 x 60).
     */
    public List<Double> recoveryTimesMinutes(List<FailType> sequence) {
        return scanEpisodes(sequence).stream()
                .map(RecoveryEpisode::durationMinutes)
                .collect(Collectors.toList());
    }

    /**
     * Tiempo medio de recuperación [días]. Vacío si no hay ningún episodio.
     */
    public OptionalDouble meanRecoveryTimeDays(List<FailType> sequence) {
        return recoveryTimesDays(sequence).stream().mapToDouble(Double::doubleValue).average();
    }

    /**
     * Tiempo medio de recuperación [min]. Vacío si no hay ningún episodio.
     */
    public OptionalDouble meanRecoveryTimeMinutes(List<FailType> sequence) {
        return recoveryTimesMinutes(sequence).stream().mapToDouble(Double::doubleValue).average();
    }

    /**
     * Resumen (número, media, dispersión, extremos) de un escenario ya clasificado.
     */
    public RecoveryAnalysis analyse(String scenarioKey, ScenarioTable classified) {
        List<Double> minutes = recoveryTimesMinutes(failTypes(classified));
        RecoveryAnalysis analysis = RecoveryAnalysis.of(scenarioKey, minutes);
        if (!analysis.hasData()) {
            log.info("Escenario {}: sin episodios de recuperación completos.", scenarioKey);
        }
        return analysis;
    }

    /**
     * Extrae la secuencia ordenada de tipos de fallo de una tabla clasificada.
     */
    public static List<FailType> failTypes(ScenarioTable classified) {
        return Arrays.stream(classified.text(Columns.FAIL_TYPE))
                .map(FailType::fromLabel)
                .collect(Collectors.toList());
    }

    public double getTimeStepDays() {
        return timeStepDays;
    }

    public TrailingRunPolicy getTrailingRunPolicy() {
        return trailingRunPolicy;
    }
}
