package projectpsi.domain.analysis;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Resumen de los tiempos de recuperación de un escenario, en minutos.
 * <p>
 * Sin episodios, las estadísticas quedan vacías ("sin datos"), nunca a cero.
 *
 * @param scenario              Clave del escenario.
 * @param eventCount            Número de episodios emitidos.
 * @param recoveryTimesMinutes  Muestras ordenadas [min].
 * @param meanMinutes           Media aritmética.
 * @param stdMinutes            Desviación típica poblacional.
 * @param minMinutes            Mínimo.
 * @param maxMinutes            Máximo.
 */
public record RecoveryAnalysis(
        String scenario,
        int eventCount,
        List<Double> recoveryTimesMinutes,
        OptionalDouble meanMinutes,
        OptionalDouble stdMinutes,
        OptionalDouble minMinutes,
        OptionalDouble maxMinutes
) {
    public RecoveryAnalysis {
        recoveryTimesMinutes = List.copyOf(recoveryTimesMinutes);
    }

    public static RecoveryAnalysis of(String scenario, List<Double> recoveryTimesMinutes) {
        if (recoveryTimesMinutes.isEmpty()) {
            return new RecoveryAnalysis(scenario, 0, List.of(),
                    OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());
        }
        double mean = recoveryTimesMinutes.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        double sumSq = 0.0;
        for (double t : recoveryTimesMinutes) {
            sumSq += (t - mean) * (t - mean);
        }
        double std = Math.sqrt(sumSq / recoveryTimesMinutes.size());
        return new RecoveryAnalysis(
                scenario,
                recoveryTimesMinutes.size(),
                recoveryTimesMinutes,
                OptionalDouble.of(mean),
                OptionalDouble.of(std),
                recoveryTimesMinutes.stream().mapToDouble(Double::doubleValue).min(),
                recoveryTimesMinutes.stream().mapToDouble(Double::doubleValue).max());
    }

    public boolean hasData() {
        return eventCount > 0;
    }
}
