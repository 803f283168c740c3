package projectpsi.analysis;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.AnalysisConfig;
import projectpsi.domain.analysis.NonStationarityRow;
import projectpsi.domain.table.ScenarioTable;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Índice de no estacionariedad: cuánto se aparta la varianza local (ventana móvil) de la
 * varianza global de la serie.
 * <pre>
 *   score = media(|var_movil - var_global|) / var_global
 * </pre>
 * Todas las varianzas son muestrales (n - 1). Los NaN se descartan antes de calcular y las
 * primeras {@code window - 1} posiciones de la ventana móvil no participan en la media.
 */
@Slf4j
public class NonStationarityScorer {

    private final int window;

    public NonStationarityScorer() {
        this(AnalysisConfig.DEFAULT_ROLLING_WINDOW);
    }

    public NonStationarityScorer(int window) {
        if (window < 2) {
            throw new IllegalArgumentException("La ventana debe ser de al menos 2 muestras: " + window);
        }
        this.window = window;
    }

    /**
     * @return El índice (≥ 0), o vacío si la serie limpia es más corta que la ventana o
     * su varianza global es cero.
     */
    public OptionalDouble score(double[] series) {
        double[] clean = dropNaN(series);
        if (clean.length < window) {
            log.debug("Serie de {} muestras válidas, menor que la ventana {}: índice indefinido.", clean.length, window);
            return OptionalDouble.empty();
        }

        double overall = sampleVariance(clean, 0, clean.length);
        if (overall == 0.0) {
            log.debug("Varianza global nula: índice indefinido.");
            return OptionalDouble.empty();
        }

        double sum = 0.0;
        int count = 0;
        for (double local : rollingVariance(clean)) {
            if (!Double.isNaN(local)) {
                sum += Math.abs(local - overall);
                count++;
            }
        }
        return OptionalDouble.of(sum / count / overall);
    }

    /**
     * Varianza muestral móvil, alineada con la serie de entrada ya limpia de NaN.
     * Las primeras {@code window - 1} posiciones quedan a NaN (ventana incompleta).
     */
    public double[] rollingVariance(double[] series) {
        double[] clean = dropNaN(series);
        double[] result = new double[clean.length];
        Arrays.fill(result, Double.NaN);
        for (int end = window; end <= clean.length; end++) {
            result[end - 1] = sampleVariance(clean, end - window, end);
        }
        return result;
    }

    /**
     * Puntúa las columnas indicadas de un escenario. Las columnas ausentes se omiten.
     */
    public NonStationarityRow scoreColumns(String scenarioKey, ScenarioTable table, List<String> columns) {
        Map<String, OptionalDouble> scores = new LinkedHashMap<>();
        for (String column : columns) {
            if (!table.numericColumnNames().contains(column)) {
                log.warn("[{}] Columna {} no disponible para el índice de no estacionariedad.", scenarioKey, column);
                continue;
            }
            scores.put(column, score(table.numeric(column)));
        }
        return new NonStationarityRow(scenarioKey, scores);
    }

    /**
     * Varianza muestral (n - 1) del tramo [from, to) en dos pasadas. NaN con menos de dos muestras.
     */
    public static double sampleVariance(double[] values, int from, int to) {
        int n = to - from;
        if (n < 2) {
            return Double.NaN;
        }
        double mean = mean(values, from, to);
        double sumSq = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            sumSq += d * d;
        }
        return sumSq / (n - 1);
    }

    public static double[] dropNaN(double[] series) {
        return Arrays.stream(series).filter(v -> !Double.isNaN(v)).toArray();
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
