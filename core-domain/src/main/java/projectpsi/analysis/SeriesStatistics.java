package projectpsi.analysis;

import projectpsi.domain.analysis.SummaryStatistics;
import projectpsi.domain.table.Columns;
import projectpsi.domain.table.ScenarioTable;

import java.util.Arrays;
import java.util.Collections;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Estadística descriptiva de las series de concentración de un escenario:
 * resumen por columna, coeficiente de variación y probabilidad de superación de umbral.
 */
public class SeriesStatistics {

    /** Columnas resumidas por defecto. */
    public static final List<String> DEFAULT_COLUMNS = List.of(
            Columns.BOD_INFLUENT, Columns.BOD_EFFLUENT, Columns.COD_INFLUENT, Columns.COD_EFFLUENT);

    /** Umbrales de superación por defecto [mg/L]. */
    public static final Map<String, Double> DEFAULT_EXCEEDANCE_THRESHOLDS = defaultThresholds();

    private final List<String> columns;
    private final Map<String, Double> exceedanceThresholds;

    public SeriesStatistics() {
        this(DEFAULT_COLUMNS, DEFAULT_EXCEEDANCE_THRESHOLDS);
    }

    public SeriesStatistics(List<String> columns, Map<String, Double> exceedanceThresholds) {
        this.columns = List.copyOf(columns);
        this.exceedanceThresholds = new LinkedHashMap<>(exceedanceThresholds);
    }

    public static SummaryStatistics summarise(String column, double[] values) {
        double[] clean = NonStationarityScorer.dropNaN(values);
        if (clean.length == 0) {
            return SummaryStatistics.empty(column);
        }
        DoubleSummaryStatistics stats = Arrays.stream(clean).summaryStatistics();
        double variance = NonStationarityScorer.sampleVariance(clean, 0, clean.length);
        OptionalDouble std = Double.isNaN(variance) ? OptionalDouble.empty() : OptionalDouble.of(Math.sqrt(variance));
        return new SummaryStatistics(
                column,
                stats.getCount(),
                OptionalDouble.of(stats.getAverage()),
                std,
                OptionalDouble.of(stats.getMin()),
                OptionalDouble.of(stats.getMax()));
    }

    /**
     * Fracción de filas con valor estrictamente mayor que el umbral, sobre el total de filas
     * (un NaN cuenta como no superado). Vacía para una serie vacía.
     */
    public static OptionalDouble exceedanceProbability(double[] values, double threshold) {
        if (values.length == 0) {
            return OptionalDouble.empty();
        }
        long above = Arrays.stream(values).filter(v -> v > threshold).count();
        return OptionalDouble.of((double) above / values.length);
    }

    /**
     * Resumen de las columnas configuradas presentes en la tabla.
     */
    public Map<String, SummaryStatistics> summarise(ScenarioTable table) {
        Map<String, SummaryStatistics> result = new LinkedHashMap<>();
        for (String column : columns) {
            if (table.numericColumnNames().contains(column)) {
                result.put(column, summarise(column, table.numeric(column)));
            }
        }
        return result;
    }

    /**
     * Probabilidades de superación, con claves del estilo {@code prob_bod1_gt_300}.
     */
    public Map<String, OptionalDouble> exceedance(ScenarioTable table) {
        Map<String, OptionalDouble> result = new LinkedHashMap<>();
        exceedanceThresholds.forEach((column, threshold) -> {
            if (table.numericColumnNames().contains(column)) {
                result.put(exceedanceKey(column, threshold), exceedanceProbability(table.numeric(column), threshold));
            }
        });
        return result;
    }

    public static String exceedanceKey(String column, double threshold) {
        String value = threshold == Math.rint(threshold)
                ? Long.toString((long) threshold)
                : Double.toString(threshold);
        return "prob_" + column + "_gt_" + value;
    }

    private static Map<String, Double> defaultThresholds() {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        thresholds.put(Columns.BOD_INFLUENT, 300.0);
        thresholds.put(Columns.BOD_EFFLUENT, 50.0);
        thresholds.put(Columns.COD_INFLUENT, 500.0);
        thresholds.put(Columns.COD_EFFLUENT, 250.0);
        return Collections.unmodifiableMap(thresholds);
    }
}
