package projectpsi.domain.analysis;

import java.util.OptionalDouble;

/**
 * Estadísticos descriptivos de una columna (NaN excluidos).
 *
 * @param column Nombre de la columna.
 * @param count  Muestras válidas.
 * @param mean   Media; vacía sin muestras.
 * @param std    Desviación típica muestral; vacía con menos de dos muestras.
 * @param min    Mínimo; vacío sin muestras.
 * @param max    Máximo; vacío sin muestras.
 */
public record SummaryStatistics(
        String column,
        long count,
        OptionalDouble mean,
        OptionalDouble std,
        OptionalDouble min,
        OptionalDouble max
) {
    public static SummaryStatistics empty(String column) {
        return new SummaryStatistics(column, 0, OptionalDouble.empty(), OptionalDouble.empty(),
                OptionalDouble.empty(), OptionalDouble.empty());
    }

    /**
     * Coeficiente de variación (std / media). Vacío si la media es cero o falta algún término.
     */
    public OptionalDouble coefficientOfVariation() {
        if (mean.isEmpty() || std.isEmpty() || mean.getAsDouble() == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(std.getAsDouble() / mean.getAsDouble());
    }
}
