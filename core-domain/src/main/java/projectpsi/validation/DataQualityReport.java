package projectpsi.validation;

import java.util.List;
import java.util.Map;

/**
 * Informe de calidad de datos de una tabla de entrada.
 *
 * @param totalRows          Número de filas.
 * @param totalColumns       Número de columnas.
 * @param missingColumns     Columnas obligatorias ausentes.
 * @param nanCounts          Número de NaN por columna numérica.
 * @param hasExpectedColumns true si están bod1, cod1, bod31 y cod31.
 */
public record DataQualityReport(
        int totalRows,
        int totalColumns,
        List<String> missingColumns,
        Map<String, Integer> nanCounts,
        boolean hasExpectedColumns
) {
    public boolean isValid() {
        return missingColumns.isEmpty() && totalRows > 0;
    }
}
