package projectpsi.domain.analysis;

import lombok.Builder;

import java.util.OptionalDouble;

/**
 * Recuento de la clasificación de un escenario.
 */
@Builder
public record ComplianceSummary(
        String scenario,
        int totalRows,
        int compliant,
        int lutExceedance,
        int maxLimitFailure,
        int noData,
        int bodSource,
        int codSource,
        int bodAndCodSource,
        int passSource,
        int bodPsi2BelowCod,
        int bodPsi3BelowCod
) {
    /**
     * Filas con todas las medidas disponibles.
     */
    public int classifiedRows() {
        return totalRows - noData;
    }

    /**
     * Fracción de filas conformes sobre las clasificadas; vacía si no hay ninguna.
     */
    public OptionalDouble compliantShare() {
        int classified = classifiedRows();
        return classified == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) compliant / classified);
    }

    public int nonCompliant() {
        return lutExceedance + maxLimitFailure;
    }
}
