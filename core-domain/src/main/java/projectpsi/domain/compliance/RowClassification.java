package projectpsi.domain.compliance;

/**
 * Resultado de clasificar una fila.
 *
 * @param failType         Tipo de fallo (exactamente uno por fila).
 * @param failSource       Contaminante(s) de la rama elegida; {@code null} si la fila es conforme.
 * @param bodLutExceedance Predicado LUT de DBO.
 * @param bodMaxLimit      Predicado de límite máximo de DBO.
 * @param codLutExceedance Predicado LUT de DQO.
 * @param codMaxLimit      Predicado de límite máximo de DQO.
 */
public record RowClassification(
        FailType failType,
        FailSource failSource,
        boolean bodLutExceedance,
        boolean bodMaxLimit,
        boolean codLutExceedance,
        boolean codMaxLimit
) {
    /** Algún contaminante excede la tabla LUT. */
    public boolean lutCondition() {
        return bodLutExceedance || codLutExceedance;
    }

    /** Algún contaminante supera su límite máximo. */
    public boolean maxCondition() {
        return bodMaxLimit || codMaxLimit;
    }

    /** Selección de métrica LUT: hay exceso LUT sin fallo de límite máximo. */
    public boolean selectsLutMetric() {
        return lutCondition() && !maxCondition();
    }

    /** Selección de métrica de máximo: exceso LUT y fallo de límite máximo a la vez. */
    public boolean selectsMaxMetric() {
        return lutCondition() && maxCondition();
    }
}
