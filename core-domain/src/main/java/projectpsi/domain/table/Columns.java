package projectpsi.domain.table;

import projectpsi.domain.compliance.Pollutant;

import java.util.List;

/**
 * Nombres de columna de la tabla de escenario que no dependen de un contaminante concreto.
 * <p>
 * Las columnas derivadas por contaminante (umbrales, desviaciones, PSI...) las nombra
 * {@link Pollutant}. Se conservan los nombres históricos de los informes (BODut, LIN_BODe,
 * bod_psi_2...) para que los CSV exportados sean comparables con los anteriores.
 */
public final class Columns {

    private Columns() {}

    // --- Entrada (afluente / efluente) ---
    public static final String BOD_INFLUENT = "bod1";
    public static final String COD_INFLUENT = "cod1";
    public static final String SNH_INFLUENT = "snh1";
    public static final String BOD_EFFLUENT = "bod31";
    public static final String COD_EFFLUENT = "cod31";
    public static final String SNH_EFFLUENT = "snh31";

    public static final List<String> REQUIRED = List.of(
            BOD_INFLUENT, COD_INFLUENT, BOD_EFFLUENT, COD_EFFLUENT, SNH_INFLUENT, SNH_EFFLUENT);

    /** Medidas de las que depende la clasificación de una fila. */
    public static final List<String> CLASSIFICATION_INPUTS = List.of(
            BOD_INFLUENT, BOD_EFFLUENT, COD_INFLUENT, COD_EFFLUENT);

    public static final List<String> LINEARISED = List.of(
            Pollutant.BOD.linearisedInfluentColumn(), Pollutant.BOD.linearisedEffluentColumn(),
            Pollutant.COD.linearisedInfluentColumn(), Pollutant.COD.linearisedEffluentColumn());

    // --- Métricas agregadas ---
    public static final String METRIC_LUT = "metric_lut";
    public static final String METRIC_MAX = "metric_max";
    public static final String METRIC = "metric";

    // --- Clasificación ---
    public static final String BOD_PSI_2_BELOW_COD = "c_BOD_2";
    public static final String BOD_PSI_3_BELOW_COD = "c_BOD_3";
    public static final String FAIL_TYPE = "fail_type";
    public static final String FAIL_SOURCE = "fail_source";
}
