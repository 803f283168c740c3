package projectpsi.domain.compliance;

import projectpsi.config.ComplianceLimits;
import projectpsi.domain.table.Columns;

/**
 * Contaminantes regulados. Cada uno conoce sus columnas de entrada, sus límites
 * y el nombre de las columnas derivadas que el motor le añade a la tabla.
 */
public enum Pollutant {

    BOD("BOD", "bod", Columns.BOD_INFLUENT, Columns.BOD_EFFLUENT),
    COD("COD", "cod", Columns.COD_INFLUENT, Columns.COD_EFFLUENT);

    private final String code;
    private final String key;
    private final String influentColumn;
    private final String effluentColumn;

    Pollutant(String code, String key, String influentColumn, String effluentColumn) {
        this.code = code;
        this.key = key;
        this.influentColumn = influentColumn;
        this.effluentColumn = effluentColumn;
    }

    public String influentColumn() {
        return influentColumn;
    }

    public String effluentColumn() {
        return effluentColumn;
    }

    // --- Parámetros regulatorios ---

    public double upperLimit(ComplianceLimits limits) {
        return this == BOD ? limits.bodUpper() : limits.codUpper();
    }

    public double lowerLimit(ComplianceLimits limits) {
        return this == BOD ? limits.bodLower() : limits.codLower();
    }

    public double percentageFactor(ComplianceLimits limits) {
        return this == BOD ? limits.bodPc() : limits.codPc();
    }

    // --- Columnas derivadas ---

    public String upperThresholdColumn() {
        return code + "ut";
    }

    public String lowerThresholdColumn() {
        return code + "lt";
    }

    public String linearisedInfluentColumn() {
        return "LIN_" + code + "i";
    }

    public String linearisedEffluentColumn() {
        return "LIN_" + code + "e";
    }

    public String upperDeviationColumn() {
        return code + "ut-" + code + "effl";
    }

    public String lowerDeviationColumn() {
        return code + "lt-" + code + "effl";
    }

    public String reductionColumn() {
        return "reduction_" + code;
    }

    public String reductionMarginColumn() {
        return key + "p";
    }

    public String upperFlagColumn() {
        return "flag_" + code + "ut";
    }

    public String lowerFlagColumn() {
        return "flag_" + code + "lt";
    }

    public String reductionFlagColumn() {
        return "flag_reduction_" + key;
    }

    public String psi1MinColumn() {
        return key + "_psi_1_min";
    }

    public String psi1Column() {
        return key + "_psi_1";
    }

    public String psi2Column() {
        return key + "_psi_2";
    }

    public String psi3Column() {
        return key + "_psi_3";
    }

    public String lutExceedanceColumn() {
        return key + "_lut_exc";
    }

    public String maxLimitColumn() {
        return key + "_max_lim";
    }
}
