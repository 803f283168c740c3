package projectpsi.metrics.impl;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.compliance.FailSource;
import projectpsi.domain.compliance.FailType;
import projectpsi.domain.compliance.Pollutant;
import projectpsi.domain.compliance.RowClassification;
import projectpsi.domain.table.Columns;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.metrics.i.ITableStage;

import java.util.EnumMap;
import java.util.Map;

/**
 * Asigna a cada fila su tipo de fallo y el contaminante que lo provoca.
 * <p>
 * Predicados por contaminante P (flags = criterio cumplido):
 * <ul>
 * <li><b>Exceso LUT:</b> {@code psi_2 < 0}, no cumple el umbral inferior ni la reducción,
 * pero sí el umbral superior.</li>
 * <li><b>Límite máximo:</b> {@code psi_3 < 0} y no cumple ningún criterio.</li>
 * </ul>
 * Precedencia: Max Limit Failure, después LUT Exceedance, y por defecto Compliant.
 * Una fila a la que le falta alguna medida de DBO o DQO (NaN) no se evalúa: queda como
 * No Data, sin fuente, sin métrica y con todos los predicados a false.
 * Cada fila depende sólo de sus propias columnas.
 */
@Slf4j
public class FailureClassifier implements ITableStage {

    @Override
    public String getName() {
        return "FailureClassifier";
    }

    @Override
    public String getDescription() {
        return "fail_type / fail_source por fila a partir de PSI y flags";
    }

    @Override
    public ScenarioTable apply(ScenarioTable table, ComplianceLimits limits) {
        int n = table.rowCount();

        double[] bodPsi1 = table.numeric(Pollutant.BOD.psi1Column());
        double[] codPsi1 = table.numeric(Pollutant.COD.psi1Column());
        double[] bodPsi2 = table.numeric(Pollutant.BOD.psi2Column());
        double[] codPsi2 = table.numeric(Pollutant.COD.psi2Column());
        double[] bodPsi3 = table.numeric(Pollutant.BOD.psi3Column());
        double[] codPsi3 = table.numeric(Pollutant.COD.psi3Column());
        double[] metricLut = table.numeric(Columns.METRIC_LUT);
        double[] metricMax = table.numeric(Columns.METRIC_MAX);
        boolean[] missing = missingMeasurements(table);

        boolean[] bodLut = lutExceedance(table, Pollutant.BOD);
        boolean[] bodMax = maxLimitFailure(table, Pollutant.BOD);
        boolean[] codLut = lutExceedance(table, Pollutant.COD);
        boolean[] codMax = maxLimitFailure(table, Pollutant.COD);

        double[] metric = new double[n];
        String[] failType = new String[n];
        String[] failSource = new String[n];
        boolean[] bodPsi2Lower = new boolean[n];
        boolean[] bodPsi3Lower = new boolean[n];
        Map<FailType, Integer> counts = new EnumMap<>(FailType.class);

        for (int i = 0; i < n; i++) {
            if (missing[i]) {
                metric[i] = Double.NaN;
                failType[i] = FailType.NO_DATA.label();
                bodLut[i] = bodMax[i] = codLut[i] = codMax[i] = false;
                counts.merge(FailType.NO_DATA, 1, Integer::sum);
                continue;
            }
            RowClassification row = classify(bodLut[i], bodMax[i], codLut[i], codMax[i]);
            metric[i] = PsiCalculator.selectMetric(row.selectsLutMetric(), row.selectsMaxMetric(),
                    metricLut[i], metricMax[i], bodPsi1[i], codPsi1[i]);
            failType[i] = row.failType().label();
            failSource[i] = row.failSource() == null ? null : row.failSource().label();
            bodPsi2Lower[i] = bodPsi2[i] < codPsi2[i];
            bodPsi3Lower[i] = bodPsi3[i] < codPsi3[i];
            counts.merge(row.failType(), 1, Integer::sum);
        }
        if (counts.containsKey(FailType.NO_DATA)) {
            log.warn("{} filas sin medidas completas de DBO/DQO clasificadas como {}.",
                    counts.get(FailType.NO_DATA), FailType.NO_DATA.label());
        }

        log.debug("Clasificación completada: {}", counts);
        return table
                .withNumeric(Columns.METRIC, metric)
                .withFlag(Pollutant.BOD.lutExceedanceColumn(), bodLut)
                .withFlag(Pollutant.BOD.maxLimitColumn(), bodMax)
                .withFlag(Pollutant.COD.lutExceedanceColumn(), codLut)
                .withFlag(Pollutant.COD.maxLimitColumn(), codMax)
                .withFlag(Columns.BOD_PSI_2_BELOW_COD, bodPsi2Lower)
                .withFlag(Columns.BOD_PSI_3_BELOW_COD, bodPsi3Lower)
                .withText(Columns.FAIL_TYPE, failType)
                .withText(Columns.FAIL_SOURCE, failSource);
    }

    /**
     * Resuelve el tipo y la fuente de fallo de una fila a partir de los cuatro predicados.
     */
    public static RowClassification classify(boolean bodLut, boolean bodMax, boolean codLut, boolean codMax) {
        FailType type;
        FailSource source;
        if (bodMax || codMax) {
            type = FailType.MAX_LIMIT_FAILURE;
            source = FailSource.of(bodMax, codMax);
        } else if (bodLut || codLut) {
            type = FailType.LUT_EXCEEDANCE;
            source = FailSource.of(bodLut, codLut);
        } else {
            type = FailType.COMPLIANT;
            source = null;
        }
        return new RowClassification(type, source, bodLut, bodMax, codLut, codMax);
    }

    /**
     * Exceso LUT: la concentración está entre el umbral inferior y el superior
     * y tampoco se alcanza la reducción porcentual exigida.
     */
    public static boolean isLutExceedance(double psi2, boolean lowerMet, boolean upperMet, boolean reductionMet) {
        return psi2 < 0 && !lowerMet && !reductionMet && upperMet;
    }

    /**
     * Fallo de límite máximo: se supera el umbral superior sin alcanzar la reducción exigida.
     */
    public static boolean isMaxLimitFailure(double psi3, boolean lowerMet, boolean upperMet, boolean reductionMet) {
        return psi3 < 0 && !lowerMet && !upperMet && !reductionMet;
    }

    /**
     * Filas a las que les falta alguna de las medidas de las que depende la clasificación.
     */
    static boolean[] missingMeasurements(ScenarioTable table) {
        boolean[] missing = new boolean[table.rowCount()];
        for (String column : Columns.CLASSIFICATION_INPUTS) {
            double[] values = table.numeric(column);
            for (int i = 0; i < missing.length; i++) {
                missing[i] |= Double.isNaN(values[i]);
            }
        }
        return missing;
    }

    private static boolean[] lutExceedance(ScenarioTable table, Pollutant pollutant) {
        double[] psi2 = table.numeric(pollutant.psi2Column());
        boolean[] lower = table.flag(pollutant.lowerFlagColumn());
        boolean[] upper = table.flag(pollutant.upperFlagColumn());
        boolean[] reduction = table.flag(pollutant.reductionFlagColumn());
        boolean[] result = new boolean[table.rowCount()];
        for (int i = 0; i < result.length; i++) {
            result[i] = isLutExceedance(psi2[i], lower[i], upper[i], reduction[i]);
        }
        return result;
    }

    private static boolean[] maxLimitFailure(ScenarioTable table, Pollutant pollutant) {
        double[] psi3 = table.numeric(pollutant.psi3Column());
        boolean[] lower = table.flag(pollutant.lowerFlagColumn());
        boolean[] upper = table.flag(pollutant.upperFlagColumn());
        boolean[] reduction = table.flag(pollutant.reductionFlagColumn());
        boolean[] result = new boolean[table.rowCount()];
        for (int i = 0; i < result.length; i++) {
            result[i] = isMaxLimitFailure(psi3[i], lower[i], upper[i], reduction[i]);
        }
        return result;
    }
}
