package projectpsi.metrics.impl;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.ComplianceLimits;
import projectpsi.domain.compliance.Pollutant;
import projectpsi.domain.compliance.PollutantState;
import projectpsi.domain.compliance.PsiComponents;
import projectpsi.domain.table.Columns;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.metrics.i.ITableStage;

/**
 * Calcula los tres componentes PSI de cada contaminante y las métricas agregadas
 * {@code metric_lut} y {@code metric_max}.
 * <p>
 * Con {@code lt}, {@code ut} las holguras de umbral y {@code pc} el margen de reducción:
 * <pre>
 * psi_1 = max(lt, min(lt, pc))
 * psi_2 = min(lt, pc, ut)
 * psi_3 = min(ut, pc)
 * </pre>
 * El anidamiento de psi_1 es parte del contrato y no se simplifica.
 * La métrica final {@code metric} depende de los predicados de fallo y la escribe
 * {@link FailureClassifier} mediante {@link #selectMetric}.
 */
@Slf4j
public class PsiCalculator implements ITableStage {

    @Override
    public String getName() {
        return "PSI";
    }

    @Override
    public String getDescription() {
        return "psi_1 = max(lt, min(lt, pc)); psi_2 = min(lt, pc, ut); psi_3 = min(ut, pc)";
    }

    @Override
    public ScenarioTable apply(ScenarioTable table, ComplianceLimits limits) {
        int n = table.rowCount();
        ScenarioTable result = table;

        double[][] psi2ByPollutant = new double[Pollutant.values().length][];
        double[][] psi3ByPollutant = new double[Pollutant.values().length][];

        for (Pollutant pollutant : Pollutant.values()) {
            double[] lt = table.numeric(pollutant.lowerDeviationColumn());
            double[] ut = table.numeric(pollutant.upperDeviationColumn());
            double[] pc = table.numeric(pollutant.reductionMarginColumn());

            double[] psi1Min = new double[n];
            double[] psi1 = new double[n];
            double[] psi2 = new double[n];
            double[] psi3 = new double[n];

            for (int i = 0; i < n; i++) {
                PsiComponents psi = compute(new PollutantState(lt[i], ut[i], pc[i]));
                psi1Min[i] = psi.psi1Min();
                psi1[i] = psi.psi1();
                psi2[i] = psi.psi2();
                psi3[i] = psi.psi3();
            }

            psi2ByPollutant[pollutant.ordinal()] = psi2;
            psi3ByPollutant[pollutant.ordinal()] = psi3;

            result = result
                    .withNumeric(pollutant.psi1MinColumn(), psi1Min)
                    .withNumeric(pollutant.psi1Column(), psi1)
                    .withNumeric(pollutant.psi2Column(), psi2)
                    .withNumeric(pollutant.psi3Column(), psi3);
        }

        double[] metricLut = new double[n];
        double[] metricMax = new double[n];
        double[] bodPsi2 = psi2ByPollutant[Pollutant.BOD.ordinal()];
        double[] codPsi2 = psi2ByPollutant[Pollutant.COD.ordinal()];
        double[] bodPsi3 = psi3ByPollutant[Pollutant.BOD.ordinal()];
        double[] codPsi3 = psi3ByPollutant[Pollutant.COD.ordinal()];
        for (int i = 0; i < n; i++) {
            metricLut[i] = Math.min(bodPsi2[i], codPsi2[i]);
            metricMax[i] = Math.min(bodPsi3[i], codPsi3[i]);
        }

        log.debug("PSI calculado para {} filas.", n);
        return result
                .withNumeric(Columns.METRIC_LUT, metricLut)
                .withNumeric(Columns.METRIC_MAX, metricMax);
    }

    /**
     * Componentes PSI de un contaminante en una fila.
     */
    public static PsiComponents compute(PollutantState state) {
        double lt = state.lt();
        double ut = state.ut();
        double pc = state.pc();

        double psi1Min = Math.min(lt, pc);
        double psi1 = Math.max(lt, psi1Min);
        double psi2 = Math.min(Math.min(lt, pc), ut);
        double psi3 = Math.min(ut, pc);
        return new PsiComponents(psi1Min, psi1, psi2, psi3);
    }

    /**
     * Selección de la métrica final de una fila. Primera coincidencia: LUT, después máximo,
     * y por defecto {@code max(bod_psi_1, cod_psi_1)}.
     */
    public static double selectMetric(boolean lutSelected, boolean maxSelected,
                                      double metricLut, double metricMax,
                                      double bodPsi1, double codPsi1) {
        if (lutSelected) {
            return metricLut;
        }
        if (maxSelected) {
            return metricMax;
        }
        return Math.max(bodPsi1, codPsi1);
    }
}
