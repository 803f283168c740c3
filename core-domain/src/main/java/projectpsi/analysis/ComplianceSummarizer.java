package projectpsi.analysis;

import projectpsi.domain.analysis.ComplianceSummary;
import projectpsi.domain.compliance.FailSource;
import projectpsi.domain.compliance.FailType;
import projectpsi.domain.table.Columns;
import projectpsi.domain.table.ScenarioTable;

/**
 * Agrega la clasificación fila a fila de una tabla enriquecida.
 * Las filas sin datos sólo suman a su propio contador.
 */
public class ComplianceSummarizer {

    public ComplianceSummary summarise(String scenarioKey, ScenarioTable classified) {
        int compliant = 0;
        int lut = 0;
        int max = 0;
        int noData = 0;
        int bod = 0;
        int cod = 0;
        int both = 0;
        int pass = 0;
        int c2 = 0;
        int c3 = 0;

        for (int row = 0; row < classified.rowCount(); row++) {
            switch (FailType.fromLabel(classified.textAt(Columns.FAIL_TYPE, row))) {
                case COMPLIANT:
                    compliant++;
                    break;
                case LUT_EXCEEDANCE:
                    lut++;
                    break;
                case MAX_LIMIT_FAILURE:
                    max++;
                    break;
                case NO_DATA:
                    noData++;
                    continue;
                default:
                    throw new IllegalStateException("Tipo de fallo no soportado en la fila " + row);
            }

            String source = classified.textAt(Columns.FAIL_SOURCE, row);
            if (source == null) {
                pass++;
            } else if (FailSource.BOD.label().equals(source)) {
                bod++;
            } else if (FailSource.COD.label().equals(source)) {
                cod++;
            } else if (FailSource.BOD_AND_COD.label().equals(source)) {
                both++;
            } else {
                throw new IllegalStateException("Origen de fallo desconocido '" + source + "' en la fila " + row);
            }

            if (classified.flagAt(Columns.BOD_PSI_2_BELOW_COD, row)) {
                c2++;
            }
            if (classified.flagAt(Columns.BOD_PSI_3_BELOW_COD, row)) {
                c3++;
            }
        }

        return ComplianceSummary.builder()
                .scenario(scenarioKey)
                .totalRows(classified.rowCount())
                .compliant(compliant)
                .lutExceedance(lut)
                .maxLimitFailure(max)
                .noData(noData)
                .bodSource(bod)
                .codSource(cod)
                .bodAndCodSource(both)
                .passSource(pass)
                .bodPsi2BelowCod(c2)
                .bodPsi3BelowCod(c3)
                .build();
    }
}
