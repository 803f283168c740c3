package projectpsi.io;

import projectpsi.domain.analysis.ComplianceSummary;
import projectpsi.domain.analysis.NonStationarityRow;
import projectpsi.domain.analysis.RecoveryAnalysis;
import projectpsi.domain.analysis.ScenarioAnalysis;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Formato tabular (cabecera + filas de texto) de los resúmenes por escenario.
 * Un valor indefinido se deja como celda vacía.
 */
public final class SummaryTables {

    public static final List<String> COMPLIANCE_HEADER = List.of(
            "scenario", "total_rows", "compliant", "lut_exceedance", "max_limit_failure", "no_data",
            "fail_source_bod", "fail_source_cod", "fail_source_bod_cod", "fail_source_pass",
            "c_BOD_2", "c_BOD_3", "compliant_share");

    public static final List<String> RECOVERY_HEADER = List.of(
            "scenario", "event_count", "mean_recovery_min", "std_recovery_min",
            "min_recovery_min", "max_recovery_min");

    private SummaryTables() {}

    public static List<String[]> complianceRows(List<ScenarioAnalysis> analyses) {
        List<String[]> rows = new ArrayList<>();
        for (ScenarioAnalysis analysis : analyses) {
            ComplianceSummary s = analysis.compliance();
            rows.add(new String[]{
                    s.scenario(),
                    Integer.toString(s.totalRows()),
                    Integer.toString(s.compliant()),
                    Integer.toString(s.lutExceedance()),
                    Integer.toString(s.maxLimitFailure()),
                    Integer.toString(s.noData()),
                    Integer.toString(s.bodSource()),
                    Integer.toString(s.codSource()),
                    Integer.toString(s.bodAndCodSource()),
                    Integer.toString(s.passSource()),
                    Integer.toString(s.bodPsi2BelowCod()),
                    Integer.toString(s.bodPsi3BelowCod()),
                    format(s.compliantShare())
            });
        }
        return rows;
    }

    /**
     * Cabecera del índice de no estacionariedad: escenario más la unión ordenada de columnas puntuadas.
     */
    public static List<String> nonStationarityHeader(List<ScenarioAnalysis> analyses) {
        Set<String> columns = new LinkedHashSet<>();
        columns.add("scenario");
        analyses.forEach(a -> columns.addAll(a.nonStationarity().scores().keySet()));
        return new ArrayList<>(columns);
    }

    public static List<String[]> nonStationarityRows(List<ScenarioAnalysis> analyses, List<String> header) {
        List<String[]> rows = new ArrayList<>();
        for (ScenarioAnalysis analysis : analyses) {
            NonStationarityRow ns = analysis.nonStationarity();
            String[] cells = new String[header.size()];
            cells[0] = ns.scenario();
            for (int c = 1; c < header.size(); c++) {
                cells[c] = format(ns.score(header.get(c)));
            }
            rows.add(cells);
        }
        return rows;
    }

    public static List<String[]> recoveryRows(List<ScenarioAnalysis> analyses) {
        List<String[]> rows = new ArrayList<>();
        for (ScenarioAnalysis analysis : analyses) {
            RecoveryAnalysis r = analysis.recovery();
            rows.add(new String[]{
                    r.scenario(),
                    Integer.toString(r.eventCount()),
                    format(r.meanMinutes()),
                    format(r.stdMinutes()),
                    format(r.minMinutes()),
                    format(r.maxMinutes())
            });
        }
        return rows;
    }

    static String format(OptionalDouble value) {
        return value.isPresent() ? Double.toString(value.getAsDouble()) : "";
    }
}
