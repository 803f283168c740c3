package projectpsi.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectpsi.analysis.ScenarioAnalyzer;
import projectpsi.config.AnalysisConfig;
import projectpsi.domain.analysis.ScenarioAnalysis;
import projectpsi.domain.scenario.ObservationRow;
import projectpsi.domain.scenario.Scenario;
import projectpsi.factory.ScenarioTableFactory;
import projectpsi.runner.BatchResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ResultExporterTest {

    @TempDir
    Path outputDir;

    private AnalysisConfig config;
    private BatchResult result;

    @BeforeEach
    void setUp() {
        config = AnalysisConfig.defaults();
        List<ObservationRow> rows = new ArrayList<>();
        // C, N, N, C: un episodio cerrado de dos pasos
        rows.add(row(200, 10));
        rows.add(row(100, 40));
        rows.add(row(100, 40));
        rows.add(row(200, 10));
        ScenarioAnalysis analysis = new ScenarioAnalyzer(config)
                .analyse(new Scenario("130%", "Shift 130%"), ScenarioTableFactory.fromObservations(rows));
        result = new BatchResult(List.of(analysis), Map.of("190%", "[190%] Faltan columnas"));
    }

    private static ObservationRow row(double bod1, double bod31) {
        return ObservationRow.builder().bod1(bod1).bod31(bod31).cod1(600).cod31(60).snh1(30).snh31(2).build();
    }

    @Test
    @DisplayName("Exportación: escribe los cuatro CSV y el informe JSON")
    void export_shouldWriteAllOutputs() throws IOException {
        new ResultExporter().export(config, result, outputDir);

        Path csv = outputDir.resolve("csv");
        assertThat(csv.resolve("130%_processed.csv")).exists();
        assertThat(csv.resolve("compliance_summary.csv")).exists();
        assertThat(csv.resolve("nonstationarity.csv")).exists();
        assertThat(csv.resolve("recovery_analysis.csv")).exists();
        assertThat(outputDir.resolve("analysis_report.json")).exists();
    }

    @Test
    @DisplayName("Resúmenes: recuento de cumplimiento y tiempos de recuperación en minutos")
    void export_summariesShouldContainScenarioRows() throws IOException {
        new ResultExporter().export(config, result, outputDir);

        List<String> compliance = Files.readAllLines(outputDir.resolve("csv/compliance_summary.csv"));
        assertThat(compliance.get(0)).startsWith("scenario,total_rows,compliant,lut_exceedance,max_limit_failure,no_data");
        assertThat(compliance.get(1)).startsWith("130%,4,2,2,0,0,2,0,0,2,");

        List<String> recovery = Files.readAllLines(outputDir.resolve("csv/recovery_analysis.csv"));
        String[] cells = recovery.get(1).split(",", -1);
        assertThat(cells[0]).isEqualTo("130%");
        assertThat(cells[1]).isEqualTo("1");
        // 2 pasos x 0.08 días x 1440 min
        assertThat(Double.parseDouble(cells[2])).isCloseTo(230.4, within(1e-6));

        List<String> nonStationarity = Files.readAllLines(outputDir.resolve("csv/nonstationarity.csv"));
        assertThat(nonStationarity.get(0)).isEqualTo("scenario,LIN_BODi,LIN_BODe,LIN_CODi,LIN_CODe");
        // Serie más corta que la ventana por defecto: índices indefinidos
        assertThat(nonStationarity.get(1)).isEqualTo("130%,,,,");
    }

    @Test
    @DisplayName("Informe JSON: parámetros, escenarios y fallos, sin la tabla enriquecida")
    void export_reportShouldDescribeRun() throws IOException {
        new ResultExporter().export(config, result, outputDir);

        JsonNode report = new ObjectMapper().readTree(outputDir.resolve("analysis_report.json").toFile());
        assertThat(report.get("limits").get("bodUpper").asDouble()).isEqualTo(50.0);
        assertThat(report.get("trailingRunPolicy").asText()).isEqualTo("DROP");
        assertThat(report.get("failures").get("190%").asText()).contains("Faltan columnas");

        JsonNode scenario = report.get("scenarios").get(0);
        assertThat(scenario.get("scenario").get("displayName").asText()).isEqualTo("Shift 130%");
        assertThat(scenario.has("enrichedTable")).isFalse();
        assertThat(scenario.get("recovery").get("eventCount").asInt()).isEqualTo(1);
        assertThat(scenario.get("nonStationarity").get("scores").get("LIN_BODi").isNull()).isTrue();
    }

    @Test
    @DisplayName("Colaboradores: una tabla procesada por escenario y un único informe")
    void export_shouldDelegateToWriters() throws IOException {
        CsvTableWriter csvWriter = mock(CsvTableWriter.class);
        JsonFileHandler jsonHandler = mock(JsonFileHandler.class);

        new ResultExporter(csvWriter, jsonHandler).export(config, result, outputDir);

        verify(csvWriter).writeTable(any(), eq(outputDir.resolve("csv/130%_processed.csv")));
        verify(csvWriter, times(3)).writeRows(any(), any(), any());
        verify(jsonHandler).writeToFile(any(AnalysisReport.class), eq(outputDir.resolve("analysis_report.json")));
    }
}
