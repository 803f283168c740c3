package projectpsi;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import projectpsi.config.AnalysisConfig;
import projectpsi.config.ScenarioCatalog;
import projectpsi.io.ResultExporter;
import projectpsi.io.ScenarioCsvReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Slf4j
class AnalysisApplicationTest {

    private static final String HEADER = "bod1,cod1,snh1,bod31,cod31,snh31\n";

    @TempDir
    Path tempDir;

    private AnalysisApplication newApplication() {
        return new AnalysisApplication(
                AnalysisConfig.defaults(), ScenarioCatalog.defaults(), new ScenarioCsvReader(), new ResultExporter());
    }

    @Test
    @DisplayName("Extremo a extremo: carga los escenarios del disco, los analiza y exporta resultados")
    void run_shouldProcessAvailableScenarios() throws IOException {
        Path dataDir = tempDir.resolve("data");
        Path outputDir = tempDir.resolve("out");
        Files.createDirectories(dataDir.resolve("baseline"));
        Files.createDirectories(dataDir.resolve("1.3"));
        Files.writeString(dataDir.resolve("baseline/run1.csv"),
                HEADER + "200,600,30,10,60,2\n100,600,30,40,60,2\n200,600,30,10,60,2\n");
        Files.writeString(dataDir.resolve("1.3/run1.csv"),
                HEADER + "100,400,30,80,300,2\n200,600,30,10,60,2\n");

        int exitCode = newApplication().run(dataDir, outputDir, 2);

        assertEquals(AnalysisApplication.EXIT_OK, exitCode);
        assertThat(outputDir.resolve("csv/baseline_processed.csv")).exists();
        assertThat(outputDir.resolve("csv/130%_processed.csv")).exists();
        assertThat(Files.readAllLines(outputDir.resolve("csv/compliance_summary.csv"))).hasSize(3);
    }

    @Test
    @DisplayName("Escenario inválido: se informa en el JSON y los demás se exportan")
    void run_invalidScenario_shouldBeReportedAsFailure() throws IOException {
        Path dataDir = tempDir.resolve("data");
        Path outputDir = tempDir.resolve("out");
        Files.createDirectories(dataDir.resolve("baseline"));
        Files.createDirectories(dataDir.resolve("1.9"));
        Files.writeString(dataDir.resolve("baseline/run1.csv"), HEADER + "200,600,30,10,60,2\n");
        Files.writeString(dataDir.resolve("1.9/run1.csv"), "bod1,bod31\n100,40\n");

        int exitCode = newApplication().run(dataDir, outputDir, 1);

        assertEquals(AnalysisApplication.EXIT_OK, exitCode);
        String report = Files.readString(outputDir.resolve("analysis_report.json"));
        log.info("Informe generado:\n{}", report);
        assertThat(report).contains("\"190%\" : \"[190%] Faltan columnas obligatorias");
        assertThat(outputDir.resolve("csv/190%_processed.csv")).doesNotExist();
    }

    @Test
    @DisplayName("Carga fallida: un valor no numérico se informa como fallo del escenario en el JSON")
    void run_unreadableScenario_shouldBeReportedAsFailure() throws IOException {
        Path dataDir = tempDir.resolve("data");
        Path outputDir = tempDir.resolve("out");
        Files.createDirectories(dataDir.resolve("baseline"));
        Files.createDirectories(dataDir.resolve("1.5"));
        Files.writeString(dataDir.resolve("baseline/run1.csv"), HEADER + "200,600,30,10,60,2\n");
        Files.writeString(dataDir.resolve("1.5/run1.csv"), HEADER + "200,600,30,n/a,60,2\n");

        int exitCode = newApplication().run(dataDir, outputDir, 1);

        assertEquals(AnalysisApplication.EXIT_OK, exitCode);
        String report = Files.readString(outputDir.resolve("analysis_report.json"));
        assertThat(report).contains("\"150%\" : \"[150%] Fichero run1.csv: Valor no numérico 'n/a'");
        assertThat(outputDir.resolve("csv/baseline_processed.csv")).exists();
    }

    @Test
    @DisplayName("Sin datos: directorio sin escenarios devuelve código de error")
    void run_noData_shouldReturnError() {
        int exitCode = newApplication().run(tempDir.resolve("empty"), tempDir.resolve("out"), 1);

        assertEquals(AnalysisApplication.EXIT_NO_DATA, exitCode);
    }

    @Test
    @DisplayName("CLI: argumentos incorrectos devuelven el código de uso")
    void execute_badArguments_shouldReturnUsage() {
        assertEquals(AnalysisApplication.EXIT_USAGE, AnalysisApplication.execute(new String[]{"only-one"}));
        assertEquals(AnalysisApplication.EXIT_USAGE,
                AnalysisApplication.execute(new String[]{"data", "out", "many"}));
    }
}
