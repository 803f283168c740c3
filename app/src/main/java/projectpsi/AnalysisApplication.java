package projectpsi;

import lombok.extern.slf4j.Slf4j;
import projectpsi.analysis.ScenarioAnalyzer;
import projectpsi.config.AnalysisConfig;
import projectpsi.config.ScenarioCatalog;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.io.ResultExporter;
import projectpsi.io.ScenarioCsvReader;
import projectpsi.runner.BatchResult;
import projectpsi.runner.ScenarioBatchProcessor;
import projectpsi.runner.ScenarioInput;
import projectpsi.validation.ScenarioValidationException;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Punto de entrada por línea de comandos.
 * <pre>
 *   AnalysisApplication &lt;dataDir&gt; &lt;outputDir&gt; [threads]
 * </pre>
 * Carga los escenarios del catálogo presentes en {@code dataDir}, los analiza en paralelo
 * y exporta CSV y JSON a {@code outputDir}.
 */
@Slf4j
public class AnalysisApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_NO_DATA = 2;
    static final int EXIT_IO_ERROR = 3;

    private final AnalysisConfig config;
    private final ScenarioCatalog catalog;
    private final ScenarioCsvReader reader;
    private final ResultExporter exporter;

    public AnalysisApplication(AnalysisConfig config, ScenarioCatalog catalog,
                               ScenarioCsvReader reader, ResultExporter exporter) {
        this.config = config;
        this.catalog = catalog;
        this.reader = reader;
        this.exporter = exporter;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String[] args) {
        if (args.length < 2 || args.length > 3) {
            log.error("Uso: AnalysisApplication <dataDir> <outputDir> [threads]");
            return EXIT_USAGE;
        }
        int threads = Runtime.getRuntime().availableProcessors();
        if (args.length == 3) {
            try {
                threads = Integer.parseInt(args[2]);
            } catch (NumberFormatException e) {
                log.error("Número de hilos no válido: {}", args[2]);
                return EXIT_USAGE;
            }
        }
        AnalysisApplication app = new AnalysisApplication(
                AnalysisConfig.defaults(), ScenarioCatalog.defaults(), new ScenarioCsvReader(), new ResultExporter());
        return app.run(Paths.get(args[0]), Paths.get(args[1]), threads);
    }

    /**
     * @return Código de salida: 0 si todo fue bien (aunque algún escenario fallase),
     * distinto de 0 si no hubo datos o falló la exportación.
     */
    public int run(Path dataDir, Path outputDir, int threads) {
        log.info("Iniciando análisis. Datos: {}, salida: {}", dataDir.toAbsolutePath(), outputDir.toAbsolutePath());

        Map<String, String> loadFailures = new LinkedHashMap<>();
        List<ScenarioInput> inputs = loadScenarios(dataDir, loadFailures);
        if (inputs.isEmpty() && loadFailures.isEmpty()) {
            log.error("No se encontraron escenarios con datos en {}", dataDir.toAbsolutePath());
            return EXIT_NO_DATA;
        }

        BatchResult result;
        try (ScenarioBatchProcessor processor = new ScenarioBatchProcessor(new ScenarioAnalyzer(config), threads)) {
            result = processor.process(inputs).withEarlierFailures(loadFailures);
        }

        try {
            exporter.export(config, result, outputDir);
        } catch (IOException e) {
            log.error("Error al exportar los resultados a {}", outputDir.toAbsolutePath(), e);
            return EXIT_IO_ERROR;
        }

        if (result.hasFailures()) {
            log.warn("Escenarios fallidos: {}", result.failures().keySet());
        }
        return EXIT_OK;
    }

    /**
     * Lee los escenarios disponibles. Los que no se pueden cargar se anotan en {@code failures}.
     */
    List<ScenarioInput> loadScenarios(Path dataDir, Map<String, String> failures) {
        List<ScenarioInput> inputs = new ArrayList<>();
        for (ScenarioCatalog.Entry entry : catalog.available(dataDir)) {
            try {
                Optional<ScenarioTable> table = reader.readScenario(entry.scenario(), catalog.folderOf(entry, dataDir));
                table.ifPresent(t -> inputs.add(new ScenarioInput(entry.scenario(), t)));
            } catch (IOException | ScenarioValidationException e) {
                log.error("No se pudo cargar el escenario {}: {}", entry.scenario().key(), e.getMessage());
                failures.put(entry.scenario().key(), String.valueOf(e.getMessage()));
            }
        }
        return inputs;
    }
}
