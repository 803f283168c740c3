package projectpsi.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import projectpsi.domain.scenario.Scenario;
import projectpsi.domain.table.ScenarioTable;
import projectpsi.factory.ScenarioTableFactory;
import projectpsi.validation.ScenarioValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Carga la tabla de un escenario desde su carpeta de CSV.
 * <p>
 * Cada fichero {@code *.csv} tiene una fila de cabecera. Los ficheros se leen en orden de
 * nombre y se concatenan; un fichero vacío o ilegible se omite con un aviso. Las columnas
 * que no son obligatorias (marcas de tiempo, etiquetas) se conservan tal cual.
 */
@Slf4j
public class ScenarioCsvReader {

    // Reutilizable y thread-safe una vez configurado.
    private static final CsvMapper csvMapper = new CsvMapper();
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    /**
     * Lee un único fichero CSV con cabecera.
     *
     * @throws IOException              si el fichero no existe o no se puede leer.
     * @throws IllegalArgumentException si una columna obligatoria contiene un valor no numérico.
     */
    public ScenarioTable readFile(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("El archivo especificado no existe: " + file.toAbsolutePath());
        }
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerForMapOf(String.class)
                .with(HEADER_SCHEMA)
                .readValues(file.toFile())) {
            List<Map<String, String>> records = it.readAll();
            log.debug("Leídas {} filas de {}", records.size(), file.getFileName());
            return ScenarioTableFactory.fromRecords(records);
        } catch (IOException e) {
            log.error("Error al leer o parsear el CSV {}", file.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee y concatena todos los CSV de la carpeta de un escenario.
     *
     * @return La tabla del escenario, o vacío si la carpeta no aporta ninguna fila.
     * @throws IOException si la carpeta no se puede listar.
     * @throws ScenarioValidationException si una columna obligatoria tiene un valor no numérico
     *                                     o si los ficheros no comparten columnas.
     */
    public Optional<ScenarioTable> readScenario(Scenario scenario, Path folder) throws IOException {
        if (!Files.isDirectory(folder)) {
            log.warn("[{}] Carpeta de datos inexistente: {}", scenario.key(), folder.toAbsolutePath());
            return Optional.empty();
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing
                    .filter(p -> p.getFileName().toString().toLowerCase().endsWith(".csv"))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<ScenarioTable> tables = new ArrayList<>();
        for (Path file : files) {
            ScenarioTable table;
            try {
                table = readFile(file);
            } catch (IOException e) {
                log.warn("[{}] Fichero {} omitido: {}", scenario.key(), file.getFileName(), e.getMessage());
                continue;
            } catch (IllegalArgumentException e) {
                throw new ScenarioValidationException(scenario.key(),
                        "Fichero " + file.getFileName() + ": " + e.getMessage(), e);
            }
            if (table.isEmpty()) {
                log.warn("[{}] Fichero {} vacío, omitido.", scenario.key(), file.getFileName());
                continue;
            }
            tables.add(table);
        }

        if (tables.isEmpty()) {
            log.warn("[{}] Ningún CSV con datos en {}", scenario.key(), folder.toAbsolutePath());
            return Optional.empty();
        }

        try {
            ScenarioTable combined = ScenarioTableFactory.concat(tables);
            log.info("[{}] {} ficheros cargados, {} filas.", scenario.key(), tables.size(), combined.rowCount());
            return Optional.of(combined);
        } catch (IllegalArgumentException e) {
            throw new ScenarioValidationException(scenario.key(), "Los CSV del escenario no comparten columnas.", e);
        }
    }
}
