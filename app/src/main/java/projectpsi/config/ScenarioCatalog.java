package projectpsi.config;

import projectpsi.domain.scenario.Scenario;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Catálogo de escenarios y de la carpeta de datos de cada uno.
 * <p>
 * Por defecto: la línea base y los desplazamientos de carga de 130%, 150% y 190%.
 */
public record ScenarioCatalog(List<Entry> entries) {

    /**
     * Un escenario y la carpeta (relativa al directorio de datos) que contiene sus CSV.
     */
    public record Entry(Scenario scenario, String folder) {
    }

    public ScenarioCatalog {
        entries = List.copyOf(entries);
    }

    public static ScenarioCatalog defaults() {
        return new ScenarioCatalog(List.of(
                new Entry(new Scenario("baseline", "Baseline"), "baseline"),
                new Entry(new Scenario("130%", "Shift 130%"), "1.3"),
                new Entry(new Scenario("150%", "Shift 150%"), "1.5"),
                new Entry(new Scenario("190%", "Shift 190%"), "1.9")
        ));
    }

    public Path folderOf(Entry entry, Path dataDir) {
        return dataDir.resolve(entry.folder());
    }

    /**
     * Entradas cuya carpeta existe bajo el directorio de datos.
     */
    public List<Entry> available(Path dataDir) {
        return entries.stream()
                .filter(entry -> Files.isDirectory(folderOf(entry, dataDir)))
                .collect(Collectors.toList());
    }
}
