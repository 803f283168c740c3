package projectpsi.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import projectpsi.domain.table.ScenarioTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exporta tablas a CSV con fila de cabecera. Los NaN y los nulos se escriben como celda vacía.
 */
@Slf4j
public class CsvTableWriter {

    // Comillas sólo donde hacen falta (separador, comillas o saltos de línea).
    private static final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    /**
     * Escribe una tabla de escenario completa (numéricas, flags y texto, en ese orden).
     */
    public void writeTable(ScenarioTable table, Path file) throws IOException {
        List<String> header = table.columnNames();
        String[][] rows = new String[table.rowCount()][];
        for (int row = 0; row < table.rowCount(); row++) {
            String[] cells = new String[header.size()];
            for (int c = 0; c < header.size(); c++) {
                cells[c] = table.formatCell(header.get(c), row);
            }
            rows[row] = cells;
        }
        writeRows(file, header, List.of(rows));
    }

    /**
     * Escribe filas ya formateadas bajo la cabecera dada. Si el fichero existe, se sobrescribe.
     */
    public void writeRows(Path file, List<String> header, List<String[]> rows) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder();
        header.forEach(builder::addColumn);
        CsvSchema schema = builder.build().withHeader();

        log.info("Escribiendo {} filas a {}", rows.size(), file.toAbsolutePath());
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            try (SequenceWriter writer = csvMapper.writer(schema).writeValues(file.toFile())) {
                for (String[] row : rows) {
                    writer.write(row);
                }
            }
        } catch (IOException e) {
            log.error("Error al escribir el CSV en {}", file.toAbsolutePath(), e);
            throw e;
        }
    }
}
