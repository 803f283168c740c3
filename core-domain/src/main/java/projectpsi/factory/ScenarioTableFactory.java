package projectpsi.factory;

import lombok.extern.slf4j.Slf4j;
import projectpsi.domain.scenario.ObservationRow;
import projectpsi.domain.table.Columns;
import projectpsi.domain.table.ScenarioTable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fábrica de {@link ScenarioTable} a partir de las representaciones de entrada:
 * filas tipadas (tests, generación sintética) o registros de texto (lectores CSV).
 */
@Slf4j
public class ScenarioTableFactory {

    private ScenarioTableFactory() {}

    /**
     * Construye la tabla con las seis columnas obligatorias, en el orden de las filas.
     */
    public static ScenarioTable fromObservations(List<ObservationRow> rows) {
        int n = rows.size();
        double[] bod1 = new double[n];
        double[] cod1 = new double[n];
        double[] snh1 = new double[n];
        double[] bod31 = new double[n];
        double[] cod31 = new double[n];
        double[] snh31 = new double[n];

        for (int i = 0; i < n; i++) {
            ObservationRow row = rows.get(i);
            bod1[i] = row.bod1();
            cod1[i] = row.cod1();
            snh1[i] = row.snh1();
            bod31[i] = row.bod31();
            cod31[i] = row.cod31();
            snh31[i] = row.snh31();
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put(Columns.BOD_INFLUENT, bod1);
        columns.put(Columns.COD_INFLUENT, cod1);
        columns.put(Columns.SNH_INFLUENT, snh1);
        columns.put(Columns.BOD_EFFLUENT, bod31);
        columns.put(Columns.COD_EFFLUENT, cod31);
        columns.put(Columns.SNH_EFFLUENT, snh31);
        return ScenarioTable.of(columns);
    }

    /**
     * Construye una tabla a partir de registros cabecera → valor, con las columnas
     * obligatorias como columnas numéricas.
     *
     * @see #fromRecords(List, Collection)
     */
    public static ScenarioTable fromRecords(List<Map<String, String>> records) {
        return fromRecords(records, Columns.REQUIRED);
    }

    /**
     * Construye una tabla a partir de registros cabecera → valor.
     * <p>
     * Las columnas se toman del primer registro (orden de cabecera). Una celda vacía o
     * ausente se interpreta como NaN. Las columnas de {@code numericColumns} deben ser
     * numéricas; el resto (marcas de tiempo, etiquetas de ejecución...) se guarda como
     * numérica si todas sus celdas lo son y como texto en caso contrario.
     *
     * @throws IllegalArgumentException si una celda de {@code numericColumns} no es numérica
     *                                  (indica columna y fila).
     */
    public static ScenarioTable fromRecords(List<Map<String, String>> records, Collection<String> numericColumns) {
        if (records.isEmpty()) {
            return ScenarioTable.empty(0);
        }
        List<String> headers = new ArrayList<>(records.get(0).keySet());
        ScenarioTable table = ScenarioTable.empty(records.size());

        for (String header : headers) {
            String[] cells = new String[records.size()];
            for (int row = 0; row < cells.length; row++) {
                cells[row] = records.get(row).get(header);
            }

            if (numericColumns.contains(header)) {
                double[] values = new double[cells.length];
                for (int row = 0; row < cells.length; row++) {
                    values[row] = parseCell(cells[row], header, row);
                }
                table = table.withNumeric(header, values);
            } else {
                double[] values = tryParseColumn(cells);
                if (values != null) {
                    table = table.withNumeric(header, values);
                } else {
                    log.debug("Columna adicional {} conservada como texto.", header);
                    table = table.withText(header, cells);
                }
            }
        }
        return table;
    }

    /**
     * Concatena varias tablas con las mismas columnas en el orden dado.
     */
    public static ScenarioTable concat(List<ScenarioTable> tables) {
        if (tables.isEmpty()) {
            return ScenarioTable.empty(0);
        }
        ScenarioTable result = tables.get(0);
        for (int i = 1; i < tables.size(); i++) {
            result = result.appendRows(tables.get(i));
        }
        return result;
    }

    private static double[] tryParseColumn(String[] cells) {
        double[] values = new double[cells.length];
        for (int row = 0; row < cells.length; row++) {
            String raw = cells[row];
            if (raw == null || raw.isBlank()) {
                values[row] = Double.NaN;
                continue;
            }
            try {
                values[row] = Double.parseDouble(raw.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return values;
    }

    private static double parseCell(String raw, String column, int row) {
        if (raw == null || raw.isBlank()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Valor no numérico '" + raw + "' en la columna " + column + ", fila " + row + ".", e);
        }
    }
}
