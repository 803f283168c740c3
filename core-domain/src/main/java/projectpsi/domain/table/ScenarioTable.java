package projectpsi.domain.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Tabla inmutable y ordenada de un escenario: una fila por paso de tiempo.
 * <p>
 * Guarda tres familias de columnas (numéricas, booleanas y de texto) conservando el orden
 * de inserción. Cada etapa del motor devuelve una tabla NUEVA con sus columnas añadidas;
 * la tabla de entrada nunca se modifica, por lo que las etapas pueden componerse,
 * reordenarse en tests o ejecutarse en paralelo por escenario sin aliasing.
 * <p>
 * Las columnas se copian al entrar y al salir (copias defensivas).
 */
public final class ScenarioTable {

    private final int rowCount;
    private final Map<String, double[]> numericColumns;
    private final Map<String, boolean[]> flagColumns;
    private final Map<String, String[]> textColumns;

    private ScenarioTable(int rowCount,
                          Map<String, double[]> numericColumns,
                          Map<String, boolean[]> flagColumns,
                          Map<String, String[]> textColumns) {
        this.rowCount = rowCount;
        this.numericColumns = numericColumns;
        this.flagColumns = flagColumns;
        this.textColumns = textColumns;
    }

    public static ScenarioTable empty(int rowCount) {
        if (rowCount < 0) {
            throw new IllegalArgumentException("El número de filas no puede ser negativo: " + rowCount);
        }
        return new ScenarioTable(rowCount, new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    /**
     * Construye una tabla a partir de columnas numéricas (en el orden del mapa).
     * Todas las columnas deben tener la misma longitud.
     */
    public static ScenarioTable of(Map<String, double[]> columns) {
        Objects.requireNonNull(columns, "El mapa de columnas no puede ser nulo.");
        int rows = columns.values().stream().findFirst().map(c -> c.length).orElse(0);
        ScenarioTable table = empty(rows);
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            table = table.withNumeric(entry.getKey(), entry.getValue());
        }
        return table;
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public boolean hasColumn(String name) {
        return numericColumns.containsKey(name) || flagColumns.containsKey(name) || textColumns.containsKey(name);
    }

    /**
     * Nombres de todas las columnas: primero numéricas, luego booleanas y por último de texto.
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(numericColumns.keySet());
        names.addAll(flagColumns.keySet());
        names.addAll(textColumns.keySet());
        return Collections.unmodifiableList(names);
    }

    public List<String> numericColumnNames() {
        return List.copyOf(numericColumns.keySet());
    }

    public List<String> flagColumnNames() {
        return List.copyOf(flagColumns.keySet());
    }

    public List<String> textColumnNames() {
        return List.copyOf(textColumns.keySet());
    }

    // --- Lectura ---

    public double[] numeric(String name) {
        return requireColumn(numericColumns, name).clone();
    }

    public double numericAt(String name, int row) {
        return requireColumn(numericColumns, name)[checkRow(row)];
    }

    public boolean[] flag(String name) {
        return requireColumn(flagColumns, name).clone();
    }

    public boolean flagAt(String name, int row) {
        return requireColumn(flagColumns, name)[checkRow(row)];
    }

    public String[] text(String name) {
        return requireColumn(textColumns, name).clone();
    }

    /**
     * Valor de texto de una celda; puede ser {@code null} (ej: fail_source en filas conformes).
     */
    public String textAt(String name, int row) {
        return requireColumn(textColumns, name)[checkRow(row)];
    }

    /**
     * Representación textual de cualquier celda, usada por los exportadores.
     * Los NaN y los nulos se devuelven como cadena vacía.
     */
    public String formatCell(String name, int row) {
        checkRow(row);
        if (numericColumns.containsKey(name)) {
            double value = numericColumns.get(name)[row];
            return Double.isNaN(value) ? "" : Double.toString(value);
        }
        if (flagColumns.containsKey(name)) {
            return Boolean.toString(flagColumns.get(name)[row]);
        }
        String value = requireColumn(textColumns, name)[row];
        return value == null ? "" : value;
    }

    // --- Escritura (copy-on-write) ---

    public ScenarioTable withNumeric(String name, double[] values) {
        Map<String, double[]> copy = new LinkedHashMap<>(numericColumns);
        copy.put(name, checkLength(name, values).clone());
        return new ScenarioTable(rowCount, copy, flagColumns, textColumns);
    }

    public ScenarioTable withFlag(String name, boolean[] values) {
        Objects.requireNonNull(values, "La columna " + name + " no puede ser nula.");
        if (values.length != rowCount) {
            throw lengthMismatch(name, values.length);
        }
        Map<String, boolean[]> copy = new LinkedHashMap<>(flagColumns);
        copy.put(name, values.clone());
        return new ScenarioTable(rowCount, numericColumns, copy, textColumns);
    }

    public ScenarioTable withText(String name, String[] values) {
        Objects.requireNonNull(values, "La columna " + name + " no puede ser nula.");
        if (values.length != rowCount) {
            throw lengthMismatch(name, values.length);
        }
        Map<String, String[]> copy = new LinkedHashMap<>(textColumns);
        copy.put(name, values.clone());
        return new ScenarioTable(rowCount, numericColumns, flagColumns, copy);
    }

    /**
     * Concatena las filas de otra tabla con las mismas columnas numéricas (ej: varias
     * ejecuciones de un mismo escenario). Se conservan las columnas numéricas y las de
     * texto presentes en ambas tablas.
     */
    public ScenarioTable appendRows(ScenarioTable other) {
        if (!numericColumns.keySet().equals(other.numericColumns.keySet())) {
            throw new IllegalArgumentException("No se pueden concatenar tablas con columnas distintas: "
                    + numericColumns.keySet() + " vs " + other.numericColumns.keySet());
        }
        Map<String, double[]> merged = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : numericColumns.entrySet()) {
            double[] left = entry.getValue();
            double[] right = other.numericColumns.get(entry.getKey());
            double[] joined = Arrays.copyOf(left, left.length + right.length);
            System.arraycopy(right, 0, joined, left.length, right.length);
            merged.put(entry.getKey(), joined);
        }
        Map<String, String[]> mergedText = new LinkedHashMap<>();
        for (Map.Entry<String, String[]> entry : textColumns.entrySet()) {
            String[] right = other.textColumns.get(entry.getKey());
            if (right == null) {
                continue;
            }
            String[] left = entry.getValue();
            String[] joined = Arrays.copyOf(left, left.length + right.length);
            System.arraycopy(right, 0, joined, left.length, right.length);
            mergedText.put(entry.getKey(), joined);
        }
        return new ScenarioTable(rowCount + other.rowCount, merged, new LinkedHashMap<>(), mergedText);
    }

    // --- Helpers ---

    private double[] checkLength(String name, double[] values) {
        Objects.requireNonNull(values, "La columna " + name + " no puede ser nula.");
        if (values.length != rowCount) {
            throw lengthMismatch(name, values.length);
        }
        return values;
    }

    private IllegalArgumentException lengthMismatch(String name, int length) {
        return new IllegalArgumentException("La columna " + name + " tiene " + length
                + " filas, pero la tabla tiene " + rowCount + ".");
    }

    private int checkRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("La fila " + row + " está fuera de los límites [0, " + (rowCount - 1) + "].");
        }
        return row;
    }

    private static <T> T requireColumn(Map<String, T> columns, String name) {
        T column = columns.get(name);
        if (column == null) {
            throw new NoSuchElementException("La columna no existe en la tabla: " + name);
        }
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScenarioTable that = (ScenarioTable) o;
        if (rowCount != that.rowCount
                || !numericColumns.keySet().equals(that.numericColumns.keySet())
                || !flagColumns.keySet().equals(that.flagColumns.keySet())
                || !textColumns.keySet().equals(that.textColumns.keySet())) {
            return false;
        }
        for (String name : numericColumns.keySet()) {
            if (!Arrays.equals(numericColumns.get(name), that.numericColumns.get(name))) return false;
        }
        for (String name : flagColumns.keySet()) {
            if (!Arrays.equals(flagColumns.get(name), that.flagColumns.get(name))) return false;
        }
        for (String name : textColumns.keySet()) {
            if (!Arrays.equals(textColumns.get(name), that.textColumns.get(name))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(rowCount);
        for (Map.Entry<String, double[]> entry : numericColumns.entrySet()) {
            result = 31 * result + entry.getKey().hashCode();
            result = 31 * result + Arrays.hashCode(entry.getValue());
        }
        result = 31 * result + flagColumns.keySet().hashCode();
        result = 31 * result + textColumns.keySet().hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "ScenarioTable[rows=" + rowCount + ", columns=" + columnNames() + "]";
    }
}
