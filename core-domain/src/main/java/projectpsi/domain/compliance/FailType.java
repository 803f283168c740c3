package projectpsi.domain.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Clasificación categórica de cada paso de tiempo.
 * <p>
 * {@link #NO_DATA} marca las filas a las que les falta alguna medida de DBO o DQO: no se
 * pueden evaluar y no cuentan como conformes ni como incumplimientos.
 */
public enum FailType {

    COMPLIANT("Compliant"),
    LUT_EXCEEDANCE("LUT Exceedance"),
    MAX_LIMIT_FAILURE("Max Limit Failure"),
    NO_DATA("No Data");

    private final String label;

    FailType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isCompliant() {
        return this == COMPLIANT;
    }

    public boolean isClassified() {
        return this != NO_DATA;
    }

    /**
     * Resuelve la etiqueta exportada. Acepta también la grafía histórica "LUT exceedance".
     */
    public static FailType fromLabel(String label) {
        return Arrays.stream(values())
                .filter(type -> type.label.equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Tipo de fallo desconocido: " + label));
    }
}
