package projectpsi.domain.compliance;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Contaminante(s) que dispararon la rama de incumplimiento elegida.
 * Las filas conformes no tienen fuente (se representan con {@code null}).
 */
public enum FailSource {

    BOD("BOD"),
    COD("COD"),
    BOD_AND_COD("BOD+COD");

    private final String label;

    FailSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Combina las dos señales de forma determinista.
     *
     * @return la fuente, o {@code null} si ningún contaminante disparó la rama.
     */
    public static FailSource of(boolean bodTriggered, boolean codTriggered) {
        if (bodTriggered && codTriggered) return BOD_AND_COD;
        if (bodTriggered) return BOD;
        if (codTriggered) return COD;
        return null;
    }
}
