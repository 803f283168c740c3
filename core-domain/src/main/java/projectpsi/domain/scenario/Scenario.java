package projectpsi.domain.scenario;

import java.util.Objects;

/**
 * Identidad de un escenario de simulación (ej: "baseline", "130%").
 *
 * @param key         Clave corta usada en tablas y nombres de archivo.
 * @param displayName Etiqueta legible para informes (ej: "Shift 130%").
 */
public record Scenario(String key, String displayName) {

    public Scenario {
        Objects.requireNonNull(key, "La clave del escenario no puede ser nula.");
        if (key.isBlank()) {
            throw new IllegalArgumentException("La clave del escenario no puede estar vacía.");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = key;
        }
    }

    public static Scenario of(String key) {
        return new Scenario(key, key);
    }
}
