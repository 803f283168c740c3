package projectpsi.validation;

/**
 * Violación del contrato de entrada de un escenario (columnas ausentes, tabla vacía,
 * valores no numéricos...). Se lanza en la frontera, antes de entrar en el motor,
 * e identifica el escenario afectado.
 */
public class ScenarioValidationException extends RuntimeException {

    private final String scenarioKey;

    public ScenarioValidationException(String scenarioKey, String message) {
        super("[" + scenarioKey + "] " + message);
        this.scenarioKey = scenarioKey;
    }

    public ScenarioValidationException(String scenarioKey, String message, Throwable cause) {
        super("[" + scenarioKey + "] " + message, cause);
        this.scenarioKey = scenarioKey;
    }

    public String getScenarioKey() {
        return scenarioKey;
    }
}
