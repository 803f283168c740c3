package projectpsi.config;

import lombok.Builder;
import lombok.With;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Un objeto de valor inmutable con los límites regulatorios de vertido que se aplican
 * a todas las filas y a todos los escenarios.
 * <p>
 * Se pasa explícitamente a cada punto de entrada del motor; nunca se muta tras su creación.
 *
 * @param bodUpper Límite máximo absoluto de DBO en el efluente [mg/L].
 * @param bodLower Límite de concentración de DBO del criterio LUT [mg/L].
 * @param codUpper Límite máximo absoluto de DQO en el efluente [mg/L].
 * @param codLower Límite de concentración de DQO del criterio LUT [mg/L].
 * @param bodPc    Reducción porcentual mínima exigida para DBO (fracción, ej: 0.7 = 70%).
 * @param codPc    Reducción porcentual mínima exigida para DQO (fracción).
 */
@Builder
@With
public record ComplianceLimits(
        double bodUpper,
        double bodLower,
        double codUpper,
        double codLower,
        double bodPc,
        double codPc
) {
    public static final double DEFAULT_BOD_UPPER = 50;
    public static final double DEFAULT_BOD_LOWER = 25;
    public static final double DEFAULT_COD_UPPER = 250;
    public static final double DEFAULT_COD_LOWER = 125;
    public static final double DEFAULT_BOD_PC = 0.7;
    public static final double DEFAULT_COD_PC = 0.75;

    /**
     * Constructor canónico: el límite inferior debe quedar estrictamente por debajo del superior
     * y los factores porcentuales dentro de [0, 1].
     */
    public ComplianceLimits {
        if (!(bodLower < bodUpper)) {
            throw new IllegalArgumentException(
                    "El límite inferior de DBO (" + bodLower + ") debe ser menor que el superior (" + bodUpper + ").");
        }
        if (!(codLower < codUpper)) {
            throw new IllegalArgumentException(
                    "El límite inferior de DQO (" + codLower + ") debe ser menor que el superior (" + codUpper + ").");
        }
        requireFraction(bodPc, "bodPc");
        requireFraction(codPc, "codPc");
    }

    private static void requireFraction(double value, String name) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " debe estar en [0, 1]: " + value);
        }
    }

    /**
     * Límites de la Directiva de aguas residuales urbanas usados en los informes de referencia.
     */
    public static ComplianceLimits defaults() {
        return ComplianceLimits.builder()
                .bodUpper(DEFAULT_BOD_UPPER)
                .bodLower(DEFAULT_BOD_LOWER)
                .codUpper(DEFAULT_COD_UPPER)
                .codLower(DEFAULT_COD_LOWER)
                .bodPc(DEFAULT_BOD_PC)
                .codPc(DEFAULT_COD_PC)
                .build();
    }

    /**
     * Vista plana con las claves históricas (bod_upper, cod_pc...), útil para exportar la configuración.
     */
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("bod_upper", bodUpper);
        map.put("bod_lower", bodLower);
        map.put("cod_upper", codUpper);
        map.put("cod_lower", codLower);
        map.put("bod_pc", bodPc);
        map.put("cod_pc", codPc);
        return map;
    }
}
