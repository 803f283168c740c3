package projectpsi.domain.compliance;

/**
 * Componentes del Índice de Sostenibilidad del Rendimiento (PSI) de un contaminante.
 *
 * @param psi1Min Término intermedio min(lt, pc).
 * @param psi1    Rendimiento recortado del umbral inferior.
 * @param psi2    Puntuación LUT, la más conservadora.
 * @param psi3    Puntuación de límite máximo.
 */
public record PsiComponents(double psi1Min, double psi1, double psi2, double psi3) {
}
