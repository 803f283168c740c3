package projectpsi.domain.compliance;

/**
 * Estado de un contaminante en una fila: las tres entradas de las que se derivan sus PSI.
 *
 * @param lt Holgura respecto al umbral inferior (umbral - efluente). Positivo = cumple.
 * @param ut Holgura respecto al umbral superior (umbral - efluente). Positivo = cumple.
 * @param pc Margen de reducción porcentual (reducción lograda - reducción exigida).
 */
public record PollutantState(double lt, double ut, double pc) {
}
