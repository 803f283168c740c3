package projectpsi.domain.analysis;

import projectpsi.config.AnalysisConfig;

/**
 * Tramo máximo y contiguo de filas no conformes.
 *
 * @param startIndex   Fila en la que empieza el episodio.
 * @param length       Número de filas del episodio.
 * @param durationDays Duración = filas x paso de tiempo [días].
 * @param closed       false si la serie terminó con el episodio aún abierto.
 */
public record RecoveryEpisode(int startIndex, int length, double durationDays, boolean closed) {

    public double durationMinutes() {
        return durationDays * AnalysisConfig.HOURS_PER_DAY * AnalysisConfig.MINUTES_PER_HOUR;
    }
}
