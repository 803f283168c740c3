package projectpsi.analysis;

/**
 * Tratamiento de un episodio de incumplimiento que sigue abierto al terminar la serie.
 */
public enum TrailingRunPolicy {
    /**
     * Sólo cuentan los episodios cerrados (el proceso volvió a cumplir dentro de la ventana).
     * Infravalora la recuperación de los episodios que nunca se recuperan.
     */
    DROP,
    /**
     * El episodio abierto se emite con la duración observada hasta el final de la serie.
     */
    COUNT_AS_ONGOING
}
