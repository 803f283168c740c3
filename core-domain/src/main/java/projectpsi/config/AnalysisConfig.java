package projectpsi.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import projectpsi.analysis.TrailingRunPolicy;
import projectpsi.domain.table.Columns;

import java.util.List;

/**
 * Contenedor principal para todas las configuraciones de un análisis.
 * Agrupa los límites regulatorios con los parámetros temporales y estadísticos.
 */
@Value
@Builder
@With
public class AnalysisConfig {

    /** Paso de tiempo por defecto de la simulación, en días. */
    public static final double DEFAULT_TIME_STEP_DAYS = 0.08;

    /** Ventana por defecto de la varianza móvil. */
    public static final int DEFAULT_ROLLING_WINDOW = 30;

    public static final int HOURS_PER_DAY = 24;
    public static final int MINUTES_PER_HOUR = 60;

    /**
     * Límites regulatorios compartidos por todos los escenarios.
     */
    ComplianceLimits limits;

    /**
     * Paso de tiempo uniforme entre filas [días].
     */
    double timeStepDays;

    /**
     * Ventana (en filas) de la varianza móvil del índice de no estacionariedad.
     */
    int rollingWindow;

    /**
     * Qué hacer con un episodio de incumplimiento que sigue abierto al final de la serie.
     */
    TrailingRunPolicy trailingRunPolicy;

    /**
     * Columnas sobre las que se calcula el índice de no estacionariedad.
     */
    List<String> nonStationarityColumns;

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder()
                .limits(ComplianceLimits.defaults())
                .timeStepDays(DEFAULT_TIME_STEP_DAYS)
                .rollingWindow(DEFAULT_ROLLING_WINDOW)
                .trailingRunPolicy(TrailingRunPolicy.DROP)
                .nonStationarityColumns(Columns.LINEARISED)
                .build();
    }

    public double getTimeStepMinutes() {
        return timeStepDays * HOURS_PER_DAY * MINUTES_PER_HOUR;
    }
}
