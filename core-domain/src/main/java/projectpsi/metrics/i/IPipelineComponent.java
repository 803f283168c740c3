package projectpsi.metrics.i;

/**
 * Contrato base para cualquier componente numérico del motor.
 * Permite tratar a todas las etapas de forma polimórfica para tareas
 * de logging, identificación y depuración, sin importar su fórmula.
 */
public interface IPipelineComponent {
    /**
     * Nombre corto de la etapa (ej: "Thresholds", "PSI").
     */
    String getName();

    /**
     * Descripción técnica detallada (ej: "psi_2 = min(lt, pc, ut)").
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
