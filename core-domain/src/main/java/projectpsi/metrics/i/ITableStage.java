package projectpsi.metrics.i;

import projectpsi.config.ComplianceLimits;
import projectpsi.domain.table.ScenarioTable;

/**
 * Etapa del pipeline de cumplimiento: recibe una tabla y devuelve una tabla NUEVA
 * con sus columnas añadidas. La tabla de entrada no se modifica.
 */
public interface ITableStage extends IPipelineComponent {

    ScenarioTable apply(ScenarioTable table, ComplianceLimits limits);
}
