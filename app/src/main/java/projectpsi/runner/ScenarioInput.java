package projectpsi.runner;

import projectpsi.domain.scenario.Scenario;
import projectpsi.domain.table.ScenarioTable;

/**
 * Escenario cargado y listo para analizar.
 */
public record ScenarioInput(Scenario scenario, ScenarioTable table) {
}
