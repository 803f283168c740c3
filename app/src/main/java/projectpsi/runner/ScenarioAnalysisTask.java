package projectpsi.runner;

import projectpsi.analysis.ScenarioAnalyzer;
import projectpsi.domain.analysis.ScenarioAnalysis;

import java.util.concurrent.Callable;

/**
 * Unidad de trabajo del pool: analiza un escenario de forma independiente.
 */
public class ScenarioAnalysisTask implements Callable<ScenarioAnalysis> {

    private final ScenarioAnalyzer analyzer;
    private final ScenarioInput input;

    public ScenarioAnalysisTask(ScenarioAnalyzer analyzer, ScenarioInput input) {
        this.analyzer = analyzer;
        this.input = input;
    }

    @Override
    public ScenarioAnalysis call() {
        return analyzer.analyse(input.scenario(), input.table());
    }

    public ScenarioInput getInput() {
        return input;
    }
}
