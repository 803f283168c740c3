package projectpsi.runner;

import lombok.extern.slf4j.Slf4j;
import projectpsi.analysis.ScenarioAnalyzer;
import projectpsi.domain.analysis.ScenarioAnalysis;
import projectpsi.validation.ScenarioValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Analiza varios escenarios en paralelo sobre un pool fijo, una tarea por escenario.
 * <p>
 * Los escenarios son independientes: el fallo de uno (contrato de entrada violado o error
 * inesperado) se registra y el lote continúa con los demás.
 */
@Slf4j
public class ScenarioBatchProcessor implements AutoCloseable {

    private final ScenarioAnalyzer analyzer;
    private final ExecutorService threadPool;

    public ScenarioBatchProcessor(ScenarioAnalyzer analyzer, int threads) {
        this.analyzer = analyzer;
        this.threadPool = Executors.newFixedThreadPool(Math.max(threads, 1));
        log.info("ScenarioBatchProcessor inicializado con {} hilos.", Math.max(threads, 1));
    }

    public BatchResult process(List<ScenarioInput> inputs) {
        long startTime = System.currentTimeMillis();

        List<ScenarioAnalysisTask> tasks = new ArrayList<>(inputs.size());
        for (ScenarioInput input : inputs) {
            tasks.add(new ScenarioAnalysisTask(analyzer, input));
        }

        List<Future<ScenarioAnalysis>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Análisis por lotes interrumpido.", e);
        }

        List<ScenarioAnalysis> analyses = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (int i = 0; i < futures.size(); i++) {
            String key = tasks.get(i).getInput().scenario().key();
            try {
                analyses.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ScenarioValidationException) {
                    log.error("Escenario {} descartado por datos inválidos: {}", key, cause.getMessage());
                } else {
                    log.error("Error inesperado al analizar el escenario {}", key, cause);
                }
                failures.put(key, String.valueOf(cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Análisis por lotes interrumpido.", e);
            }
        }

        log.info("Lote completado en {} ms: {} escenarios correctos, {} fallidos.",
                System.currentTimeMillis() - startTime, analyses.size(), failures.size());
        return new BatchResult(analyses, failures);
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("ScenarioBatchProcessor cerrado.");
    }
}
