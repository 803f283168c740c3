package projectpsi.io;

import lombok.extern.slf4j.Slf4j;
import projectpsi.config.AnalysisConfig;
import projectpsi.domain.analysis.ScenarioAnalysis;
import projectpsi.runner.BatchResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Escribe los resultados de una ejecución por lotes:
 * <pre>
 *   output/csv/&lt;escenario&gt;_processed.csv
 *   output/csv/compliance_summary.csv
 *   output/csv/nonstationarity.csv
 *   output/csv/recovery_analysis.csv
 *   output/analysis_report.json
 * </pre>
 */
@Slf4j
public class ResultExporter {

    public static final String CSV_FOLDER = "csv";
    public static final String PROCESSED_SUFFIX = "_processed.csv";
    public static final String COMPLIANCE_FILE = "compliance_summary.csv";
    public static final String NONSTATIONARITY_FILE = "nonstationarity.csv";
    public static final String RECOVERY_FILE = "recovery_analysis.csv";
    public static final String REPORT_FILE = "analysis_report.json";

    private final CsvTableWriter csvWriter;
    private final JsonFileHandler jsonFileHandler;

    public ResultExporter() {
        this(new CsvTableWriter(), new JsonFileHandler());
    }

    public ResultExporter(CsvTableWriter csvWriter, JsonFileHandler jsonFileHandler) {
        this.csvWriter = csvWriter;
        this.jsonFileHandler = jsonFileHandler;
    }

    public void export(AnalysisConfig config, BatchResult result, Path outputDir) throws IOException {
        Path csvDir = outputDir.resolve(CSV_FOLDER);
        List<ScenarioAnalysis> analyses = result.analyses();

        for (ScenarioAnalysis analysis : analyses) {
            csvWriter.writeTable(analysis.enrichedTable(), csvDir.resolve(processedFileName(analysis.scenario().key())));
        }

        csvWriter.writeRows(csvDir.resolve(COMPLIANCE_FILE),
                SummaryTables.COMPLIANCE_HEADER, SummaryTables.complianceRows(analyses));

        List<String> nsHeader = SummaryTables.nonStationarityHeader(analyses);
        csvWriter.writeRows(csvDir.resolve(NONSTATIONARITY_FILE),
                nsHeader, SummaryTables.nonStationarityRows(analyses, nsHeader));

        csvWriter.writeRows(csvDir.resolve(RECOVERY_FILE),
                SummaryTables.RECOVERY_HEADER, SummaryTables.recoveryRows(analyses));

        jsonFileHandler.writeToFile(AnalysisReport.of(config, result), outputDir.resolve(REPORT_FILE));
        log.info("Resultados de {} escenarios exportados a {}", analyses.size(), outputDir.toAbsolutePath());
    }

    public static String processedFileName(String scenarioKey) {
        return scenarioKey + PROCESSED_SUFFIX;
    }
}
