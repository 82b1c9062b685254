package com.mof.tool.command;

import com.mof.tool.config.MatchConfig;
import com.mof.tool.dataset.DatasetException;
import com.mof.tool.dataset.DatasetLoaders;
import com.mof.tool.match.InvalidCriteriaException;
import com.mof.tool.match.MofMatcher;
import com.mof.tool.match.QueryNormalizer;
import com.mof.tool.match.UnknownColumnException;
import com.mof.tool.model.Dataset;
import com.mof.tool.model.ResultTable;
import com.mof.tool.report.ConsoleReporter;
import com.mof.tool.report.CsvResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "match",
    description = "Find MOF records matching the given criteria (numeric values within ±2%)",
    mixinStandardHelpOptions = true
)
public class MatchCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_INVALID_INPUT = 2;

    private static final Logger log = LoggerFactory.getLogger(MatchCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"-D", "--dataset"}, description = "Dataset file (.csv, .tsv, .xlsx, .xlsm, .xls)")
    private String datasetPath;

    @Option(names = {"-s", "--sheet"}, description = "Workbook sheet holding the data (default: Sheet2)")
    private String sheet;

    @Option(names = {"--delimiter"}, description = "Field delimiter for delimited text datasets (default: ,)")
    private String delimiter;

    @Option(names = {"-f", "--config-file"}, description = "Match configuration YAML file")
    private String configFile;

    @Option(names = {"-C", "--criterion"}, description = "Search criterion as column=value (repeatable)")
    private Map<String, String> criteria = new LinkedHashMap<>();

    @Option(names = {"--output-format"}, description = "Output format: console, csv, json")
    private String outputFormat;

    @Option(names = {"-o", "--export"}, arity = "0..1", fallbackValue = CsvResultWriter.DEFAULT_FILE_NAME,
        description = "Also write the results as CSV to this file (default name: ${FALLBACK-VALUE})")
    private String exportFile;

    @Option(names = {"-q", "--quiet"}, description = "Suppress headers and summaries", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            MatchConfig config = configFile != null ? MatchConfig.fromYaml(configFile) : new MatchConfig();

            // CLI options override config file
            if (datasetPath != null) {
                config.getDataset().setPath(datasetPath);
            }
            if (sheet != null) {
                config.getDataset().setSheet(sheet);
            }
            if (delimiter != null) {
                config.getDataset().setDelimiter(MatchConfig.toDelimiter(delimiter));
            }
            if (outputFormat != null) {
                config.getOutput().setFormat(outputFormat);
            }
            if (exportFile != null) {
                config.getOutput().setFile(exportFile);
            }
            if (quiet) {
                config.getOutput().setQuiet(true);
            }
            config.mergeCriteria(criteria);

            if (config.getDataset().getPath() == null) {
                err.println("Error: no dataset given (use --dataset or dataset.path in the config file)");
                return EXIT_INVALID_INPUT;
            }

            return executeMatch(config);
        } catch (IOException e) {
            err.println("Error: cannot read config file " + configFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }
    }

    private int executeMatch(MatchConfig config) {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        String format = config.getOutput().getFormat().toLowerCase();
        boolean quietOutput = config.getOutput().isQuiet() || !format.equals("console");
        ConsoleReporter reporter = new ConsoleReporter(quietOutput, out);

        Map<String, Object> rawCriteria = config.getCriteria();
        try {
            new QueryNormalizer().normalize(rawCriteria);
        } catch (InvalidCriteriaException e) {
            reporter.printInvalidCriteria(e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        try {
            Path path = Path.of(config.getDataset().getPath());
            Dataset dataset = DatasetLoaders
                .forPath(path, config.getDataset().getSheet(), config.getDataset().getDelimiter())
                .load(path);

            reporter.printMatchHeader(path.toString(), dataset, rawCriteria);

            ResultTable table = new MofMatcher().match(dataset, rawCriteria);
            log.debug("Match returned {} rows", table.size());

            switch (format) {
                case "csv" -> reporter.printResultsCsv(table);
                case "json" -> reporter.printResultsJson(table);
                default -> reporter.printResults(table);
            }

            if (config.getOutput().getFile() != null) {
                new CsvResultWriter().write(table, Path.of(config.getOutput().getFile()));
                reporter.printExported(config.getOutput().getFile(), table.size());
            }

            return EXIT_OK;
        } catch (UnknownColumnException e) {
            reporter.printColumnError(e);
            return EXIT_INVALID_INPUT;
        } catch (DatasetException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Unexpected error during matching", e);
            err.println("Unexpected error during matching: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
