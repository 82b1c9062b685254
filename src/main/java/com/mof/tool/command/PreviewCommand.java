package com.mof.tool.command;

import com.mof.tool.config.MatchConfig;
import com.mof.tool.dataset.DatasetException;
import com.mof.tool.dataset.DatasetLoaders;
import com.mof.tool.model.Dataset;
import com.mof.tool.model.MatchSchema;
import com.mof.tool.report.ConsoleReporter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "preview",
    description = "Show the dataset's columns and its first records",
    mixinStandardHelpOptions = true
)
public class PreviewCommand implements Callable<Integer> {

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

    @Option(names = {"-n", "--rows"}, description = "Number of records to show")
    private Integer rows;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            MatchConfig config = configFile != null ? MatchConfig.fromYaml(configFile) : new MatchConfig();

            if (datasetPath != null) {
                config.getDataset().setPath(datasetPath);
            }
            if (sheet != null) {
                config.getDataset().setSheet(sheet);
            }
            if (delimiter != null) {
                config.getDataset().setDelimiter(MatchConfig.toDelimiter(delimiter));
            }
            if (rows != null) {
                config.getOutput().setPreviewRows(rows);
            }

            if (config.getDataset().getPath() == null) {
                err.println("Error: no dataset given (use --dataset or dataset.path in the config file)");
                return MatchCommand.EXIT_INVALID_INPUT;
            }

            Path path = Path.of(config.getDataset().getPath());
            Dataset dataset = DatasetLoaders
                .forPath(path, config.getDataset().getSheet(), config.getDataset().getDelimiter())
                .load(path);

            ConsoleReporter reporter = new ConsoleReporter(false, spec.commandLine().getOut());
            reporter.printPreview(path.toString(), dataset,
                MatchSchema.mofAdsorption().missingInputColumns(dataset),
                config.getOutput().getPreviewRows());
            return MatchCommand.EXIT_OK;
        } catch (IOException e) {
            err.println("Error: cannot read config file " + configFile + ": " + e.getMessage());
            return MatchCommand.EXIT_FAILURE;
        } catch (DatasetException e) {
            err.println("Error: " + e.getMessage());
            return MatchCommand.EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return MatchCommand.EXIT_INVALID_INPUT;
        }
    }
}
