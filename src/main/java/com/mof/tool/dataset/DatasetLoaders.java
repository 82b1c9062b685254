package com.mof.tool.dataset;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks a {@link DatasetLoader} from the file extension.
 */
public final class DatasetLoaders {

    private DatasetLoaders() {
    }

    /**
     * Returns the loader for a dataset file.
     *
     * @param path      the dataset file
     * @param sheetName sheet to read from a workbook, null for the default
     * @param delimiter field delimiter for delimited text files
     * @return a CSV loader for .csv/.tsv/.txt, a workbook loader for .xlsx/.xlsm/.xls
     * @throws DatasetException if the extension is not supported
     */
    public static DatasetLoader forPath(Path path, String sheetName, char delimiter) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);

        if (name.endsWith(".xlsx") || name.endsWith(".xlsm") || name.endsWith(".xls")) {
            return new WorkbookDatasetLoader(sheetName);
        }
        if (name.endsWith(".tsv")) {
            return new CsvDatasetLoader('\t');
        }
        if (name.endsWith(".csv") || name.endsWith(".txt")) {
            return new CsvDatasetLoader(delimiter);
        }
        throw new DatasetException("Unsupported dataset format: " + path.getFileName()
            + " (expected .csv, .tsv, .txt, .xlsx, .xlsm or .xls)");
    }
}
