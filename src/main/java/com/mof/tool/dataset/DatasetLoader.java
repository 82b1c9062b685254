package com.mof.tool.dataset;

import com.mof.tool.model.Dataset;

import java.nio.file.Path;

/**
 * Reads a tabular dataset whose first row names the columns.
 */
public interface DatasetLoader {

    /**
     * @param path the file to read
     * @return the dataset, header names trimmed
     * @throws DatasetException if the file cannot be read or has no header
     */
    Dataset load(Path path);
}
