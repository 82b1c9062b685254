package com.mof.tool.dataset;

import com.mof.tool.model.CellValues;
import com.mof.tool.model.Dataset;
import com.mof.tool.model.MofRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a delimited text export of the MOF workbook.
 *
 * <p>Empty cells are missing, cells that parse as numbers become numeric and everything
 * else is kept as text. Columns with a blank header are ignored.
 */
public class CsvDatasetLoader implements DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvDatasetLoader.class);
    private static final char BOM = '\uFEFF';

    private final char delimiter;

    public CsvDatasetLoader() {
        this(',');
    }

    public CsvDatasetLoader(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public Dataset load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Dataset dataset = read(reader);
            log.info("Loaded {} records with {} columns from {}", dataset.size(), dataset.getColumns().size(), path);
            return dataset;
        } catch (IOException e) {
            log.error("Failed to read dataset {}: {}", path, e.getMessage());
            throw new DatasetException("Failed to read dataset " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads a dataset from an open reader. The reader is not closed.
     */
    public Dataset read(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setQuote('"')
            .setIgnoreSurroundingSpaces(false)
            .setTrim(false)
            .build();

        CSVParser parser = format.parse(reader);
        Iterator<CSVRecord> iterator = parser.iterator();
        if (!iterator.hasNext()) {
            throw new DatasetException("Dataset has no header row");
        }

        CSVRecord header = iterator.next();
        List<String> columns = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1);
            }
            name = name.trim();
            if (name.isEmpty()) {
                log.debug("Ignoring column {} with blank header", i);
                continue;
            }
            if (columns.contains(name)) {
                throw new DatasetException("Duplicate column in dataset header: " + name);
            }
            columns.add(name);
            positions.add(i);
        }

        List<MofRecord> records = new ArrayList<>();
        while (iterator.hasNext()) {
            CSVRecord row = iterator.next();
            Map<String, Object> values = new LinkedHashMap<>();
            boolean blank = true;
            for (int c = 0; c < columns.size(); c++) {
                int position = positions.get(c);
                Object value = position < row.size() ? toCellValue(row.get(position)) : null;
                if (value != null) {
                    blank = false;
                }
                values.put(columns.get(c), value);
            }
            if (!blank) {
                records.add(new MofRecord(values));
            }
        }

        return new Dataset(columns, records);
    }

    private Object toCellValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Double number = CellValues.parseNumber(raw);
        return number != null ? number : raw;
    }
}
