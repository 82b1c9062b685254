package com.mof.tool.config;

import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

public class MatchConfig {

    private DatasetSettings dataset = new DatasetSettings();
    private OutputSettings output = new OutputSettings();
    private Map<String, Object> criteria = new LinkedHashMap<>();

    public static class DatasetSettings {
        private String path;
        private String sheet = "Sheet2";
        private char delimiter = ',';

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getSheet() {
            return sheet;
        }

        public void setSheet(String sheet) {
            this.sheet = sheet;
        }

        public char getDelimiter() {
            return delimiter;
        }

        public void setDelimiter(char delimiter) {
            this.delimiter = delimiter;
        }
    }

    public static class OutputSettings {
        private String format = "console"; // console, csv, json
        private String file;
        private int previewRows = 20;
        private boolean quiet = false;

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public int getPreviewRows() {
            return previewRows;
        }

        public void setPreviewRows(int previewRows) {
            this.previewRows = previewRows;
        }

        public boolean isQuiet() {
            return quiet;
        }

        public void setQuiet(boolean quiet) {
            this.quiet = quiet;
        }
    }

    public MatchConfig() {
    }

    public static MatchConfig fromYaml(String filePath) throws IOException {
        try (InputStream input = new FileInputStream(filePath)) {
            return fromYaml(input);
        }
    }

    public static MatchConfig fromYaml(InputStream input) {
        Yaml yaml = new Yaml();
        Map<String, Object> data = yaml.load(input);
        return fromMap(data == null ? Map.of() : data);
    }

    @SuppressWarnings("unchecked")
    private static MatchConfig fromMap(Map<String, Object> data) {
        MatchConfig config = new MatchConfig();

        // an empty section ("dataset:") loads as null
        Map<String, Object> ds = (Map<String, Object>) data.get("dataset");
        if (ds != null) {
            if (ds.containsKey("path")) {
                config.dataset.setPath((String) ds.get("path"));
            }
            if (ds.containsKey("sheet")) {
                config.dataset.setSheet((String) ds.get("sheet"));
            }
            if (ds.containsKey("delimiter")) {
                config.dataset.setDelimiter(toDelimiter(String.valueOf(ds.get("delimiter"))));
            }
        }

        if (data.containsKey("criteria")) {
            Map<Object, Object> crit = (Map<Object, Object>) data.get("criteria");
            if (crit != null) {
                for (Map.Entry<Object, Object> entry : crit.entrySet()) {
                    config.criteria.put(String.valueOf(entry.getKey()), entry.getValue());
                }
            }
        }

        Map<String, Object> out = (Map<String, Object>) data.get("output");
        if (out != null) {
            if (out.containsKey("format")) {
                config.output.setFormat((String) out.get("format"));
            }
            if (out.containsKey("file")) {
                config.output.setFile((String) out.get("file"));
            }
            if (out.containsKey("previewRows")) {
                config.output.setPreviewRows(((Number) out.get("previewRows")).intValue());
            }
            if (out.containsKey("quiet")) {
                config.output.setQuiet((Boolean) out.get("quiet"));
            }
        }

        return config;
    }

    /**
     * Parses a delimiter option: a single character, or "\t" / "tab" for a tab.
     */
    public static char toDelimiter(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Delimiter must not be empty");
        }
        if (value.equals("\\t") || value.equalsIgnoreCase("tab")) {
            return '\t';
        }
        if (value.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character: " + value);
        }
        return value.charAt(0);
    }

    /**
     * Adds criteria over the configured ones; a later value for the same column wins.
     */
    public void mergeCriteria(Map<String, ?> overrides) {
        if (overrides != null) {
            criteria.putAll(overrides);
        }
    }

    // Getters and setters
    public DatasetSettings getDataset() {
        return dataset;
    }

    public void setDataset(DatasetSettings dataset) {
        this.dataset = dataset;
    }

    public OutputSettings getOutput() {
        return output;
    }

    public void setOutput(OutputSettings output) {
        this.output = output;
    }

    public Map<String, Object> getCriteria() {
        return criteria;
    }

    public void setCriteria(Map<String, Object> criteria) {
        this.criteria = criteria;
    }
}
