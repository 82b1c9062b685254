package com.mof.tool.dataset;

import com.mof.tool.model.Dataset;
import com.mof.tool.model.MofRecord;
import org.apache.poi.EmptyFileException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads one sheet of an Excel workbook (.xlsx, .xlsm or .xls).
 *
 * <p>The published MOF workbook keeps its data on "Sheet2", which is the default.
 * Numeric cells become numbers, string cells text, booleans the text "True"/"False".
 * Formula cells use their cached result; error cells are missing.
 */
public class WorkbookDatasetLoader implements DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkbookDatasetLoader.class);

    public static final String DEFAULT_SHEET = "Sheet2";

    private final String sheetName;
    private final DataFormatter headerFormatter = new DataFormatter();

    public WorkbookDatasetLoader() {
        this(DEFAULT_SHEET);
    }

    public WorkbookDatasetLoader(String sheetName) {
        this.sheetName = sheetName != null ? sheetName : DEFAULT_SHEET;
    }

    @Override
    public Dataset load(Path path) {
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            Sheet sheet = workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new DatasetException("Workbook " + path + " has no sheet named '" + sheetName + "'");
            }
            Dataset dataset = read(sheet);
            log.info("Loaded {} records with {} columns from {} [{}]",
                dataset.size(), dataset.getColumns().size(), path, sheetName);
            return dataset;
        } catch (IOException | UnsupportedFileFormatException | EmptyFileException e) {
            log.error("Failed to read workbook {}: {}", path, e.getMessage());
            throw new DatasetException("Failed to read workbook " + path + ": " + e.getMessage(), e);
        }
    }

    Dataset read(Sheet sheet) {
        Row header = sheet.getRow(sheet.getFirstRowNum());
        if (header == null) {
            throw new DatasetException("Sheet '" + sheet.getSheetName() + "' has no header row");
        }

        List<String> columns = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();
        for (int c = 0; c < header.getLastCellNum(); c++) {
            Cell cell = header.getCell(c);
            String name = cell == null ? "" : headerFormatter.formatCellValue(cell).trim();
            if (name.isEmpty()) {
                continue;
            }
            if (columns.contains(name)) {
                throw new DatasetException("Duplicate column in sheet header: " + name);
            }
            columns.add(name);
            positions.add(c);
        }

        List<MofRecord> records = new ArrayList<>();
        for (int r = header.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            Map<String, Object> values = new LinkedHashMap<>();
            boolean blank = true;
            for (int c = 0; c < columns.size(); c++) {
                Object value = toCellValue(row.getCell(positions.get(c)));
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

    private Object toCellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        return switch (type) {
            case NUMERIC -> cell.getNumericCellValue();
            case STRING -> {
                String text = cell.getStringCellValue();
                yield text == null || text.isBlank() ? null : text;
            }
            case BOOLEAN -> cell.getBooleanCellValue() ? "True" : "False";
            default -> null;
        };
    }
}
