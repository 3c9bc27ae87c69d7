package com.master.sync.bulk;

import com.master.sync.core.model.Table;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spreadsheet reader. Cells are read with their displayed text; blank cells are missing and
 * fully blank rows are skipped.
 */
public class XlsxTableReader implements TableReader {
    private static final Logger log = LoggerFactory.getLogger(XlsxTableReader.class);

    private final DataFormatter formatter = new DataFormatter();

    /**
     * Reads the first sheet.
     */
    @Override
    public Table read(Path path) {
        return read(path, null);
    }

    /**
     * Reads the named sheet, or the first sheet when {@code sheetName} is null.
     *
     * @throws TableIoException if the file cannot be read or the sheet does not exist
     */
    public Table read(Path path, String sheetName) {
        try (InputStream in = Files.newInputStream(path);
             Workbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = sheetName != null ? workbook.getSheet(sheetName) : workbook.getSheetAt(0);
            if (sheet == null) {
                throw new TableIoException("Sheet '" + sheetName + "' not found in " + path);
            }
            Table table = read(sheet);
            log.debug("table.read format=xlsx path={} sheet={} rows={}", path, sheet.getSheetName(), table.size());
            return table;
        } catch (IOException e) {
            throw new TableIoException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private Table read(Sheet sheet) {
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            return Table.empty(List.of());
        }
        List<String> header = new ArrayList<>();
        for (int c = 0; c < headerRow.getLastCellNum(); c++) {
            header.add(text(headerRow.getCell(c)));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            Map<String, Object> values = new LinkedHashMap<>();
            boolean blank = true;
            for (int c = 0; c < header.size(); c++) {
                String value = text(row.getCell(c));
                String cell = value == null || value.isEmpty() ? null : value;
                blank &= cell == null;
                values.put(header.get(c), cell);
            }
            if (!blank) {
                rows.add(values);
            }
        }
        return new Table(header, rows);
    }

    private String text(Cell cell) {
        return cell == null ? null : formatter.formatCellValue(cell);
    }

    @Override
    public String getFormat() {
        return "xlsx";
    }
}
