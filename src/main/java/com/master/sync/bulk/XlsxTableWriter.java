package com.master.sync.bulk;

import com.master.sync.core.model.Table;
import com.master.sync.core.model.Values;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Spreadsheet writer for the full change set. Numbers are written as numeric cells,
 * everything else as text.
 */
public class XlsxTableWriter implements TableWriter {

    private final String sheetName;

    public XlsxTableWriter() {
        this("Sheet1");
    }

    public XlsxTableWriter(String sheetName) {
        this.sheetName = sheetName;
    }

    @Override
    public void write(Table table, Path path) {
        try (Workbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(path)) {
            Sheet sheet = workbook.createSheet(sheetName);
            Row header = sheet.createRow(0);
            for (int c = 0; c < table.columns().size(); c++) {
                header.createCell(c).setCellValue(table.columns().get(c));
            }
            int r = 1;
            for (Map<String, Object> values : table.rows()) {
                Row row = sheet.createRow(r++);
                for (int c = 0; c < table.columns().size(); c++) {
                    Object value = values.get(table.columns().get(c));
                    if (Values.isMissing(value)) {
                        continue;
                    }
                    if (value instanceof Number n) {
                        row.createCell(c).setCellValue(n.doubleValue());
                    } else {
                        row.createCell(c).setCellValue(value.toString());
                    }
                }
            }
            workbook.write(out);
        } catch (IOException e) {
            throw new TableIoException("Failed to write " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getExtension() {
        return "xlsx";
    }
}
