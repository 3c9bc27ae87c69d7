package com.master.sync.bulk;

import com.master.sync.core.model.Table;
import com.master.sync.core.model.Values;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Comma-separated writer used for upload chunks.
 */
public class CsvTableWriter implements TableWriter {

    private final Charset charset;

    public CsvTableWriter() {
        this(StandardCharsets.UTF_8);
    }

    public CsvTableWriter(Charset charset) {
        this.charset = charset;
    }

    @Override
    public void write(Table table, Path path) {
        try (Writer writer = Files.newBufferedWriter(path, charset)) {
            write(table, writer);
        } catch (IOException e) {
            throw new TableIoException("Failed to write " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the table to a writer. The caller closes the writer.
     */
    public void write(Table table, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(table.columns().toArray(new String[0]))
                .setRecordSeparator("\n")
                .build();
        CSVPrinter printer = new CSVPrinter(writer, format);
        for (Map<String, Object> row : table.rows()) {
            List<Object> values = new ArrayList<>(table.columns().size());
            for (String column : table.columns()) {
                Object value = row.get(column);
                values.add(Values.isMissing(value) ? "" : value);
            }
            printer.printRecord(values);
        }
        printer.flush();
    }

    @Override
    public String getExtension() {
        return "csv";
    }
}
