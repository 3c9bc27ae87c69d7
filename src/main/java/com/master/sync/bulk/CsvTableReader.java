package com.master.sync.bulk;

import com.master.sync.core.model.Table;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delimited-text reader. Tab-separated {@code .txt} exports from the master system use
 * Windows-31J by default; comma-separated files use the configured charset as well.
 */
public class CsvTableReader implements TableReader {
    private static final Logger log = LoggerFactory.getLogger(CsvTableReader.class);

    public static final Charset DEFAULT_CHARSET = Charset.forName("windows-31j");

    private final char delimiter;
    private final Charset charset;

    public CsvTableReader(char delimiter, Charset charset) {
        this.delimiter = delimiter;
        this.charset = charset;
    }

    public static CsvTableReader tabSeparated() {
        return new CsvTableReader('\t', DEFAULT_CHARSET);
    }

    public static CsvTableReader commaSeparated(Charset charset) {
        return new CsvTableReader(',', charset);
    }

    @Override
    public Table read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, charset)) {
            return read(reader);
        } catch (IOException e) {
            throw new TableIoException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads delimited text from a reader. The caller closes the reader.
     */
    public Table read(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .build();

        CSVParser parser = format.parse(reader);
        List<String> header = parser.getHeaderNames();
        List<Map<String, Object>> rows = new ArrayList<>();
        for (CSVRecord record : parser) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                String value = i < record.size() ? record.get(i) : null;
                row.put(header.get(i), value == null || value.isEmpty() ? null : value);
            }
            rows.add(row);
        }
        log.debug("table.read format=csv rows={} columns={}", rows.size(), header.size());
        return new Table(header, rows);
    }

    @Override
    public String getFormat() {
        return delimiter == '\t' ? "tsv" : "csv";
    }
}
