package com.master.sync.bulk;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Picks a {@link TableReader} from a file extension.
 */
public final class TableReaders {

    private TableReaders() {
    }

    public static TableReader forPath(Path path) {
        return forPath(path, CsvTableReader.DEFAULT_CHARSET);
    }

    /**
     * @param charset charset for delimited text files; ignored for spreadsheets
     * @throws IllegalArgumentException for an unsupported extension
     */
    public static TableReader forPath(Path path, Charset charset) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".xlsx")) {
            return new XlsxTableReader();
        }
        if (name.endsWith(".txt")) {
            return new CsvTableReader('\t', charset);
        }
        if (name.endsWith(".csv")) {
            return CsvTableReader.commaSeparated(charset);
        }
        throw new IllegalArgumentException("Unsupported file type: " + path.getFileName());
    }
}
