package com.master.sync.bulk;

import com.master.sync.core.model.Table;

import java.nio.file.Path;

/**
 * Reads a tabular file into a {@link Table}. Every cell is read as text; empty cells are
 * missing values. The first row is the header.
 */
public interface TableReader {

    /**
     * Reads the file.
     *
     * @throws TableIoException if the file cannot be read
     */
    Table read(Path path);

    /**
     * Returns the format handled by this reader (e.g., "csv", "xlsx").
     */
    String getFormat();
}
