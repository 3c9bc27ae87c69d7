package com.master.sync.bulk;

import com.master.sync.core.model.Table;

import java.nio.file.Path;

/**
 * Writes a {@link Table} with a header row. Missing values are written as empty cells.
 */
public interface TableWriter {

    /**
     * @throws TableIoException if the file cannot be written
     */
    void write(Table table, Path path);

    /**
     * File extension produced by this writer, without the dot.
     */
    String getExtension();
}
