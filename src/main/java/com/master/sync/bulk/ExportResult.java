package com.master.sync.bulk;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a change-set export.
 *
 * @param original  the file holding the full change set
 * @param chunks    chunk files in order, empty when the set fits in one chunk
 * @param totalRows number of rows exported
 */
public record ExportResult(Path original, List<Path> chunks, long totalRows) {

    public ExportResult {
        chunks = chunks != null ? List.copyOf(chunks) : List.of();
    }

    public int chunkCount() {
        return chunks.size();
    }

    @Override
    public String toString() {
        return "ExportResult{original=" + original +
                ", chunks=" + chunks.size() +
                ", rows=" + totalRows + '}';
    }
}
