package com.master.sync.bulk;

import com.master.sync.core.model.Table;
import com.master.sync.logging.LogContext;
import com.master.sync.reconcile.ChangeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a change set for upload: the full set as {@code {base}_original.xlsx}, and when it
 * holds more than {@code chunkSize} rows, consecutive slices as {@code {base}_01.csv},
 * {@code {base}_02.csv}, ... in their original order.
 */
public class ChunkedChangeSetWriter {
    private static final Logger log = LoggerFactory.getLogger(ChunkedChangeSetWriter.class);

    private final TableWriter originalWriter;
    private final TableWriter chunkWriter;

    public ChunkedChangeSetWriter() {
        this(new XlsxTableWriter(), new CsvTableWriter());
    }

    public ChunkedChangeSetWriter(TableWriter originalWriter, TableWriter chunkWriter) {
        this.originalWriter = originalWriter;
        this.chunkWriter = chunkWriter;
    }

    public ExportResult write(ChangeSet changes, int chunkSize, Path target, ProgressCallback callback) {
        return write(changes.toTable(), chunkSize, target, callback);
    }

    /**
     * @param target directory plus base name, e.g. {@code out/organization}
     * @throws IllegalArgumentException if {@code chunkSize <= 0}
     * @throws TableIoException         if the output directory cannot be created
     */
    public ExportResult write(Table table, int chunkSize, Path target, ProgressCallback callback) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        Path directory = target.toAbsolutePath().getParent();
        String base = target.getFileName().toString();

        try (LogContext ctx = LogContext.forExport(LogContext.generateRunId(), base)) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new TableIoException("Failed to create " + directory + ": " + e.getMessage(), e);
            }

            Path original = directory.resolve(base + "_original." + originalWriter.getExtension());
            originalWriter.write(table, original);
            log.info("export.original path={} rows={}", original, table.size());

            List<Path> chunkPaths = new ArrayList<>();
            if (table.size() > chunkSize) {
                List<Table> chunks = table.chunks(chunkSize);
                long written = 0;
                for (int i = 0; i < chunks.size(); i++) {
                    Path chunkPath = directory.resolve(
                            String.format("%s_%02d.%s", base, i + 1, chunkWriter.getExtension()));
                    chunkWriter.write(chunks.get(i), chunkPath);
                    chunkPaths.add(chunkPath);
                    written += chunks.get(i).size();
                    cb.onProgress(written, table.size(), "Wrote " + chunkPath.getFileName());
                }
            }

            ExportResult result = new ExportResult(original, chunkPaths, table.size());
            cb.onProgress(table.size(), table.size(), "Export completed");
            log.info("export.completed result={}", result);
            return result;
        }
    }
}
