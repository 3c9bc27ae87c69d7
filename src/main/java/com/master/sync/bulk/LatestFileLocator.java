package com.master.sync.bulk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

/**
 * Resolves a glob such as {@code downloads/org_*.txt} to the most recently modified match.
 * Master-system exports carry a timestamp in their name, so the newest download wins.
 */
public class LatestFileLocator {
    private static final Logger log = LoggerFactory.getLogger(LatestFileLocator.class);

    /**
     * @param directory directory to search (not recursive)
     * @param glob      file-name glob, e.g. {@code "org_*.txt"}
     * @throws TableIoException if nothing matches or the directory cannot be listed
     */
    public Path latest(Path directory, String glob) {
        Path latest = null;
        FileTime latestTime = null;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path candidate : stream) {
                if (!Files.isRegularFile(candidate)) {
                    continue;
                }
                FileTime modified = Files.getLastModifiedTime(candidate);
                if (latestTime == null || modified.compareTo(latestTime) > 0) {
                    latest = candidate;
                    latestTime = modified;
                }
            }
        } catch (IOException e) {
            throw new TableIoException("Failed to list " + directory + ": " + e.getMessage(), e);
        }
        if (latest == null) {
            throw new TableIoException("No file matching '" + glob + "' in " + directory);
        }
        log.debug("file.latest glob={} path={}", glob, latest);
        return latest;
    }

    /**
     * Splits {@code pattern} into its parent directory and file-name glob.
     */
    public Path latest(Path pattern) {
        Path directory = pattern.getParent() != null ? pattern.getParent() : Path.of(".");
        return latest(directory, pattern.getFileName().toString());
    }
}
