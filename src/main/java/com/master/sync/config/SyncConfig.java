package com.master.sync.config;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for one synchronization run.
 *
 * @param chunkSize          maximum rows per upload chunk
 * @param otherLabel         label written into rank-name gaps, or null to leave gaps empty
 * @param retirementSentinel department code marking a retired user
 * @param charset            charset of downloaded delimited-text files
 * @param outputDirectory    directory receiving the change-set files
 * @param sources            locally maintained input files
 * @param downloads          file-name globs of the exports downloaded from the master system
 */
public record SyncConfig(
        int chunkSize,
        String otherLabel,
        String retirementSentinel,
        Charset charset,
        Path outputDirectory,
        Sources sources,
        Downloads downloads
) {
    public static final int DEFAULT_CHUNK_SIZE = 100;
    public static final String DEFAULT_OTHER_LABEL = "その他";
    public static final String DEFAULT_RETIREMENT_SENTINEL = "SYS_RETIRE";
    public static final String DEFAULT_CHARSET = "windows-31j";

    public SyncConfig {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (retirementSentinel == null || retirementSentinel.isBlank()) {
            throw new IllegalArgumentException("retirementSentinel must not be blank");
        }
        Objects.requireNonNull(charset, "charset is required");
        Objects.requireNonNull(outputDirectory, "outputDirectory is required");
        Objects.requireNonNull(sources, "sources is required");
        Objects.requireNonNull(downloads, "downloads is required");
    }

    public boolean fillsRankGaps() {
        return otherLabel != null && !otherLabel.isBlank();
    }

    /**
     * Local files maintained by the administrator.
     *
     * @param organizations org records ({@code org_code, org_name, parent_org_code, rank, ...})
     * @param mapping       abbreviation overrides, optional
     * @param locations     location master
     * @param users         user info
     * @param columns       column configuration workbook, one sheet per entity
     */
    public record Sources(Path organizations, Path mapping, Path locations, Path users, Path columns) {
        public Sources {
            Objects.requireNonNull(organizations, "sources.organizations is required");
            Objects.requireNonNull(locations, "sources.locations is required");
            Objects.requireNonNull(users, "sources.users is required");
            Objects.requireNonNull(columns, "sources.columns is required");
        }
    }

    /**
     * Globs resolved to the newest matching download.
     */
    public record Downloads(Path organizations, Path users, Path locations, Path userGroups) {
        public Downloads {
            Objects.requireNonNull(organizations, "downloads.organizations is required");
            Objects.requireNonNull(users, "downloads.users is required");
            Objects.requireNonNull(locations, "downloads.locations is required");
            Objects.requireNonNull(userGroups, "downloads.userGroups is required");
        }
    }
}
