package com.master.sync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link SyncConfig} from YAML.
 *
 * <pre>
 * chunkSize: 100
 * otherLabel: その他
 * retirementSentinel: SYS_RETIRE
 * charset: windows-31j
 * outputDirectory: out
 * sources:
 *   organizations: data/organizations.csv
 *   mapping: data/mapping.csv
 *   locations: data/locations.csv
 *   users: data/users.csv
 *   columns: conf/columns.xlsx
 * downloads:
 *   organizations: download/org_*.txt
 *   users: download/user_*.txt
 *   locations: download/location_*.txt
 *   userGroups: download/usergroup_*.txt
 * </pre>
 *
 * Relative paths are resolved against the directory holding the configuration file.
 */
public class SyncConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SyncConfigLoader.class);

    private final ObjectMapper mapper;

    public SyncConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * @throws ConfigurationException if the file cannot be read or a required entry is missing
     */
    public SyncConfig load(Path file) {
        Path baseDir = file.toAbsolutePath().getParent();
        try (InputStream in = Files.newInputStream(file)) {
            SyncConfig config = load(in, baseDir);
            log.info("config.loaded path={} chunkSize={}", file, config.chunkSize());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + file + ": " + e.getMessage(), e);
        }
    }

    public SyncConfig load(InputStream in, Path baseDir) throws IOException {
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuration must be a YAML mapping");
        }
        try {
            JsonNode sources = root.path("sources");
            JsonNode downloads = root.path("downloads");
            return new SyncConfig(
                    root.path("chunkSize").asInt(SyncConfig.DEFAULT_CHUNK_SIZE),
                    text(root, "otherLabel", SyncConfig.DEFAULT_OTHER_LABEL),
                    text(root, "retirementSentinel", SyncConfig.DEFAULT_RETIREMENT_SENTINEL),
                    Charset.forName(text(root, "charset", SyncConfig.DEFAULT_CHARSET)),
                    resolve(baseDir, text(root, "outputDirectory", "out")),
                    new SyncConfig.Sources(
                            path(sources, "sources", "organizations", baseDir, true),
                            path(sources, "sources", "mapping", baseDir, false),
                            path(sources, "sources", "locations", baseDir, true),
                            path(sources, "sources", "users", baseDir, true),
                            path(sources, "sources", "columns", baseDir, true)),
                    new SyncConfig.Downloads(
                            path(downloads, "downloads", "organizations", baseDir, true),
                            path(downloads, "downloads", "users", baseDir, true),
                            path(downloads, "downloads", "locations", baseDir, true),
                            path(downloads, "downloads", "userGroups", baseDir, true)));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? defaultValue : value.asText();
    }

    /**
     * @throws ConfigurationException if {@code required} and the entry is absent or blank
     */
    private static Path path(JsonNode node, String section, String field, Path baseDir, boolean required) {
        String value = text(node, field, null);
        if (value == null || value.isBlank()) {
            if (required) {
                throw new ConfigurationException("Missing required entry " + section + "." + field);
            }
            return null;
        }
        return resolve(baseDir, value);
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDir == null) {
            return path;
        }
        return baseDir.resolve(path).normalize();
    }
}
