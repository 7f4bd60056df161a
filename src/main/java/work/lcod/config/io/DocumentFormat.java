package work.lcod.config.io;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Text formats a configuration document can be read from or written to.
 */
public enum DocumentFormat {
    YAML,
    JSON,
    TOML;

    /**
     * Format implied by the file extension; unknown extensions are read as YAML, a superset of JSON.
     */
    public static DocumentFormat detect(Path path) {
        var fileName = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".json")) {
            return JSON;
        }
        if (fileName.endsWith(".toml")) {
            return TOML;
        }
        return YAML;
    }

    public static DocumentFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        try {
            return DocumentFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported document format: " + value);
        }
    }
}
