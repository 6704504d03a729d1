package work.lcod.empaths.api;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Supported encodings for data and reference files.
 */
public enum DataFormat {
    JSON,
    YAML,
    TOML;

    public static DataFormat from(String value) {
        if (value == null || value.isBlank()) {
            return JSON;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("YML".equals(normalized)) {
            return YAML;
        }
        try {
            return DataFormat.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported data format: " + value);
        }
    }

    public static DataFormat detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return JSON;
        }
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            return YAML;
        }
        if (name.endsWith(".toml")) {
            return TOML;
        }
        return JSON;
    }
}
