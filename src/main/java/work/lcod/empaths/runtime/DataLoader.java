package work.lcod.empaths.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlTable;
import work.lcod.empaths.api.DataFormat;
import work.lcod.empaths.api.DataSource;

/**
 * Loads JSON, YAML or TOML documents into plain {@link Map}/{@link List}/scalar graphs.
 */
public final class DataLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private DataLoader() {}

    public static Object load(DataSource source, DataFormat format) {
        if (source.inlineText().isPresent()) {
            return parse(source.inlineText().get(), format, "<inline>");
        }
        var path = source.localPath().orElseThrow();
        return parse(readText(path), format, path.toString());
    }

    /**
     * Loads a document whose top level must be a table, such as a references file.
     */
    public static Map<String, Object> loadTable(Path path) {
        var value = parse(readText(path), DataFormat.detect(path), path.toString());
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Expected a table at the top of " + path);
        }
        var table = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            table.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return table;
    }

    public static Object parse(String text, DataFormat format, String origin) {
        try {
            switch (format) {
                case YAML:
                    return YAML.readValue(text, Object.class);
                case TOML:
                    return parseToml(text, origin);
                case JSON:
                default:
                    return JSON.readValue(text, Object.class);
            }
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid " + format.name().toLowerCase(Locale.ROOT) + " in " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private static String readText(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read data: " + path, ex);
        }
    }

    private static Map<String, Object> parseToml(String text, String origin) {
        var result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid toml in " + origin + ": " + result.errors().get(0).toString());
        }
        return convertTomlTable(result);
    }

    private static Map<String, Object> convertTomlTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convertTomlValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertTomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
