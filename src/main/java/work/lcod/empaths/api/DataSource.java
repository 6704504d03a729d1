package work.lcod.empaths.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the data model comes from: a local file or inline text (stdin, tests).
 */
public record DataSource(Optional<Path> localPath, Optional<String> inlineText) {
    public DataSource {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(inlineText, "inlineText");
        if (localPath.isEmpty() && inlineText.isEmpty()) {
            throw new IllegalArgumentException("Either localPath or inlineText must be present.");
        }
    }

    public static DataSource forLocal(Path path) {
        return new DataSource(Optional.of(path), Optional.empty());
    }

    public static DataSource forInline(String text) {
        return new DataSource(Optional.empty(), Optional.of(text));
    }

    public DataFormat detectFormat() {
        return localPath.map(DataFormat::detect).orElse(DataFormat.JSON);
    }

    public String display() {
        return localPath.map(Path::toString).orElse("<inline>");
    }
}
