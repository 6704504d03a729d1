package work.lcod.empaths.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class DataFormatTest {
    @Test
    void parsesNames() {
        assertEquals(DataFormat.JSON, DataFormat.from("json"));
        assertEquals(DataFormat.YAML, DataFormat.from("YAML"));
        assertEquals(DataFormat.YAML, DataFormat.from(" yml "));
        assertEquals(DataFormat.TOML, DataFormat.from("toml"));
        assertEquals(DataFormat.JSON, DataFormat.from(null));
    }

    @Test
    void rejectsUnknownNames() {
        var ex = assertThrows(IllegalArgumentException.class, () -> DataFormat.from("xml"));
        assertEquals("Unsupported data format: xml", ex.getMessage());
    }

    @Test
    void detectsFromExtension() {
        assertEquals(DataFormat.YAML, DataFormat.detect(Path.of("conf", "a.YAML")));
        assertEquals(DataFormat.TOML, DataFormat.detect(Path.of("refs.toml")));
        assertEquals(DataFormat.JSON, DataFormat.detect(Path.of("data")));
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from("debug"));
        var ex = assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
        assertEquals("Unsupported log level: loud", ex.getMessage());
    }
}
