package work.lcod.empaths.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import work.lcod.empaths.api.LogLevel;

class EmpathsCommandTest {
    private static final Path DATA = Path.of("src", "test", "resources", "data");

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(CommandLine commandLine, String... args) {
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private int execute(String... args) {
        return execute(Main.commandLine(), args);
    }

    @Test
    void printsRawValues() {
        int exit = execute("-d", DATA.resolve("person.json").toString(), "-e", ".Name", "'Hi ' .Name", "--raw");
        assertEquals(0, exit);
        assertEquals(List.of("Alice", "Hi Alice"), out.toString().lines().toList());
    }

    @Test
    void rawModePrintsRealsInShortestForm() {
        var stdin = new ByteArrayInputStream("{\"x\": 1e23, \"y\": 30.0}".getBytes(StandardCharsets.UTF_8));
        var commandLine = new CommandLine(new EmpathsCommand().withStdin(stdin));
        int exit = execute(commandLine, "-e", ".x", ".y", "?.x=='100000000000000000000000'", "--raw");
        assertEquals(0, exit);
        assertEquals(List.of("100000000000000000000000", "30", "true"), out.toString().lines().toList());
    }

    @Test
    void repeatedExpressionOptionsKeepOrder() {
        int exit = execute("-d", DATA.resolve("person.yaml").toString(), "-e", ".Tags[1]", "-e", "?.Age=='30'", "--raw");
        assertEquals(0, exit);
        assertEquals(List.of("gopher", "true"), out.toString().lines().toList());
    }

    @Test
    void printsJsonReportByDefault() throws Exception {
        int exit = execute("-d", DATA.resolve("person.toml").toString(), "-e", ".Address.City");
        assertEquals(0, exit);
        var report = new ObjectMapper().readValue(out.toString(), Map.class);
        assertEquals("success", report.get("status"));
        assertEquals("TOML", ((Map<?, ?>) report.get("context")).get("format"));
        assertEquals(List.of(Map.of("expression", ".Address.City", "value", "NYC")), report.get("results"));
    }

    @Test
    void readsDataFromStdin() {
        var stdin = new ByteArrayInputStream("{\"User\": {\"Name\": \"Eve\"}}".getBytes(StandardCharsets.UTF_8));
        var commandLine = new CommandLine(new EmpathsCommand().withStdin(stdin));
        int exit = execute(commandLine, "-e", ".User.Name", "--raw");
        assertEquals(0, exit);
        assertEquals("Eve", out.toString().trim());
    }

    @Test
    void formatOptionOverridesDetection() {
        var stdin = new ByteArrayInputStream("Name: Zed\n".getBytes(StandardCharsets.UTF_8));
        var commandLine = new CommandLine(new EmpathsCommand().withStdin(stdin));
        int exit = execute(commandLine, "-f", "yaml", "-e", ".Name", "--raw");
        assertEquals(0, exit);
        assertEquals("Zed", out.toString().trim());
    }

    @Test
    void usesReferenceFile() {
        int exit = execute(
            "-d", DATA.resolve("person.json").toString(),
            "-r", DATA.resolve("templates.yaml").toString(),
            "--refs-as-expressions",
            "-e", ":letter",
            "--raw"
        );
        assertEquals(0, exit);
        assertEquals("Dear Alice, you are 30", out.toString().trim());
    }

    @Test
    void failedRunExitsWithOneAndReportsError() throws Exception {
        int exit = execute("-d", DATA.resolve("missing.json").toString(), "-e", ".Name", "--raw");
        assertEquals(1, exit);
        var report = new ObjectMapper().readValue(out.toString(), Map.class);
        assertEquals("failure", report.get("status"));
        assertTrue(report.get("error").toString().contains("missing.json"));
    }

    @Test
    void invalidFormatIsAShortError() {
        int exit = execute("-d", DATA.resolve("person.json").toString(), "-f", "xml", "-e", ".Name");
        assertEquals(1, exit);
        assertTrue(err.toString().contains("Unsupported data format: xml"));
    }

    @Test
    void expressionIsRequired() {
        int exit = execute("-d", DATA.resolve("person.json").toString());
        assertEquals(2, exit);
        assertTrue(err.toString().contains("--expr"));
    }

    @Test
    void printsVersion() {
        int exit = execute("--version");
        assertEquals(0, exit);
        assertTrue(out.toString().startsWith("empaths (java) "));
    }

    @Test
    void mapsLogLevelsToLogback() {
        assertEquals(Level.TRACE, LoggingSetup.toLogback(LogLevel.TRACE));
        assertEquals(Level.WARN, LoggingSetup.toLogback(LogLevel.WARN));
        assertEquals(Level.ERROR, LoggingSetup.toLogback(LogLevel.FATAL));
    }
}
