package work.lcod.empaths.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.empaths.api.DataFormat;
import work.lcod.empaths.api.DataSource;
import work.lcod.empaths.api.EvalConfiguration;
import work.lcod.empaths.api.EvalResult;
import work.lcod.empaths.api.EvalRunner;
import work.lcod.empaths.api.ExpressionResult;
import work.lcod.empaths.api.LogLevel;

@CommandLine.Command(
    name = "empaths",
    description = "Evaluate model path expressions against a JSON, YAML or TOML document.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class EmpathsCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-e", "--expr"},
        required = true,
        description = "Path expression to evaluate (repeatable), e.g. \".User.Name\" or \"'Hi ' .Name\".",
        arity = "1..*"
    )
    private List<String> expressions = new ArrayList<>();

    @CommandLine.Option(
        names = {"-d", "--data"},
        paramLabel = "PATH|-",
        description = "Data document; use '-' to read from stdin.",
        defaultValue = "-"
    )
    private String data;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Data format (json|yaml|toml); detected from the file extension when omitted.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String format;

    @CommandLine.Option(
        names = {"-r", "--refs"},
        paramLabel = "PATH",
        description = "Table of :references (JSON, YAML or TOML).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path references;

    @CommandLine.Option(
        names = "--refs-as-expressions",
        description = "Treat string entries of the references table as path expressions."
    )
    private boolean referencesAsExpressions;

    @CommandLine.Option(
        names = "--raw",
        description = "Print each result as plain text, one per line, instead of a JSON report."
    )
    private boolean raw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    private InputStream stdin = System.in;

    EmpathsCommand withStdin(InputStream stdin) {
        this.stdin = stdin;
        return this;
    }

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = LogLevel.from(logLevelRaw);
        LoggingSetup.apply(logLevel);

        DataSource source = "-".equals(data) ? DataSource.forInline(readStdin()) : DataSource.forLocal(Path.of(data));
        EvalConfiguration configuration = EvalConfiguration.builder()
            .dataSource(source)
            .dataFormat(format == null ? null : DataFormat.from(format))
            .expressions(expressions)
            .referencesFile(Optional.ofNullable(references))
            .referencesAsExpressions(referencesAsExpressions)
            .logLevel(logLevel)
            .build();

        EvalResult result = new EvalRunner().run(configuration);
        var out = spec.commandLine().getOut();
        if (raw && result.status() == EvalResult.Status.SUCCESS) {
            for (ExpressionResult entry : result.results()) {
                out.println(entry.text());
            }
        } else {
            out.println(result.toPrettyJson());
        }
        out.flush();
        return result.status().exitCode();
    }

    private String readStdin() {
        try {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin: " + ex.getMessage(), ex);
        }
    }
}
