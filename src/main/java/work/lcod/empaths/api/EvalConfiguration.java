package work.lcod.empaths.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for an {@link EvalRunner} run.
 */
public record EvalConfiguration(
    DataSource dataSource,
    DataFormat dataFormat,
    List<String> expressions,
    Optional<Path> referencesFile,
    boolean referencesAsExpressions,
    LogLevel logLevel
) {
    public EvalConfiguration {
        Objects.requireNonNull(dataSource, "dataSource");
        Objects.requireNonNull(dataFormat, "dataFormat");
        Objects.requireNonNull(expressions, "expressions");
        Objects.requireNonNull(referencesFile, "referencesFile");
        Objects.requireNonNull(logLevel, "logLevel");
        if (expressions.isEmpty()) {
            throw new IllegalArgumentException("At least one expression is required.");
        }
        expressions = List.copyOf(expressions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DataSource dataSource;
        private DataFormat dataFormat;
        private final List<String> expressions = new ArrayList<>();
        private Optional<Path> referencesFile = Optional.empty();
        private boolean referencesAsExpressions;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        public Builder dataFormat(DataFormat dataFormat) {
            this.dataFormat = dataFormat;
            return this;
        }

        public Builder expression(String expression) {
            this.expressions.add(expression);
            return this;
        }

        public Builder expressions(List<String> expressions) {
            this.expressions.addAll(expressions);
            return this;
        }

        public Builder referencesFile(Optional<Path> referencesFile) {
            this.referencesFile = referencesFile;
            return this;
        }

        public Builder referencesAsExpressions(boolean referencesAsExpressions) {
            this.referencesAsExpressions = referencesAsExpressions;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public EvalConfiguration build() {
            Objects.requireNonNull(dataSource, "dataSource");
            return new EvalConfiguration(
                dataSource,
                dataFormat == null ? dataSource.detectFormat() : dataFormat,
                expressions,
                referencesFile,
                referencesAsExpressions,
                logLevel
            );
        }
    }
}
