package work.lcod.empaths.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an {@link EvalRunner} run: the results in expression order, the context the run was
 * made in (data source, format, references, log level) and, on failure, the error message.
 */
public record EvalResult(
    Status status,
    List<ExpressionResult> results,
    Map<String, Object> context,
    Optional<String> error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter REPORT_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public EvalResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(error, "error");
        results = List.copyOf(results);
        context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    static EvalResult success(List<ExpressionResult> results, Map<String, Object> context, Instant startedAt) {
        return new EvalResult(Status.SUCCESS, results, context, Optional.empty(), startedAt, Instant.now());
    }

    static EvalResult failure(String error, Map<String, Object> context, Instant startedAt) {
        return new EvalResult(Status.FAILURE, List.of(), context, Optional.of(error), startedAt, Instant.now());
    }

    /** Values in expression order; absent values stay {@code null}. */
    public List<Object> values() {
        var values = new ArrayList<>(results.size());
        for (var result : results) {
            values.add(result.value());
        }
        return values;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("status", status.name().toLowerCase(Locale.ROOT));
        report.put("context", context);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (var result : results) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("expression", result.expression());
            entry.put("value", result.value());
            entries.add(entry);
        }
        report.put("results", entries);
        error.ifPresent(message -> report.put("error", message));
        report.put("startedAt", startedAt.toString());
        report.put("elapsedMillis", elapsed().toMillis());
        return report;
    }

    public String toPrettyJson() {
        try {
            return REPORT_WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Unable to render evaluation report", ex);
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
