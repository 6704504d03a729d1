package work.lcod.empaths.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.empaths.runtime.DataLoader;

/**
 * Loads a data document and evaluates a batch of expressions against it.
 */
public final class EvalRunner {
    private static final Logger LOG = LoggerFactory.getLogger(EvalRunner.class);

    public EvalResult run(EvalConfiguration configuration) {
        var started = Instant.now();
        var context = new LinkedHashMap<String, Object>();
        context.put("data", configuration.dataSource().display());
        context.put("format", configuration.dataFormat().name());
        configuration.referencesFile().ifPresent(path -> context.put("references", path.toString()));
        context.put("logLevel", configuration.logLevel().name());
        try {
            var data = DataLoader.load(configuration.dataSource(), configuration.dataFormat());
            var empaths = Empaths.create().withReferenceResolver(loadReferences(configuration));

            List<ExpressionResult> results = new ArrayList<>();
            for (String expression : configuration.expressions()) {
                var value = empaths.evaluate(expression, data);
                LOG.debug("{} -> {}", expression, value);
                results.add(new ExpressionResult(expression, value));
            }
            return EvalResult.success(results, context, started);
        } catch (RuntimeException ex) {
            LOG.debug("Evaluation of {} failed", configuration.dataSource().display(), ex);
            var message = ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getSimpleName() : ex.getMessage();
            return EvalResult.failure(message, context, started);
        }
    }

    private ReferenceResolver loadReferences(EvalConfiguration configuration) {
        return configuration.referencesFile()
            .map(path -> buildResolver(path, configuration.referencesAsExpressions()))
            .orElse(null);
    }

    private static ReferenceResolver buildResolver(Path path, boolean asExpressions) {
        var table = DataLoader.loadTable(path);
        if (!asExpressions) {
            return new MapReferenceResolver(table);
        }
        var expressions = new LinkedHashMap<String, String>();
        var constants = new LinkedHashMap<String, Object>();
        for (var entry : table.entrySet()) {
            if (entry.getValue() instanceof String text) {
                expressions.put(entry.getKey(), text);
            } else {
                constants.put(entry.getKey(), entry.getValue());
            }
        }
        return new ExpressionReferenceResolver(expressions, new MapReferenceResolver(constants));
    }
}
