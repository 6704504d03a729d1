package work.lcod.empaths.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves references whose definitions are themselves path expressions, evaluated against the
 * data in scope where the reference appears. Definitions may reference each other; a cycle raises
 * {@link ReferenceCycleException}. Unknown names go to the fallback resolver, if any.
 */
public final class ExpressionReferenceResolver implements ReferenceResolver {
    private final Map<String, String> expressions;
    private final ReferenceResolver fallback;
    private final List<String> chain;

    public ExpressionReferenceResolver(Map<String, String> expressions) {
        this(expressions, null);
    }

    public ExpressionReferenceResolver(Map<String, String> expressions, ReferenceResolver fallback) {
        this(expressions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(expressions)), fallback, List.of());
    }

    private ExpressionReferenceResolver(Map<String, String> expressions, ReferenceResolver fallback, List<String> chain) {
        this.expressions = expressions;
        this.fallback = fallback;
        this.chain = chain;
    }

    @Override
    public Object resolve(String name, Object data) {
        var expression = expressions.get(name);
        if (expression == null) {
            return fallback == null ? null : fallback.resolve(name, data);
        }
        var nested = new ArrayList<>(chain);
        nested.add(name);
        if (chain.contains(name)) {
            throw new ReferenceCycleException(nested);
        }
        return Empaths.resolve(expression, data, new ExpressionReferenceResolver(expressions, fallback, List.copyOf(nested)));
    }
}
