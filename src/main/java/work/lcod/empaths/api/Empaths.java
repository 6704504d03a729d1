package work.lcod.empaths.api;

import java.util.Objects;
import work.lcod.empaths.expr.ExpressionDispatcher;

/**
 * Public entry point: evaluates path expressions against arbitrary object graphs.
 *
 * <p>A path is made of space-separated segments:
 * <ul>
 *   <li>{@code .User.Address.City}, {@code .Items[0].Name}, {@code .Scores[math]} model references</li>
 *   <li>{@code 'text'} or {@code "text"} literals, {@code \} escapes the next character</li>
 *   <li>{@code !operand} negation</li>
 *   <li>{@code :name} external reference</li>
 *   <li>{@code ?left==right} / {@code ?left!=right} string comparison</li>
 * </ul>
 * A single segment keeps its native type, several are concatenated as a string. Lookups that fail
 * resolve to {@code null} instead of throwing.
 *
 * <p>Instances are immutable and can be shared between threads.
 */
public final class Empaths {
    private final ReferenceResolver referenceResolver;

    private Empaths(ReferenceResolver referenceResolver) {
        this.referenceResolver = referenceResolver;
    }

    public static Empaths create() {
        return new Empaths(null);
    }

    public Empaths withReferenceResolver(ReferenceResolver referenceResolver) {
        return new Empaths(referenceResolver);
    }

    public Object evaluate(String path, Object data) {
        return resolve(path, data, referenceResolver);
    }

    public static Object resolve(String path, Object data) {
        return resolve(path, data, null);
    }

    /**
     * @param referenceResolver may be {@code null}, in which case every {@code :name} is absent
     * @return the resolved value, {@code data} itself for an empty path, {@code null} when absent
     */
    public static Object resolve(String path, Object data, ReferenceResolver referenceResolver) {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            return data;
        }
        return new ExpressionDispatcher(referenceResolver).resolveExpressions(path, data, 0).value();
    }

    /**
     * Resolves the single model reference whose leading {@code .} is at {@code index}.
     */
    public static Resolution resolveModel(String path, Object data, int index) {
        Objects.requireNonNull(path, "path");
        return new ExpressionDispatcher(null).resolveModel(path, data, index);
    }
}
