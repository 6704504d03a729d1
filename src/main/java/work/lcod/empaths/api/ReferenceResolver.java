package work.lcod.empaths.api;

/**
 * Resolves {@code :name} references (templates, configuration values, any external source).
 *
 * <p>Exceptions thrown by an implementation are not caught; they abort the evaluation.
 */
@FunctionalInterface
public interface ReferenceResolver {
    Object resolve(String name, Object data);
}
