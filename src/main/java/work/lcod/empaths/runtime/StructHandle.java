package work.lcod.empaths.runtime;

import java.util.Optional;

/**
 * Member access on a record-like object.
 */
public interface StructHandle {
    Object raw();

    /**
     * Calls the zero-argument accessor called {@code name}.
     *
     * @return empty when no such accessor exists, otherwise the (possibly absent) result
     */
    Optional<Value> invoke0(String name);

    /** Reads the field called {@code name}; absent when missing or inaccessible. */
    Value field(String name);
}
