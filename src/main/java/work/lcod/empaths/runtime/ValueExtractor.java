package work.lcod.empaths.runtime;

/**
 * Turns a resolved {@link Value} back into the plain object handed to callers.
 */
public final class ValueExtractor {
    private ValueExtractor() {}

    /**
     * @return the underlying object, or {@code null} for absent values and empty indirections
     */
    public static Object extract(Value value) {
        if (value == null || value.isAbsent()) {
            return null;
        }
        if (value instanceof Value.Indirect indirect) {
            var handle = indirect.handle();
            return handle.isEmpty() ? null : extract(handle.unwrap());
        }
        if (value instanceof Value.Bool bool) {
            return bool.value();
        }
        if (value instanceof Value.Int integer) {
            return integer.value();
        }
        if (value instanceof Value.Real real) {
            return real.value();
        }
        if (value instanceof Value.Text text) {
            return text.value();
        }
        if (value instanceof Value.Struct struct) {
            return struct.handle().raw();
        }
        if (value instanceof Value.Indexed indexed) {
            return indexed.handle().raw();
        }
        if (value instanceof Value.Keyed keyed) {
            return keyed.handle().raw();
        }
        return null;
    }
}
