package work.lcod.empaths.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Classifies plain Java objects into {@link Value} cases.
 */
public final class Values {
    private Values() {}

    public static Value of(Object raw) {
        if (raw == null) {
            return Value.ABSENT;
        }
        if (raw instanceof Boolean bool) {
            return new Value.Bool(bool);
        }
        if (raw instanceof String text) {
            return new Value.Text(text);
        }
        if (isIntegral(raw)) {
            return new Value.Int((Number) raw);
        }
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            return new Value.Real((Number) raw);
        }
        if (isIndirection(raw)) {
            return new Value.Indirect(new OptionalIndirect(raw));
        }
        if (raw instanceof List<?> list) {
            return new Value.Indexed(SequenceHandle.ofList(list));
        }
        if (raw.getClass().isArray()) {
            return new Value.Indexed(SequenceHandle.ofArray(raw));
        }
        if (raw instanceof Map<?, ?> map) {
            return new Value.Keyed(new MapKeyed(map));
        }
        return new Value.Struct(new ReflectiveStruct(raw));
    }

    static boolean isIntegral(Object raw) {
        return raw instanceof Integer
            || raw instanceof Long
            || raw instanceof Short
            || raw instanceof Byte
            || raw instanceof BigInteger;
    }

    private static boolean isIndirection(Object raw) {
        return raw instanceof Optional<?>
            || raw instanceof OptionalInt
            || raw instanceof OptionalLong
            || raw instanceof OptionalDouble
            || raw instanceof AtomicReference<?>;
    }
}
