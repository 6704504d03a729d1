package work.lcod.empaths.runtime;

import java.util.Objects;

/**
 * Introspected view of a value being walked by the {@link PathResolver}.
 *
 * <p>Scalars carry the caller's boxed object, so extraction hands back the same type.
 * Containers and indirections expose a capability handle instead of a concrete Java type.
 */
public sealed interface Value
    permits Value.Absent, Value.Bool, Value.Int, Value.Real, Value.Text,
            Value.Struct, Value.Indexed, Value.Keyed, Value.Indirect {

    Value ABSENT = new Absent();

    default boolean isAbsent() {
        return this instanceof Absent;
    }

    record Absent() implements Value {}

    record Bool(Boolean value) implements Value {
        public Bool {
            Objects.requireNonNull(value, "value");
        }
    }

    /** Integer family: {@code Byte}, {@code Short}, {@code Integer}, {@code Long}, {@code BigInteger}. */
    record Int(Number value) implements Value {
        public Int {
            Objects.requireNonNull(value, "value");
        }
    }

    /** Float family: {@code Float}, {@code Double}, {@code BigDecimal}. */
    record Real(Number value) implements Value {
        public Real {
            Objects.requireNonNull(value, "value");
        }
    }

    record Text(String value) implements Value {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    record Struct(StructHandle handle) implements Value {}

    record Indexed(IndexedHandle handle) implements Value {}

    record Keyed(KeyedHandle handle) implements Value {}

    record Indirect(IndirectHandle handle) implements Value {}
}
