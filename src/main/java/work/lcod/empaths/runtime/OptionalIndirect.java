package work.lcod.empaths.runtime;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

final class OptionalIndirect implements IndirectHandle {
    private final Object raw;

    OptionalIndirect(Object raw) {
        this.raw = raw;
    }

    @Override
    public Object raw() {
        return raw;
    }

    @Override
    public boolean isEmpty() {
        if (raw instanceof Optional<?> optional) {
            return optional.isEmpty();
        }
        if (raw instanceof OptionalInt optional) {
            return optional.isEmpty();
        }
        if (raw instanceof OptionalLong optional) {
            return optional.isEmpty();
        }
        if (raw instanceof OptionalDouble optional) {
            return optional.isEmpty();
        }
        if (raw instanceof AtomicReference<?> ref) {
            return ref.get() == null;
        }
        return true;
    }

    @Override
    public Value unwrap() {
        if (raw instanceof Optional<?> optional) {
            return Values.of(optional.orElse(null));
        }
        if (raw instanceof OptionalInt optional) {
            return optional.isPresent() ? Values.of(optional.getAsInt()) : Value.ABSENT;
        }
        if (raw instanceof OptionalLong optional) {
            return optional.isPresent() ? Values.of(optional.getAsLong()) : Value.ABSENT;
        }
        if (raw instanceof OptionalDouble optional) {
            return optional.isPresent() ? Values.of(optional.getAsDouble()) : Value.ABSENT;
        }
        if (raw instanceof AtomicReference<?> ref) {
            return Values.of(ref.get());
        }
        return Value.ABSENT;
    }
}
