package work.lcod.empaths.runtime;

/**
 * Key lookup on a map, with the key given in its textual path form.
 */
public interface KeyedHandle {
    Object raw();

    Value lookup(String rawKey);
}
