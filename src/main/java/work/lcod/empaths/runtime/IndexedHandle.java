package work.lcod.empaths.runtime;

/**
 * Positional access on an array or list.
 */
public interface IndexedHandle {
    Object raw();

    int length();

    /** Callers bounds-check first. */
    Value at(int index);
}
