package work.lcod.empaths.runtime;

/**
 * Optional-like wrapper that has to be unwrapped before its content can be inspected.
 */
public interface IndirectHandle {
    Object raw();

    boolean isEmpty();

    Value unwrap();
}
