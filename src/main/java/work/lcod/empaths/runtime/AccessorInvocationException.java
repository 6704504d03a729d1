package work.lcod.empaths.runtime;

/**
 * Wraps a checked exception thrown by a computed accessor while a path was being resolved.
 */
public final class AccessorInvocationException extends RuntimeException {
    private final String member;

    public AccessorInvocationException(String member, Throwable cause) {
        super("Accessor " + member + " failed: " + cause.getMessage(), cause);
        this.member = member;
    }

    public String member() {
        return member;
    }
}
