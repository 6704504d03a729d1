package work.lcod.empaths.api;

import java.util.List;

/**
 * Raised when expression references end up referring to themselves.
 */
public final class ReferenceCycleException extends RuntimeException {
    private final List<String> chain;

    public ReferenceCycleException(List<String> chain) {
        super("Reference cycle: " + String.join(" -> ", chain));
        this.chain = List.copyOf(chain);
    }

    public List<String> chain() {
        return chain;
    }
}
