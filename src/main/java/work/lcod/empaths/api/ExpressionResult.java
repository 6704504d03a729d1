package work.lcod.empaths.api;

import java.util.Objects;
import work.lcod.empaths.shared.StringCoercion;

/**
 * One evaluated expression and its value ({@code null} when absent).
 */
public record ExpressionResult(String expression, Object value) {
    public ExpressionResult {
        Objects.requireNonNull(expression, "expression");
    }

    /** The value as it would appear inside a concatenation. */
    public String text() {
        return StringCoercion.toString(value);
    }
}
