package work.lcod.empaths.expr;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.empaths.api.ReferenceResolver;
import work.lcod.empaths.api.Resolution;
import work.lcod.empaths.runtime.PathResolver;
import work.lcod.empaths.runtime.ValueExtractor;
import work.lcod.empaths.runtime.Values;
import work.lcod.empaths.shared.StringCoercion;

/**
 * Evaluates single operands: model references, literals, negations, references and comparisons.
 */
final class OperandResolver {
    private static final Logger LOG = LoggerFactory.getLogger(OperandResolver.class);

    private final ReferenceResolver referenceResolver;

    OperandResolver(ReferenceResolver referenceResolver) {
        this.referenceResolver = referenceResolver;
    }

    /**
     * Resolves the next operand, skipping bytes that do not start one. Comparisons are not
     * operands. Returns {@code data} when the path runs out first.
     */
    Resolution resolveOperand(String path, Object data, int index) {
        while (index < path.length()) {
            char c = path.charAt(index);
            switch (c) {
                case '.':
                    return resolveModel(path, data, index);
                case '\'':
                case '"':
                    return Scanner.readLiteral(path, index, c);
                case '!':
                    return resolveNegation(path, data, index);
                case ':':
                    return resolveReference(path, data, index);
                default:
                    index++;
            }
        }
        return new Resolution(data, index);
    }

    static Resolution resolveModel(String path, Object data, int index) {
        var modelPath = Scanner.readUntilTerminator(path, index + 1);
        if (data == null) {
            return new Resolution(null, modelPath.nextIndex());
        }
        var resolved = PathResolver.resolve((String) modelPath.value(), Values.of(data));
        return new Resolution(ValueExtractor.extract(resolved), modelPath.nextIndex());
    }

    Resolution resolveNegation(String path, Object data, int index) {
        var operand = resolveOperand(path, data, index + 1);
        if (operand.value() instanceof Boolean bool) {
            return new Resolution(!bool, operand.nextIndex());
        }
        var text = StringCoercion.toString(operand.value()).toLowerCase(Locale.ROOT);
        if ("true".equals(text)) {
            return new Resolution(false, operand.nextIndex());
        }
        if ("false".equals(text)) {
            return new Resolution(true, operand.nextIndex());
        }
        return new Resolution(false, operand.nextIndex());
    }

    Resolution resolveReference(String path, Object data, int index) {
        var name = Scanner.readUntilTerminator(path, index + 1);
        if (referenceResolver == null) {
            LOG.trace("No reference resolver for ':{}'", name.value());
            return new Resolution(null, name.nextIndex());
        }
        return new Resolution(referenceResolver.resolve((String) name.value(), data), name.nextIndex());
    }

    Resolution resolveComparison(String path, Object data, int index) {
        var left = resolveOperand(path, data, index + 1);
        index = left.nextIndex();
        Boolean equals = parseOperator(path, index);
        if (equals == null) {
            LOG.debug("Expected '==' or '!=' at {} in '{}'", index, path);
            return new Resolution(false, index + 1);
        }
        var right = resolveOperand(path, data, index + 2);
        var leftText = StringCoercion.toString(left.value());
        var rightText = StringCoercion.toString(right.value());
        boolean same = leftText.equals(rightText);
        return new Resolution(equals ? same : !same, right.nextIndex());
    }

    /** {@code TRUE} for {@code ==}, {@code FALSE} for {@code !=}, {@code null} for anything else. */
    private static Boolean parseOperator(String path, int index) {
        if (index >= path.length() - 1) {
            return null;
        }
        char first = path.charAt(index);
        if (path.charAt(index + 1) != '=') {
            return null;
        }
        if (first == '=') {
            return Boolean.TRUE;
        }
        if (first == '!') {
            return Boolean.FALSE;
        }
        return null;
    }
}
