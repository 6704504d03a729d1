package work.lcod.empaths.expr;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.empaths.api.ReferenceResolver;
import work.lcod.empaths.api.Resolution;
import work.lcod.empaths.shared.StringCoercion;

/**
 * Scans a path expression segment by segment and combines the results.
 *
 * <p>A single segment keeps its native type; several segments are stringified and concatenated in
 * order. Bytes that do not start a segment are skipped.
 */
public final class ExpressionDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(ExpressionDispatcher.class);

    private final OperandResolver operands;

    public ExpressionDispatcher(ReferenceResolver referenceResolver) {
        this.operands = new OperandResolver(referenceResolver);
    }

    public Resolution resolveExpressions(String path, Object data, int startIndex) {
        if (path.isEmpty()) {
            return new Resolution(data, startIndex);
        }

        int index = startIndex;
        Object first = null;
        boolean hasFirst = false;
        List<Object> rest = null;

        while (index < path.length()) {
            var segment = resolveSegment(path, data, index);
            if (segment == null) {
                index++;
                continue;
            }
            LOG.trace("Segment [{}, {}) of '{}' -> {}", index, segment.nextIndex(), path, segment.value());
            index = segment.nextIndex();
            if (!hasFirst) {
                first = segment.value();
                hasFirst = true;
            } else {
                if (rest == null) {
                    rest = new ArrayList<>();
                }
                rest.add(segment.value());
            }
        }

        if (hasFirst && rest == null) {
            return new Resolution(first, index);
        }
        var sb = new StringBuilder();
        if (hasFirst) {
            sb.append(StringCoercion.toString(first));
            for (Object value : rest) {
                sb.append(StringCoercion.toString(value));
            }
        }
        return new Resolution(sb.toString(), index);
    }

    public Resolution resolveModel(String path, Object data, int index) {
        return OperandResolver.resolveModel(path, data, index);
    }

    private Resolution resolveSegment(String path, Object data, int index) {
        char c = path.charAt(index);
        switch (c) {
            case '.':
                return OperandResolver.resolveModel(path, data, index);
            case '\'':
            case '"':
                return Scanner.readLiteral(path, index, c);
            case '!':
                return operands.resolveNegation(path, data, index);
            case ':':
                return operands.resolveReference(path, data, index);
            case '?':
                return operands.resolveComparison(path, data, index);
            default:
                return null;
        }
    }
}
