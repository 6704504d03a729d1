package work.lcod.empaths.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a dotted/bracketed model path ({@code User.Address.City}, {@code Items[0].Name},
 * {@code Scores[math]}) over a {@link Value}.
 *
 * <p>Every failed hop (missing member, unknown key, index out of range, empty indirection) yields
 * {@link Value#ABSENT} and stops the walk.
 */
public final class PathResolver {
    private static final Logger LOG = LoggerFactory.getLogger(PathResolver.class);

    private PathResolver() {}

    public static Value resolve(String path, Value value) {
        if (value == null || value.isAbsent()) {
            return Value.ABSENT;
        }
        if (!path.isEmpty() && path.charAt(0) == '.') {
            path = path.substring(1);
        }
        if (path.isEmpty()) {
            return value;
        }
        if (value instanceof Value.Indirect indirect) {
            var handle = indirect.handle();
            if (handle.isEmpty()) {
                LOG.trace("Empty indirection before '{}'", path);
                return Value.ABSENT;
            }
            return resolve(path, handle.unwrap());
        }
        return resolveSegments(path, value);
    }

    private static Value resolveSegments(String path, Value value) {
        if (path.charAt(0) == '[') {
            return resolveBracket(path, value);
        }

        int split = -1;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '.' || c == '[') {
                split = i;
                break;
            }
        }

        String segment;
        String remaining;
        if (split == -1) {
            segment = path;
            remaining = "";
        } else if (path.charAt(split) == '.') {
            segment = path.substring(0, split);
            remaining = path.substring(split + 1);
        } else {
            segment = path.substring(0, split);
            remaining = path.substring(split);
        }

        var resolved = resolveMember(segment, value);
        if (resolved.isAbsent() || remaining.isEmpty()) {
            return resolved;
        }
        return resolve(remaining, resolved);
    }

    private static Value resolveBracket(String path, Value value) {
        int close = path.indexOf(']');
        if (close == -1) {
            LOG.trace("Unterminated bracket in '{}'", path);
            return Value.ABSENT;
        }
        var resolved = resolveIndexOrKey(path.substring(1, close), value);
        if (resolved.isAbsent() || close == path.length() - 1) {
            return resolved;
        }
        return resolve(path.substring(close + 1), resolved);
    }

    private static Value resolveIndexOrKey(String indexOrKey, Value value) {
        if (value instanceof Value.Indexed indexed) {
            var handle = indexed.handle();
            int index;
            try {
                index = Integer.parseInt(indexOrKey, 10);
            } catch (NumberFormatException ex) {
                LOG.trace("'{}' is not an index", indexOrKey);
                return Value.ABSENT;
            }
            if (index < 0 || index >= handle.length()) {
                LOG.trace("Index {} outside [0, {})", index, handle.length());
                return Value.ABSENT;
            }
            return handle.at(index);
        }
        if (value instanceof Value.Keyed keyed) {
            return keyed.handle().lookup(indexOrKey);
        }
        return Value.ABSENT;
    }

    private static Value resolveMember(String name, Value value) {
        if (name.isEmpty()) {
            return Value.ABSENT;
        }
        if (value instanceof Value.Struct struct) {
            var handle = struct.handle();
            var computed = handle.invoke0(name);
            if (computed.isPresent()) {
                return computed.get();
            }
            return handle.field(name);
        }
        if (value instanceof Value.Keyed keyed) {
            return keyed.handle().lookup(name);
        }
        LOG.trace("'{}' cannot be resolved on {}", name, value.getClass().getSimpleName());
        return Value.ABSENT;
    }
}
