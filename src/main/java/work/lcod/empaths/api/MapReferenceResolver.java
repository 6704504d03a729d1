package work.lcod.empaths.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves references from a fixed name/value table.
 */
public final class MapReferenceResolver implements ReferenceResolver {
    private final Map<String, Object> values;

    public MapReferenceResolver(Map<String, ?> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public Object resolve(String name, Object data) {
        return values.get(name);
    }

    public Map<String, Object> values() {
        return values;
    }
}
