package work.lcod.empaths.runtime;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map access keyed by the runtime class of the map's keys.
 */
final class MapKeyed implements KeyedHandle {
    private static final Logger LOG = LoggerFactory.getLogger(MapKeyed.class);

    private final Map<?, ?> map;

    MapKeyed(Map<?, ?> map) {
        this.map = map;
    }

    @Override
    public Object raw() {
        return map;
    }

    @Override
    public Value lookup(String rawKey) {
        var keyType = keyType();
        if (keyType == null) {
            return Value.ABSENT;
        }
        var key = KeyParser.parse(rawKey, keyType);
        if (key.isEmpty()) {
            LOG.debug("Key '{}' is not a valid {} key", rawKey, keyType.getSimpleName());
            return Value.ABSENT;
        }
        // A fresh Value is built from the stored entry; unwrapping it later never touches the map.
        return Values.of(map.get(key.get()));
    }

    private Class<?> keyType() {
        for (Object key : map.keySet()) {
            if (key != null) {
                return key instanceof Enum<?> constant ? constant.getDeclaringClass() : key.getClass();
            }
        }
        return null;
    }
}
