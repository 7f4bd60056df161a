package work.lcod.config.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered map node. Equality ignores key order.
 */
public record MapValue(Map<String, ConfigValue> entries) implements ConfigValue {
    public static final MapValue EMPTY = new MapValue(Map.of());

    public MapValue {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public ConfigValue get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String typeName() {
        return "map";
    }

    @Override
    public Object toPlain() {
        var plain = new LinkedHashMap<String, Object>();
        for (var entry : entries.entrySet()) {
            plain.put(entry.getKey(), entry.getValue().toPlain());
        }
        return plain;
    }
}
