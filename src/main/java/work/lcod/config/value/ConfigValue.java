package work.lcod.config.value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Universal representation of every node of a configuration document, before and after resolution.
 *
 * <p>Cases: {@link StringValue}, {@link NumberValue}, {@link BooleanValue}, {@link NullValue},
 * {@link ListValue}, {@link MapValue}.
 */
public interface ConfigValue {

    /**
     * Short type name used in diagnostics ({@code string}, {@code number}, ...).
     */
    String typeName();

    /**
     * Converts back to plain Java collections/scalars (for serialization).
     */
    Object toPlain();

    /**
     * Converts plain Java values (maps, lists, strings, numbers, booleans, null) into a tree.
     */
    static ConfigValue fromPlain(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof ConfigValue configValue) {
            return configValue;
        }
        if (value instanceof String str) {
            return new StringValue(str);
        }
        if (value instanceof Boolean bool) {
            return BooleanValue.of(bool);
        }
        if (value instanceof BigDecimal decimal) {
            return new NumberValue(decimal.doubleValue());
        }
        if (value instanceof Float f) {
            return new NumberValue(f.doubleValue());
        }
        if (value instanceof Number number) {
            return new NumberValue(number);
        }
        if (value instanceof Map<?, ?> map) {
            var entries = new LinkedHashMap<String, ConfigValue>();
            for (var entry : map.entrySet()) {
                entries.put(String.valueOf(entry.getKey()), fromPlain(entry.getValue()));
            }
            return new MapValue(entries);
        }
        if (value instanceof List<?> list) {
            var items = new ArrayList<ConfigValue>(list.size());
            for (var item : list) {
                items.add(fromPlain(item));
            }
            return new ListValue(items);
        }
        if (value instanceof Character || value instanceof Enum<?>) {
            return new StringValue(value.toString());
        }
        throw new IllegalArgumentException("Unsupported configuration value type: " + value.getClass().getName());
    }
}
