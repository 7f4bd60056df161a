package work.lcod.config.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.ListValue;
import work.lcod.config.value.MapValue;

/**
 * View over the document used as the {@code values} scope: resolved nodes expose their final value,
 * every other path its original one. Values are only ever added, never replaced.
 */
public final class ResolutionContext {
    private final ConfigValue root;
    private final Map<LeafPath, ConfigValue> resolved = new HashMap<>();

    public ResolutionContext(ConfigValue root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    /**
     * Value at {@code path}, walking through already resolved nodes; empty when the path does not exist.
     */
    public Optional<ConfigValue> lookup(LeafPath path) {
        ConfigValue current = resolved.getOrDefault(LeafPath.ROOT, root);
        var segments = path.segments();
        for (int i = 0; i < segments.size(); i++) {
            current = child(current, segments.get(i));
            if (current == null) {
                return Optional.empty();
            }
            var override = resolved.get(path.prefix(i + 1));
            if (override != null) {
                current = override;
            }
        }
        if (current instanceof MapValue || current instanceof ListValue) {
            // maps and lists carry the resolved values of the nodes inside them
            current = rebuild(path, current);
        }
        return Optional.of(current);
    }

    public boolean isResolved(LeafPath path) {
        return resolved.containsKey(path);
    }

    void record(LeafPath path, ConfigValue value) {
        if (resolved.putIfAbsent(path, Objects.requireNonNull(value, "value")) != null) {
            throw new IllegalStateException("Value already resolved at '" + path + "'");
        }
    }

    /**
     * Document of the same shape as the input with every resolved node replaced.
     */
    public ConfigValue toTree() {
        if (resolved.isEmpty()) {
            return root;
        }
        return rebuild(LeafPath.ROOT, root);
    }

    /**
     * Splices resolved values into {@code value}; returns the same instance when nothing below it changed.
     */
    private ConfigValue rebuild(LeafPath path, ConfigValue value) {
        var replacement = resolved.get(path);
        if (replacement != null) {
            return replacement;
        }
        if (value instanceof MapValue map) {
            var entries = new LinkedHashMap<String, ConfigValue>();
            boolean changed = false;
            for (var entry : map.entries().entrySet()) {
                var rebuilt = rebuild(path.child(entry.getKey()), entry.getValue());
                changed |= rebuilt != entry.getValue();
                entries.put(entry.getKey(), rebuilt);
            }
            return changed ? new MapValue(entries) : map;
        }
        if (value instanceof ListValue list) {
            var items = new ArrayList<ConfigValue>(list.size());
            boolean changed = false;
            for (int i = 0; i < list.size(); i++) {
                var rebuilt = rebuild(path.child(i), list.get(i));
                changed |= rebuilt != list.get(i);
                items.add(rebuilt);
            }
            return changed ? new ListValue(items) : list;
        }
        return value;
    }

    private static ConfigValue child(ConfigValue parent, String segment) {
        if (parent instanceof MapValue map) {
            return map.get(segment);
        }
        if (parent instanceof ListValue list) {
            int index = parseIndex(segment);
            return index < 0 || index >= list.size() ? null : list.get(index);
        }
        return null;
    }

    private static int parseIndex(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
