package work.lcod.config.support;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import work.lcod.config.api.ConfigResolver;
import work.lcod.config.filter.FilterRegistry;
import work.lcod.config.runtime.Delimiters;
import work.lcod.config.runtime.ExpressionScanner;
import work.lcod.config.runtime.GraphBuilder;
import work.lcod.config.runtime.LeafPath;
import work.lcod.config.runtime.ReferenceGraph;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.ListValue;
import work.lcod.config.value.MapValue;

/**
 * Shared helpers for resolver test suites: ordered document literals, graphs and fixture paths.
 */
public final class ConfigTestSupport {
    private ConfigTestSupport() {}

    /**
     * Ordered map literal: {@code map("a", 1, "b", "{{ values.a }}")}. Nested plain maps/lists are converted.
     */
    public static MapValue map(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        var entries = new LinkedHashMap<String, ConfigValue>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.put(String.valueOf(keysAndValues[i]), ConfigValue.fromPlain(keysAndValues[i + 1]));
        }
        return new MapValue(entries);
    }

    public static ConfigValue list(Object... items) {
        var values = new ArrayList<Object>();
        for (var item : items) {
            values.add(item);
        }
        return ConfigValue.fromPlain(values);
    }

    public static ReferenceGraph graph(ConfigValue document) {
        return new GraphBuilder(new ExpressionScanner(Delimiters.DEFAULT), FilterRegistry.standard()).build(document);
    }

    /**
     * Chain {@code l0..l<levels>} where {@code l0} is a plain value and every other level references the previous one.
     */
    public static MapValue chain(int levels) {
        var entries = new ArrayList<Object>();
        entries.add("l0");
        entries.add("base");
        for (int i = 1; i <= levels; i++) {
            entries.add("l" + i);
            entries.add("{{ values.l" + (i - 1) + " }}");
        }
        return map(entries.toArray());
    }

    public static ConfigValue resolve(ConfigValue document) {
        return new ConfigResolver().resolve(document).tree();
    }

    public static ConfigValue at(ConfigValue document, String dottedPath) {
        ConfigValue current = document;
        for (var segment : LeafPath.parse(dottedPath).segments()) {
            if (current instanceof MapValue map) {
                current = map.get(segment);
            } else if (current instanceof ListValue list) {
                current = list.get(Integer.parseInt(segment));
            } else {
                throw new AssertionError("No value at " + dottedPath);
            }
            if (current == null) {
                throw new AssertionError("No value at " + dottedPath);
            }
        }
        return current;
    }

    public static List<String> paths(List<LeafPath> paths) {
        var out = new ArrayList<String>();
        paths.forEach(path -> out.add(path.toString()));
        return out;
    }

    public static Path fixture(String name) {
        return Path.of("src", "test", "resources", "configs", name).toAbsolutePath();
    }
}
