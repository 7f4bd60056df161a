package work.lcod.config.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed mapping from filter name to implementation and accepted argument count.
 */
public final class FilterRegistry {
    private final Map<String, Entry> filters = new LinkedHashMap<>();

    /**
     * Registry holding the filters every document may use.
     */
    public static FilterRegistry standard() {
        return StandardFilters.register(new FilterRegistry());
    }

    public FilterRegistry register(String name, ConfigFilter filter) {
        return register(name, 0, 0, filter);
    }

    public FilterRegistry register(String name, int minArguments, int maxArguments, ConfigFilter filter) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(filter, "filter");
        if (minArguments < 0 || maxArguments < minArguments) {
            throw new IllegalArgumentException("Invalid arity for filter '" + name + "': " + minArguments + ".." + maxArguments);
        }
        filters.put(name, new Entry(name, minArguments, maxArguments, filter));
        return this;
    }

    public Optional<Entry> get(String name) {
        return Optional.ofNullable(filters.get(name));
    }

    public Map<String, Entry> entries() {
        return Collections.unmodifiableMap(filters);
    }

    public record Entry(String name, int minArguments, int maxArguments, ConfigFilter filter) {
        public boolean accepts(int argumentCount) {
            return argumentCount >= minArguments && argumentCount <= maxArguments;
        }

        public String arity() {
            return minArguments == maxArguments ? Integer.toString(minArguments) : minArguments + ".." + maxArguments;
        }
    }
}
