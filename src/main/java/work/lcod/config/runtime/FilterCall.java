package work.lcod.config.runtime;

import java.util.List;
import java.util.Objects;
import work.lcod.config.value.ConfigValue;

/**
 * One {@code | name(args...)} segment of an expression's filter pipeline.
 */
public record FilterCall(String name, List<ConfigValue> arguments) {
    public FilterCall {
        Objects.requireNonNull(name, "name");
        arguments = List.copyOf(arguments);
    }
}
