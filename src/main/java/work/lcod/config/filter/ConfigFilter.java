package work.lcod.config.filter;

import java.util.List;
import work.lcod.config.value.ConfigValue;

/**
 * Pure function applied to a referenced value inside an expression's filter pipeline.
 * Implementations throw {@link IllegalArgumentException} when the input or arguments do not fit.
 */
@FunctionalInterface
public interface ConfigFilter {
    ConfigValue apply(ConfigValue input, List<ConfigValue> arguments);
}
