package work.lcod.config.value;

import java.util.Optional;

/**
 * Canonical text of scalar values, as used for string interpolation.
 */
public final class Scalars {
    private Scalars() {}

    /**
     * Decimal text for numbers, {@code true}/{@code false}, {@code null}; empty for lists and maps.
     */
    public static Optional<String> text(ConfigValue value) {
        if (value instanceof StringValue str) {
            return Optional.of(str.value());
        }
        if (value instanceof NumberValue number) {
            return Optional.of(number.toDecimalString());
        }
        if (value instanceof BooleanValue bool) {
            return Optional.of(Boolean.toString(bool.value()));
        }
        if (value instanceof NullValue) {
            return Optional.of("null");
        }
        return Optional.empty();
    }
}
