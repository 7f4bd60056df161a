package work.lcod.config.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Integral numbers keep their boxed integral type; everything else is carried as a {@code Double}.
 */
public record NumberValue(Number value) implements ConfigValue {
    public NumberValue {
        Objects.requireNonNull(value, "value");
    }

    public boolean isIntegral() {
        return value instanceof Integer
            || value instanceof Long
            || value instanceof Short
            || value instanceof Byte
            || value instanceof BigInteger;
    }

    /**
     * Decimal text: integers as-is, floating numbers in plain notation ({@code 2.0}, {@code 0.5}).
     */
    public String toDecimalString() {
        if (isIntegral()) {
            return value.toString();
        }
        double d = value.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        var text = BigDecimal.valueOf(d).toPlainString();
        return text.contains(".") ? text : text + ".0";
    }

    @Override
    public String typeName() {
        return isIntegral() ? "integer" : "float";
    }

    @Override
    public Object toPlain() {
        return value;
    }
}
