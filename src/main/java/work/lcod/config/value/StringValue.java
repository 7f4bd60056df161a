package work.lcod.config.value;

import java.util.Objects;

public record StringValue(String value) implements ConfigValue {
    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public Object toPlain() {
        return value;
    }
}
