package work.lcod.config.value;

public record NullValue() implements ConfigValue {
    public static final NullValue INSTANCE = new NullValue();

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public Object toPlain() {
        return null;
    }
}
