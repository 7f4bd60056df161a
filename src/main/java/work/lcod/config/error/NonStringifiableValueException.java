package work.lcod.config.error;

import work.lcod.config.runtime.LeafPath;

/**
 * An interpolated expression produced a list or map.
 */
public final class NonStringifiableValueException extends ResolutionException {
    private final LeafPath path;
    private final String expression;
    private final String valueType;

    public NonStringifiableValueException(LeafPath path, String expression, String valueType) {
        super(
            "non_stringifiable",
            "Cannot interpolate a " + valueType + " into a string at '" + path + "': '" + expression + "'"
        );
        this.path = path;
        this.expression = expression;
        this.valueType = valueType;
    }

    public LeafPath path() {
        return path;
    }

    public String expression() {
        return expression;
    }

    public String valueType() {
        return valueType;
    }
}
