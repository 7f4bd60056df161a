package work.lcod.config.filter;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import work.lcod.config.value.BooleanValue;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.ListValue;
import work.lcod.config.value.MapValue;
import work.lcod.config.value.NullValue;
import work.lcod.config.value.NumberValue;
import work.lcod.config.value.Scalars;
import work.lcod.config.value.StringValue;

/**
 * String and conversion filters available to configuration expressions.
 */
public final class StandardFilters {
    private StandardFilters() {}

    public static FilterRegistry register(FilterRegistry registry) {
        registry.register("lower", (input, args) -> text(scalarText(input, "lower").toLowerCase(Locale.ROOT)));
        registry.register("upper", (input, args) -> text(scalarText(input, "upper").toUpperCase(Locale.ROOT)));
        registry.register("title", (input, args) -> text(title(scalarText(input, "title"))));
        registry.register("capitalize", (input, args) -> text(capitalize(scalarText(input, "capitalize"))));
        registry.register("trim", (input, args) -> text(scalarText(input, "trim").strip()));
        registry.register("replace", 2, 2, StandardFilters::replace);
        registry.register("quote", (input, args) -> text("\"" + scalarText(input, "quote") + "\""));
        registry.register("default", 1, 1, (input, args) -> input instanceof NullValue ? args.get(0) : input);
        registry.register("string", (input, args) -> text(scalarText(input, "string")));
        registry.register("int", 0, 1, StandardFilters::toInt);
        registry.register("float", 0, 1, StandardFilters::toFloat);
        registry.register("length", StandardFilters::length);
        registry.register("join", 0, 1, StandardFilters::join);
        return registry;
    }

    /**
     * Canonical text of a scalar; lists and maps are rejected.
     */
    public static String scalarText(ConfigValue value, String filter) {
        return Scalars.text(value)
            .orElseThrow(() -> new IllegalArgumentException("filter '" + filter + "' expects a scalar, got " + value.typeName()));
    }

    private static ConfigValue replace(ConfigValue input, List<ConfigValue> args) {
        var source = scalarText(input, "replace");
        var target = scalarText(args.get(0), "replace");
        var replacement = scalarText(args.get(1), "replace");
        return text(source.replace(target, replacement));
    }

    private static ConfigValue toInt(ConfigValue input, List<ConfigValue> args) {
        if (input instanceof NumberValue number) {
            return number.isIntegral() ? number : new NumberValue((long) number.value().doubleValue());
        }
        if (input instanceof BooleanValue bool) {
            return new NumberValue(bool.value() ? 1 : 0);
        }
        if (input instanceof StringValue str) {
            var trimmed = str.value().strip();
            try {
                long parsed = Long.parseLong(trimmed);
                return parsed == (int) parsed ? new NumberValue((int) parsed) : new NumberValue(parsed);
            } catch (NumberFormatException ex) {
                try {
                    return new NumberValue((long) Double.parseDouble(trimmed));
                } catch (NumberFormatException ignored) {
                    return fallback(args, new NumberValue(0));
                }
            }
        }
        return fallback(args, new NumberValue(0));
    }

    private static ConfigValue toFloat(ConfigValue input, List<ConfigValue> args) {
        if (input instanceof NumberValue number) {
            return new NumberValue(number.value().doubleValue());
        }
        if (input instanceof BooleanValue bool) {
            return new NumberValue(bool.value() ? 1.0 : 0.0);
        }
        if (input instanceof StringValue str) {
            try {
                return new NumberValue(Double.parseDouble(str.value().strip()));
            } catch (NumberFormatException ex) {
                return fallback(args, new NumberValue(0.0));
            }
        }
        return fallback(args, new NumberValue(0.0));
    }

    private static ConfigValue fallback(List<ConfigValue> args, ConfigValue defaultValue) {
        return args.isEmpty() ? defaultValue : args.get(0);
    }

    private static ConfigValue length(ConfigValue input, List<ConfigValue> args) {
        if (input instanceof StringValue str) {
            return new NumberValue(str.value().codePointCount(0, str.value().length()));
        }
        if (input instanceof ListValue list) {
            return new NumberValue(list.size());
        }
        if (input instanceof MapValue map) {
            return new NumberValue(map.entries().size());
        }
        throw new IllegalArgumentException("filter 'length' expects a string, list or map, got " + input.typeName());
    }

    private static ConfigValue join(ConfigValue input, List<ConfigValue> args) {
        if (!(input instanceof ListValue list)) {
            throw new IllegalArgumentException("filter 'join' expects a list, got " + input.typeName());
        }
        var separator = args.isEmpty() ? "" : scalarText(args.get(0), "join");
        return text(list.items().stream()
            .map(item -> scalarText(item, "join"))
            .collect(Collectors.joining(separator)));
    }

    private static String title(String value) {
        var out = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                out.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                out.append(c);
                startOfWord = !Character.isDigit(c);
            }
        }
        return out.toString();
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase(Locale.ROOT);
    }

    private static ConfigValue text(String value) {
        return new StringValue(value);
    }
}
