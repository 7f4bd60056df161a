package work.lcod.config.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.config.value.BooleanValue;
import work.lcod.config.value.ConfigValue;
import work.lcod.config.value.ListValue;
import work.lcod.config.value.MapValue;
import work.lcod.config.value.NullValue;
import work.lcod.config.value.NumberValue;
import work.lcod.config.value.StringValue;

/**
 * Reads YAML, JSON or TOML documents into {@link ConfigValue} trees, keeping key order.
 */
public final class ConfigLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private ConfigLoader() {}

    public static ConfigValue load(Path path) {
        return load(path, DocumentFormat.detect(path));
    }

    public static ConfigValue load(Path path, DocumentFormat format) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
        try {
            return parse(text, format);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid configuration file " + path + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Parses document text; an empty document is an empty map.
     *
     * @throws IllegalArgumentException when the text is not valid in {@code format}
     */
    public static ConfigValue parse(String text, DocumentFormat format) {
        if (text == null || text.isBlank()) {
            return MapValue.EMPTY;
        }
        if (format == DocumentFormat.TOML) {
            return parseToml(text);
        }
        var mapper = format == DocumentFormat.JSON ? JSON_MAPPER : YAML_MAPPER;
        try {
            var root = mapper.readTree(text);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return MapValue.EMPTY;
            }
            return convertNode(root);
        } catch (IOException ex) {
            throw new IllegalArgumentException(format.name().toLowerCase(Locale.ROOT) + " parse error: " + ex.getMessage(), ex);
        }
    }

    private static ConfigValue convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, ConfigValue>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return new MapValue(map);
        }
        if (node.isArray()) {
            var list = new ArrayList<ConfigValue>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return new ListValue(list);
        }
        if (node.isIntegralNumber()) {
            return new NumberValue(narrow(node.bigIntegerValue()));
        }
        if (node.isNumber()) {
            return new NumberValue(node.doubleValue());
        }
        if (node.isBoolean()) {
            return BooleanValue.of(node.booleanValue());
        }
        if (node.isNull()) {
            return NullValue.INSTANCE;
        }
        return new StringValue(node.asText());
    }

    private static ConfigValue parseToml(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("toml parse error: " + result.errors().get(0).toString());
        }
        return convertTomlTable(result);
    }

    private static ConfigValue convertTomlTable(TomlTable table) {
        var map = new LinkedHashMap<String, ConfigValue>();
        for (String key : table.keySet()) {
            map.put(key, convertTomlValue(table.get(key)));
        }
        return new MapValue(map);
    }

    private static ConfigValue convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<ConfigValue>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertTomlValue(array.get(i)));
            }
            return new ListValue(list);
        }
        if (value instanceof Long number) {
            return new NumberValue(narrow(BigInteger.valueOf(number)));
        }
        if (value instanceof Double number) {
            return new NumberValue(number);
        }
        if (value instanceof Boolean bool) {
            return BooleanValue.of(bool);
        }
        if (value == null) {
            return NullValue.INSTANCE;
        }
        // dates and times stay in their TOML text form
        return new StringValue(value.toString());
    }

    private static Number narrow(BigInteger value) {
        if (value.bitLength() < 32) {
            return value.intValue();
        }
        if (value.bitLength() < 64) {
            return value.longValue();
        }
        return value;
    }
}
