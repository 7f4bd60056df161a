package work.lcod.config.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import work.lcod.config.value.ConfigValue;

/**
 * Serializes resolved documents as pretty JSON or YAML.
 */
public final class ConfigWriter {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();
    private static final ObjectWriter YAML_WRITER = new ObjectMapper(
        new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
    ).writer();

    private ConfigWriter() {}

    public static String write(ConfigValue value, DocumentFormat format) {
        try {
            switch (format) {
                case JSON:
                    return JSON_WRITER.writeValueAsString(value.toPlain());
                case YAML:
                    return YAML_WRITER.writeValueAsString(value.toPlain());
                default:
                    throw new IllegalArgumentException("Writing " + format + " documents is not supported");
            }
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize document: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String toJson(ConfigValue value) {
        return write(value, DocumentFormat.JSON);
    }

    public static String toYaml(ConfigValue value) {
        return write(value, DocumentFormat.YAML);
    }
}
