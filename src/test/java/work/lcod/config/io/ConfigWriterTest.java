package work.lcod.config.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.config.support.ConfigTestSupport.list;
import static work.lcod.config.support.ConfigTestSupport.map;

import org.junit.jupiter.api.Test;
import work.lcod.config.value.MapValue;

class ConfigWriterTest {
    private final MapValue document = map(
        "name", "billing",
        "port", 8080,
        "ratio", 2.0,
        "enabled", true,
        "missing", null,
        "tags", list("a", "b")
    );

    @Test
    void jsonIsPrettyAndReadable() {
        var json = ConfigWriter.toJson(document);

        assertTrue(json.contains("\"port\" : 8080"), json);
        assertTrue(json.contains("\"ratio\" : 2.0"), json);
        assertTrue(json.indexOf("\"name\"") < json.indexOf("\"tags\""), json);
        assertEquals(document, ConfigLoader.parse(json, DocumentFormat.JSON));
    }

    @Test
    void yamlHasNoDocumentMarker() {
        var yaml = ConfigWriter.toYaml(document);

        assertFalse(yaml.startsWith("---"), yaml);
        assertTrue(yaml.contains("name: billing"), yaml);
        assertEquals(document, ConfigLoader.parse(yaml, DocumentFormat.YAML));
    }

    @Test
    void tomlOutputIsUnsupported() {
        assertThrows(IllegalArgumentException.class, () -> ConfigWriter.write(document, DocumentFormat.TOML));
    }
}
