package ca.gc.cra.taskwerk.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigFormatTest {

  @Test
  void formatFollowsExtension() {
    assertEquals(Optional.of(ConfigFormat.YAML), ConfigFormat.forPath(Path.of("config.yml")));
    assertEquals(Optional.of(ConfigFormat.YAML), ConfigFormat.forPath(Path.of("config.YAML")));
    assertEquals(Optional.of(ConfigFormat.JSON), ConfigFormat.forPath(Path.of("config.json")));
    assertTrue(ConfigFormat.forPath(Path.of("config")).isEmpty());
    assertTrue(ConfigFormat.forPath(Path.of("config.conf")).isEmpty());
  }

  @Test
  void yamlSerializesBlockStyle() {
    Map<String, Object> tree = new LinkedHashMap<>();
    tree.put("general", Map.of("defaultPriority", "high"));

    String yaml = ConfigFormat.YAML.serialize(tree);

    assertEquals("general:\n  defaultPriority: high\n", yaml);
    assertEquals(tree, ConfigFormat.YAML.parse(yaml));
  }

  @Test
  void jsonParsesNestedDocuments() {
    Object parsed = ConfigFormat.JSON.parse("{\"export\":{\"formats\":[\"json\"],\"includeDeleted\":true}}");

    assertEquals(Map.of("export", Map.of("formats", List.of("json"), "includeDeleted", true)), parsed);
  }

  @Test
  void emptyDocumentsParseToNull() {
    assertNull(ConfigFormat.YAML.parse(""));
    assertNull(ConfigFormat.JSON.parse("  \n"));
  }

  @Test
  void invalidContentIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigFormat.YAML.parse("a: [b"));
    assertThrows(IllegalArgumentException.class, () -> ConfigFormat.JSON.parse("{\"a\":"));
  }

  @Test
  void yamlRefusesArbitraryTypes() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigFormat.YAML.parse("!!java.io.File [\"/tmp\"]"));
  }
}
