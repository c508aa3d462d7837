package ca.gc.cra.taskwerk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.taskwerk.domain.config.ConfigLayer;
import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigSection;
import ca.gc.cra.taskwerk.domain.config.ConfigTrees;
import ca.gc.cra.taskwerk.domain.config.FieldType;
import ca.gc.cra.taskwerk.domain.config.SchemaField;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
  private final ConfigMerger merger = new ConfigMerger(ConfigSchema.taskwerk());

  @Test
  void nestedMapsMergeKeyByKey() {
    Map<String, Object> target = Map.of("x", Map.of("p", 1, "q", 2));
    Map<String, Object> source = Map.of("x", Map.of("q", 3));

    assertEquals(Map.of("x", Map.of("p", 1, "q", 3)), merger.deepMerge(target, source));
  }

  @Test
  void inputsAreNotModified() {
    Map<String, Object> target = ConfigTrees.emptyTree();
    ConfigTrees.put(target, ConfigPath.parse("x.p"), 1);
    Map<String, Object> source = ConfigTrees.emptyTree();
    ConfigTrees.put(source, ConfigPath.parse("x.q"), 3);
    Map<String, Object> targetBefore = ConfigTrees.deepCopy(target);
    Map<String, Object> sourceBefore = ConfigTrees.deepCopy(source);

    Map<String, Object> result = merger.deepMerge(target, source);
    ConfigTrees.put(result, ConfigPath.parse("x.p"), 99);

    assertEquals(targetBefore, target);
    assertEquals(sourceBefore, source);
  }

  @Test
  void scalarsAndListsReplaceOutright() {
    Map<String, Object> target = Map.of("a", Map.of("list", List.of(1, 2), "s", "old"));
    Map<String, Object> source = Map.of("a", Map.of("list", List.of(3), "s", Map.of("nested", true)));

    assertEquals(Map.of("a", Map.of("list", List.of(3), "s", Map.of("nested", true))),
        merger.deepMerge(target, source));
  }

  @Test
  void declaredObjectLeavesAreReplacedWhole() {
    ConfigMerger schemaAware = new ConfigMerger(new ConfigSchema(ConfigSection.builder("")
        .section(ConfigSection.builder("ai")
            .field("headers", SchemaField.builder(FieldType.OBJECT))
            .build())
        .build()));
    Map<String, Object> target = Map.of("ai", Map.of("headers", Map.of("a", "1")));
    Map<String, Object> source = Map.of("ai", Map.of("headers", Map.of("b", "2")));

    assertEquals(Map.of("ai", Map.of("headers", Map.of("b", "2"))), schemaAware.deepMerge(target, source));
  }

  @Test
  void mergeAppliesLayersInPrecedenceOrder() {
    Map<ConfigLayer, Map<String, Object>> layers = new EnumMap<>(ConfigLayer.class);
    layers.put(ConfigLayer.ENV, Map.of("general", Map.of("defaultPriority", "critical")));
    layers.put(ConfigLayer.DEFAULT, Map.of("general", Map.of("defaultPriority", "medium", "dateFormat", "X")));
    layers.put(ConfigLayer.GLOBAL, Map.of("general", Map.of("defaultPriority", "high")));

    Map<String, Object> merged = merger.merge(layers);

    assertEquals(Map.of("general", Map.of("defaultPriority", "critical", "dateFormat", "X")), merged);
  }
}
