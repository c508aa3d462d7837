package ca.gc.cra.taskwerk.config;

import ca.gc.cra.taskwerk.domain.config.ConfigLayer;
import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigTrees;
import java.util.Map;
import java.util.Objects;

/**
 * Deep-merges configuration layers in precedence order.
 *
 * <p>Both operations are pure: inputs are never modified and every value in the result is a fresh copy.
 * A map on both sides is merged key by key unless the schema declares a leaf at that path, in which case
 * the higher layer replaces the whole value like any scalar or list.</p>
 *
 * @since 0.1.0
 */
public final class ConfigMerger {
  private final ConfigSchema schema;

  /**
   * Creates a merger that consults {@code schema} for leaf boundaries.
   *
   * @param schema schema registry
   */
  public ConfigMerger(ConfigSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /**
   * Merges the loaded layers from {@link ConfigLayer#DEFAULT} up to {@link ConfigLayer#ENV}.
   *
   * @param layers layer contents keyed by layer; absent or {@code null} entries are skipped
   * @return fresh merged tree
   */
  public Map<String, Object> merge(Map<ConfigLayer, ? extends Map<String, ?>> layers) {
    Objects.requireNonNull(layers, "layers");
    Map<String, Object> merged = ConfigTrees.emptyTree();
    for (ConfigLayer layer : ConfigLayer.values()) {
      Map<String, ?> data = layers.get(layer);
      if (data != null) {
        merged = deepMerge(merged, data);
      }
    }
    return merged;
  }

  /**
   * Returns {@code target} overlaid with {@code source}.
   *
   * @param target lower-precedence tree
   * @param source higher-precedence tree
   * @return fresh merged tree
   */
  public Map<String, Object> deepMerge(Map<String, ?> target, Map<String, ?> source) {
    Map<String, Object> result = ConfigTrees.deepCopy(target);
    if (source != null) {
      mergeInto(result, source, null);
    }
    return result;
  }

  private void mergeInto(Map<String, Object> result, Map<String, ?> source, ConfigPath prefix) {
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      String key = entry.getKey();
      ConfigPath path = prefix == null ? ConfigPath.ofKey(key) : prefix.child(key);
      Object incoming = entry.getValue();
      Object existing = result.get(key);
      if (incoming instanceof Map<?, ?> incomingMap && existing instanceof Map<?, ?>
          && !schema.isLeaf(path)) {
        mergeInto(ConfigTrees.asTree(existing), ConfigTrees.asTree(incomingMap), path);
      } else {
        result.put(key, ConfigTrees.copyValue(incoming));
      }
    }
  }
}
