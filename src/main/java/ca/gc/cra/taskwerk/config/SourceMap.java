package ca.gc.cra.taskwerk.config;

import ca.gc.cra.taskwerk.domain.config.ConfigLayer;
import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigTrees;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Records which layer supplied each effective leaf.
 *
 * <p>A path is claimed by the first layer tracked for it and re-claimed only by a strictly higher layer, so
 * tracking order does not affect the result. Paths never tracked are attributed to
 * {@link ConfigLayer#DEFAULT}. Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class SourceMap {
  private final ConfigSchema schema;
  private final Map<ConfigPath, ConfigLayer> sources = new LinkedHashMap<>();

  /**
   * Creates an empty map using {@code schema} to find leaf boundaries.
   *
   * @param schema schema registry
   */
  public SourceMap(ConfigSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /** Forgets every attribution. */
  public void reset() {
    sources.clear();
  }

  /**
   * Attributes every leaf of {@code layerData} to {@code layer} where it outranks the current claimant.
   *
   * @param layerData contents of one layer; {@code null} is ignored
   * @param layer layer that holds the data
   */
  public void track(Map<String, ?> layerData, ConfigLayer layer) {
    Objects.requireNonNull(layer, "layer");
    ConfigTrees.forEachLeaf(layerData, schema::isLeaf, (path, value) -> {
      ConfigLayer current = sources.get(path);
      if (layer.outranks(current)) {
        sources.put(path, layer);
      }
    });
  }

  /**
   * Returns the layer that supplied {@code path}.
   *
   * @param path leaf path
   * @return attributed layer; {@link ConfigLayer#DEFAULT} when untracked
   */
  public ConfigLayer sourceOf(ConfigPath path) {
    return find(path).orElse(ConfigLayer.DEFAULT);
  }

  /**
   * Returns the recorded layer for {@code path}, if any.
   *
   * @param path leaf path
   * @return layer when tracked
   */
  public Optional<ConfigLayer> find(ConfigPath path) {
    return Optional.ofNullable(sources.get(Objects.requireNonNull(path, "path")));
  }

  /**
   * Returns a copy of every attribution in tracking order.
   *
   * @return immutable snapshot
   */
  public Map<ConfigPath, ConfigLayer> snapshot() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(sources));
  }

  /**
   * Rebuilds the map from the supplied layers.
   *
   * @param layers layer contents keyed by layer; absent entries are skipped
   */
  void rebuild(Map<ConfigLayer, ? extends Map<String, ?>> layers) {
    reset();
    for (ConfigLayer layer : ConfigLayer.values()) {
      Map<String, ?> data = layers.get(layer);
      if (data != null) {
        track(data, layer);
      }
    }
  }
}
