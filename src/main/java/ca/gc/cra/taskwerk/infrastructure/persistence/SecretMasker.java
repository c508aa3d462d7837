package ca.gc.cra.taskwerk.infrastructure.persistence;

import ca.gc.cra.taskwerk.config.ConfigSchema;
import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigTrees;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Replaces sensitive leaves with a fixed placeholder.
 * <p><strong>Why:</strong> Secrets must never reach disk or printed output; masking works on a deep copy so the
 * live layer keeps its real values until the process exits.</p>
 * <p><strong>Thread-safety:</strong> Stateless after construction.</p>
 *
 * @since 0.1.0
 */
public final class SecretMasker {
  /** Placeholder written in place of every real secret. */
  public static final String PLACEHOLDER = "********";

  private final List<ConfigPath> sensitivePaths;

  /**
   * Creates a masker for the sensitive fields declared in {@code schema}.
   *
   * @param schema schema registry
   */
  public SecretMasker(ConfigSchema schema) {
    this.sensitivePaths = Objects.requireNonNull(schema, "schema").sensitivePaths();
  }

  /**
   * Returns a deep copy of {@code tree} with every real sensitive value replaced by {@link #PLACEHOLDER}.
   * Empty strings and absent values are left untouched. The input is never modified.
   *
   * @param tree tree to mask; {@code null} yields an empty tree
   * @return masked copy
   */
  public Map<String, Object> mask(Map<String, ?> tree) {
    Map<String, Object> copy = ConfigTrees.deepCopy(tree);
    for (ConfigPath path : sensitivePaths) {
      if (isRealSecret(ConfigTrees.find(copy, path))) {
        ConfigTrees.put(copy, path, PLACEHOLDER);
      }
    }
    return copy;
  }

  /**
   * Returns whether any sensitive path of {@code tree} holds a real (non-empty, non-placeholder) value.
   *
   * @param tree tree to inspect; may be {@code null}
   * @return {@code true} when at least one secret is present
   */
  public boolean hasSensitiveData(Map<String, ?> tree) {
    if (tree == null) {
      return false;
    }
    for (ConfigPath path : sensitivePaths) {
      if (isRealSecret(ConfigTrees.find(tree, path))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Removes sensitive leaves that hold the placeholder, so a masked file never shadows a real secret from a
   * lower layer.
   *
   * @param tree parsed layer; mutated in place
   * @return paths that were removed
   */
  public List<ConfigPath> stripPlaceholders(Map<String, Object> tree) {
    List<ConfigPath> removed = new ArrayList<>();
    for (ConfigPath path : sensitivePaths) {
      if (ConfigTrees.find(tree, path).filter(SecretMasker::isPlaceholder).isPresent()) {
        ConfigTrees.remove(tree, path);
        removed.add(path);
      }
    }
    return removed;
  }

  /**
   * Returns whether {@code value} is the placeholder.
   *
   * @param value candidate
   * @return {@code true} for {@link #PLACEHOLDER}
   */
  public static boolean isPlaceholder(Object value) {
    return PLACEHOLDER.equals(value);
  }

  private static boolean isRealSecret(Optional<Object> value) {
    return value
        .filter(candidate -> !(candidate instanceof String text && text.isEmpty()))
        .filter(candidate -> !isPlaceholder(candidate))
        .isPresent();
  }
}
