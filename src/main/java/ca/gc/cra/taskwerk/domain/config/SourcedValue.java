package ca.gc.cra.taskwerk.domain.config;

import java.util.Objects;

/**
 * Effective value paired with the layer that supplied it.
 *
 * @param value effective value; may be {@code null} when a file declares an empty key
 * @param source attributed layer
 * @since 0.1.0
 */
public record SourcedValue(Object value, ConfigLayer source) {
  public SourcedValue {
    Objects.requireNonNull(source, "source");
  }
}
