package ca.gc.cra.taskwerk.domain.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named group of schema nodes. The schema root is itself a section.
 *
 * @param name section name; {@code ""} for the root
 * @param children ordered child nodes keyed by property name
 * @param required names of children that must be present in a validated object
 * @param additionalProperties whether keys not declared in {@code children} are tolerated
 * @since 0.1.0
 */
public record ConfigSection(
    String name,
    Map<String, SchemaNode> children,
    Set<String> required,
    boolean additionalProperties) implements SchemaNode {

  public ConfigSection {
    Objects.requireNonNull(name, "name");
    children = Collections.unmodifiableMap(
        new LinkedHashMap<>(Objects.requireNonNull(children, "children")));
    required = Collections.unmodifiableSet(
        new LinkedHashSet<>(Objects.requireNonNull(required, "required")));
    for (String key : required) {
      if (!children.containsKey(key)) {
        throw new IllegalArgumentException("section '" + name + "' requires undeclared child " + key);
      }
    }
  }

  /**
   * Starts a builder for a section.
   *
   * @param name section name
   * @return builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Looks up a direct child.
   *
   * @param key child name
   * @return child node when declared
   */
  public Optional<SchemaNode> child(String key) {
    return Optional.ofNullable(children.get(key));
  }

  /**
   * Walks {@code path} from this section.
   *
   * @param path path relative to this section
   * @return node at the path when every segment is declared
   */
  public Optional<SchemaNode> find(ConfigPath path) {
    SchemaNode current = this;
    for (String segment : path.segments()) {
      if (!(current instanceof ConfigSection section)) {
        return Optional.empty();
      }
      current = section.children.get(segment);
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  /**
   * Returns the field declared at {@code path}.
   *
   * @param path path relative to this section
   * @return field when the path resolves to a leaf declaration
   */
  public Optional<SchemaField> field(ConfigPath path) {
    return find(path).filter(SchemaField.class::isInstance).map(SchemaField.class::cast);
  }

  /**
   * Returns whether the schema declares a leaf at {@code path}.
   *
   * @param path path relative to this section
   * @return {@code true} when a field is declared there
   */
  public boolean isLeaf(ConfigPath path) {
    return field(path).isPresent();
  }

  /** Fluent builder used by the schema registry. */
  public static final class Builder {
    private final String name;
    private final Map<String, SchemaNode> children = new LinkedHashMap<>();
    private final Set<String> required = new LinkedHashSet<>();
    private boolean additionalProperties = true;

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder field(String key, SchemaField field) {
      put(key, field);
      return this;
    }

    public Builder field(String key, SchemaField.Builder field) {
      return field(key, field.build());
    }

    public Builder section(ConfigSection section) {
      put(section.name(), section);
      return this;
    }

    public Builder required(String... keys) {
      required.addAll(List.of(keys));
      return this;
    }

    public Builder additionalProperties(boolean allowed) {
      this.additionalProperties = allowed;
      return this;
    }

    public ConfigSection build() {
      return new ConfigSection(name, children, required, additionalProperties);
    }

    private void put(String key, SchemaNode node) {
      if (children.putIfAbsent(key, node) != null) {
        throw new IllegalArgumentException("duplicate schema key '" + key + "' in section '" + name + "'");
      }
    }
  }
}
