package ca.gc.cra.taskwerk.config;

import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigSection;
import ca.gc.cra.taskwerk.domain.config.FieldType;
import ca.gc.cra.taskwerk.domain.config.SchemaField;
import ca.gc.cra.taskwerk.domain.config.SchemaNode;
import ca.gc.cra.taskwerk.domain.config.Violation;
import ca.gc.cra.taskwerk.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * <strong>What:</strong> Recursive validator checking a configuration tree against the schema registry.
 * <p><strong>Why:</strong> Operators fix configuration in one pass when every problem is reported, so the
 * validator collects all violations before failing.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Flag unknown keys in sections that disallow additional properties, and missing required keys.</li>
 *   <li>Check type, enum membership, pattern (strings) and inclusive range (numbers) of present fields.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless after construction; safe to share.</p>
 * <p><strong>Security:</strong> Values of sensitive fields are never echoed into violation records.</p>
 *
 * @since 0.1.0
 */
public final class SchemaValidator {
  private final ConfigSchema schema;

  /**
   * Creates a validator for {@code schema}.
   *
   * @param schema registry to validate against
   */
  public SchemaValidator(ConfigSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /**
   * Validates a tree and throws when it violates the schema.
   *
   * @param tree merged or proposed configuration
   * @throws ConfigValidationException carrying every violation when at least one is found
   */
  public void validate(Map<String, ?> tree) {
    List<Violation> found = violations(tree);
    if (!found.isEmpty()) {
      throw new ConfigValidationException(found);
    }
  }

  /**
   * Collects all violations without throwing.
   *
   * @param tree configuration tree
   * @return violations in discovery order; empty when the tree is valid
   */
  public List<Violation> violations(Map<String, ?> tree) {
    Objects.requireNonNull(tree, "tree");
    List<Violation> found = new ArrayList<>();
    validateSection(tree, schema.root(), null, found);
    return found;
  }

  /**
   * Checks a single value about to be written at {@code path}, without looking at the rest of the tree.
   * Undeclared paths are accepted unless an enclosing section disallows additional properties.
   *
   * @param path target path
   * @param value proposed value
   * @return violations of the value alone; empty when acceptable
   */
  public List<Violation> violationsAt(ConfigPath path, Object value) {
    Objects.requireNonNull(path, "path");
    List<Violation> found = new ArrayList<>();
    Optional<SchemaNode> node = schema.root().find(path);
    if (node.isEmpty()) {
      checkUndeclared(path, found);
    } else if (node.get() instanceof ConfigSection section) {
      if (value instanceof Map<?, ?> map) {
        validateSection(map, section, path, found);
      } else {
        found.add(new Violation(path.toString(), FieldType.OBJECT.schemaName(), FieldType.describe(value)));
      }
    } else if (node.get() instanceof SchemaField field) {
      validateField(value, field, path, found);
    }
    return found;
  }

  private void checkUndeclared(ConfigPath path, List<Violation> out) {
    ConfigSection current = schema.root();
    for (String segment : path.segments()) {
      Optional<SchemaNode> child = current.child(segment);
      if (child.isEmpty()) {
        if (!current.additionalProperties()) {
          out.add(new Violation(path.toString(), "no undeclared properties", "unknown property"));
        }
        return;
      }
      if (!(child.get() instanceof ConfigSection nested)) {
        return;
      }
      current = nested;
    }
  }

  private void validateSection(Map<?, ?> object, ConfigSection section, ConfigPath prefix, List<Violation> out) {
    if (!section.additionalProperties()) {
      for (Object key : object.keySet()) {
        String name = String.valueOf(key);
        if (!section.children().containsKey(name)) {
          out.add(new Violation(pathOf(prefix, name), "no undeclared properties", "unknown property"));
        }
      }
    }
    for (String required : section.required()) {
      if (!object.containsKey(required)) {
        out.add(new Violation(pathOf(prefix, required), "required property", "missing"));
      }
    }
    for (Map.Entry<String, SchemaNode> entry : section.children().entrySet()) {
      String key = entry.getKey();
      if (!object.containsKey(key)) {
        continue;
      }
      ConfigPath path = prefix == null ? ConfigPath.of(key) : prefix.child(key);
      Object value = object.get(key);
      if (entry.getValue() instanceof ConfigSection nested) {
        if (value instanceof Map<?, ?> map) {
          validateSection(map, nested, path, out);
        } else {
          out.add(new Violation(path.toString(), FieldType.OBJECT.schemaName(), FieldType.describe(value)));
        }
      } else if (entry.getValue() instanceof SchemaField field) {
        validateField(value, field, path, out);
      }
    }
  }

  private void validateField(Object value, SchemaField field, ConfigPath path, List<Violation> out) {
    String where = path.toString();
    if (!field.type().accepts(value)) {
      out.add(new Violation(where, field.type().schemaName(), FieldType.describe(value)));
      return;
    }
    if (!field.allowedValues().isEmpty() && !field.allowedValues().contains(value)) {
      String members = field.allowedValues().stream().map(String::valueOf).collect(Collectors.joining(", "));
      out.add(new Violation(where, "one of " + members, render(value, field)));
    }
    if (field.pattern().isPresent() && value instanceof String text
        && !field.pattern().get().matcher(text).find()) {
      out.add(new Violation(where, "match for pattern " + field.pattern().get().pattern(), render(value, field)));
    }
    if (value instanceof Number number) {
      double numeric = number.doubleValue();
      field.minimum().filter(min -> numeric < min).ifPresent(min ->
          out.add(new Violation(where, ">= " + formatBound(min), render(value, field))));
      field.maximum().filter(max -> numeric > max).ifPresent(max ->
          out.add(new Violation(where, "<= " + formatBound(max), render(value, field))));
    }
  }

  private static String render(Object value, SchemaField field) {
    return Logs.describeValue(value, field.sensitive());
  }

  private static String formatBound(double bound) {
    if (bound == Math.rint(bound) && Math.abs(bound) < 1e15) {
      return Long.toString((long) bound);
    }
    return Double.toString(bound);
  }

  private static String pathOf(ConfigPath prefix, String key) {
    return prefix == null ? key : prefix + "." + key;
  }
}
