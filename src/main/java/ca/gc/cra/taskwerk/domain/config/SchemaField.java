package ca.gc.cra.taskwerk.domain.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Immutable declaration of one configuration leaf.
 * <p><strong>Why:</strong> A single declaration drives default generation, runtime validation and secret
 * masking, so the three can never drift apart.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param type declared value type
 * @param defaultValue default applied by the default layer; empty when the field has none
 * @param allowedValues enum members; empty when unrestricted
 * @param pattern regular expression a string value must match (find semantics)
 * @param minimum inclusive lower bound for numeric values
 * @param maximum inclusive upper bound for numeric values
 * @param sensitive whether the value is a secret masked on disk and in masked reads
 * @param description human-readable description used in env exports
 * @since 0.1.0
 */
public record SchemaField(
    FieldType type,
    Optional<Object> defaultValue,
    List<Object> allowedValues,
    Optional<Pattern> pattern,
    Optional<Double> minimum,
    Optional<Double> maximum,
    boolean sensitive,
    String description) implements SchemaNode {

  public SchemaField {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(defaultValue, "defaultValue");
    allowedValues = List.copyOf(Objects.requireNonNull(allowedValues, "allowedValues"));
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(minimum, "minimum");
    Objects.requireNonNull(maximum, "maximum");
    description = description == null ? "" : description;
  }

  /**
   * Starts a builder for a field of the given type.
   *
   * @param type declared type
   * @return builder
   */
  public static Builder builder(FieldType type) {
    return new Builder(type);
  }

  /** Shorthand for {@code builder(FieldType.STRING)}. */
  public static Builder string() {
    return builder(FieldType.STRING);
  }

  /** Shorthand for {@code builder(FieldType.BOOLEAN)}. */
  public static Builder bool() {
    return builder(FieldType.BOOLEAN);
  }

  /** Shorthand for {@code builder(FieldType.INTEGER)}. */
  public static Builder integer() {
    return builder(FieldType.INTEGER);
  }

  /** Shorthand for {@code builder(FieldType.NUMBER)}. */
  public static Builder number() {
    return builder(FieldType.NUMBER);
  }

  /** Fluent builder used by the schema registry. */
  public static final class Builder {
    private final FieldType type;
    private Object defaultValue;
    private final List<Object> allowedValues = new ArrayList<>();
    private Pattern pattern;
    private Double minimum;
    private Double maximum;
    private boolean sensitive;
    private String description = "";

    private Builder(FieldType type) {
      this.type = Objects.requireNonNull(type, "type");
    }

    public Builder defaultValue(Object value) {
      this.defaultValue = Objects.requireNonNull(value, "default value");
      return this;
    }

    public Builder allowed(Object... values) {
      allowedValues.addAll(Arrays.asList(values));
      return this;
    }

    /**
     * Restricts string values to those containing a match of {@code regex}. An unescaped {@code $} outside a
     * character class matches only at the very end of the value, never before a trailing line terminator.
     *
     * @param regex regular expression
     * @return this builder
     */
    public Builder pattern(String regex) {
      this.pattern = Pattern.compile(endOfInputAnchors(regex));
      return this;
    }

    public Builder range(double min, double max) {
      if (min > max) {
        throw new IllegalArgumentException("minimum " + min + " exceeds maximum " + max);
      }
      this.minimum = min;
      this.maximum = max;
      return this;
    }

    public Builder minimum(double min) {
      this.minimum = min;
      return this;
    }

    public Builder maximum(double max) {
      this.maximum = max;
      return this;
    }

    public Builder sensitive() {
      this.sensitive = true;
      return this;
    }

    public Builder description(String text) {
      this.description = text;
      return this;
    }

    public SchemaField build() {
      return new SchemaField(
          type,
          Optional.ofNullable(defaultValue),
          allowedValues,
          Optional.ofNullable(pattern),
          Optional.ofNullable(minimum),
          Optional.ofNullable(maximum),
          sensitive,
          description);
    }

    private static String endOfInputAnchors(String regex) {
      StringBuilder out = new StringBuilder(regex.length() + 4);
      boolean inClass = false;
      for (int i = 0; i < regex.length(); i++) {
        char c = regex.charAt(i);
        if (c == '\\' && i + 1 < regex.length()) {
          out.append(c).append(regex.charAt(++i));
          continue;
        }
        if (c == '[') {
          inClass = true;
        } else if (c == ']') {
          inClass = false;
        } else if (c == '$' && !inClass) {
          out.append("\\z");
          continue;
        }
        out.append(c);
      }
      return out.toString();
    }
  }
}
