package ca.gc.cra.taskwerk.domain.config;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Value types a {@link SchemaField} may declare.
 *
 * <p>{@link #INTEGER} is stricter than {@link #NUMBER}: it accepts only whole numbers, whatever the boxed
 * representation produced by the YAML or JSON parser.</p>
 *
 * @since 0.1.0
 */
public enum FieldType {
  STRING,
  NUMBER,
  INTEGER,
  BOOLEAN,
  OBJECT,
  ARRAY;

  /**
   * Returns the lower-case schema name used in violation messages.
   *
   * @return schema type name, e.g. {@code integer}
   */
  public String schemaName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Checks whether {@code value} is an instance of this type.
   *
   * @param value candidate value; {@code null} never matches
   * @return {@code true} when the value conforms
   */
  public boolean accepts(Object value) {
    return switch (this) {
      case STRING -> value instanceof String;
      case NUMBER -> value instanceof Number number && isFinite(number);
      case INTEGER -> value instanceof Number number && isWholeNumber(number);
      case BOOLEAN -> value instanceof Boolean;
      case OBJECT -> value instanceof Map<?, ?>;
      case ARRAY -> value instanceof List<?>;
    };
  }

  /**
   * Names the type of an arbitrary parsed value, for the {@code actual} side of a violation.
   *
   * @param value parsed value; may be {@code null}
   * @return one of {@code string}, {@code number}, {@code boolean}, {@code object}, {@code array}, {@code null}
   */
  public static String describe(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof String) {
      return STRING.schemaName();
    }
    if (value instanceof Number) {
      return NUMBER.schemaName();
    }
    if (value instanceof Boolean) {
      return BOOLEAN.schemaName();
    }
    if (value instanceof Map<?, ?>) {
      return OBJECT.schemaName();
    }
    if (value instanceof List<?>) {
      return ARRAY.schemaName();
    }
    return value.getClass().getSimpleName();
  }

  static boolean isWholeNumber(Number number) {
    if (number instanceof Integer
        || number instanceof Long
        || number instanceof Short
        || number instanceof Byte
        || number instanceof BigInteger) {
      return true;
    }
    if (number instanceof BigDecimal decimal) {
      return decimal.stripTrailingZeros().scale() <= 0;
    }
    double value = number.doubleValue();
    return Double.isFinite(value) && value == Math.rint(value);
  }

  private static boolean isFinite(Number number) {
    if (number instanceof Double || number instanceof Float) {
      return Double.isFinite(number.doubleValue());
    }
    return true;
  }
}
