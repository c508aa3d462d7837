package ca.gc.cra.taskwerk.logging;

/**
 * Renders configuration values for log lines and violation messages.
 *
 * <p>Values of sensitive fields are replaced outright; everything else is shortened to a fixed number of
 * code points so a pasted document cannot flood the log.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Replacement for the value of a sensitive field. */
  public static final String REDACTED = "[REDACTED]";
  private static final String NULL_VALUE = "<null>";
  private static final int DEFAULT_MAX_CODE_POINTS = 64;

  private Logs() {
    // Utility
  }

  /**
   * Renders a configuration value.
   *
   * @param value value as read from a layer; may be {@code null}
   * @param sensitive whether the value belongs to a secret field
   * @return {@link #REDACTED} for secrets, otherwise the value shortened by {@link #truncate}
   */
  public static String describeValue(Object value, boolean sensitive) {
    if (sensitive) {
      return REDACTED;
    }
    return truncate(value == null ? null : String.valueOf(value), DEFAULT_MAX_CODE_POINTS);
  }

  /**
   * Shortens {@code value} to at most {@code maxCodePoints} code points, never splitting a surrogate pair.
   *
   * @param value text; {@code null} renders as {@code <null>}
   * @param maxCodePoints code points to keep; must be positive
   * @return the value, or its prefix followed by {@code ... (+N more)}
   * @throws IllegalArgumentException if {@code maxCodePoints} is not positive
   */
  public static String truncate(String value, int maxCodePoints) {
    if (maxCodePoints <= 0) {
      throw new IllegalArgumentException("maxCodePoints must be positive");
    }
    if (value == null) {
      return NULL_VALUE;
    }
    int total = value.codePointCount(0, value.length());
    if (total <= maxCodePoints) {
      return value;
    }
    int cut = value.offsetByCodePoints(0, maxCodePoints);
    return value.substring(0, cut) + "... (+" + (total - maxCodePoints) + " more)";
  }
}
