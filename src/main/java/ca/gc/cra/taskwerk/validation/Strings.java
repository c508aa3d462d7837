package ca.gc.cra.taskwerk.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied to the configuration core.
 * <p><strong>Why:</strong> Dotted paths and environment prefixes come from callers and from the process
 * environment; rejecting blank or control-character input early keeps file and env handling predictable.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Verify environment-variable style identifiers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern ENV_IDENTIFIER = Pattern.compile("^[A-Z][A-Z0-9_]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an upper-case environment identifier such as {@code TASKWERK_}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate identifier
   * @return the validated identifier
   * @throws IllegalArgumentException if the value is not upper-case letters, digits and underscores
   */
  public static String requireEnvIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!ENV_IDENTIFIER.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must start with a letter and only contain A-Z, 0-9 or underscore"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
