package ca.gc.cra.taskwerk.config;

/**
 * Base unchecked exception for configuration failures.
 *
 * <p>Carries the operation that failed ({@code load}, {@code save}, {@code migrate}, ...) so callers can
 * report it without parsing the message.</p>
 *
 * @since 0.1.0
 */
public class ConfigurationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String operation;

  /**
   * Creates an exception for a failed operation.
   *
   * @param message human-readable error
   * @param operation operation label
   */
  public ConfigurationException(String message, String operation) {
    super(message);
    this.operation = operation;
  }

  /**
   * Creates an exception with an underlying cause.
   *
   * @param message human-readable error
   * @param operation operation label
   * @param cause root cause
   */
  public ConfigurationException(String message, String operation, Throwable cause) {
    super(message, cause);
    this.operation = operation;
  }

  /**
   * Returns the operation that failed.
   *
   * @return operation label such as {@code load}
   */
  public String operation() {
    return operation;
  }
}
