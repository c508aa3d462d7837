package ca.gc.cra.taskwerk.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Thrown when a layer file exists but cannot be parsed as YAML or JSON, or its root is not a mapping.
 *
 * @since 0.1.0
 */
public final class ConfigParseException extends ConfigurationException {
  private static final long serialVersionUID = 1L;

  private final transient Path path;

  /**
   * Creates a parse failure for {@code path}.
   *
   * @param path file that failed to parse
   * @param detail short reason
   * @param cause parser exception; may be {@code null}
   */
  public ConfigParseException(Path path, String detail, Throwable cause) {
    super("Failed to parse configuration file " + path + ": " + detail, "load", cause);
    this.path = Objects.requireNonNull(path, "path");
  }

  /**
   * Returns the file that failed to parse.
   *
   * @return file path
   */
  public Path path() {
    return path;
  }
}
