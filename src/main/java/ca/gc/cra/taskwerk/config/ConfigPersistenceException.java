package ca.gc.cra.taskwerk.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Thrown when a layer file or its parent directory cannot be written.
 *
 * @since 0.1.0
 */
public final class ConfigPersistenceException extends ConfigurationException {
  private static final long serialVersionUID = 1L;

  private final transient Path path;

  /**
   * Creates a persistence failure for {@code path}.
   *
   * @param path target file
   * @param cause IO failure
   */
  public ConfigPersistenceException(Path path, Throwable cause) {
    super("Failed to save configuration to " + path + ": " + cause.getMessage(), "save", cause);
    this.path = Objects.requireNonNull(path, "path");
  }

  /**
   * Returns the file that could not be written.
   *
   * @return file path
   */
  public Path path() {
    return path;
  }
}
