package ca.gc.cra.taskwerk.application.port;

import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Port supplying a snapshot of process environment variables.
 * <p><strong>Why:</strong> The environment overlay and path resolution both read the environment; routing
 * the reads through a port lets tests inject a fixed map instead of mutating the JVM environment.</p>
 * <p><strong>Thread-safety:</strong> Implementations should return immutable snapshots.</p>
 *
 * @implNote Default implementation delegates to {@link System#getenv()}.
 * @since 0.1.0
 */
@FunctionalInterface
public interface EnvironmentPort {

  /**
   * Returns every visible environment variable.
   *
   * @return name to value map; never {@code null}
   */
  Map<String, String> variables();

  /**
   * Returns a single variable when set to a non-blank value.
   *
   * @param name variable name
   * @return trimmed value
   */
  default Optional<String> variable(String name) {
    String value = variables().get(name);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  /** Environment of the running process. */
  EnvironmentPort SYSTEM = System::getenv;

  /**
   * Creates a port over a fixed map, typically for tests.
   *
   * @param variables variables to expose; copied
   * @return port returning the copy
   */
  static EnvironmentPort of(Map<String, String> variables) {
    Map<String, String> copy = Map.copyOf(variables);
    return () -> copy;
  }
}
