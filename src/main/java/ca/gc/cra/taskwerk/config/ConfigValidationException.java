package ca.gc.cra.taskwerk.config;

import ca.gc.cra.taskwerk.domain.config.Violation;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a configuration tree violates the schema. Carries every violation found, not only the first.
 *
 * @since 0.1.0
 */
public final class ConfigValidationException extends ConfigurationException {
  private static final long serialVersionUID = 1L;

  private final transient List<Violation> violations;

  /**
   * Creates an aggregated validation failure.
   *
   * @param violations complete violation list; must not be empty
   */
  public ConfigValidationException(List<Violation> violations) {
    super(render(violations), "validation");
    this.violations = List.copyOf(violations);
  }

  /**
   * Returns all violations in discovery order.
   *
   * @return immutable violation list
   */
  public List<Violation> violations() {
    return violations;
  }

  private static String render(List<Violation> violations) {
    if (violations == null || violations.isEmpty()) {
      throw new IllegalArgumentException("validation failure requires at least one violation");
    }
    return "Configuration validation failed (" + violations.size() + " violation"
        + (violations.size() == 1 ? "" : "s") + "): "
        + violations.stream().map(Violation::describe).collect(Collectors.joining("; "));
  }
}
