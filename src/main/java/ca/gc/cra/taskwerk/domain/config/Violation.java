package ca.gc.cra.taskwerk.domain.config;

import java.util.Objects;

/**
 * One schema violation found while validating a configuration tree.
 *
 * @param path dotted path of the offending value, or of the section missing a required key
 * @param expected what the schema demands (e.g. {@code one of low, medium, high})
 * @param actual what was found, rendered for diagnostics
 * @since 0.1.0
 */
public record Violation(String path, String expected, String actual) {

  public Violation {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(expected, "expected");
    Objects.requireNonNull(actual, "actual");
  }

  /**
   * Renders the violation for an aggregated error message.
   *
   * @return single-line description
   */
  public String describe() {
    return path + ": expected " + expected + ", got " + actual;
  }
}
