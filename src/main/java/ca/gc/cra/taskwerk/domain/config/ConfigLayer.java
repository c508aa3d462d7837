package ca.gc.cra.taskwerk.domain.config;

/**
 * <strong>What:</strong> The four configuration sources, in ascending precedence.
 * <p><strong>Why:</strong> Merge order and source attribution both key off the declared priority, so the
 * ordering lives in one place and can never be inverted by a caller.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ConfigLayer {
  /** Values generated from the schema; never persisted. */
  DEFAULT(0, false),
  /** Per-user file shared by every project. */
  GLOBAL(1, true),
  /** Per-project file under the project dotdirectory. */
  LOCAL(2, true),
  /** Values derived from {@code TASKWERK_*} environment variables; recomputed on every load. */
  ENV(3, false);

  private final int priority;
  private final boolean persisted;

  ConfigLayer(int priority, boolean persisted) {
    this.priority = priority;
    this.persisted = persisted;
  }

  /**
   * Returns the merge priority; higher values win.
   *
   * @return priority between {@code 0} and {@code 3}
   */
  public int priority() {
    return priority;
  }

  /**
   * Indicates whether the layer is backed by a file.
   *
   * @return {@code true} for {@link #GLOBAL} and {@link #LOCAL}
   */
  public boolean persisted() {
    return persisted;
  }

  /**
   * Returns whether this layer strictly outranks {@code other}.
   *
   * @param other layer to compare against; {@code null} is outranked by every layer
   * @return {@code true} when this layer's priority is strictly higher
   */
  public boolean outranks(ConfigLayer other) {
    return other == null || priority > other.priority;
  }
}
