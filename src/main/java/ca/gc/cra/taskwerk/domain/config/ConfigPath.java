package ca.gc.cra.taskwerk.domain.config;

import ca.gc.cra.taskwerk.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed configuration path: an ordered list of segments such as {@code [general, defaultPriority]}.
 *
 * <p>Parsed from and rendered to the dotted form used in files, logs and the source map. Paths built by
 * {@link #parse} and {@link #of} are addressable: every segment is non-blank and free of {@code .}. Paths
 * built from raw file keys through {@link #ofKey} and {@link #child} keep the keys verbatim.</p>
 *
 * @param segments path segments from the root; never empty
 * @since 0.1.0
 */
public record ConfigPath(List<String> segments) {

  public ConfigPath {
    Objects.requireNonNull(segments, "segments");
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("config path must have at least one segment");
    }
    for (String segment : segments) {
      Objects.requireNonNull(segment, "segment");
    }
    segments = List.copyOf(segments);
  }

  /**
   * Parses a dotted path such as {@code ai.apiKey}.
   *
   * @param dotted dotted path; must not be blank or contain empty segments
   * @return parsed path
   * @throws IllegalArgumentException when the path is blank or has empty segments
   */
  public static ConfigPath parse(String dotted) {
    String sanitized = Strings.requireNonBlank("config path", dotted);
    return addressable(List.of(sanitized.split("\\.", -1)));
  }

  /**
   * Builds a path from explicit segments.
   *
   * @param first first segment
   * @param rest remaining segments
   * @return path
   * @throws IllegalArgumentException when a segment is blank or contains {@code .}
   */
  public static ConfigPath of(String first, String... rest) {
    List<String> all = new ArrayList<>(rest.length + 1);
    all.add(first);
    all.addAll(List.of(rest));
    return addressable(all);
  }

  /**
   * Builds a top-level path from a key read out of a configuration tree.
   *
   * @param key map key, taken verbatim
   * @return single-segment path
   */
  public static ConfigPath ofKey(String key) {
    return new ConfigPath(List.of(key));
  }

  /**
   * Returns whether this path can be written in dotted form and parsed back unchanged.
   *
   * @return {@code true} when every segment is non-blank and free of {@code .}
   */
  public boolean isAddressable() {
    return segments.stream().allMatch(ConfigPath::isAddressableSegment);
  }

  /**
   * Appends a segment.
   *
   * @param segment child segment
   * @return new path one level deeper
   */
  public ConfigPath child(String segment) {
    List<String> all = new ArrayList<>(segments);
    all.add(segment);
    return new ConfigPath(all);
  }

  /**
   * Returns the enclosing path, empty for a top-level path.
   *
   * @return parent path
   */
  public Optional<ConfigPath> parent() {
    if (segments.size() == 1) {
      return Optional.empty();
    }
    return Optional.of(new ConfigPath(segments.subList(0, segments.size() - 1)));
  }

  /** @return first segment, usually the section name */
  public String head() {
    return segments.get(0);
  }

  /** @return last segment */
  public String leaf() {
    return segments.get(segments.size() - 1);
  }

  /** @return number of segments */
  public int depth() {
    return segments.size();
  }

  private static ConfigPath addressable(List<String> segments) {
    for (String segment : segments) {
      if (segment == null || segment.isBlank()) {
        throw new IllegalArgumentException("config path segments must not be blank");
      }
      if (segment.indexOf('.') >= 0) {
        throw new IllegalArgumentException("config path segment must not contain '.': " + segment);
      }
    }
    return new ConfigPath(segments);
  }

  private static boolean isAddressableSegment(String segment) {
    return !segment.isBlank() && segment.indexOf('.') < 0;
  }

  @Override
  public String toString() {
    return String.join(".", segments);
  }
}
