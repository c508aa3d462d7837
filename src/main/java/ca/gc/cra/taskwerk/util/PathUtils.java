package ca.gc.cra.taskwerk.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the lower-cased extension of the file name, without the dot.
   *
   * @param path source path; may be {@code null}
   * @return extension such as {@code yml}; empty when the name has none
   */
  public static Optional<String> extension(Path path) {
    return fileName(path).flatMap(name -> {
      int dot = name.lastIndexOf('.');
      if (dot <= 0 || dot == name.length() - 1) {
        return Optional.empty();
      }
      return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    });
  }

  /**
   * Returns a sibling path with the extension replaced, e.g. {@code config.yml -> config.json}.
   *
   * @param path source path with a file name
   * @param extension new extension without the dot
   * @return sibling path
   */
  public static Path withExtension(Path path, String extension) {
    String name = fileName(path).orElseThrow(() -> new IllegalArgumentException("path has no file name: " + path));
    int dot = name.lastIndexOf('.');
    String base = dot > 0 ? name.substring(0, dot) : name;
    return path.resolveSibling(base + '.' + extension);
  }
}
