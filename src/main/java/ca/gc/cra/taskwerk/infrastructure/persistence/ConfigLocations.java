package ca.gc.cra.taskwerk.infrastructure.persistence;

import ca.gc.cra.taskwerk.application.port.EnvironmentPort;
import ca.gc.cra.taskwerk.util.PathUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Resolved locations of the two persisted layers.
 *
 * @param globalPath per-user configuration file
 * @param localPath per-project configuration file
 * @since 0.1.0
 */
public record ConfigLocations(Path globalPath, Path localPath) {
  /** Directory name shared by the project dotdirectory and the legacy per-user location. */
  public static final String DOT_DIRECTORY = ".taskwerk";
  /** Application directory below the per-user config directory. */
  public static final String APP_DIRECTORY = "taskwerk";
  /** Default file name of both layers. */
  public static final String FILE_NAME = "config.yml";
  /** Override directory variable consulted first. */
  public static final String CONFIG_HOME_VARIABLE = "XDG_CONFIG_HOME";

  public ConfigLocations {
    Objects.requireNonNull(globalPath, "globalPath");
    Objects.requireNonNull(localPath, "localPath");
  }

  /**
   * Resolves both layer paths.
   *
   * @param environment process environment
   * @param userHome user home directory
   * @param projectDirectory project root holding the dotdirectory
   * @return resolved locations
   */
  public static ConfigLocations resolve(EnvironmentPort environment, Path userHome, Path projectDirectory) {
    return new ConfigLocations(resolveGlobalPath(environment, userHome), resolveLocalPath(projectDirectory));
  }

  /**
   * Resolves the per-user file.
   *
   * <ol>
   *   <li>{@code $XDG_CONFIG_HOME/taskwerk/config.yml} when the override variable is set;</li>
   *   <li>{@code ~/.config/taskwerk/config.yml} when it exists;</li>
   *   <li>the legacy {@code ~/.taskwerk/config.yml} when only that exists;</li>
   *   <li>JSON variants of the conventional, then the legacy, file when only those exist;</li>
   *   <li>otherwise the conventional YAML path, created on first save.</li>
   * </ol>
   *
   * @param environment process environment
   * @param userHome user home directory
   * @return global layer path
   */
  public static Path resolveGlobalPath(EnvironmentPort environment, Path userHome) {
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(userHome, "userHome");
    var override = environment.variable(CONFIG_HOME_VARIABLE);
    if (override.isPresent()) {
      return Path.of(override.get()).resolve(APP_DIRECTORY).resolve(FILE_NAME);
    }
    Path conventional = userHome.resolve(".config").resolve(APP_DIRECTORY).resolve(FILE_NAME);
    Path legacy = userHome.resolve(DOT_DIRECTORY).resolve(FILE_NAME);
    List<Path> candidates = List.of(
        conventional,
        legacy,
        PathUtils.withExtension(conventional, "json"),
        PathUtils.withExtension(legacy, "json"));
    for (Path candidate : candidates) {
      if (Files.isRegularFile(candidate)) {
        return candidate;
      }
    }
    return conventional;
  }

  /**
   * Resolves the per-project file.
   *
   * @param projectDirectory project root
   * @return {@code <project>/.taskwerk/config.yml}
   */
  public static Path resolveLocalPath(Path projectDirectory) {
    Objects.requireNonNull(projectDirectory, "projectDirectory");
    return projectDirectory.resolve(DOT_DIRECTORY).resolve(FILE_NAME);
  }
}
