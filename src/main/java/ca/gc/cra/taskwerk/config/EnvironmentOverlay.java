package ca.gc.cra.taskwerk.config;

import ca.gc.cra.taskwerk.application.json.JsonSupport;
import ca.gc.cra.taskwerk.application.port.EnvironmentPort;
import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigTrees;
import ca.gc.cra.taskwerk.validation.Strings;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Translates between prefixed environment variables and configuration paths.
 * <p><strong>Why:</strong> The environment is the highest-precedence layer and the usual way to override a
 * setting for one invocation; the same naming rules render a shell snippet from an effective tree.</p>
 * <p><strong>Naming:</strong> {@code TASKWERK_GENERAL_DEFAULT_PRIORITY} maps to
 * {@code general.defaultPriority}. The two directions are not inverses for multi-word section names or
 * acronyms ({@code ai.baseURL} renders as {@code TASKWERK_AI_BASE_URL}, which reads back as
 * {@code ai.baseUrl}).</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected collaborators.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentOverlay {
  private static final Logger log = LoggerFactory.getLogger(EnvironmentOverlay.class);
  /** Prefix of every configuration variable. */
  public static final String DEFAULT_PREFIX = "TASKWERK_";
  private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");

  private final String prefix;
  private final EnvironmentPort environment;
  private final ConfigSchema schema;
  private final Clock clock;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates an overlay with the default prefix and the system clock.
   *
   * @param environment variable source
   * @param schema schema registry used for field descriptions
   */
  public EnvironmentOverlay(EnvironmentPort environment, ConfigSchema schema) {
    this(DEFAULT_PREFIX, environment, schema, Clock.systemUTC());
  }

  /**
   * Creates an overlay.
   *
   * @param prefix upper-case variable prefix ending in {@code _}
   * @param environment variable source
   * @param schema schema registry used for field descriptions
   * @param clock clock stamped into exported snippets
   * @throws IllegalArgumentException when the prefix is not an upper-case identifier
   */
  public EnvironmentOverlay(String prefix, EnvironmentPort environment, ConfigSchema schema, Clock clock) {
    this.prefix = Strings.requireEnvIdentifier("prefix", prefix);
    this.environment = Objects.requireNonNull(environment, "environment");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the environment layer from every prefixed variable. Values are decoded as JSON where possible
   * and kept as raw strings otherwise.
   *
   * @return fresh nested tree; empty when no variable carries the prefix
   */
  public Map<String, Object> loadFromEnv() {
    Map<String, Object> layer = ConfigTrees.emptyTree();
    // Sorted so that conflicting names resolve the same way on every run.
    Map<String, String> variables = new TreeMap<>(environment.variables());
    for (Map.Entry<String, String> entry : variables.entrySet()) {
      String name = entry.getKey();
      if (!name.startsWith(prefix)) {
        continue;
      }
      Optional<ConfigPath> path = parseEnvKey(name);
      if (path.isEmpty()) {
        continue;
      }
      try {
        ConfigTrees.put(layer, path.get(), decode(entry.getValue()));
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring environment variable {}: {}", name, ex.getMessage());
      }
    }
    if (!layer.isEmpty()) {
      log.debug("Loaded environment overrides for sections {}", layer.keySet());
    }
    return layer;
  }

  /**
   * Maps a variable name to a configuration path.
   *
   * @param variableName full variable name including the prefix
   * @return path such as {@code general.defaultPriority}; empty when the name carries no tokens or does not
   *     start with the prefix
   */
  public Optional<ConfigPath> parseEnvKey(String variableName) {
    if (variableName == null || !variableName.startsWith(prefix)) {
      return Optional.empty();
    }
    List<String> tokens = new ArrayList<>();
    for (String token : variableName.substring(prefix.length()).split("_")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    if (tokens.isEmpty()) {
      return Optional.empty();
    }
    String section = tokens.get(0).toLowerCase(Locale.ROOT);
    if (tokens.size() == 1) {
      return safePath(variableName, section, null);
    }
    StringBuilder property = new StringBuilder(tokens.get(1).toLowerCase(Locale.ROOT));
    for (String token : tokens.subList(2, tokens.size())) {
      String lower = token.toLowerCase(Locale.ROOT);
      property.append(Character.toUpperCase(lower.charAt(0))).append(lower.substring(1));
    }
    return safePath(variableName, section, property.toString());
  }

  /**
   * Returns the variable name that overrides {@code path}.
   *
   * @param path configuration path
   * @return name such as {@code TASKWERK_GENERAL_DEFAULT_PRIORITY}
   */
  public String envName(ConfigPath path) {
    Objects.requireNonNull(path, "path");
    List<String> parts = new ArrayList<>(path.depth());
    for (String segment : path.segments()) {
      parts.add(CAMEL_BOUNDARY.matcher(segment).replaceAll("$1_$2").toUpperCase(Locale.ROOT));
    }
    return prefix + String.join("_", parts);
  }

  /**
   * Dotted-path convenience for {@link #envName(ConfigPath)}.
   *
   * @param dottedPath path such as {@code ai.apiKey}
   * @return variable name
   * @throws IllegalArgumentException when the path is blank or has empty segments
   */
  public String envName(String dottedPath) {
    return envName(ConfigPath.parse(dottedPath));
  }

  /**
   * Renders {@code config} as {@code export NAME="value"} lines. Entries one level below each section are
   * emitted individually; deeper values are kept whole as JSON. Strings are written verbatim, other values
   * as JSON with double quotes escaped. Keys that are blank or contain {@code .} are skipped.
   *
   * @param config effective tree, usually already masked
   * @param includeComments whether to emit a header and each field's description
   * @return shell snippet separated by {@code \n}
   */
  public String exportToEnv(Map<String, ?> config, boolean includeComments) {
    List<String> lines = new ArrayList<>();
    if (includeComments) {
      lines.add("# Taskwerk Configuration Environment Variables");
      lines.add("# Generated on " + Instant.now(clock));
      lines.add("");
    }
    flatten(config).forEach((path, value) -> {
      if (!path.isAddressable()) {
        log.debug("Not exporting {}: key has no environment variable form", path.segments());
        return;
      }
      if (includeComments) {
        schema.describe(path).ifPresent(description -> lines.add("# " + description));
      }
      lines.add("export " + envName(path) + "=\"" + render(value) + "\"");
      if (includeComments) {
        lines.add("");
      }
    });
    return String.join("\n", lines);
  }

  /**
   * Returns the configured prefix.
   *
   * @return prefix such as {@code TASKWERK_}
   */
  public String prefix() {
    return prefix;
  }

  private Object decode(String raw) {
    try {
      return json.parse(raw);
    } catch (IllegalArgumentException ex) {
      return raw;
    }
  }

  private String render(Object value) {
    if (value instanceof String text) {
      return text;
    }
    return json.write(value).replace("\"", "\\\"");
  }

  private static Map<ConfigPath, Object> flatten(Map<String, ?> config) {
    Map<ConfigPath, Object> flat = new LinkedHashMap<>();
    if (config == null) {
      return flat;
    }
    for (Map.Entry<String, ?> entry : config.entrySet()) {
      ConfigPath section = ConfigPath.ofKey(entry.getKey());
      if (entry.getValue() instanceof Map<?, ?> map) {
        for (Map.Entry<?, ?> child : map.entrySet()) {
          flat.put(section.child(String.valueOf(child.getKey())), child.getValue());
        }
      } else {
        flat.put(section, entry.getValue());
      }
    }
    return flat;
  }

  private static Optional<ConfigPath> safePath(String variableName, String section, String property) {
    try {
      return Optional.of(property == null ? ConfigPath.of(section) : ConfigPath.of(section, property));
    } catch (IllegalArgumentException ex) {
      log.debug("Skipping environment variable {}: {}", variableName, ex.getMessage());
      return Optional.empty();
    }
  }
}
