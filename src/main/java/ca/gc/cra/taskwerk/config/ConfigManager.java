package ca.gc.cra.taskwerk.config;

import ca.gc.cra.taskwerk.application.port.EnvironmentPort;
import ca.gc.cra.taskwerk.application.port.MetricsPort;
import ca.gc.cra.taskwerk.domain.config.ConfigLayer;
import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigTrees;
import ca.gc.cra.taskwerk.domain.config.SourcedValue;
import ca.gc.cra.taskwerk.domain.config.Violation;
import ca.gc.cra.taskwerk.infrastructure.persistence.ConfigLocations;
import ca.gc.cra.taskwerk.infrastructure.persistence.LayerStore;
import ca.gc.cra.taskwerk.infrastructure.persistence.SecretMasker;
import ca.gc.cra.taskwerk.logging.LoggingConfigurator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the effective Taskwerk configuration from four layers and persists edits.
 * <p><strong>Why:</strong> Collaborators need one place that guarantees precedence
 * ({@code ENV > LOCAL > GLOBAL > DEFAULT}), validation and source attribution, and that never writes a real
 * secret to disk.</p>
 * <p><strong>Lifecycle:</strong> Construct once at process entry via {@link #create()} or {@link #builder()}
 * and pass by reference. Accessors load lazily; {@link #discard()} drops in-memory state so the next accessor
 * re-reads the files.</p>
 * <p><strong>Failure semantics:</strong> {@link #set} and {@link #delete} validate the proposed result before
 * committing, so a rejected edit leaves every layer unchanged. When {@link #load()} fails validation the
 * layers stay in memory but no effective configuration is published: readers keep throwing
 * {@link ConfigValidationException} until the layers are valid again. Edits are rejected only for violations
 * they introduce, so an invalid file can be repaired one value at a time through {@link #set},
 * {@link #delete} or {@link #clear}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine to one thread.</p>
 * <p><strong>Observability:</strong> Emits {@code config.load.count}, {@code config.load.latencyMs},
 * {@code config.validation.failures} and {@code config.save.count}.</p>
 *
 * @since 0.1.0
 */
public final class ConfigManager {
  private static final Logger log = LoggerFactory.getLogger(ConfigManager.class);
  private static final ConfigPath LOG_LEVEL = ConfigPath.of("developer", "logLevel");

  private final ConfigSchema schema;
  private final SchemaValidator validator;
  private final ConfigMerger merger;
  private final SourceMap sources;
  private final EnvironmentOverlay overlay;
  private final SecretMasker masker;
  private final LayerStore store;
  private final MetricsPort metrics;
  private final Path globalPath;
  private final Path localPath;
  private final boolean applyLogLevel;

  private final Map<ConfigLayer, Map<String, Object>> layers = new EnumMap<>(ConfigLayer.class);
  private Map<String, Object> merged;

  private ConfigManager(Builder builder) {
    this.schema = builder.schema;
    this.validator = new SchemaValidator(schema);
    this.merger = new ConfigMerger(schema);
    this.sources = new SourceMap(schema);
    this.overlay = new EnvironmentOverlay(EnvironmentOverlay.DEFAULT_PREFIX, builder.environment, schema, builder.clock);
    this.masker = new SecretMasker(schema);
    this.store = new LayerStore(masker);
    this.metrics = builder.metrics;
    this.globalPath = builder.globalPath != null
        ? builder.globalPath
        : ConfigLocations.resolveGlobalPath(builder.environment, builder.userHome);
    this.localPath = builder.localPath != null
        ? builder.localPath
        : ConfigLocations.resolveLocalPath(builder.projectDirectory);
    this.applyLogLevel = builder.applyLogLevel;
  }

  /**
   * Creates a manager for the current working directory, user home and process environment.
   *
   * @return new manager; nothing is read until the first accessor
   */
  public static ConfigManager create() {
    return builder().build();
  }

  /**
   * Starts a builder with process defaults.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads every layer, merges and validates them.
   *
   * @return deep copy of the effective configuration
   * @throws ConfigParseException when a layer file cannot be parsed
   * @throws ConfigValidationException when the merged configuration violates the schema; the layers are kept
   *     for repair but every reader throws until they validate
   */
  public Map<String, Object> load() {
    check(readLayers());
    if (applyLogLevel) {
      ConfigTrees.find(merged, LOG_LEVEL)
          .filter(String.class::isInstance)
          .map(String.class::cast)
          .ifPresent(LoggingConfigurator::applyLevel);
    }
    return ConfigTrees.deepCopy(merged);
  }

  private List<Violation> readLayers() {
    long started = System.nanoTime();
    Map<ConfigLayer, Map<String, Object>> loaded = new EnumMap<>(ConfigLayer.class);
    loaded.put(ConfigLayer.DEFAULT, schema.defaults());
    if (Files.exists(globalPath)) {
      Map<String, Object> global = store.loadLayer(globalPath);
      loaded.put(ConfigLayer.GLOBAL, global);
      store.checkPermissions(globalPath, global);
    }
    if (Files.exists(localPath)) {
      loaded.put(ConfigLayer.LOCAL, store.loadLayer(localPath));
    }
    loaded.put(ConfigLayer.ENV, overlay.loadFromEnv());

    layers.clear();
    layers.putAll(loaded);
    List<Violation> violations = refreshView();
    metrics.increment("config.load.count");
    metrics.observe("config.load.latencyMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    log.debug("Loaded configuration layers {} (global={}, local={})", layers.keySet(), globalPath, localPath);
    return violations;
  }

  /**
   * Looks up an effective value.
   *
   * @param path dotted path such as {@code general.defaultPriority}
   * @return copy of the value; empty when the path is absent
   * @throws IllegalArgumentException when the path is blank or has empty segments
   */
  public Optional<Object> get(String path) {
    ConfigPath parsed = ConfigPath.parse(path);
    ensureLoaded();
    return ConfigTrees.find(merged, parsed).map(ConfigTrees::copyValue);
  }

  /**
   * Looks up an effective value, falling back to {@code defaultValue}.
   *
   * @param path dotted path
   * @param defaultValue value returned when the path is absent
   * @return effective value or {@code defaultValue}
   */
  public Object get(String path, Object defaultValue) {
    return get(path).orElse(defaultValue);
  }

  /**
   * Sets a value in the local layer.
   *
   * @param path dotted path
   * @param value new value
   * @throws ConfigValidationException when the value or resulting configuration is invalid
   */
  public void set(String path, Object value) {
    set(path, value, false);
  }

  /**
   * Sets a value in the global or local layer. The layer is created when it was never loaded.
   *
   * @param path dotted path
   * @param value new value; maps and lists are copied
   * @param toGlobal {@code true} for the global layer
   * @throws ConfigValidationException when the value or resulting configuration is invalid; nothing changes
   * @throws IllegalArgumentException when the path crosses an existing non-object value
   */
  public void set(String path, Object value, boolean toGlobal) {
    ConfigPath parsed = ConfigPath.parse(path);
    ensureLayers();
    ConfigLayer target = toGlobal ? ConfigLayer.GLOBAL : ConfigLayer.LOCAL;
    Map<String, Object> proposed = ConfigTrees.deepCopy(layers.get(target));
    ConfigTrees.put(proposed, parsed, value);

    // Shadowed writes are checked on their own too.
    Set<Violation> found = new LinkedHashSet<>(validator.violationsAt(parsed, value));
    found.addAll(introducedBy(target, proposed));
    check(new ArrayList<>(found));

    layers.put(target, proposed);
    refreshView();
    log.debug("Set {} in {} layer", parsed, target);
  }

  /**
   * Removes a value from the local layer.
   *
   * @param path dotted path
   * @return {@code true} when the key existed
   */
  public boolean delete(String path) {
    return delete(path, false);
  }

  /**
   * Removes a value from the global or local layer.
   *
   * @param path dotted path
   * @param fromGlobal {@code true} for the global layer
   * @return {@code true} when the key existed in that layer
   * @throws ConfigValidationException when the resulting configuration is invalid; nothing changes
   */
  public boolean delete(String path, boolean fromGlobal) {
    ConfigPath parsed = ConfigPath.parse(path);
    ensureLayers();
    ConfigLayer target = fromGlobal ? ConfigLayer.GLOBAL : ConfigLayer.LOCAL;
    Map<String, Object> current = layers.get(target);
    if (current == null) {
      return false;
    }
    Map<String, Object> proposed = ConfigTrees.deepCopy(current);
    if (!ConfigTrees.remove(proposed, parsed)) {
      return false;
    }
    check(introducedBy(target, proposed));

    layers.put(target, proposed);
    refreshView();
    log.debug("Deleted {} from {} layer", parsed, target);
    return true;
  }

  /**
   * Returns the layer that supplied an effective value.
   *
   * @param path dotted path
   * @return attributed layer; {@link ConfigLayer#DEFAULT} for untracked paths
   */
  public ConfigLayer getSource(String path) {
    ConfigPath parsed = ConfigPath.parse(path);
    ensureLoaded();
    return sources.sourceOf(parsed);
  }

  /**
   * Mirrors the effective configuration with every leaf paired with its source.
   *
   * @return fresh tree whose leaves are {@link SourcedValue} instances
   */
  public Map<String, Object> getWithSources() {
    ensureLoaded();
    Map<String, Object> result = ConfigTrees.emptyTree();
    ConfigTrees.forEachLeaf(merged, schema::isLeaf, (path, value) ->
        ConfigTrees.put(result, path, new SourcedValue(ConfigTrees.copyValue(value), sources.sourceOf(path))));
    return result;
  }

  /**
   * Returns the effective configuration with real secrets replaced by {@link SecretMasker#PLACEHOLDER}.
   *
   * @return masked copy suitable for printing
   */
  public Map<String, Object> getMasked() {
    ensureLoaded();
    return masker.mask(merged);
  }

  /**
   * Returns the masked global layer.
   *
   * @return masked copy; empty when no global layer is loaded
   */
  public Optional<Map<String, Object>> getGlobalMasked() {
    return Optional.ofNullable(layers.get(ConfigLayer.GLOBAL)).map(masker::mask);
  }

  /**
   * Returns the masked local layer.
   *
   * @return masked copy; empty when no local layer is loaded
   */
  public Optional<Map<String, Object>> getLocalMasked() {
    return Optional.ofNullable(layers.get(ConfigLayer.LOCAL)).map(masker::mask);
  }

  /**
   * Persists one layer with secrets masked. The in-memory layer keeps its real values.
   *
   * @param toGlobal {@code true} for the global layer, which is also restricted to its owner
   * @throws ConfigurationException when that layer was never loaded or set
   * @throws ConfigPersistenceException when the file cannot be written
   */
  public void save(boolean toGlobal) {
    ConfigLayer target = toGlobal ? ConfigLayer.GLOBAL : ConfigLayer.LOCAL;
    Map<String, Object> data = layers.get(target);
    if (data == null) {
      throw new ConfigurationException(
          "No " + (toGlobal ? "global" : "local") + " configuration to save", "save");
    }
    Path path = toGlobal ? globalPath : localPath;
    store.saveLayer(path, data, toGlobal);
    metrics.increment("config.save.count");
    log.info("Saved {} configuration to {}", toGlobal ? "global" : "local", path);
  }

  /**
   * Moves every local setting into the global layer and persists both files.
   *
   * @throws ConfigurationException when there is no local layer
   */
  public void migrateToGlobal() {
    ensureLoaded();
    Map<String, Object> local = layers.get(ConfigLayer.LOCAL);
    if (local == null) {
      throw new ConfigurationException("No local configuration to migrate", "migrate");
    }
    Map<String, Object> global = layers.get(ConfigLayer.GLOBAL);
    layers.put(ConfigLayer.GLOBAL, global == null ? ConfigTrees.deepCopy(local) : merger.deepMerge(global, local));
    save(true);
    layers.put(ConfigLayer.LOCAL, ConfigTrees.emptyTree());
    save(false);
    refreshView();
    log.info("Migrated local configuration {} into {}", localPath, globalPath);
  }

  /**
   * Overlays the global layer onto the local layer and persists the local file.
   *
   * @throws ConfigurationException when there is no global layer
   */
  public void copyFromGlobal() {
    ensureLoaded();
    Map<String, Object> global = layers.get(ConfigLayer.GLOBAL);
    if (global == null) {
      throw new ConfigurationException("No global configuration to copy", "copy");
    }
    Map<String, Object> local = layers.get(ConfigLayer.LOCAL);
    layers.put(ConfigLayer.LOCAL, local == null ? ConfigTrees.deepCopy(global) : merger.deepMerge(local, global));
    save(false);
    refreshView();
    log.info("Copied global configuration {} into {}", globalPath, localPath);
  }

  /**
   * Empties one layer, persists it and reloads.
   *
   * @param toGlobal {@code true} for the global layer
   */
  public void clear(boolean toGlobal) {
    layers.put(toGlobal ? ConfigLayer.GLOBAL : ConfigLayer.LOCAL, ConfigTrees.emptyTree());
    save(toGlobal);
    load();
  }

  /** Empties the local layer, persists it and reloads. */
  public void reset() {
    clear(false);
  }

  /**
   * Returns whether {@code tree} holds a real value at any sensitive path.
   *
   * @param tree tree to inspect
   * @return {@code true} when a non-empty, non-placeholder secret is present
   */
  public boolean hasSensitiveData(Map<String, ?> tree) {
    return masker.hasSensitiveData(tree);
  }

  /**
   * Renders the masked effective configuration as shell {@code export} lines.
   *
   * @param includeComments whether to emit a header and field descriptions
   * @return shell snippet
   */
  public String exportToEnv(boolean includeComments) {
    return overlay.exportToEnv(getMasked(), includeComments);
  }

  /**
   * Returns the environment variable that overrides {@code path}.
   *
   * @param path dotted path
   * @return variable name such as {@code TASKWERK_AI_API_KEY}
   */
  public String envName(String path) {
    return overlay.envName(path);
  }

  /**
   * Returns the schema this manager validates against.
   *
   * @return schema registry
   */
  public ConfigSchema schema() {
    return schema;
  }

  public Path globalPath() {
    return globalPath;
  }

  public Path localPath() {
    return localPath;
  }

  /** Drops every in-memory layer; the next accessor reloads from disk. */
  public void discard() {
    layers.clear();
    merged = null;
    sources.reset();
  }

  private void ensureLoaded() {
    if (layers.isEmpty()) {
      load();
    } else if (merged == null) {
      check(validator.violations(merger.merge(layers)));
      refreshView();
    }
  }

  private void ensureLayers() {
    if (layers.isEmpty()) {
      List<Violation> pending = readLayers();
      if (!pending.isEmpty()) {
        log.debug("Editing configuration with {} outstanding violation(s)", pending.size());
      }
    }
  }

  /** Merges the layers; the result is published only when it validates. */
  private List<Violation> refreshView() {
    Map<String, Object> view = merger.merge(layers);
    List<Violation> violations = validator.violations(view);
    merged = violations.isEmpty() ? view : null;
    sources.rebuild(layers);
    return violations;
  }

  /** Violations present once {@code target} holds {@code proposed} that the current layers do not have. */
  private List<Violation> introducedBy(ConfigLayer target, Map<String, Object> proposed) {
    Map<ConfigLayer, Map<String, Object>> candidate = new EnumMap<>(layers);
    candidate.put(target, proposed);
    List<Violation> after = validator.violations(merger.merge(candidate));
    if (merged == null && !after.isEmpty()) {
      after.removeAll(validator.violations(merger.merge(layers)));
    }
    return after;
  }

  private void check(List<Violation> violations) {
    if (!violations.isEmpty()) {
      metrics.increment("config.validation.failures");
      throw new ConfigValidationException(violations);
    }
  }

  /**
   * Builder for {@link ConfigManager}. Unset options fall back to {@code user.dir}, {@code user.home},
   * the process environment and the built-in schema.
   */
  public static final class Builder {
    private ConfigSchema schema = ConfigSchema.taskwerk();
    private EnvironmentPort environment = EnvironmentPort.SYSTEM;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private Clock clock = Clock.systemUTC();
    private Path projectDirectory = Path.of(System.getProperty("user.dir"));
    private Path userHome = Path.of(System.getProperty("user.home"));
    private Path globalPath;
    private Path localPath;
    private boolean applyLogLevel;

    private Builder() {}

    public Builder schema(ConfigSchema schema) {
      this.schema = Objects.requireNonNull(schema, "schema");
      return this;
    }

    public Builder environment(EnvironmentPort environment) {
      this.environment = Objects.requireNonNull(environment, "environment");
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Sets the directory holding {@code .taskwerk/config.yml}; ignored when {@link #localPath} is set.
     *
     * @param projectDirectory project root
     * @return this builder
     */
    public Builder projectDirectory(Path projectDirectory) {
      this.projectDirectory = Objects.requireNonNull(projectDirectory, "projectDirectory");
      return this;
    }

    /**
     * Sets the home directory used to resolve the global file; ignored when {@link #globalPath} is set.
     *
     * @param userHome home directory
     * @return this builder
     */
    public Builder userHome(Path userHome) {
      this.userHome = Objects.requireNonNull(userHome, "userHome");
      return this;
    }

    public Builder globalPath(Path globalPath) {
      this.globalPath = Objects.requireNonNull(globalPath, "globalPath");
      return this;
    }

    public Builder localPath(Path localPath) {
      this.localPath = Objects.requireNonNull(localPath, "localPath");
      return this;
    }

    /**
     * Applies {@code developer.logLevel} to the Logback root logger after every successful load.
     *
     * @param applyLogLevel whether to apply the level
     * @return this builder
     */
    public Builder applyLogLevel(boolean applyLogLevel) {
      this.applyLogLevel = applyLogLevel;
      return this;
    }

    public ConfigManager build() {
      return new ConfigManager(this);
    }
  }
}
