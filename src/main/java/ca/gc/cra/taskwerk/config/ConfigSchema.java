package ca.gc.cra.taskwerk.config;

import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigSection;
import ca.gc.cra.taskwerk.domain.config.ConfigTrees;
import ca.gc.cra.taskwerk.domain.config.SchemaField;
import ca.gc.cra.taskwerk.domain.config.SchemaNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema registry: the static declaration of every Taskwerk setting, and the defaults derived from it.
 *
 * <p>The registry is the single source of truth for defaults, validation rules and secret masking. All
 * accessors are pure functions of the declared tree.</p>
 */
public final class ConfigSchema {
  private static final ConfigSchema TASKWERK = new ConfigSchema(buildTaskwerkRoot());

  private final ConfigSection root;
  private final List<ConfigPath> sensitivePaths;

  /**
   * Wraps an arbitrary root section. Production code uses {@link #taskwerk()}.
   *
   * @param root schema root
   */
  public ConfigSchema(ConfigSection root) {
    this.root = Objects.requireNonNull(root, "root");
    List<ConfigPath> sensitive = new ArrayList<>();
    collectSensitive(root, null, sensitive);
    this.sensitivePaths = List.copyOf(sensitive);
  }

  /**
   * Returns the built-in Taskwerk schema.
   *
   * @return shared immutable registry
   */
  public static ConfigSchema taskwerk() {
    return TASKWERK;
  }

  /**
   * Returns the full field tree.
   *
   * @return schema root section
   */
  public ConfigSection root() {
    return root;
  }

  /**
   * Builds the default layer: every declared default at its path. Fields without a default are absent;
   * every section is present, possibly empty.
   *
   * @return fresh mutable tree
   */
  public Map<String, Object> defaults() {
    return defaultsOf(root);
  }

  /**
   * Returns the dotted paths of every field flagged sensitive, in declaration order.
   *
   * @return immutable list such as {@code [ai.apiKey]}
   */
  public List<String> sensitiveFields() {
    return sensitivePaths.stream().map(ConfigPath::toString).toList();
  }

  /**
   * Typed variant of {@link #sensitiveFields()}.
   *
   * @return immutable list of sensitive paths
   */
  public List<ConfigPath> sensitivePaths() {
    return sensitivePaths;
  }

  /**
   * Looks up the field declared at {@code path}.
   *
   * @param path typed path from the root
   * @return declaration when the path names a leaf
   */
  public Optional<SchemaField> field(ConfigPath path) {
    return root.field(path);
  }

  /**
   * Returns whether {@code path} names a declared leaf.
   *
   * @param path typed path from the root
   * @return {@code true} for declared fields
   */
  public boolean isLeaf(ConfigPath path) {
    return root.isLeaf(path);
  }

  /**
   * Returns whether {@code path} names a sensitive field.
   *
   * @param path typed path from the root
   * @return {@code true} when the field is flagged sensitive
   */
  public boolean isSensitive(ConfigPath path) {
    return sensitivePaths.contains(path);
  }

  /**
   * Returns the declared description of a field.
   *
   * @param path typed path from the root
   * @return description, empty when the field is undeclared or undocumented
   */
  public Optional<String> describe(ConfigPath path) {
    return field(path).map(SchemaField::description).filter(text -> !text.isBlank());
  }

  private static Map<String, Object> defaultsOf(ConfigSection section) {
    Map<String, Object> tree = ConfigTrees.emptyTree();
    for (Map.Entry<String, SchemaNode> entry : section.children().entrySet()) {
      SchemaNode node = entry.getValue();
      if (node instanceof ConfigSection nested) {
        tree.put(entry.getKey(), defaultsOf(nested));
      } else if (node instanceof SchemaField field && field.defaultValue().isPresent()) {
        tree.put(entry.getKey(), ConfigTrees.copyValue(field.defaultValue().get()));
      }
    }
    return tree;
  }

  private static void collectSensitive(ConfigSection section, ConfigPath prefix, List<ConfigPath> out) {
    for (Map.Entry<String, SchemaNode> entry : section.children().entrySet()) {
      ConfigPath path = prefix == null ? ConfigPath.of(entry.getKey()) : prefix.child(entry.getKey());
      SchemaNode node = entry.getValue();
      if (node instanceof ConfigSection nested) {
        collectSensitive(nested, path, out);
      } else if (node instanceof SchemaField field && field.sensitive()) {
        out.add(path);
      }
    }
  }

  private static ConfigSection buildTaskwerkRoot() {
    return ConfigSection.builder("")
        .section(general())
        .section(database())
        .section(git())
        .section(ai())
        .section(output())
        .section(export())
        .section(developer())
        .build();
  }

  private static ConfigSection general() {
    return ConfigSection.builder("general")
        .field("defaultPriority", SchemaField.string()
            .allowed("low", "medium", "high", "critical")
            .defaultValue("medium")
            .description("Default priority for new tasks"))
        .field("defaultStatus", SchemaField.string()
            .allowed("todo", "in-progress", "blocked", "done")
            .defaultValue("todo")
            .description("Default status for new tasks"))
        .field("taskIdPrefix", SchemaField.string()
            .defaultValue("TASK")
            .pattern("^[A-Z]+$")
            .description("Prefix for generated task IDs"))
        .field("dateFormat", SchemaField.string()
            .defaultValue("YYYY-MM-DD")
            .description("Date format for display"))
        .build();
  }

  private static ConfigSection database() {
    return ConfigSection.builder("database")
        .field("path", SchemaField.string()
            .defaultValue("~/.taskwerk/taskwerk.db")
            .description("Path to the SQLite database file"))
        .field("backupEnabled", SchemaField.bool()
            .defaultValue(true)
            .description("Enable automatic database backups"))
        .field("backupInterval", SchemaField.string()
            .defaultValue("daily")
            .allowed("hourly", "daily", "weekly", "never")
            .description("How often to backup the database"))
        .field("backupCount", SchemaField.integer()
            .defaultValue(7)
            .range(1, 365)
            .description("Number of backups to keep"))
        .build();
  }

  private static ConfigSection git() {
    return ConfigSection.builder("git")
        .field("enabled", SchemaField.bool()
            .defaultValue(true)
            .description("Enable git integration features"))
        .field("branchPrefix", SchemaField.string()
            .defaultValue("task/")
            .description("Prefix for task-related git branches"))
        .field("commitPrefix", SchemaField.string()
            .defaultValue("task:")
            .description("Prefix for task-related commits"))
        .field("autoCommit", SchemaField.bool()
            .defaultValue(false)
            .description("Automatically commit task changes"))
        .field("autoPush", SchemaField.bool()
            .defaultValue(false)
            .description("Automatically push commits to remote"))
        .build();
  }

  private static ConfigSection ai() {
    return ConfigSection.builder("ai")
        .field("enabled", SchemaField.bool()
            .defaultValue(false)
            .description("Enable AI integration features"))
        .field("provider", SchemaField.string()
            .allowed("openai", "claude", "mistral", "grok", "llama", "lmstudio", "ollama")
            .defaultValue("openai")
            .description("AI provider to use"))
        .field("model", SchemaField.string()
            .defaultValue("gpt-3.5-turbo")
            .description("AI model to use"))
        .field("apiKey", SchemaField.string()
            .defaultValue("")
            .sensitive()
            .description("API key for the AI provider"))
        .field("baseUrl", SchemaField.string()
            .defaultValue("")
            .description("Base URL for API calls (for self-hosted models)"))
        .field("temperature", SchemaField.number()
            .defaultValue(0.7)
            .range(0, 2)
            .description("Temperature for AI responses"))
        .field("maxTokens", SchemaField.integer()
            .defaultValue(2000)
            .range(100, 8000)
            .description("Maximum tokens for AI responses"))
        .build();
  }

  private static ConfigSection output() {
    return ConfigSection.builder("output")
        .field("format", SchemaField.string()
            .allowed("text", "json", "markdown", "csv")
            .defaultValue("text")
            .description("Default output format"))
        .field("color", SchemaField.bool().defaultValue(true).description("Enable colored output"))
        .field("verbose", SchemaField.bool().defaultValue(false).description("Enable verbose output"))
        .field("quiet", SchemaField.bool().defaultValue(false).description("Suppress non-essential output"))
        .field("timestamps", SchemaField.bool()
            .defaultValue(false)
            .description("Include timestamps in output"))
        .build();
  }

  private static ConfigSection export() {
    return ConfigSection.builder("export")
        .field("defaultFormat", SchemaField.string()
            .allowed("json", "csv", "markdown", "html")
            .defaultValue("json")
            .description("Default export format"))
        .field("includeArchived", SchemaField.bool()
            .defaultValue(false)
            .description("Include archived tasks in exports"))
        .field("includeDeleted", SchemaField.bool()
            .defaultValue(false)
            .description("Include deleted tasks in exports"))
        .field("exportPath", SchemaField.string()
            .defaultValue("./exports")
            .description("Default path for exports"))
        .build();
  }

  private static ConfigSection developer() {
    return ConfigSection.builder("developer")
        .field("debug", SchemaField.bool().defaultValue(false).description("Enable debug mode"))
        .field("telemetry", SchemaField.bool()
            .defaultValue(false)
            .description("Enable anonymous usage telemetry"))
        .field("experimental", SchemaField.bool()
            .defaultValue(false)
            .description("Enable experimental features"))
        .field("logLevel", SchemaField.string()
            .allowed("error", "warn", "info", "debug", "trace")
            .defaultValue("info")
            .description("Logging level"))
        .field("logConsole", SchemaField.bool().defaultValue(true).description("Enable console logging"))
        .field("logFile", SchemaField.bool().defaultValue(true).description("Enable file logging"))
        .field("logDirectory", SchemaField.string()
            .defaultValue("~/.taskwerk/logs")
            .description("Directory for log files"))
        .build();
  }
}
