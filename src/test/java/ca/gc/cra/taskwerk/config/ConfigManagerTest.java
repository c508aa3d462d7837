package ca.gc.cra.taskwerk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.taskwerk.application.port.EnvironmentPort;
import ca.gc.cra.taskwerk.application.port.MetricsPort;
import ca.gc.cra.taskwerk.domain.config.ConfigLayer;
import ca.gc.cra.taskwerk.domain.config.SourcedValue;
import ca.gc.cra.taskwerk.domain.config.Violation;
import ca.gc.cra.taskwerk.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigManagerTest {
  private static final String PRIORITY = "general.defaultPriority";

  @TempDir
  Path tempDir;

  private Path globalPath;
  private Path localPath;
  private Map<String, String> env;
  private RecordingMetrics metrics;

  @BeforeEach
  void setUp() {
    globalPath = tempDir.resolve("home/.config/taskwerk/config.yml");
    localPath = tempDir.resolve("project/.taskwerk/config.yml");
    env = new HashMap<>();
    metrics = new RecordingMetrics();
  }

  @Test
  void highestLayerWins() throws IOException {
    write(globalPath, "general:\n  defaultPriority: high\n  dateFormat: DD/MM/YYYY\n");
    write(localPath, "general:\n  defaultPriority: low\n");
    env.put("TASKWERK_GENERAL_DEFAULT_PRIORITY", "critical");
    ConfigManager manager = manager();

    assertEquals("critical", manager.get(PRIORITY).orElseThrow());
    assertEquals(ConfigLayer.ENV, manager.getSource(PRIORITY));
    assertEquals("DD/MM/YYYY", manager.get("general.dateFormat").orElseThrow());
    assertEquals(ConfigLayer.GLOBAL, manager.getSource("general.dateFormat"));
    assertEquals("todo", manager.get("general.defaultStatus").orElseThrow());
    assertEquals(ConfigLayer.DEFAULT, manager.getSource("general.defaultStatus"));
  }

  @Test
  void priorityAndSecretScenario() throws IOException {
    write(globalPath, "general:\n  defaultPriority: high\n");
    ConfigManager manager = manager();

    assertEquals("high", manager.get(PRIORITY).orElseThrow());
    assertEquals(ConfigLayer.GLOBAL, manager.getSource(PRIORITY));

    manager.set(PRIORITY, "low");
    assertEquals("low", manager.get(PRIORITY).orElseThrow());
    assertEquals(ConfigLayer.LOCAL, manager.getSource(PRIORITY));

    manager.set("ai.apiKey", "sk-XYZ");
    manager.save(false);
    String onDisk = Files.readString(localPath);
    assertTrue(onDisk.contains("********"));
    assertFalse(onDisk.contains("sk-XYZ"));
    assertEquals("sk-XYZ", manager.get("ai.apiKey").orElseThrow());

    ConfigValidationException ex =
        assertThrows(ConfigValidationException.class, () -> manager.set(PRIORITY, "urgent"));
    assertEquals(PRIORITY, ex.violations().get(0).path());
    assertEquals("low", manager.get(PRIORITY).orElseThrow());
  }

  @Test
  void maskedSecretOnDiskNeverShadowsLowerLayers() throws IOException {
    write(globalPath, "ai:\n  apiKey: sk-global\n");
    write(localPath, "ai:\n  apiKey: '********'\n");
    ConfigManager manager = manager();

    assertEquals("sk-global", manager.get("ai.apiKey").orElseThrow());
    assertEquals(ConfigLayer.GLOBAL, manager.getSource("ai.apiKey"));
  }

  @Test
  void freshManagerSeesPlaceholderAsAbsent() {
    ConfigManager writer = manager();
    writer.set("ai.apiKey", "sk-XYZ");
    writer.save(false);

    ConfigManager reader = manager();
    reader.load();

    assertEquals("", reader.get("ai.apiKey").orElseThrow());
    assertEquals(ConfigLayer.DEFAULT, reader.getSource("ai.apiKey"));
  }

  @Test
  void savedValuesRoundTrip() {
    ConfigManager writer = manager();
    writer.set("output.format", "json");
    writer.set("database.backupCount", 14, true);
    writer.set("plugins.enabled", List.of("a", "b"));
    writer.save(false);
    writer.save(true);

    ConfigManager reader = manager();
    reader.load();

    assertEquals("json", reader.get("output.format").orElseThrow());
    assertEquals(14, reader.get("database.backupCount").orElseThrow());
    assertEquals(List.of("a", "b"), reader.get("plugins.enabled").orElseThrow());
    assertEquals(ConfigLayer.GLOBAL, reader.getSource("database.backupCount"));
  }

  @Test
  void boxedNumbersRoundTripInTheirParsedForm() {
    ConfigManager writer = manager();
    writer.set("database.backupCount", 14L);
    writer.set("ai.temperature", 0.5f);
    Object count = writer.get("database.backupCount").orElseThrow();
    Object temperature = writer.get("ai.temperature").orElseThrow();
    writer.save(false);

    ConfigManager reader = manager();
    reader.load();

    assertEquals(Integer.valueOf(14), count);
    assertEquals(Double.valueOf(0.5), temperature);
    assertEquals(count, reader.get("database.backupCount").orElseThrow());
    assertEquals(temperature, reader.get("ai.temperature").orElseThrow());
  }

  @Test
  void environmentOverrideReverts() throws IOException {
    write(localPath, "output:\n  format: markdown\n");
    ConfigManager manager = manager();
    env.put("TASKWERK_OUTPUT_FORMAT", "csv");

    manager.load();
    assertEquals("csv", manager.get("output.format").orElseThrow());

    env.remove("TASKWERK_OUTPUT_FORMAT");
    manager.load();
    assertEquals("markdown", manager.get("output.format").orElseThrow());
    assertEquals(ConfigLayer.LOCAL, manager.getSource("output.format"));
  }

  @Test
  void shadowedInvalidWriteIsRejected() {
    env.put("TASKWERK_OUTPUT_FORMAT", "json");
    ConfigManager manager = manager();

    assertThrows(ConfigValidationException.class, () -> manager.set("output.format", "xml"));

    assertTrue(manager.getLocalMasked().isEmpty());
    assertEquals(1L, metrics.counter("config.validation.failures"));
  }

  @Test
  void deleteRevertsToLowerLayer() throws IOException {
    write(globalPath, "general:\n  defaultPriority: high\n");
    ConfigManager manager = manager();
    manager.set(PRIORITY, "low");

    assertTrue(manager.delete(PRIORITY));
    assertEquals("high", manager.get(PRIORITY).orElseThrow());
    assertEquals(ConfigLayer.GLOBAL, manager.getSource(PRIORITY));
    assertFalse(manager.delete(PRIORITY));
    assertFalse(manager.delete("never.set", true));
  }

  @Test
  void getWithDefaultFallsBack() {
    ConfigManager manager = manager();

    assertEquals("fallback", manager.get("missing.key", "fallback"));
    assertTrue(manager.get("missing.key").isEmpty());
    assertThrows(IllegalArgumentException.class, () -> manager.get("bad..path"));
  }

  @Test
  void savingUnloadedLayerFails() {
    ConfigManager manager = manager();
    manager.load();

    ConfigurationException ex = assertThrows(ConfigurationException.class, () -> manager.save(true));

    assertEquals("No global configuration to save", ex.getMessage());
    assertEquals("save", ex.operation());
    assertFalse(Files.exists(globalPath));
  }

  @Test
  void globalSaveIsOwnerOnly() throws IOException {
    Assumptions.assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
    ConfigManager manager = manager();
    manager.set("ai.apiKey", "sk-XYZ", true);

    manager.save(true);

    assertEquals("rw-------", PosixFilePermissions.toString(Files.getPosixFilePermissions(globalPath)));
    assertEquals(1L, metrics.counter("config.save.count"));
  }

  @Test
  void migrateMovesLocalIntoGlobal() throws IOException {
    write(globalPath, "git:\n  autoPush: true\n");
    write(localPath, "general:\n  defaultPriority: low\n");
    ConfigManager manager = manager();

    manager.migrateToGlobal();

    assertEquals(ConfigLayer.GLOBAL, manager.getSource(PRIORITY));
    assertEquals("low", manager.get(PRIORITY).orElseThrow());
    assertEquals(Map.of(), manager.getLocalMasked().orElseThrow());
    ConfigManager reader = manager();
    assertEquals("low", reader.get(PRIORITY).orElseThrow());
    assertEquals(true, reader.get("git.autoPush").orElseThrow());
    assertEquals(ConfigLayer.GLOBAL, reader.getSource(PRIORITY));
  }

  @Test
  void migrateWithoutLocalFails() {
    ConfigManager manager = manager();

    ConfigurationException ex = assertThrows(ConfigurationException.class, manager::migrateToGlobal);

    assertEquals("migrate", ex.operation());
  }

  @Test
  void copyFromGlobalOverlaysLocal() throws IOException {
    write(globalPath, "general:\n  defaultPriority: high\n");
    write(localPath, "general:\n  defaultPriority: low\n  dateFormat: MM-DD\n");
    ConfigManager manager = manager();

    manager.copyFromGlobal();

    assertEquals(ConfigLayer.LOCAL, manager.getSource(PRIORITY));
    assertEquals("high", manager.get(PRIORITY).orElseThrow());
    assertEquals("MM-DD", manager.get("general.dateFormat").orElseThrow());
    assertTrue(Files.readString(localPath).contains("high"));
  }

  @Test
  void copyWithoutGlobalFails() {
    ConfigManager manager = manager();

    assertEquals("copy", assertThrows(ConfigurationException.class, manager::copyFromGlobal).operation());
  }

  @Test
  void clearEmptiesLayerAndReloads() throws IOException {
    write(localPath, "general:\n  defaultPriority: low\n");
    ConfigManager manager = manager();
    manager.load();

    manager.reset();

    assertEquals("medium", manager.get(PRIORITY).orElseThrow());
    assertEquals(ConfigLayer.DEFAULT, manager.getSource(PRIORITY));
    assertEquals(Map.of(), manager.getLocalMasked().orElseThrow());
  }

  @Test
  void invalidFileIsNeverServed() throws IOException {
    write(localPath, "general:\n  defaultPriority: urgent\nai:\n  temperature: 9\n");
    ConfigManager manager = manager();

    ConfigValidationException ex = assertThrows(ConfigValidationException.class, manager::load);
    assertEquals(2, ex.violations().size());

    assertThrows(ConfigValidationException.class, () -> manager.get(PRIORITY));
    assertThrows(ConfigValidationException.class, manager::getMasked);
    assertThrows(ConfigValidationException.class, () -> manager.getSource(PRIORITY));
  }

  @Test
  void invalidFileCanBeRepairedOneValueAtATime() throws IOException {
    write(localPath, "general:\n  defaultPriority: urgent\nai:\n  temperature: 9\n");
    ConfigManager manager = manager();
    assertThrows(ConfigValidationException.class, manager::load);

    manager.set(PRIORITY, "high");
    assertThrows(ConfigValidationException.class, () -> manager.get(PRIORITY));

    ConfigValidationException rejected =
        assertThrows(ConfigValidationException.class, () -> manager.set("output.format", "xml"));
    assertEquals(List.of("output.format"), rejected.violations().stream().map(Violation::path).toList());

    manager.set("ai.temperature", 1);
    assertEquals("high", manager.get(PRIORITY).orElseThrow());
    assertEquals(1, manager.get("ai.temperature").orElseThrow());
    assertEquals("text", manager.get("output.format").orElseThrow());
  }

  @Test
  void deletingTheOffendingValueRepairsTheFile() throws IOException {
    write(localPath, "general:\n  defaultPriority: urgent\n");
    ConfigManager manager = manager();

    assertTrue(manager.delete(PRIORITY));

    assertEquals("medium", manager.get(PRIORITY).orElseThrow());
  }

  @Test
  void looseKeysInFilesStayLoadable() throws IOException {
    write(localPath, "hooks:\n  on: commit\nhosts:\n  example.com: 1\n");
    ConfigManager manager = manager();

    manager.load();

    assertEquals("commit", manager.get("hooks.true").orElseThrow());
    assertEquals(Map.of("example.com", 1), manager.get("hosts").orElseThrow());
    Map<?, ?> hosts = (Map<?, ?>) manager.getWithSources().get("hosts");
    assertEquals(new SourcedValue(1, ConfigLayer.LOCAL), hosts.get("example.com"));
    String exported = manager.exportToEnv(false);
    assertTrue(exported.contains("export TASKWERK_HOOKS_TRUE=\"commit\""));
    assertFalse(exported.contains("example.com"));
  }

  @Test
  void unparsableFileNamesPath() throws IOException {
    write(localPath, "general: [unclosed\n");
    ConfigManager manager = manager();

    ConfigParseException ex = assertThrows(ConfigParseException.class, manager::load);

    assertEquals(localPath, ex.path());
    assertTrue(ex.getMessage().contains(localPath.toString()));
  }

  @Test
  void maskedViewsHideSecrets() {
    ConfigManager manager = manager();
    manager.set("ai.apiKey", "sk-XYZ");

    Map<?, ?> masked = (Map<?, ?>) manager.getMasked().get("ai");
    Map<?, ?> local = (Map<?, ?>) manager.getLocalMasked().orElseThrow().get("ai");

    assertEquals("********", masked.get("apiKey"));
    assertEquals("********", local.get("apiKey"));
    assertTrue(manager.getGlobalMasked().isEmpty());
    assertTrue(manager.hasSensitiveData(Map.of("ai", Map.of("apiKey", "sk-XYZ"))));
    assertFalse(manager.hasSensitiveData(manager.getMasked()));
    assertTrue(manager.exportToEnv(false).contains("export TASKWERK_AI_API_KEY=\"********\""));
  }

  @Test
  void getWithSourcesPairsEveryLeaf() throws IOException {
    write(globalPath, "general:\n  defaultPriority: high\n");
    ConfigManager manager = manager();

    Map<?, ?> general = (Map<?, ?>) manager.getWithSources().get("general");

    assertEquals(new SourcedValue("high", ConfigLayer.GLOBAL), general.get("defaultPriority"));
    assertEquals(new SourcedValue("todo", ConfigLayer.DEFAULT), general.get("defaultStatus"));
  }

  @Test
  void loadReturnsIndependentCopy() {
    ConfigManager manager = manager();

    manager.load().put("general", "mutated");

    assertEquals("medium", manager.get(PRIORITY).orElseThrow());
    assertEquals(1L, metrics.counter("config.load.count"));
  }

  @Test
  void discardForcesReload() throws IOException {
    ConfigManager manager = manager();
    assertEquals("medium", manager.get(PRIORITY).orElseThrow());
    write(localPath, "general:\n  defaultPriority: critical\n");

    manager.discard();

    assertEquals("critical", manager.get(PRIORITY).orElseThrow());
  }

  @Test
  void pathsResolveFromHomeAndProject() {
    ConfigManager manager = ConfigManager.builder()
        .environment(EnvironmentPort.of(Map.of()))
        .userHome(tempDir.resolve("home"))
        .projectDirectory(tempDir.resolve("project"))
        .build();

    assertEquals(globalPath, manager.globalPath());
    assertEquals(localPath, manager.localPath());
    assertEquals("TASKWERK_AI_MAX_TOKENS", manager.envName("ai.maxTokens"));
  }

  @Test
  void appliesConfiguredLogLevel() throws IOException {
    write(localPath, "developer:\n  logLevel: error\n");
    String previous = LoggingConfigurator.currentLevel().orElse("warn");
    try {
      ConfigManager manager = ConfigManager.builder()
          .globalPath(globalPath)
          .localPath(localPath)
          .environment(EnvironmentPort.of(Map.of()))
          .applyLogLevel(true)
          .build();

      manager.load();

      assertEquals("error", LoggingConfigurator.currentLevel().orElseThrow());
    } finally {
      LoggingConfigurator.applyLevel(previous);
    }
  }

  private ConfigManager manager() {
    return ConfigManager.builder()
        .globalPath(globalPath)
        .localPath(localPath)
        .environment(() -> env)
        .metrics(metrics)
        .build();
  }

  private static void write(Path path, String content) throws IOException {
    Files.createDirectories(path.getParent());
    Files.writeString(path, content);
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, Long> counters = new HashMap<>();

    @Override
    public void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public void observe(String key, long value) {
      // latency values are not asserted
    }

    long counter(String key) {
      return counters.getOrDefault(key, 0L);
    }
  }
}
