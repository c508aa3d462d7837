package ca.gc.cra.taskwerk.infrastructure.persistence;

import ca.gc.cra.taskwerk.config.ConfigParseException;
import ca.gc.cra.taskwerk.config.ConfigPersistenceException;
import ca.gc.cra.taskwerk.domain.config.ConfigPath;
import ca.gc.cra.taskwerk.domain.config.ConfigTrees;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads and writes the on-disk configuration layers.
 * <p><strong>Why:</strong> Keeps format detection, secret masking and file permissions at one boundary so the
 * manager only ever sees in-memory trees.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse YAML or JSON by extension, auto-detecting when the extension is unknown.</li>
 *   <li>Mask secrets on a copy, serialize fully in memory, then write with a single call.</li>
 *   <li>Restrict the global file to its owner and warn about readable files holding secrets.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the masker; no file locking is performed.</p>
 * <p><strong>Observability:</strong> DEBUG on load/save, WARN for permission findings.</p>
 *
 * @since 0.1.0
 */
public final class LayerStore {
  private static final Logger log = LoggerFactory.getLogger(LayerStore.class);
  private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

  private final SecretMasker masker;

  /**
   * Creates a store masking the sensitive fields known to {@code masker}.
   *
   * @param masker secret masker
   */
  public LayerStore(SecretMasker masker) {
    this.masker = Objects.requireNonNull(masker, "masker");
  }

  /**
   * Loads one layer.
   *
   * @param path layer file
   * @return parsed tree; empty when the file is absent or the document is empty
   * @throws ConfigParseException when the file cannot be read or parsed, or its root is not a mapping
   */
  public Map<String, Object> loadLayer(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return ConfigTrees.emptyTree();
    }
    String content;
    try {
      content = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new ConfigParseException(path, "unable to read file", ex);
    }
    Object document = parse(path, content);
    if (document == null) {
      return ConfigTrees.emptyTree();
    }
    Map<String, Object> tree = toTree(path, document, "root");
    List<ConfigPath> stripped = masker.stripPlaceholders(tree);
    if (!stripped.isEmpty()) {
      log.debug("Ignoring masked placeholders for {} in {}", stripped, path);
    }
    log.debug("Loaded configuration layer from {}", path);
    return tree;
  }

  /**
   * Persists one layer. Sensitive values are masked on a copy; {@code data} is not modified.
   *
   * @param path target file; its extension selects the format (YAML when unknown)
   * @param data layer contents
   * @param ownerOnly whether to restrict the file to owner read/write afterwards
   * @throws ConfigPersistenceException when the directory cannot be created or the file cannot be written
   */
  public void saveLayer(Path path, Map<String, ?> data, boolean ownerOnly) {
    Objects.requireNonNull(path, "path");
    ConfigFormat format = ConfigFormat.forPath(path).orElse(ConfigFormat.YAML);
    String content = format.serialize(masker.mask(data));
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(path, content, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new ConfigPersistenceException(path, ex);
    }
    log.debug("Wrote {} configuration layer to {}", format, path);
    if (ownerOnly) {
      restrictToOwner(path);
    }
  }

  /**
   * Warns when {@code path} is readable by group or others while {@code data} holds a real secret.
   *
   * @param path layer file
   * @param data in-memory contents of that layer
   * @return {@code true} when the warning was emitted
   */
  public boolean checkPermissions(Path path, Map<String, ?> data) {
    if (path == null || !Files.exists(path) || !masker.hasSensitiveData(data)) {
      return false;
    }
    Optional<Set<PosixFilePermission>> permissions = posixPermissions(path);
    if (permissions.isEmpty()) {
      return false;
    }
    Set<PosixFilePermission> current = permissions.get();
    if (current.contains(PosixFilePermission.GROUP_READ) || current.contains(PosixFilePermission.OTHERS_READ)) {
      log.warn("Configuration file {} is readable by other users and contains secrets. Run: chmod 600 \"{}\" to fix",
          path, path);
      return true;
    }
    return false;
  }

  private Object parse(Path path, String content) {
    Optional<ConfigFormat> declared = ConfigFormat.forPath(path);
    if (declared.isPresent()) {
      try {
        return declared.get().parse(content);
      } catch (IllegalArgumentException ex) {
        throw new ConfigParseException(path, ex.getMessage(), ex);
      }
    }
    try {
      return ConfigFormat.YAML.parse(content);
    } catch (IllegalArgumentException yamlFailure) {
      try {
        return ConfigFormat.JSON.parse(content);
      } catch (IllegalArgumentException jsonFailure) {
        jsonFailure.addSuppressed(yamlFailure);
        throw new ConfigParseException(path, "content is neither YAML nor JSON", jsonFailure);
      }
    }
  }

  // Keys are stringified: YAML 1.1 reads on/yes/no as booleans and numbers stay numbers.
  private static Map<String, Object> toTree(Path path, Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new ConfigParseException(path, context + " must be a mapping", null);
    }
    Map<String, Object> tree = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      String child = "root".equals(context) ? key : context + '.' + key;
      tree.put(key, value instanceof Map<?, ?> ? toTree(path, value, child) : ConfigTrees.copyValue(value));
    }
    return tree;
  }

  private static void restrictToOwner(Path path) {
    try {
      Files.setPosixFilePermissions(path, OWNER_ONLY);
    } catch (IOException | UnsupportedOperationException ex) {
      log.warn("Could not set secure permissions on {}: {}", path, ex.getMessage());
    }
  }

  private static Optional<Set<PosixFilePermission>> posixPermissions(Path path) {
    try {
      return Optional.of(Files.getPosixFilePermissions(path));
    } catch (IOException | UnsupportedOperationException ex) {
      log.debug("Skipping permission check for {}: {}", path, ex.getMessage());
      return Optional.empty();
    }
  }
}
