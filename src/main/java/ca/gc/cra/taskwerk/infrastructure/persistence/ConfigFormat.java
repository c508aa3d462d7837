package ca.gc.cra.taskwerk.infrastructure.persistence;

import ca.gc.cra.taskwerk.application.json.JsonSupport;
import ca.gc.cra.taskwerk.util.PathUtils;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * The two structured-text serializations accepted for layer files.
 *
 * <p>{@link #parse(String)} returns the raw document (usually a map, {@code null} for an empty document) and
 * throws {@link IllegalArgumentException} when the text is not valid for the format.</p>
 */
public enum ConfigFormat {
  YAML {
    @Override
    public Object parse(String content) {
      try {
        return yaml().load(content);
      } catch (YAMLException ex) {
        throw new IllegalArgumentException("invalid YAML: " + firstLine(ex.getMessage()), ex);
      }
    }

    @Override
    public String serialize(Map<String, ?> tree) {
      DumperOptions options = new DumperOptions();
      options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
      options.setIndent(2);
      options.setWidth(80);
      options.setPrettyFlow(true);
      return new Yaml(options).dump(tree);
    }
  },

  JSON {
    @Override
    public Object parse(String content) {
      if (content.isBlank()) {
        return null;
      }
      return JSON_SUPPORT.parse(content);
    }

    @Override
    public String serialize(Map<String, ?> tree) {
      return JSON_SUPPORT.writePretty(tree);
    }
  };

  private static final JsonSupport JSON_SUPPORT = new JsonSupport();

  /**
   * Parses a document in this format.
   *
   * @param content file content
   * @return parsed document root, {@code null} when the document is empty
   * @throws IllegalArgumentException when the content is not valid for this format
   */
  public abstract Object parse(String content);

  /**
   * Serializes a tree entirely in memory.
   *
   * @param tree layer contents
   * @return document text
   */
  public abstract String serialize(Map<String, ?> tree);

  /**
   * Selects the format from a file extension.
   *
   * @param path layer file
   * @return {@link #YAML} for {@code .yml}/{@code .yaml}, {@link #JSON} for {@code .json}; empty otherwise
   */
  public static Optional<ConfigFormat> forPath(Path path) {
    return PathUtils.extension(path).flatMap(extension -> switch (extension) {
      case "yml", "yaml" -> Optional.of(YAML);
      case "json" -> Optional.of(JSON);
      default -> Optional.empty();
    });
  }

  private static Yaml yaml() {
    return new Yaml(new SafeConstructor(new LoaderOptions()));
  }

  private static String firstLine(String message) {
    if (message == null) {
      return "unknown error";
    }
    int newline = message.indexOf('\n');
    return newline < 0 ? message : message.substring(0, newline);
  }
}
