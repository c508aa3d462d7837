package ca.gc.cra.taskwerk.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PathUtilsTest {

  @Test
  void extensionIsLowerCased() {
    assertEquals(Optional.of("yml"), PathUtils.extension(Path.of("dir/config.YML")));
  }

  @Test
  void dotfilesAndBareNamesHaveNoExtension() {
    assertTrue(PathUtils.extension(Path.of(".taskwerk")).isEmpty());
    assertTrue(PathUtils.extension(Path.of("config")).isEmpty());
    assertTrue(PathUtils.extension(Path.of("config.")).isEmpty());
    assertTrue(PathUtils.extension(null).isEmpty());
  }

  @Test
  void withExtensionReplacesSuffix() {
    assertEquals(Path.of("dir/config.json"), PathUtils.withExtension(Path.of("dir/config.yml"), "json"));
    assertEquals(Path.of("dir/config.json"), PathUtils.withExtension(Path.of("dir/config"), "json"));
  }
}
