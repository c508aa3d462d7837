package ca.gc.cra.taskwerk.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LoggingConfiguratorTest {
  private String previous;

  @BeforeEach
  void rememberLevel() {
    previous = LoggingConfigurator.currentLevel().orElse("warn");
  }

  @AfterEach
  void restoreLevel() {
    LoggingConfigurator.applyLevel(previous);
  }

  @Test
  void applyLevelChangesRootLogger() {
    assertTrue(LoggingConfigurator.applyLevel("TRACE"));
    assertEquals("trace", LoggingConfigurator.currentLevel().orElseThrow());
  }

  @Test
  void verboseLoggingMeansDebug() {
    LoggingConfigurator.enableVerboseLogging();

    assertEquals("debug", LoggingConfigurator.currentLevel().orElseThrow());
  }

  @Test
  void unknownLevelsAreIgnored() {
    assertFalse(LoggingConfigurator.applyLevel("verbose"));
    assertFalse(LoggingConfigurator.applyLevel(null));
    assertEquals(previous, LoggingConfigurator.currentLevel().orElseThrow());
  }
}
