package ca.gc.cra.taskwerk.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsNull() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("test", null));
  }

  @Test
  void envIdentifierAcceptsUpperSnakeCase() {
    assertEquals("TASKWERK_", Strings.requireEnvIdentifier("prefix", "TASKWERK_"));
  }

  @Test
  void envIdentifierRejectsLowerCaseAndLeadingDigits() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireEnvIdentifier("prefix", "taskwerk_"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireEnvIdentifier("prefix", "1TASK"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireEnvIdentifier("prefix", "TASK-WERK"));
  }
}
