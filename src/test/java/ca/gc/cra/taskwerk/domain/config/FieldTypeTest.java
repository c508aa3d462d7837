package ca.gc.cra.taskwerk.domain.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldTypeTest {

  @Test
  void integerRequiresWholeNumber() {
    assertTrue(FieldType.INTEGER.accepts(7));
    assertTrue(FieldType.INTEGER.accepts(7L));
    assertTrue(FieldType.INTEGER.accepts(7.0));
    assertTrue(FieldType.INTEGER.accepts(new BigDecimal("7.00")));
    assertFalse(FieldType.INTEGER.accepts(7.5));
    assertFalse(FieldType.INTEGER.accepts("7"));
  }

  @Test
  void numberAcceptsFiniteValues() {
    assertTrue(FieldType.NUMBER.accepts(0.7));
    assertTrue(FieldType.NUMBER.accepts(2));
    assertFalse(FieldType.NUMBER.accepts(Double.NaN));
    assertFalse(FieldType.NUMBER.accepts(Double.POSITIVE_INFINITY));
  }

  @Test
  void nullMatchesNoType() {
    for (FieldType type : FieldType.values()) {
      assertFalse(type.accepts(null), type.name());
    }
  }

  @Test
  void describeNamesParsedValues() {
    assertEquals("string", FieldType.describe("x"));
    assertEquals("number", FieldType.describe(3));
    assertEquals("boolean", FieldType.describe(true));
    assertEquals("object", FieldType.describe(Map.of()));
    assertEquals("array", FieldType.describe(List.of()));
    assertEquals("null", FieldType.describe(null));
  }
}
