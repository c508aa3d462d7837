package ca.gc.cra.taskwerk.domain.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConfigLayerTest {

  @Test
  void envOutranksEveryOtherLayer() {
    assertTrue(ConfigLayer.ENV.outranks(ConfigLayer.LOCAL));
    assertTrue(ConfigLayer.LOCAL.outranks(ConfigLayer.GLOBAL));
    assertTrue(ConfigLayer.GLOBAL.outranks(ConfigLayer.DEFAULT));
    assertFalse(ConfigLayer.GLOBAL.outranks(ConfigLayer.LOCAL));
    assertFalse(ConfigLayer.LOCAL.outranks(ConfigLayer.LOCAL));
  }

  @Test
  void anyLayerOutranksAnUnclaimedPath() {
    assertTrue(ConfigLayer.DEFAULT.outranks(null));
  }

  @Test
  void onlyFileLayersArePersisted() {
    assertTrue(ConfigLayer.GLOBAL.persisted());
    assertTrue(ConfigLayer.LOCAL.persisted());
    assertFalse(ConfigLayer.DEFAULT.persisted());
    assertFalse(ConfigLayer.ENV.persisted());
  }
}
