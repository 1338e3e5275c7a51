package ca.gc.cra.cadence.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("Portishead - Roads", Logs.truncate("Portishead - Roads", 64));
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void longValuesAreCutOnCharacterBoundary() {
    String truncated = Logs.truncate("Sigur Rós", 8);

    assertTrue(truncated.startsWith("Sigur R"), truncated);
    assertTrue(truncated.endsWith("... (truncated, 8 of 10)"), truncated);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
