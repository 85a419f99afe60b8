package ca.gc.cra.testreport.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreReturnedUnchanged() {
    String value = "--- PASS: TestA (0.01s)";
    assertSame(value, Logs.truncate(value, 64));
  }

  @Test
  void longValuesAreTruncatedWithLength() {
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
  }

  @Test
  void truncationDropsSplitCodepoint() {
    assertEquals("a... (truncated, 2 of 4)", Logs.truncate("aéz", 2));
  }

  @Test
  void nullAndInvalidLimits() {
    assertEquals("<null>", Logs.truncate(null, 10));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
