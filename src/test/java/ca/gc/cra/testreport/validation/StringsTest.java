package ca.gc.cra.testreport.validation;

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
  void requireNonBlankRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("test", null));
  }

  @Test
  void optionalMapsNullToEmpty() {
    assertEquals("", Strings.optional("pkg", null));
    assertEquals("example.com/calc", Strings.optional("pkg", " example.com/calc "));
  }

  @Test
  void optionalRejectsControlCharacters() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.optional("pkg", "a\tb"));
    assertEquals("pkg must not contain control characters", ex.getMessage());
  }
}
