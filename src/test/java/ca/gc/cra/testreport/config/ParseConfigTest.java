package ca.gc.cra.testreport.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ParseConfigTest {

  @TempDir Path tempDir;

  @Test
  void emptyMapUsesDefaults() {
    ParseConfig config = ParseConfig.fromMap(Map.of());

    assertEquals(Optional.empty(), config.input());
    assertEquals("", config.fallbackPackage());
    assertEquals(StandardCharsets.UTF_8, config.charset());
    assertFalse(config.failOnTestFailures());
  }

  @Test
  void dashSelectsStandardInput() {
    assertTrue(ParseConfig.fromMap(Map.of("in", "-")).input().isEmpty());
  }

  @Test
  void fromMapReadsAllKeys() throws Exception {
    Path log = Files.writeString(tempDir.resolve("runner.log"), "PASS\n");

    ParseConfig config = ParseConfig.fromMap(Map.of(
        "in", log.toString(),
        "pkg", " example.com/calc ",
        "charset", "ISO-8859-1",
        "failOnTestFailures", "TRUE"));

    assertEquals(log.toRealPath(), config.input().orElseThrow());
    assertEquals("example.com/calc", config.fallbackPackage());
    assertEquals(StandardCharsets.ISO_8859_1, config.charset());
    assertTrue(config.failOnTestFailures());
  }

  @Test
  void missingInputFileIsRejected() {
    Path missing = tempDir.resolve("missing.log");

    assertThrows(IllegalArgumentException.class, () -> ParseConfig.fromMap(Map.of("in", missing.toString())));
  }

  @Test
  void unknownCharsetIsRejected() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> ParseConfig.fromMap(Map.of("charset", "no-such-charset")));

    assertTrue(ex.getMessage().contains("charset"));
  }

  @Test
  void malformedBooleanIsRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> ParseConfig.fromMap(Map.of("failOnTestFailures", "yes")));
  }
}
