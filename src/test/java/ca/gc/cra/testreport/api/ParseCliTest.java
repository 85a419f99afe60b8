package ca.gc.cra.testreport.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.testreport.application.pipeline.ParseUseCase;
import ca.gc.cra.testreport.domain.parse.TestOutputParser;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ParseCliTest {
  private static final String CALC_SUMMARY =
      "FAIL example.com/calc 0.030s tests=3 failed=1 skipped=1 benchmarks=0";
  private static final String STRS_SUMMARY =
      "ok   example.com/strs 0.100s tests=1 failed=0 skipped=0 benchmarks=1";
  private static final String TOTAL_SUMMARY = "total packages=2 tests=4 failed=1 skipped=1";

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ParseCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsSummaryForInputFile() throws Exception {
    ExitCode code = ParseCli.run(new String[] {"in=" + fixture()});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains(CALC_SUMMARY), out);
    assertTrue(out.contains(STRS_SUMMARY), out);
    assertTrue(out.contains(TOTAL_SUMMARY), out);
  }

  @Test
  void failOnTestFailuresReturnsTestFailures() throws Exception {
    ExitCode code = ParseCli.run(new String[] {"in=" + fixture(), "failOnTestFailures=true"});

    assertEquals(ExitCode.TEST_FAILURES, code);
    assertTrue(buffer.toString().contains(TOTAL_SUMMARY));
  }

  @Test
  void readsStandardInputByDefault() {
    String output = String.join("\n",
        "{\"Suite\":\"pkgA\",\"Test\":\"TestA\",\"Msg\":\"\"}",
        "--- PASS: TestA (0.25s)",
        "ok  \tpkgA\t0.250s",
        "");
    ParseUseCase useCase = new ParseUseCase(new TestOutputParser(),
        () -> new ByteArrayInputStream(output.getBytes(StandardCharsets.UTF_8)));

    ExitCode code = ParseCli.run(new String[] {"failOnTestFailures=true"}, useCase);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("ok   pkgA 0.250s tests=1 failed=0 skipped=0 benchmarks=0"));
    assertTrue(buffer.toString().contains("total packages=1 tests=1 failed=0 skipped=0"));
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = ParseCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("failOnTestFailures=BOOL"));
  }

  @Test
  void malformedArgumentReturnsInvalidArgs() {
    ExitCode code = ParseCli.run(new String[] {"runner.log"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: parse"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid argument")));
  }

  @Test
  void unknownKeyReturnsInvalidArgs() {
    ExitCode code = ParseCli.run(new String[] {"format=junit"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: parse"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid parse configuration")
            && event.getFormattedMessage().contains("format")));
  }

  @Test
  void missingInputFileReturnsInvalidArgs() {
    ExitCode code = ParseCli.run(new String[] {"in=" + tempDir.resolve("missing.log")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("does not exist")));
  }

  @Test
  void yamlConfigSuppliesValuesAndCliOverrides() throws Exception {
    Path yaml = tempDir.resolve("testreport.yaml");
    Files.writeString(yaml, """
        parse:
          in: "%s"
          pkg: example.com/yaml
          failOnTestFailures: true
        """.formatted(fixture()));

    ExitCode code = ParseCli.run(new String[] {"config=" + yaml, "pkg=example.com/cli"});

    assertEquals(ExitCode.TEST_FAILURES, code);
    assertTrue(buffer.toString().contains(CALC_SUMMARY));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().equals("CLI overrides YAML for key: pkg")));
  }

  @Test
  void missingConfigFileFallsBackToDefaults() {
    ParseUseCase useCase = new ParseUseCase(new TestOutputParser(),
        () -> new ByteArrayInputStream(new byte[0]));

    ExitCode code = ParseCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")}, useCase);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("total packages=0 tests=0 failed=0 skipped=0"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("not found")));
  }

  @Test
  void malformedConfigReturnsConfigError() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("bad.yaml"), "- parse\n- common\n");

    ExitCode code = ParseCli.run(new String[] {"config=" + yaml});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Unable to load configuration")));
  }

  @Test
  void unsupportedYamlKeyReturnsConfigError() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("extra.yaml"), """
        parse:
          outputFormat: junit
        """);

    ExitCode code = ParseCli.run(new String[] {"config=" + yaml});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("Unsupported key parse.outputFormat")));
  }

  @Test
  void blankConfigPathReturnsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, ParseCli.run(new String[] {"config="}));
  }

  @Test
  void readFailureReturnsIoError() {
    ParseUseCase useCase = new ParseUseCase(new TestOutputParser(), () -> new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("broken pipe");
      }
    });

    assertEquals(ExitCode.IO_ERROR, ParseCli.run(new String[0], useCase));
  }

  @Test
  void unexpectedFailureReturnsRuntimeFailure() {
    ParseUseCase useCase = new ParseUseCase(new TestOutputParser(), () -> {
      throw new IllegalStateException("stdin unavailable");
    });

    assertEquals(ExitCode.RUNTIME_FAILURE, ParseCli.run(new String[0], useCase));
  }

  private static Path fixture() throws Exception {
    return Path.of(ParseCliTest.class.getResource("/fixtures/mixed-output.txt").toURI());
  }
}
