package ca.gc.cra.testreport.api;

import ca.gc.cra.testreport.application.pipeline.ParseUseCase;
import ca.gc.cra.testreport.config.ConfigMerger;
import ca.gc.cra.testreport.config.DefaultsForMode;
import ca.gc.cra.testreport.config.ParseConfig;
import ca.gc.cra.testreport.config.YamlConfigLoader;
import ca.gc.cra.testreport.domain.report.Report;
import ca.gc.cra.testreport.logging.LoggingConfigurator;
import ca.gc.cra.testreport.validation.Strings;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing test-runner output into a report and printing its summary.
 *
 * @since 0.1.0
 */
public final class ParseCli {
  private static final Logger log = LoggerFactory.getLogger(ParseCli.class);
  private static final String MODE = "parse";
  private static final String SUMMARY_USAGE =
      "usage: parse [in=PATH|-] [pkg=NAME] [charset=NAME] [failOnTestFailures=true|false] [config=PATH]";
  private static final String HELP_TEXT = """
      Test output report builder

      Usage:
        parse [options]

      Options:
        in=PATH|-                     Runner output file; '-' (default) reads standard input
        pkg=NAME                      Package name known out-of-band
        charset=NAME                  Input encoding (default UTF-8)
        failOnTestFailures=BOOL       Exit with status 1 when any test failed (default false)
        config=PATH                   YAML file with 'common' and 'parse' sections
        --verbose                     Enable DEBUG logging
        --trace                       Also log every line the parser drops (TRACE)
        --help                        Show this message

      Notes:
        Command-line values override YAML values, which override built-in defaults.
        Tests of a package that never prints its ok/FAIL result line are not reported.
      """;

  private ParseCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the parse command and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, new ParseUseCase());
  }

  static ExitCode run(String[] args, ParseUseCase useCase) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for parse CLI");
    }
    if (input.trace()) {
      LoggingConfigurator.enableLineTracing();
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.remaining());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml;
    try {
      yaml = loadYaml(kv.remove("config"));
    } catch (IOException | IllegalArgumentException ex) {
      log.error("Unable to load configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    ParseConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          yaml, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      if (Boolean.parseBoolean(effective.get("verbose")) && !input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      config = ParseConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid parse configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Report report;
    try {
      report = useCase.run(config);
    } catch (IOException ex) {
      log.error("Failed to read test output", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while parsing test output", ex);
      return ExitCode.RUNTIME_FAILURE;
    }

    for (String line : ReportSummary.lines(report)) {
      CliPrinter.println(line);
    }
    if (config.failOnTestFailures() && report.failures() > 0) {
      return ExitCode.TEST_FAILURES;
    }
    return ExitCode.SUCCESS;
  }

  private static Optional<Map<String, String>> loadYaml(String location) throws IOException {
    if (location == null) {
      return Optional.empty();
    }
    Path path;
    try {
      path = Path.of(Strings.requireNonBlank("config", location));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("config is not a valid path: " + location, ex);
    }
    Optional<Map<String, String>> yaml =
        YamlConfigLoader.load(path, MODE, DefaultsForMode.asFlatMap(MODE).keySet());
    if (yaml.isEmpty()) {
      log.warn("Config file {} not found; using defaults", path);
    }
    return yaml;
  }
}
