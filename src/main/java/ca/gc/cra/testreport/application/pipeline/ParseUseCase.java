package ca.gc.cra.testreport.application.pipeline;

import ca.gc.cra.testreport.config.ParseConfig;
import ca.gc.cra.testreport.domain.parse.TestOutputParser;
import ca.gc.cra.testreport.domain.report.Report;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads test-runner output from a file or standard input and builds a {@link Report}.
 * <p><strong>Role:</strong> Application-layer use case behind the {@code parse} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open the configured input and hand it to {@link TestOutputParser}.</li>
 *   <li>Close file inputs; leave standard input open for the JVM.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; safe to reuse sequentially.</p>
 * <p><strong>Observability:</strong> Logs the parsed totals at INFO with the input tagged in MDC key {@code input}.</p>
 *
 * @since 0.1.0
 */
public final class ParseUseCase {
  private static final Logger log = LoggerFactory.getLogger(ParseUseCase.class);
  private static final String MDC_INPUT = "input";

  private final TestOutputParser parser;
  private final Supplier<InputStream> stdin;

  /**
   * Creates a use case that reads {@link System#in} when no input file is configured.
   */
  public ParseUseCase() {
    this(new TestOutputParser(), () -> System.in);
  }

  /**
   * Creates a use case with explicit collaborators.
   *
   * @param parser report builder; must not be {@code null}
   * @param stdin source used when the configuration names no input file; must not be {@code null}
   */
  public ParseUseCase(TestOutputParser parser, Supplier<InputStream> stdin) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.stdin = Objects.requireNonNull(stdin, "stdin");
  }

  /**
   * Parses the configured input.
   *
   * @param config validated parse configuration; must not be {@code null}
   * @return report built from the input
   * @throws IOException if the input cannot be opened or read
   */
  public Report run(ParseConfig config) throws IOException {
    Objects.requireNonNull(config, "config");
    Optional<Path> input = config.input();
    String source = input.map(Path::toString).orElse(ParseConfig.STDIN);
    String previousInput = MDC.get(MDC_INPUT);
    MDC.put(MDC_INPUT, source);
    try {
      Report report;
      if (input.isPresent()) {
        try (InputStream in = Files.newInputStream(input.get())) {
          report = parser.parse(in, config.charset(), config.fallbackPackage());
        }
      } else {
        report = parser.parse(stdin.get(), config.charset(), config.fallbackPackage());
      }
      log.info("Parsed {} packages with {} failing tests", report.packages().size(), report.failures());
      return report;
    } finally {
      if (previousInput == null) {
        MDC.remove(MDC_INPUT);
      } else {
        MDC.put(MDC_INPUT, previousInput);
      }
    }
  }
}
