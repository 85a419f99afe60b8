package ca.gc.cra.testreport.domain.parse;

import ca.gc.cra.testreport.domain.parse.LinePatterns.PackageResultLine;
import ca.gc.cra.testreport.domain.parse.LinePatterns.StatusLine;
import ca.gc.cra.testreport.domain.report.Benchmark;
import ca.gc.cra.testreport.domain.report.Report;
import ca.gc.cra.testreport.domain.report.Result;
import ca.gc.cra.testreport.domain.report.TestCase;
import ca.gc.cra.testreport.domain.report.TestPackage;
import ca.gc.cra.testreport.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns interleaved test-runner output into a {@link Report}.
 * <p><strong>Why:</strong> Runner output mixes status lines, JSON output records, package summaries and free
 * text; formatters need a typed tree of packages, tests and benchmarks instead.</p>
 * <p><strong>Role:</strong> Domain service; the only component with parsing state.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify each line, first match wins: package result, status, output record, benchmark, free text.</li>
 *   <li>Route free text to the test most recently resolved by a status line.</li>
 *   <li>Flush buffered tests into packages when a package-result line arrives.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances hold no per-parse state and may be shared; each call owns its
 * buffer.</p>
 * <p><strong>Observability:</strong> Flushes and end-of-stream discards are logged at DEBUG, dropped lines at
 * TRACE. Malformed input never produces warnings.</p>
 *
 * @implNote Tests buffered for a package that never prints a package-result line are discarded at end of
 * stream, and the fallback package name does not rescue them.
 * @since 0.1.0
 */
public final class TestOutputParser {
  private static final Logger log = LoggerFactory.getLogger(TestOutputParser.class);
  private static final int TRACE_LINE_BYTES = 256;

  private final OutputRecordDecoder decoder;

  /**
   * Creates a parser with the default record decoder.
   */
  public TestOutputParser() {
    this(new OutputRecordDecoder());
  }

  /**
   * Creates a parser with a caller-supplied record decoder.
   *
   * @param decoder structured output record decoder; must not be {@code null}
   */
  public TestOutputParser(OutputRecordDecoder decoder) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
  }

  /**
   * Parses a byte stream decoded as UTF-8.
   *
   * @param in runner output; not closed by this method
   * @param fallbackPackageName package name known out-of-band; may be {@code null}
   * @return report of every package closed by a package-result line
   * @throws IOException if reading the stream fails; no partial report is returned
   */
  public Report parse(InputStream in, String fallbackPackageName) throws IOException {
    return parse(in, StandardCharsets.UTF_8, fallbackPackageName);
  }

  /**
   * Parses a byte stream decoded with {@code charset}.
   *
   * @param in runner output; not closed by this method
   * @param charset input encoding; malformed sequences are replaced rather than rejected
   * @param fallbackPackageName package name known out-of-band; may be {@code null}
   * @return report of every package closed by a package-result line
   * @throws IOException if reading the stream fails
   */
  public Report parse(InputStream in, Charset charset, String fallbackPackageName) throws IOException {
    Objects.requireNonNull(in, "in");
    Objects.requireNonNull(charset, "charset");
    return parse(new InputStreamReader(in, charset), fallbackPackageName);
  }

  /**
   * Parses character input until end of stream. Lines end at {@code '\n'}; a bare {@code '\r'} stays in the line.
   *
   * @param reader runner output; not closed by this method
   * @param fallbackPackageName package name known out-of-band; may be {@code null}
   * @return report of every package closed by a package-result line
   * @throws IOException if reading fails
   */
  public Report parse(Reader reader, String fallbackPackageName) throws IOException {
    Objects.requireNonNull(reader, "reader");
    if (fallbackPackageName != null && !fallbackPackageName.isEmpty()) {
      log.debug("Parsing test output with fallback package {}", fallbackPackageName);
    }
    BufferedReader lines = reader instanceof BufferedReader buffered
        ? buffered
        : new BufferedReader(reader);

    List<TestPackage> packages = new ArrayList<>();
    SuiteBuffer suites = new SuiteBuffer();
    TestCase current = null;

    StringBuilder scratch = new StringBuilder();
    String line;
    while ((line = readLine(lines, scratch)) != null) {
      Optional<PackageResultLine> packageResult = LinePatterns.matchPackageResult(line);
      if (packageResult.isPresent()) {
        flush(packageResult.get(), suites, packages);
        continue;
      }

      Optional<StatusLine> status = LinePatterns.matchStatus(line);
      if (status.isPresent()) {
        current = resolve(status.get(), suites);
        continue;
      }

      Optional<OutputRecord> record = decoder.decode(line);
      if (record.isPresent()) {
        suites.append(record.get());
        continue;
      }

      Optional<Benchmark> benchmark = LinePatterns.matchBenchmark(line);
      if (benchmark.isPresent()) {
        if (!suites.addBenchmark(benchmark.get())) {
          log.debug("Dropping benchmark {} read outside any package", benchmark.get().name());
        }
        continue;
      }

      attach(current, line);
    }

    if (!suites.isEmpty()) {
      log.debug("Discarding {} tests from packages without a result line", suites.testCount());
    }
    return new Report(packages);
  }

  /**
   * Reads up to the next {@code '\n'}, dropping it and one {@code '\r'} directly before it. A bare
   * {@code '\r'} stays part of the line, so progress output rewritten in place remains one line.
   *
   * @return the line, or {@code null} at end of stream with nothing left to read
   */
  private static String readLine(Reader reader, StringBuilder scratch) throws IOException {
    scratch.setLength(0);
    int c;
    while ((c = reader.read()) != -1) {
      if (c == '\n') {
        int last = scratch.length() - 1;
        if (last >= 0 && scratch.charAt(last) == '\r') {
          scratch.setLength(last);
        }
        return scratch.toString();
      }
      scratch.append((char) c);
    }
    return scratch.length() == 0 ? null : scratch.toString();
  }

  private static void flush(PackageResultLine result, SuiteBuffer suites, List<TestPackage> packages) {
    // TODO: decide whether the result line's coverage and elapsed time should override the summed values.
    log.debug("Package result {} {} (seconds={}, coverage={}, cached={})",
        result.ok() ? "ok" : "FAIL",
        result.packageName(),
        result.seconds(),
        result.coveragePct(),
        result.cached());
    for (TestPackage pkg : suites.drain()) {
      log.debug("Flushed package {} with {} tests and {} benchmarks in {}",
          pkg.name(), pkg.tests().size(), pkg.benchmarks().size(), pkg.duration());
      packages.add(pkg);
    }
  }

  private static TestCase resolve(StatusLine status, SuiteBuffer suites) {
    String name = LinePatterns.baseName(status.name());
    Optional<TestCase> found = suites.find(name);
    if (found.isEmpty()) {
      log.trace("Status line for unknown test {}", name);
      return null;
    }
    TestCase test = found.get();
    test.result(status.result());
    test.duration(Durations.parseSeconds(status.seconds()));
    test.subtestIndent(status.indent());
    return test;
  }

  private static void attach(TestCase current, String line) {
    if (current != null && current.result() == Result.FAIL) {
      current.appendFailure(line);
    } else if (current != null && current.result() == Result.SKIP) {
      current.appendSkipMessage(line);
    } else if (log.isTraceEnabled()) {
      log.trace("Dropping {} line: {}",
          LinePatterns.isSummary(line) ? "summary" : "unattributed",
          Logs.truncate(line, TRACE_LINE_BYTES));
    }
  }
}
