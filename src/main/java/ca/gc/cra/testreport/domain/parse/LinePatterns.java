package ca.gc.cra.testreport.domain.parse;

import ca.gc.cra.testreport.domain.report.Benchmark;
import ca.gc.cra.testreport.domain.report.Result;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled line shapes recognized in test-runner output.
 *
 * <p>Patterns are compiled once and shared; every matcher is side-effect free and reports a miss as an
 * empty {@link Optional} rather than an exception.</p>
 *
 * @since 0.1.0
 */
public final class LinePatterns {
  private static final Pattern PACKAGE_RESULT = Pattern.compile(
      "^(ok|FAIL)\\s+([^ ]+)\\s+(?:(\\d+\\.\\d+)s|\\(cached\\)|(\\[\\w+ failed\\]))"
          + "(?:\\s+coverage:\\s+(\\d+\\.\\d+)%\\sof\\sstatements(?:\\sin\\s.+)?)?$");
  private static final Pattern STATUS =
      Pattern.compile("--- (PASS|FAIL|SKIP): (.+) \\((\\d+\\.\\d+)(?: seconds|s)\\)");
  private static final Pattern INDENT = Pattern.compile("^([ \\t]+)---");
  private static final Pattern BENCHMARK = Pattern.compile(
      "^(Benchmark[^ -]+)(?:-\\d+\\s+|\\s+)(\\d+)\\s+(\\d+|\\d+\\.\\d+)\\sns/op"
          + "(?:\\s+(\\d+)\\sB/op)?(?:\\s+(\\d+)\\sallocs/op)?");
  private static final Pattern SUMMARY = Pattern.compile("^(PASS|FAIL|SKIP)$");

  private LinePatterns() {}

  /**
   * Matches the terminal line of a package run, e.g. {@code ok  pkg 0.010s coverage: 87.5% of statements}.
   *
   * @param line raw line without terminator
   * @return parsed fields when the whole line matches
   */
  public static Optional<PackageResultLine> matchPackageResult(String line) {
    Matcher m = PACKAGE_RESULT.matcher(line);
    if (!m.find()) {
      return Optional.empty();
    }
    return Optional.of(new PackageResultLine(
        "ok".equals(m.group(1)),
        m.group(2),
        nullToEmpty(m.group(3)),
        nullToEmpty(m.group(4)),
        nullToEmpty(m.group(5))));
  }

  /**
   * Matches a {@code --- STATUS: name (N.NNs)} line anywhere within {@code line}.
   *
   * @param line raw line without terminator
   * @return status fields including the leading indentation, if any
   */
  public static Optional<StatusLine> matchStatus(String line) {
    Matcher m = STATUS.matcher(line);
    if (!m.find()) {
      return Optional.empty();
    }
    Result result = switch (m.group(1)) {
      case "PASS" -> Result.PASS;
      case "SKIP" -> Result.SKIP;
      default -> Result.FAIL;
    };
    Matcher indent = INDENT.matcher(line);
    String prefix = indent.find() ? indent.group(1) : "";
    return Optional.of(new StatusLine(result, m.group(2), m.group(3), prefix));
  }

  /**
   * Matches a benchmark result line, e.g. {@code BenchmarkFoo-8  1000  1234 ns/op  64 B/op  2 allocs/op}.
   *
   * @param line raw line without terminator
   * @return fully populated benchmark; absent bytes/allocs columns read as {@code 0}
   */
  public static Optional<Benchmark> matchBenchmark(String line) {
    Matcher m = BENCHMARK.matcher(line);
    if (!m.find()) {
      return Optional.empty();
    }
    return Optional.of(new Benchmark(
        m.group(1),
        Durations.parseNanoseconds(m.group(3)),
        parseCount(m.group(4)),
        parseCount(m.group(5))));
  }

  /**
   * Reports whether {@code line} is a bare {@code PASS}, {@code FAIL} or {@code SKIP} summary token.
   *
   * @param line raw line without terminator
   * @return {@code true} for a summary token
   */
  public static boolean isSummary(String line) {
    return SUMMARY.matcher(line).matches();
  }

  /**
   * Returns the last {@code /}-separated element of a test name, so {@code TestA/case_1} becomes {@code case_1}.
   *
   * <p>Trailing slashes are ignored. An empty name yields {@code "."} and a name made only of slashes
   * yields {@code "/"}.</p>
   *
   * @param name test name from a status line
   * @return last path element
   */
  public static String baseName(String name) {
    if (name == null || name.isEmpty()) {
      return ".";
    }
    int end = name.length();
    while (end > 0 && name.charAt(end - 1) == '/') {
      end--;
    }
    if (end == 0) {
      return "/";
    }
    String trimmed = name.substring(0, end);
    return trimmed.substring(trimmed.lastIndexOf('/') + 1);
  }

  private static int parseCount(String value) {
    if (value == null || value.isEmpty()) {
      return 0;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      // Counts beyond int range are not meaningful for a single operation.
      return 0;
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  /**
   * Fields of a package-result line.
   *
   * @param ok {@code true} for {@code ok}, {@code false} for {@code FAIL}
   * @param packageName package import path
   * @param seconds elapsed seconds; empty for cached or build-failed runs
   * @param failureMarker bracketed marker such as {@code [build failed]}; empty otherwise
   * @param coveragePct coverage percentage without the {@code %} sign; empty when absent
   */
  public record PackageResultLine(
      boolean ok, String packageName, String seconds, String failureMarker, String coveragePct) {

    /**
     * Indicates a {@code (cached)} result.
     *
     * @return {@code true} when neither an elapsed time nor a failure marker was printed
     */
    public boolean cached() {
      return seconds.isEmpty() && failureMarker.isEmpty();
    }
  }

  /**
   * Fields of a status line.
   *
   * @param result reported outcome
   * @param name test name as printed, possibly slash-qualified
   * @param seconds elapsed seconds literal
   * @param indent whitespace preceding {@code ---}; empty for top-level tests
   */
  public record StatusLine(Result result, String name, String seconds, String indent) {}
}
