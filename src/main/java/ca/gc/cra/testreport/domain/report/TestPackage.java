package ca.gc.cra.testreport.domain.report;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Results of one test binary (one package) after its package-result line was read.
 * <p><strong>Why:</strong> Groups tests and benchmarks the way downstream report formatters emit test suites.</p>
 * <p><strong>Role:</strong> Immutable domain aggregate owned by a {@link Report}.</p>
 * <p><strong>Thread-safety:</strong> The record and its lists are immutable. Contained {@link TestCase}s are
 * shared with the parser, which may still append free-text lines to the last failed or skipped test until
 * the parse call returns.</p>
 *
 * @param name package import path
 * @param duration sum of the contained tests' durations at flush time
 * @param tests test cases in the order they were first seen
 * @param benchmarks benchmarks in the order they were read
 * @param coveragePct statement coverage as text; empty when not reported
 * @since 0.1.0
 */
public record TestPackage(
    String name,
    Duration duration,
    List<TestCase> tests,
    List<Benchmark> benchmarks,
    String coveragePct) {

  /**
   * Validates and defensively copies package contents.
   *
   * @throws NullPointerException if {@code name} or {@code duration} is {@code null}
   */
  public TestPackage {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(duration, "duration");
    tests = tests == null ? List.of() : List.copyOf(tests);
    benchmarks = benchmarks == null ? List.of() : List.copyOf(benchmarks);
    coveragePct = coveragePct == null ? "" : coveragePct;
  }

  /**
   * Returns the package duration in whole milliseconds.
   *
   * @return {@code duration / 1ms}
   * @deprecated use {@link #duration()}; retained for consumers of the millisecond field
   */
  @Deprecated
  public long time() {
    return duration.toMillis();
  }
}
