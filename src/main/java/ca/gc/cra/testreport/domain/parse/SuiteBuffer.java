package ca.gc.cra.testreport.domain.parse;

import ca.gc.cra.testreport.domain.report.Benchmark;
import ca.gc.cra.testreport.domain.report.TestCase;
import ca.gc.cra.testreport.domain.report.TestPackage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accumulates in-progress test cases per package until a package-result line flushes them.
 *
 * <p>Suites and the tests within them keep insertion order, so lookups are by name while flushed
 * packages list tests in the order they were first seen.</p>
 *
 * <p><strong>Thread-safety:</strong> Not thread-safe. One buffer belongs to one parse call.</p>
 *
 * @since 0.1.0
 */
final class SuiteBuffer {
  private final Map<String, Map<String, TestCase>> suites = new LinkedHashMap<>();
  private final Map<String, List<Benchmark>> benchmarks = new LinkedHashMap<>();
  private String benchmarkSuite;

  /**
   * Appends a record's message to its test, creating the suite and test on first sight.
   *
   * @param record decoded output record
   * @return the test case that received the message
   */
  TestCase append(OutputRecord record) {
    TestCase test = suites
        .computeIfAbsent(record.suite(), suite -> new LinkedHashMap<>())
        .computeIfAbsent(record.test(), TestCase::new);
    test.appendOutput(record.msg());
    benchmarkSuite = record.suite();
    return test;
  }

  /**
   * Finds the first buffered test named {@code name}, scanning suites in insertion order.
   *
   * @param name test name to look up
   * @return matching test, if any suite holds one
   */
  Optional<TestCase> find(String name) {
    for (Map<String, TestCase> tests : suites.values()) {
      TestCase test = tests.get(name);
      if (test != null) {
        return Optional.of(test);
      }
    }
    return Optional.empty();
  }

  /**
   * Attributes a benchmark to the suite most recently named by an output record.
   *
   * @param benchmark parsed benchmark
   * @return {@code false} when no suite is buffered and the benchmark was not kept
   */
  boolean addBenchmark(Benchmark benchmark) {
    if (benchmarkSuite == null) {
      return false;
    }
    benchmarks.computeIfAbsent(benchmarkSuite, suite -> new ArrayList<>()).add(benchmark);
    return true;
  }

  boolean isEmpty() {
    return suites.isEmpty();
  }

  int testCount() {
    int count = 0;
    for (Map<String, TestCase> tests : suites.values()) {
      count += tests.size();
    }
    return count;
  }

  /**
   * Converts every buffered suite into a package and clears the buffer.
   *
   * @return packages in suite insertion order; each duration is the sum of its tests' durations
   */
  List<TestPackage> drain() {
    List<TestPackage> packages = new ArrayList<>(suites.size());
    for (Map.Entry<String, Map<String, TestCase>> entry : suites.entrySet()) {
      Duration total = Duration.ZERO;
      for (TestCase test : entry.getValue().values()) {
        total = total.plus(test.duration());
      }
      packages.add(new TestPackage(
          entry.getKey(),
          total,
          new ArrayList<>(entry.getValue().values()),
          benchmarks.getOrDefault(entry.getKey(), List.of()),
          ""));
    }
    suites.clear();
    benchmarks.clear();
    benchmarkSuite = null;
    return packages;
  }
}
