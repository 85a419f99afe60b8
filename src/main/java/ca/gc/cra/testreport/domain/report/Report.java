package ca.gc.cra.testreport.domain.report;

import java.util.List;

/**
 * <strong>What:</strong> Normalized result of parsing one test-runner output stream.
 * <p><strong>Role:</strong> Root domain aggregate returned by the parser and consumed by formatters.</p>
 * <p><strong>Thread-safety:</strong> Immutable once returned by the parser.</p>
 *
 * @param packages packages in the order their package-result lines were read
 * @since 0.1.0
 */
public record Report(List<TestPackage> packages) {
  /**
   * Defensively copies the package list.
   */
  public Report {
    packages = packages == null ? List.of() : List.copyOf(packages);
  }

  /**
   * Returns an empty report.
   *
   * @return report without packages
   */
  public static Report empty() {
    return new Report(List.of());
  }

  /**
   * Counts failed tests across all packages.
   *
   * @return number of tests whose result is {@link Result#FAIL}; {@code 0} for an empty report
   */
  public int failures() {
    int count = 0;
    for (TestPackage pkg : packages) {
      for (TestCase test : pkg.tests()) {
        if (test.result() == Result.FAIL) {
          count++;
        }
      }
    }
    return count;
  }
}
