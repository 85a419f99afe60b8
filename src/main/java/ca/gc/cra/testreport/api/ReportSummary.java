package ca.gc.cra.testreport.api;

import ca.gc.cra.testreport.domain.report.Report;
import ca.gc.cra.testreport.domain.report.Result;
import ca.gc.cra.testreport.domain.report.TestCase;
import ca.gc.cra.testreport.domain.report.TestPackage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the plain-text summary printed by the {@code parse} command, one line per package plus a total.
 *
 * <p>This is console feedback only; machine-readable report formats belong to downstream formatters.</p>
 */
final class ReportSummary {
  private ReportSummary() {}

  /**
   * Builds summary lines such as {@code ok   example.com/pkg 0.010s tests=3 failed=0 skipped=1 benchmarks=0}.
   *
   * @param report parsed report
   * @return lines to print, ending with a {@code total} line
   */
  static List<String> lines(Report report) {
    List<String> lines = new ArrayList<>(report.packages().size() + 1);
    int tests = 0;
    int skipped = 0;
    for (TestPackage pkg : report.packages()) {
      int failed = count(pkg, Result.FAIL);
      int skips = count(pkg, Result.SKIP);
      lines.add(String.format(Locale.ROOT, "%-4s %s %s tests=%d failed=%d skipped=%d benchmarks=%d",
          failed > 0 ? "FAIL" : "ok",
          pkg.name(),
          seconds(pkg.duration()),
          pkg.tests().size(),
          failed,
          skips,
          pkg.benchmarks().size()));
      tests += pkg.tests().size();
      skipped += skips;
    }
    lines.add(String.format(Locale.ROOT, "total packages=%d tests=%d failed=%d skipped=%d",
        report.packages().size(), tests, report.failures(), skipped));
    return lines;
  }

  private static int count(TestPackage pkg, Result result) {
    int count = 0;
    for (TestCase test : pkg.tests()) {
      if (test.result() == result) {
        count++;
      }
    }
    return count;
  }

  private static String seconds(Duration duration) {
    return String.format(Locale.ROOT, "%.3fs", duration.toNanos() / 1_000_000_000d);
  }
}
