package ca.gc.cra.testreport.domain.report;

/**
 * <strong>What:</strong> Terminal outcome of a single test case.
 * <p><strong>Why:</strong> Lets failure counting and downstream formatters branch on a closed set of outcomes.</p>
 * <p><strong>Role:</strong> Domain enumeration carried by {@link TestCase}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * <p>A test case that never receives a status line keeps {@link #PASS}.</p>
 *
 * @since 0.1.0
 */
public enum Result {
  /** Test passed, or no status line was observed. */
  PASS,
  /** Test reported {@code --- FAIL}. */
  FAIL,
  /** Test reported {@code --- SKIP}. */
  SKIP
}
