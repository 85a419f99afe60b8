package ca.gc.cra.testreport.domain.report;

import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Result of one benchmark case as printed on a single benchmark line.
 * <p><strong>Role:</strong> Immutable domain value owned by a {@link TestPackage}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param name benchmark name without the {@code -N} core-count suffix
 * @param duration time per operation
 * @param bytes bytes allocated per operation; {@code 0} when not reported
 * @param allocs allocations per operation; {@code 0} when not reported
 * @since 0.1.0
 */
public record Benchmark(String name, Duration duration, int bytes, int allocs) {
  /**
   * Validates benchmark invariants.
   *
   * @throws NullPointerException if {@code name} or {@code duration} is {@code null}
   */
  public Benchmark {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(duration, "duration");
  }
}
