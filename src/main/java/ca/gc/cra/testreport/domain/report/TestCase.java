package ca.gc.cra.testreport.domain.report;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable record of one test case (or sub-test) assembled from interleaved test-runner output.
 *
 * <p>A case is created when a structured output record or status line first names it, is mutated
 * in place while lines arrive, and is handed to a {@link TestPackage} when its package is flushed.
 * Output lines are captured before a status is known; failure lines only while the result is
 * {@link Result#FAIL}; skip messages only while it is {@link Result#SKIP}.</p>
 *
 * <p><strong>Thread-safety:</strong> Not thread-safe. Owned by the single parse call that created it.</p>
 *
 * @since 0.1.0
 */
public final class TestCase {
  private final String name;
  private final List<String> output = new ArrayList<>();
  private final List<String> failure = new ArrayList<>();
  private final List<String> skipMessages = new ArrayList<>();
  private Duration duration = Duration.ZERO;
  private Result result = Result.PASS;
  private String subtestIndent = "";

  /**
   * Creates a passing, zero-duration test case.
   *
   * @param name test name as reported by the runner; must not be {@code null}
   */
  public TestCase(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  public Duration duration() {
    return duration;
  }

  /**
   * Replaces the measured duration.
   *
   * @param duration new duration; must not be {@code null}
   */
  public void duration(Duration duration) {
    this.duration = Objects.requireNonNull(duration, "duration");
  }

  public Result result() {
    return result;
  }

  /**
   * Replaces the terminal result.
   *
   * @param result new result; must not be {@code null}
   */
  public void result(Result result) {
    this.result = Objects.requireNonNull(result, "result");
  }

  /**
   * Returns the indentation that preceded the status line, empty for top-level tests.
   *
   * @return whitespace prefix recording sub-test depth
   */
  public String subtestIndent() {
    return subtestIndent;
  }

  public void subtestIndent(String indent) {
    this.subtestIndent = indent == null ? "" : indent;
  }

  /**
   * Returns the captured output lines.
   *
   * @return unmodifiable view in arrival order
   */
  public List<String> output() {
    return Collections.unmodifiableList(output);
  }

  /**
   * Returns the failure-detail lines captured after a FAIL status.
   *
   * @return unmodifiable view in arrival order
   */
  public List<String> failure() {
    return Collections.unmodifiableList(failure);
  }

  /**
   * Returns the lines captured after a SKIP status.
   *
   * @return unmodifiable view in arrival order
   */
  public List<String> skipMessages() {
    return Collections.unmodifiableList(skipMessages);
  }

  public void appendOutput(String line) {
    output.add(line);
  }

  public void appendFailure(String line) {
    failure.add(line);
  }

  public void appendSkipMessage(String line) {
    skipMessages.add(line);
  }

  /**
   * Returns the duration in whole milliseconds.
   *
   * @return {@code duration / 1ms}
   * @deprecated use {@link #duration()}; retained for consumers of the millisecond field
   */
  @Deprecated
  public long time() {
    return duration.toMillis();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TestCase other)) {
      return false;
    }
    return name.equals(other.name)
        && duration.equals(other.duration)
        && result == other.result
        && subtestIndent.equals(other.subtestIndent)
        && output.equals(other.output)
        && failure.equals(other.failure)
        && skipMessages.equals(other.skipMessages);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, duration, result, subtestIndent, output, failure, skipMessages);
  }

  @Override
  public String toString() {
    return "TestCase[name=" + name + ", result=" + result + ", duration=" + duration
        + ", output=" + output.size() + ", failure=" + failure.size()
        + ", skipMessages=" + skipMessages.size() + ']';
  }
}
