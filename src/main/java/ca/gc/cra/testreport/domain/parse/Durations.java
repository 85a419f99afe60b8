package ca.gc.cra.testreport.domain.parse;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Converts numeric literals captured from runner output into {@link Duration}s.
 * <p><strong>Role:</strong> Domain support utility for the line classifier.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Never throws for bad input; callers cannot use these helpers to
 * validate text.</p>
 *
 * @implNote Only plain decimal literals are read; exponent forms such as {@code "1e3"} yield
 * {@link Duration#ZERO}. Sub-nanosecond fractions are truncated, so {@code "0.4"} nanoseconds yields
 * {@link Duration#ZERO}.
 * @since 0.1.0
 */
public final class Durations {
  private static final Pattern DECIMAL = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)");

  private Durations() {
    // Utility
  }

  /**
   * Interprets {@code value} as a decimal number of seconds.
   *
   * @param value literal such as {@code "0.010"}; may be {@code null} or empty
   * @return parsed duration, or {@link Duration#ZERO} when empty or unparseable
   */
  public static Duration parseSeconds(String value) {
    return parse(value, 9);
  }

  /**
   * Interprets {@code value} as a decimal number of nanoseconds.
   *
   * @param value literal such as {@code "1234.5"}; may be {@code null} or empty
   * @return parsed duration, or {@link Duration#ZERO} when empty or unparseable
   */
  public static Duration parseNanoseconds(String value) {
    return parse(value, 0);
  }

  private static Duration parse(String value, int nanosScale) {
    if (value == null || !DECIMAL.matcher(value).matches()) {
      return Duration.ZERO;
    }
    try {
      long nanos = new BigDecimal(value).movePointRight(nanosScale).toBigInteger().longValueExact();
      return Duration.ofNanos(nanos);
    } catch (NumberFormatException | ArithmeticException ex) {
      // Unparseable or out-of-range literals count as zero.
      return Duration.ZERO;
    }
  }
}
