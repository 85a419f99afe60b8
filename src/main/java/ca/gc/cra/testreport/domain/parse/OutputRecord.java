package ca.gc.cra.testreport.domain.parse;

/**
 * One structured output record: a single captured line attributed to a (package, test) pair.
 *
 * @param suite package name; empty when the field was absent
 * @param test test name; empty when the field was absent
 * @param msg captured output, usually including its trailing newline
 * @since 0.1.0
 */
public record OutputRecord(String suite, String test, String msg) {}
