package ca.gc.cra.testreport.config;

import ca.gc.cra.testreport.validation.Paths;
import ca.gc.cra.testreport.validation.Strings;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings for one {@code parse} run.
 * <p><strong>Why:</strong> Normalizes CLI and YAML values once so the use case deals only in typed values.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by
 * {@link ca.gc.cra.testreport.application.pipeline.ParseUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param input input file; empty to read standard input
 * @param fallbackPackage package name handed to the parser; empty when not supplied
 * @param charset input encoding
 * @param failOnTestFailures whether failing tests should produce a non-zero exit code
 * @since 0.1.0
 */
public record ParseConfig(
    Optional<Path> input, String fallbackPackage, Charset charset, boolean failOnTestFailures) {

  /** Input value selecting standard input. */
  public static final String STDIN = "-";

  /**
   * Validates mandatory components.
   *
   * @throws NullPointerException if a component is {@code null}
   */
  public ParseConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(fallbackPackage, "fallbackPackage");
    Objects.requireNonNull(charset, "charset");
  }

  /**
   * Returns the configuration used when no keys are supplied: stdin, UTF-8, no fallback package.
   *
   * @return default configuration
   */
  public static ParseConfig defaults() {
    return new ParseConfig(Optional.empty(), "", StandardCharsets.UTF_8, false);
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * @param args effective key/value map (CLI over YAML over defaults); must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if the input file is unreadable, the charset unknown, or a boolean malformed
   */
  public static ParseConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    ParseConfig defaults = defaults();

    String in = Strings.optional("in", args.get("in"));
    Optional<Path> input = in.isEmpty() || STDIN.equals(in)
        ? Optional.empty()
        : Optional.of(Paths.requireReadableFile(toPath(in)));

    String pkg = Strings.optional("pkg", args.get("pkg"));

    String charsetName = Strings.optional("charset", args.get("charset"));
    Charset charset = charsetName.isEmpty() ? defaults.charset() : toCharset(charsetName);

    boolean failOnTestFailures =
        parseBoolean("failOnTestFailures", args.get("failOnTestFailures"), defaults.failOnTestFailures());

    return new ParseConfig(input, pkg, charset, failOnTestFailures);
  }

  private static Path toPath(String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("in is not a valid path: " + value, ex);
    }
  }

  private static Charset toCharset(String name) {
    try {
      return Charset.forName(name);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      throw new IllegalArgumentException("charset is not supported: " + name, ex);
    }
  }

  private static boolean parseBoolean(String key, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
    };
  }
}
