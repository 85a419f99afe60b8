package ca.gc.cra.testreport.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments: recognized flags plus the remaining key=value arguments.
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final String TRACE_FLAG = "--trace";

  private final String[] remaining;
  private final boolean help;
  private final boolean verbose;
  private final boolean trace;

  private CliInput(String[] remaining, boolean help, boolean verbose, boolean trace) {
    this.remaining = remaining;
    this.help = help;
    this.verbose = verbose;
    this.trace = trace;
  }

  /**
   * Parses raw arguments, pulling out the flags.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], false, false, false);
    }

    List<String> rest = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    boolean trace = false;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (TRACE_FLAG.equals(lower)) {
        trace = true;
      } else {
        rest.add(arg);
      }
    }
    return new CliInput(rest.toArray(String[]::new), help, verbose, trace);
  }

  /**
   * Returns a defensive copy of the arguments that were not flags.
   *
   * @return remaining arguments in their original order
   */
  public String[] remaining() {
    return Arrays.copyOf(remaining, remaining.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Whether {@code --trace} asked for the parser's dropped-line diagnostics.
   *
   * @return {@code true} when line tracing was requested
   */
  public boolean trace() {
    return trace;
  }
}
