package ca.gc.cra.testreport.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of("verbose", "false");

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command name; currently only {@code parse}
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "parse" -> buildParseDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildParseDefaults() {
    ParseConfig defaults = ParseConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", ParseConfig.STDIN);
    map.put("pkg", defaults.fallbackPackage());
    map.put("charset", defaults.charset().name());
    map.put("failOnTestFailures", Boolean.toString(defaults.failOnTestFailures()));
    return map;
  }
}
