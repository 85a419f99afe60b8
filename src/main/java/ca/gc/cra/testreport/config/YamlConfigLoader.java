package ca.gc.cra.testreport.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads a {@code testreport} YAML file into the flat key/value form used by
 * {@link ConfigMerger}.
 * <p>The document holds at most two sections: {@code common} and the command's own section (for example
 * {@code parse}). Both are flat mappings of supported keys to scalars; the command section wins when a key
 * appears in both. Section and key names match ignoring case and are returned in their canonical spelling,
 * so {@code FailOnTestFailures: yes} becomes {@code failOnTestFailures=true}.</p>
 * <p><strong>Errors:</strong> Unknown sections, unknown keys, nested values and keys repeated within a
 * section raise {@link IllegalArgumentException} naming the offending {@code section.key}.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges its {@code common} section with the {@code mode} section.
   *
   * @param path location of the YAML configuration
   * @param mode command name, e.g. {@code parse}
   * @param supportedKeys canonical key names the command accepts, typically the keys of
   *     {@link DefaultsForMode#asFlatMap(String)}
   * @return merged settings keyed by canonical name; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is malformed or names unsupported sections or keys
   */
  public static Optional<Map<String, String>> load(Path path, String mode, Collection<String> supportedKeys)
      throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(supportedKeys, "supportedKeys");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config at " + path + " must be a mapping of sections");
    }

    String command = normalize(mode);
    Map<String, String> canonical = new LinkedHashMap<>();
    for (String key : supportedKeys) {
      canonical.put(normalize(key), key);
    }

    Map<String, String> common = new LinkedHashMap<>();
    Map<String, String> own = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String section = normalize(requireName(entry.getKey(), "section"));
      if (section.equals(COMMON)) {
        readSection(COMMON, entry.getValue(), canonical, common);
      } else if (section.equals(command)) {
        readSection(command, entry.getValue(), canonical, own);
      } else {
        throw new IllegalArgumentException("Unsupported section '" + entry.getKey() + "' in " + path);
      }
    }

    Map<String, String> merged = new LinkedHashMap<>(common);
    merged.putAll(own);
    return Optional.of(Map.copyOf(merged));
  }

  private static void readSection(
      String section, Object node, Map<String, String> canonical, Map<String, String> target) {
    if (node == null) {
      return;
    }
    if (!(node instanceof Map<?, ?> entries)) {
      throw new IllegalArgumentException(section + " section must be a mapping");
    }
    for (Map.Entry<?, ?> entry : entries.entrySet()) {
      String raw = requireName(entry.getKey(), section + " key");
      String key = canonical.get(normalize(raw));
      if (key == null) {
        throw new IllegalArgumentException("Unsupported key " + section + "." + raw);
      }
      if (target.containsKey(key)) {
        throw new IllegalArgumentException("Key " + section + "." + key + " is set more than once");
      }
      target.put(key, scalar(section + "." + key, entry.getValue()));
    }
  }

  private static String scalar(String name, Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new IllegalArgumentException(name + " must be a single value");
    }
    return value.toString();
  }

  private static String requireName(Object key, String what) {
    if (!(key instanceof String name) || name.isBlank()) {
      throw new IllegalArgumentException(what + " names must be non-blank strings (was " + key + ")");
    }
    return name;
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
