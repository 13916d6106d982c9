package ca.gc.cra.rill.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads pipeline configuration from YAML and flattens one pipeline's settings into dotted keys.
 *
 * <p>The document holds an optional {@code common} section and one section per named pipeline. Keys from the
 * pipeline section override {@code common}. Lists of scalars are joined with commas, so
 * {@code redact: [password, token]} and {@code redact: password,token} are equivalent.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges {@code common} with the {@code pipeline} section.
   *
   * @param path location of the YAML configuration
   * @param pipeline pipeline section name, matched case-insensitively
   * @return flat map of merged settings, or empty when {@code path} does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String pipeline) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(pipeline, "pipeline");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, pipeline, path.toString()));
    }
  }

  /**
   * Parses YAML from {@code reader}; see {@link #load(Path, String)}.
   *
   * @param reader YAML source; not closed
   * @param pipeline pipeline section name
   * @param source description used in error messages
   * @return flat map of merged settings
   * @throws IllegalArgumentException when the YAML is malformed or not shaped as sections of mappings
   */
  public static Map<String, String> parse(Reader reader, String pipeline, String source) {
    String normalized = pipeline.trim().toLowerCase(Locale.ROOT);
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    Map<String, Object> root = asMap(document, "root");

    Map<String, String> flattened = new LinkedHashMap<>();
    Object commonSection = findSection(root, "common");
    if (commonSection != null) {
      flatten(asMap(commonSection, "common"), "", flattened);
    }
    Object pipelineSection = findSection(root, normalized);
    if (pipelineSection != null) {
      flatten(asMap(pipelineSection, normalized), "", flattened);
    }
    return Map.copyOf(flattened);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinScalars(composite, items));
      } else {
        target.put(composite, value.toString());
      }
    }
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joiner = new StringJoiner(",");
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must contain only scalars");
      }
      joiner.add(item == null ? "" : item.toString());
    }
    return joiner.toString();
  }
}
