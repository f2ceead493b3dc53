package ca.gc.cra.dnstap.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the {@code common} and {@code output} sections of a YAML document as scalar key/value pairs for
 * {@link OutputConfig#load}. Keys in {@code output} win over keys in {@code common}; other top-level sections are
 * ignored.
 */
final class YamlConfigLoader {
  private static final List<String> SECTIONS = List.of("common", "output");

  private YamlConfigLoader() {}

  /**
   * Loads the configuration sections from {@code path}.
   *
   * @param path YAML file
   * @return merged section values, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or a value is not a scalar
   */
  static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML in " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(path + " must contain a mapping at the top level");
    }

    Map<String, String> values = new LinkedHashMap<>();
    for (String section : SECTIONS) {
      Object body = root.get(section);
      if (body == null) {
        continue;
      }
      if (!(body instanceof Map<?, ?> entries)) {
        throw new IllegalArgumentException(section + " must be a mapping");
      }
      entries.forEach((key, value) -> {
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
          throw new IllegalArgumentException(section + "." + key + " must be a scalar value");
        }
        values.put(String.valueOf(key).trim(), value == null ? "" : value.toString());
      });
    }
    return Optional.of(Map.copyOf(values));
  }
}
