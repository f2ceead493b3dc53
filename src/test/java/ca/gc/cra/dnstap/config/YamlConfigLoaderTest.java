package ca.gc.cra.dnstap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void outputSectionOverridesCommon() throws Exception {
    Path yaml = tempDir.resolve("config.yaml");
    Files.writeString(yaml, """
        common:
          tag: shared
          workers: 2
        output:
          tag: specific
          out:
        ignored:
          tag: never
        """);

    Map<String, String> values = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals("specific", values.get("tag"));
    assertEquals("2", values.get("workers"));
    assertEquals("", values.get("out"));
    assertEquals(3, values.size());
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("missing.yaml")));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");
    assertTrue(YamlConfigLoader.load(yaml).orElseThrow().isEmpty());
  }

  @Test
  void rejectsNestedMappings() throws Exception {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        output:
          kafka:
            bootstrap: localhost:9092
        """);
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
    assertTrue(ex.getMessage().contains("output.kafka"));
  }

  @Test
  void rejectsNonMappingSection() throws Exception {
    Path yaml = tempDir.resolve("scalar.yaml");
    Files.writeString(yaml, "common: 42\n");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml));
  }

  @Test
  void rejectsArraysAndMalformedYaml() throws Exception {
    Path arrays = tempDir.resolve("arrays.yaml");
    Files.writeString(arrays, """
        output:
          tag:
            - a
            - b
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays));

    Path broken = tempDir.resolve("broken.yaml");
    Files.writeString(broken, "output: [unclosed");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(broken));
  }
}
