package ca.gc.cra.cadence.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("cadence.yaml");
    Files.writeString(yaml, """
        common:
          metricsExporter: none
        Resolve:
          maxConcurrent: 3
          waitMillis: 2500
          metricsExporter: otlp
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "resolve");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("otlp", map.get("metricsExporter"));
    assertEquals("3", map.get("maxConcurrent"));
    assertEquals("2500", map.get("waitMillis"));
  }

  @Test
  void loadFlattensNestedMapsAndNulls() throws IOException {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, """
        resolve:
          otel:
            endpoint: http://collector:4317
          album:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "resolve").orElseThrow();
    assertEquals("http://collector:4317", map.get("otel.endpoint"));
    assertEquals("", map.get("album"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "resolve").isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");
    assertEquals(Map.of(), YamlConfigLoader.load(yaml, "resolve").orElseThrow());
  }

  @Test
  void rejectsArraysAndMalformedDocuments() throws IOException {
    Path arrays = tempDir.resolve("arrays.yaml");
    Files.writeString(arrays, """
        resolve:
          artist:
            - a
            - b
        """);
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(arrays, "resolve"));

    Path malformed = tempDir.resolve("malformed.yaml");
    Files.writeString(malformed, "resolve: [unclosed");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(malformed, "resolve"));

    Path scalar = tempDir.resolve("scalar.yaml");
    Files.writeString(scalar, "just text");
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar, "resolve"));
  }
}
