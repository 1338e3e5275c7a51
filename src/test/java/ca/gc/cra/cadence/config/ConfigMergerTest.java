package ca.gc.cra.cadence.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "resolve",
        Optional.of(Map.of("maxConcurrent", "2", "waitMillis", "4000")),
        Map.of("maxConcurrent", "6"),
        DefaultsForMode.asFlatMap("resolve"),
        warnings::add);

    assertEquals("6", effective.get("maxConcurrent"));
    assertEquals("4000", effective.get("waitMillis"));
    assertEquals("otlp", effective.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: maxConcurrent"), warnings);
  }

  @Test
  void nullCliValuesKeepLowerLayers() {
    Map<String, String> cli = new HashMap<>();
    cli.put("catalog", null);
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "resolve", Optional.of(Map.of("catalog", "/etc/cadence/catalog.yaml")), cli, Map.of(), null);

    assertEquals("/etc/cadence/catalog.yaml", effective.get("catalog"));
  }

  @Test
  void rejectsFullTextCombinedWithTrackTerms() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "resolve", Optional.empty(), Map.of("q", "roads", "artist", "Portishead"), Map.of(), null));
    assertTrue(ex.getMessage().contains("q cannot be combined"));
  }

  @Test
  void requiresArtistAndTrackTogether() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "resolve", Optional.empty(), Map.of("artist", "Portishead"), Map.of(), null));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "resolve", Optional.empty(), Map.of("track", "Roads", "artist", " "), Map.of(), null));
  }

  @Test
  void defaultsRejectUnknownMode() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" RESOLVE ");
    assertEquals("0", defaults.get("maxConcurrent"));
    assertEquals("300000", defaults.get("temporaryQueryTtlMillis"));
    assertEquals("10000", defaults.get("waitMillis"));
    assertEquals("false", defaults.get("dryRun"));
  }
}
