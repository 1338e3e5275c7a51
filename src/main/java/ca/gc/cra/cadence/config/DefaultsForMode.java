package ca.gc.cra.cadence.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CADENCE CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode CLI command (currently {@code resolve})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "resolve" -> buildResolveDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildResolveDefaults() {
    PipelineConfig defaults = PipelineConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("maxConcurrent", Integer.toString(defaults.maxConcurrent()));
    map.put("temporaryQueryTtlMillis", Long.toString(defaults.temporaryQueryTtl().toMillis()));
    map.put("waitMillis", Long.toString(defaults.queryWait().toMillis()));
    map.put("catalog", "");
    map.put("prioritized", "false");
    map.put("temporary", "false");
    map.put("dryRun", "false");
    return map;
  }
}
