package ca.gc.cra.cadence.config;

import ca.gc.cra.cadence.infrastructure.resolver.CatalogEntry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads catalog resolver definitions from YAML.
 *
 * <pre>{@code
 * resolvers:
 *   - name: local
 *     weight: 100
 *     timeoutMillis: 2000
 *     latencyMillis: 5
 *     tracks:
 *       - { artist: Portishead, track: Roads, album: Dummy }
 * }</pre>
 */
public final class CatalogLoader {
  static final int DEFAULT_WEIGHT = 50;
  static final long DEFAULT_TIMEOUT_MILLIS = 5_000L;

  private CatalogLoader() {}

  /**
   * Reads resolver definitions from {@code path}.
   *
   * @param path catalog file
   * @return definitions in file order
   * @throws IOException when the file is missing or unreadable
   * @throws IllegalArgumentException when the structure is invalid or a resolver name repeats
   */
  public static List<ResolverDefinition> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString());
    }
    Object document = YamlConfigLoader.readDocument(path);
    if (document == null) {
      return List.of();
    }
    Object resolvers = YamlConfigLoader.asMap(document, "root").get("resolvers");
    if (resolvers == null) {
      return List.of();
    }
    if (!(resolvers instanceof List<?> list)) {
      throw new IllegalArgumentException("resolvers must be a list");
    }
    List<ResolverDefinition> definitions = new ArrayList<>(list.size());
    Set<String> names = new HashSet<>();
    for (int i = 0; i < list.size(); i++) {
      ResolverDefinition definition = parseResolver(YamlConfigLoader.asMap(list.get(i), "resolvers[" + i + "]"), i);
      if (!names.add(definition.name())) {
        throw new IllegalArgumentException("Duplicate resolver name: " + definition.name());
      }
      definitions.add(definition);
    }
    return List.copyOf(definitions);
  }

  private static ResolverDefinition parseResolver(Map<String, Object> node, int index) {
    String context = "resolvers[" + index + "]";
    String name = required(node, "name", context);
    int weight = (int) number(node, "weight", DEFAULT_WEIGHT, context);
    Duration timeout = Duration.ofMillis(number(node, "timeoutMillis", DEFAULT_TIMEOUT_MILLIS, context));
    Duration latency = Duration.ofMillis(number(node, "latencyMillis", 0L, context));
    List<CatalogEntry> entries = new ArrayList<>();
    Object tracks = node.get("tracks");
    if (tracks != null) {
      if (!(tracks instanceof List<?> trackList)) {
        throw new IllegalArgumentException(context + ".tracks must be a list");
      }
      for (int t = 0; t < trackList.size(); t++) {
        String trackContext = context + ".tracks[" + t + "]";
        Map<String, Object> track = YamlConfigLoader.asMap(trackList.get(t), trackContext);
        entries.add(new CatalogEntry(
            required(track, "artist", trackContext),
            required(track, "track", trackContext),
            text(track.get("album"))));
      }
    }
    return new ResolverDefinition(name, weight, timeout, latency, entries);
  }

  private static long number(Map<String, Object> node, String key, long fallback, String context) {
    Object value = node.get(key);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(context + "." + key + " must be an integer (was " + value + ")", ex);
    }
  }

  private static String required(Map<String, Object> node, String key, String context) {
    Object value = node.get(key);
    if (value == null || value.toString().isBlank()) {
      throw new IllegalArgumentException(context + "." + key + " is required");
    }
    return value.toString();
  }

  private static String text(Object value) {
    return value == null ? null : value.toString();
  }
}
