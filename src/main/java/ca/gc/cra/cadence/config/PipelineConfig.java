package ca.gc.cra.cadence.config;

import ca.gc.cra.cadence.application.pipeline.PipelineSettings;
import ca.gc.cra.cadence.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings for the {@code resolve} command.
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param maxConcurrent concurrency cap; {@code 0} derives it from the available processors
 * @param temporaryQueryTtl quiet period after which temporary queries are swept
 * @param queryWait how long the CLI waits for submitted queries to finish
 * @since 0.1.0
 */
public record PipelineConfig(int maxConcurrent, Duration temporaryQueryTtl, Duration queryWait) {
  /** Largest accepted explicit concurrency cap. */
  public static final int MAX_CONCURRENT_LIMIT = 64;
  private static final Duration DEFAULT_QUERY_WAIT = Duration.ofSeconds(10);

  /**
   * Validates the configuration.
   *
   * @throws IllegalArgumentException when a value is out of range
   */
  public PipelineConfig {
    Numbers.requireRange("maxConcurrent", maxConcurrent, 0, MAX_CONCURRENT_LIMIT);
    Objects.requireNonNull(temporaryQueryTtl, "temporaryQueryTtl");
    Objects.requireNonNull(queryWait, "queryWait");
    if (temporaryQueryTtl.isZero() || temporaryQueryTtl.isNegative()) {
      throw new IllegalArgumentException("temporaryQueryTtl must be positive");
    }
    if (queryWait.isZero() || queryWait.isNegative()) {
      throw new IllegalArgumentException("waitMillis must be positive");
    }
  }

  /**
   * Returns the default configuration: automatic concurrency, five minute sweep, ten second wait.
   *
   * @return default configuration
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(0, PipelineSettings.DEFAULT_TEMPORARY_QUERY_TTL, DEFAULT_QUERY_WAIT);
  }

  /**
   * Builds a configuration from a flattened key/value map; absent keys keep their defaults.
   *
   * @param options merged configuration values
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PipelineConfig defaults = defaults();
    int maxConcurrent = isBlank(options.get("maxConcurrent"))
        ? defaults.maxConcurrent()
        : (int) Numbers.requireRange("maxConcurrent",
            Numbers.parseLong("maxConcurrent", options.get("maxConcurrent")), 0, MAX_CONCURRENT_LIMIT);
    Duration ttl = millis(options, "temporaryQueryTtlMillis", defaults.temporaryQueryTtl());
    Duration wait = millis(options, "waitMillis", defaults.queryWait());
    return new PipelineConfig(maxConcurrent, ttl, wait);
  }

  /**
   * Resolves the automatic concurrency cap and converts to pipeline settings.
   *
   * @param availableProcessors processor count used when {@link #maxConcurrent()} is {@code 0}
   * @return settings for {@code ResolverPipeline}
   */
  public PipelineSettings toSettings(int availableProcessors) {
    int effective = maxConcurrent == 0 ? PipelineSettings.defaultConcurrency(availableProcessors) : maxConcurrent;
    return new PipelineSettings(effective, temporaryQueryTtl);
  }

  private static Duration millis(Map<String, String> options, String key, Duration fallback) {
    String raw = options.get(key);
    if (isBlank(raw)) {
      return fallback;
    }
    long value = Numbers.requireRange(key, Numbers.parseLong(key, raw), 1, Long.MAX_VALUE);
    return Duration.ofMillis(value);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
