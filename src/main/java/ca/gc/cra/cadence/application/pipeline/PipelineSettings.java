package ca.gc.cra.cadence.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning parameters of the resolver pipeline.
 *
 * @param maxConcurrent maximum number of queries occupying a concurrency slot at once; at least 1
 * @param temporaryQueryTtl quiet period after which temporary queries are swept from the ledger; positive
 * @since 0.1.0
 */
public record PipelineSettings(int maxConcurrent, Duration temporaryQueryTtl) {
  /** Lower bound of the default concurrency. */
  public static final int MIN_DEFAULT_CONCURRENCY = 4;
  /** Upper bound of the default concurrency. */
  public static final int MAX_DEFAULT_CONCURRENCY = 16;
  /** Default quiet period of the temporary query sweep. */
  public static final Duration DEFAULT_TEMPORARY_QUERY_TTL = Duration.ofMinutes(5);

  /**
   * Validates the settings.
   */
  public PipelineSettings {
    if (maxConcurrent < 1) {
      throw new IllegalArgumentException("maxConcurrent must be >= 1 (was " + maxConcurrent + ")");
    }
    temporaryQueryTtl = Objects.requireNonNullElse(temporaryQueryTtl, DEFAULT_TEMPORARY_QUERY_TTL);
    if (temporaryQueryTtl.isNegative() || temporaryQueryTtl.isZero()) {
      throw new IllegalArgumentException("temporaryQueryTtl must be positive");
    }
  }

  /**
   * Derives settings from the host's available processors.
   *
   * @return default settings
   */
  public static PipelineSettings defaults() {
    return new PipelineSettings(
        defaultConcurrency(Runtime.getRuntime().availableProcessors()), DEFAULT_TEMPORARY_QUERY_TTL);
  }

  /**
   * Clamps the host parallelism into the default concurrency range.
   *
   * @param parallelism host parallelism
   * @return concurrency between {@link #MIN_DEFAULT_CONCURRENCY} and {@link #MAX_DEFAULT_CONCURRENCY}
   */
  public static int defaultConcurrency(int parallelism) {
    return Math.max(MIN_DEFAULT_CONCURRENCY, Math.min(MAX_DEFAULT_CONCURRENCY, parallelism));
  }
}
