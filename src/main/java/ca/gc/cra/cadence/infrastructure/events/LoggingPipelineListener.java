package ca.gc.cra.cadence.infrastructure.events;

import ca.gc.cra.cadence.application.port.MetricsPort;
import ca.gc.cra.cadence.application.port.PipelineListener;
import ca.gc.cra.cadence.application.port.Query;
import ca.gc.cra.cadence.application.port.Resolver;
import ca.gc.cra.cadence.logging.Logs;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits pipeline notifications as structured logs and counts them.
 *
 * @since 0.1.0
 */
public final class LoggingPipelineListener implements PipelineListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingPipelineListener.class);
  private static final int MAX_QUERY_BYTES = 256;

  private final MetricsPort metrics;
  private final String metricPrefix;

  /**
   * Creates a logging listener using the supplied metrics port and prefix.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters (e.g., {@code pipelineEvents})
   */
  public LoggingPipelineListener(MetricsPort metrics, String metricPrefix) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix =
        metricPrefix == null || metricPrefix.isBlank() ? "pipelineEvents" : metricPrefix.trim();
  }

  /**
   * Creates a logging listener using {@code pipelineEvents} as the metric prefix.
   *
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public LoggingPipelineListener(MetricsPort metrics) {
    this(metrics, "pipelineEvents");
  }

  @Override
  public void resolverAdded(Resolver resolver) {
    metrics.increment(metricPrefix + ".resolverAdded");
    log.info("pipeline.event type=resolverAdded, {}", describe(resolver));
  }

  @Override
  public void resolverRemoved(Resolver resolver) {
    metrics.increment(metricPrefix + ".resolverRemoved");
    log.info("pipeline.event type=resolverRemoved, {}", describe(resolver));
  }

  @Override
  public void resolving(Query query) {
    metrics.increment(metricPrefix + ".resolving");
    if (!log.isDebugEnabled()) {
      return;
    }
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("query=" + query.id());
    joiner.add("text=" + Logs.truncate(query.toString(), MAX_QUERY_BYTES));
    Resolver current = query.currentResolver();
    if (current != null) {
      joiner.add("resolver=" + current.name());
    }
    joiner.add("attempt=" + query.resolvedBy().size());
    log.debug("pipeline.event type=resolving, {}", joiner);
  }

  @Override
  public void idle() {
    metrics.increment(metricPrefix + ".idle");
    log.info("pipeline.event type=idle");
  }

  private static String describe(Resolver resolver) {
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("resolver=" + resolver.name());
    joiner.add("weight=" + resolver.weight());
    joiner.add("timeoutMs=" + resolver.timeout().toMillis());
    return joiner.toString();
  }
}
