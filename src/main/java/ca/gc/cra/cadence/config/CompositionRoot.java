package ca.gc.cra.cadence.config;

import ca.gc.cra.cadence.application.pipeline.ResolverPipeline;
import ca.gc.cra.cadence.application.port.ContentIndexPort;
import ca.gc.cra.cadence.application.port.MetricsPort;
import ca.gc.cra.cadence.application.port.Resolver;
import ca.gc.cra.cadence.infrastructure.events.LoggingPipelineListener;
import ca.gc.cra.cadence.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.cadence.infrastructure.index.InMemoryContentIndex;
import ca.gc.cra.cadence.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.cadence.infrastructure.resolver.CatalogResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root wiring the resolver pipeline to its adapters.
 * <p><strong>Role:</strong> Owns the pipeline instance, the catalog resolvers' worker pool, and the content index
 * loader; {@link #close()} releases all of them.</p>
 * <p><strong>Thread-safety:</strong> Build and close on a single bootstrap thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final int RESOLVER_THREADS = 2;

  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ResolverPipeline pipeline;
  private ScheduledExecutorService resolverPool;
  private ExecutorService indexLoader;

  /**
   * Creates a composition root exporting metrics through OpenTelemetry.
   *
   * @param config pipeline configuration; must not be {@code null}
   */
  public CompositionRoot(PipelineConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config pipeline configuration; must not be {@code null}
   * @param metrics metrics adapter shared by the pipeline and listener; must not be {@code null}
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.pipeline = new ResolverPipeline(config.toSettings(Runtime.getRuntime().availableProcessors()), metrics);
    this.pipeline.addListener(new LoggingPipelineListener(metrics));
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return pipeline configuration
   */
  public PipelineConfig config() {
    return config;
  }

  /**
   * Returns the shared metrics adapter.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the pipeline, stopped until {@link #start(List)} or its own start methods run.
   *
   * @return pipeline instance
   */
  public ResolverPipeline pipeline() {
    return pipeline;
  }

  /**
   * Builds catalog resolvers reporting to the pipeline. Does not register them.
   *
   * @param definitions resolver definitions; must not be {@code null}
   * @return resolvers in definition order
   */
  public synchronized List<Resolver> catalogResolvers(List<ResolverDefinition> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    if (resolverPool == null) {
      resolverPool = ExecutorFactories.newResolverPool(RESOLVER_THREADS, "catalog-resolver");
    }
    List<Resolver> resolvers = new ArrayList<>(definitions.size());
    for (ResolverDefinition definition : definitions) {
      resolvers.add(new CatalogResolver(
          definition.name(),
          definition.weight(),
          definition.timeout(),
          definition.latency(),
          definition.entries(),
          resolverPool,
          pipeline));
    }
    return List.copyOf(resolvers);
  }

  /**
   * Returns a content index adapter loading on a background worker.
   *
   * @return new content index
   */
  public synchronized ContentIndexPort contentIndex() {
    if (indexLoader == null) {
      indexLoader = ExecutorFactories.newLoader("index-loader");
    }
    return new InMemoryContentIndex(indexLoader);
  }

  /**
   * Registers catalog resolvers for {@code definitions} and starts the pipeline once the content index is ready.
   *
   * @param definitions resolver definitions; must not be {@code null}
   * @return the started pipeline
   */
  public ResolverPipeline start(List<ResolverDefinition> definitions) {
    for (Resolver resolver : catalogResolvers(definitions)) {
      pipeline.addResolver(resolver);
    }
    pipeline.awaitIndex(contentIndex());
    return pipeline;
  }

  /**
   * Closes the pipeline, stops worker threads, and flushes metrics when the adapter supports it.
   */
  @Override
  public synchronized void close() {
    pipeline.close();
    if (resolverPool != null) {
      resolverPool.shutdownNow();
    }
    if (indexLoader != null) {
      indexLoader.shutdownNow();
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
