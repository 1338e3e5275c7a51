package ca.gc.cra.cadence.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Outbound port for an asynchronous backend able to find results for a query.
 * <p><strong>Why:</strong> Lets the pipeline order and escalate attempts across local indexes, peers, and web
 * services without knowing how any of them work.</p>
 * <p><strong>Role:</strong> Capability consumed by {@code ResolverPipeline}; implemented by adapters such as
 * {@code CatalogResolver}.</p>
 * <p><strong>Thread-safety:</strong> {@link #resolve(Query)} is invoked on the pipeline dispatcher thread and must
 * return promptly; results are delivered later, from any thread, through a {@link ResultReporter}.</p>
 *
 * @implNote {@link #name()}, {@link #weight()}, and {@link #timeout()} must not change while registered.
 * @since 0.1.0
 */
public interface Resolver {
  /**
   * Returns the display name used in logs and results.
   *
   * @return resolver name; never {@code null}
   */
  String name();

  /**
   * Returns the selection priority; higher weights are tried first.
   *
   * @return resolver weight
   */
  int weight();

  /**
   * Returns how long the pipeline waits for an answer before escalating to the next resolver.
   *
   * @return attempt timeout; {@link Duration#ZERO} disables the timeout
   */
  Duration timeout();

  /**
   * Starts resolving the query. Must not block; answers are reported asynchronously, correlated by
   * {@link Query#id()}.
   *
   * @param query query to resolve; never {@code null}
   */
  void resolve(Query query);
}
