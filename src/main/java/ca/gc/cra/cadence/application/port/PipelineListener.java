package ca.gc.cra.cadence.application.port;

/**
 * <strong>What:</strong> Outbound port notified about pipeline activity.
 * <p><strong>Why:</strong> Lets UIs and observability adapters follow resolver registration and query progress
 * without coupling to pipeline internals.</p>
 * <p><strong>Thread-safety:</strong> Callbacks run on the pipeline dispatcher thread; implementations must not
 * block.</p>
 *
 * @since 0.1.0
 */
public interface PipelineListener {
  /**
   * Invoked after a resolver was registered.
   *
   * @param resolver registered resolver
   */
  default void resolverAdded(Resolver resolver) {}

  /**
   * Invoked after a resolver was unregistered.
   *
   * @param resolver removed resolver
   */
  default void resolverRemoved(Resolver resolver) {}

  /**
   * Invoked after a query was handed to a resolver.
   *
   * @param query dispatched query; its current resolver is set
   */
  default void resolving(Query query) {}

  /**
   * Invoked when the pending queue is empty and no query occupies a concurrency slot.
   */
  default void idle() {}

  /**
   * Listener that ignores all notifications.
   */
  PipelineListener NO_OP = new PipelineListener() {};
}
