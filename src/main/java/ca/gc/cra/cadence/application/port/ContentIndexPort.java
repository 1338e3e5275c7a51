package ca.gc.cra.cadence.application.port;

/**
 * Outbound port to the persistent content index the pipeline waits for before dispatching.
 *
 * @since 0.1.0
 */
public interface ContentIndexPort {
  /**
   * Starts loading the index. Completion is signalled to listeners registered with {@link #onIndexReady(Runnable)}.
   */
  void loadIndex();

  /**
   * Registers a callback invoked once the index is ready. Callbacks registered after readiness run immediately.
   *
   * @param listener readiness callback; never {@code null}
   */
  void onIndexReady(Runnable listener);
}
