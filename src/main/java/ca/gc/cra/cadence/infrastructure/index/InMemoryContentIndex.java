package ca.gc.cra.cadence.infrastructure.index;

import ca.gc.cra.cadence.application.port.ContentIndexPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ContentIndexPort} adapter that loads an in-memory index on a background executor
 * and announces readiness exactly once.
 * <p><strong>Thread-safety:</strong> All methods may be called from any thread. Listeners registered after
 * readiness run immediately on the registering thread; earlier listeners run on the loading thread.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryContentIndex implements ContentIndexPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryContentIndex.class);

  private final Executor executor;
  private final Runnable loader;
  private final List<Runnable> listeners = new ArrayList<>();
  private boolean loading;
  private boolean ready;

  /**
   * Creates an index whose load step does no work.
   *
   * @param executor executor running the load; must not be {@code null}
   */
  public InMemoryContentIndex(Executor executor) {
    this(executor, () -> {});
  }

  /**
   * Creates an index with a custom load step, for example a catalog scan.
   *
   * @param executor executor running the load; must not be {@code null}
   * @param loader work performed before readiness is signalled; must not be {@code null}
   */
  public InMemoryContentIndex(Executor executor, Runnable loader) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  /**
   * Starts loading on the executor. Calls after the first are ignored.
   *
   * @throws IllegalStateException if the executor rejects the load task
   */
  @Override
  public void loadIndex() {
    synchronized (this) {
      if (loading || ready) {
        return;
      }
      loading = true;
    }
    log.info("Loading content index");
    try {
      executor.execute(this::load);
    } catch (RejectedExecutionException ex) {
      synchronized (this) {
        loading = false;
      }
      throw new IllegalStateException("Content index executor rejected the load task", ex);
    }
  }

  @Override
  public void onIndexReady(Runnable listener) {
    Objects.requireNonNull(listener, "listener");
    synchronized (this) {
      if (!ready) {
        listeners.add(listener);
        return;
      }
    }
    listener.run();
  }

  /**
   * Indicates whether loading has completed.
   *
   * @return {@code true} once readiness has been signalled
   */
  public synchronized boolean isReady() {
    return ready;
  }

  private void load() {
    try {
      loader.run();
    } catch (RuntimeException ex) {
      log.error("Content index load failed; pipeline will not start", ex);
      synchronized (this) {
        loading = false;
      }
      return;
    }
    List<Runnable> toNotify;
    synchronized (this) {
      ready = true;
      loading = false;
      toNotify = List.copyOf(listeners);
      listeners.clear();
    }
    log.info("Content index ready; notifying {} listeners", toNotify.size());
    for (Runnable listener : toNotify) {
      try {
        listener.run();
      } catch (RuntimeException ex) {
        log.warn("Content index readiness listener failed", ex);
      }
    }
  }
}
