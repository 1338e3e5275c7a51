package ca.gc.cra.cadence.infrastructure.exec;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for creating executor services aligned with CADENCE concurrency requirements.
 */
public final class ExecutorFactories {
  private static final AtomicInteger DISPATCHER_INDEX = new AtomicInteger();
  private static final AtomicInteger RESOLVER_INDEX = new AtomicInteger();
  private static final AtomicInteger LOADER_INDEX = new AtomicInteger();

  private ExecutorFactories() {}

  /**
   * Builds the single-threaded scheduler that owns a pipeline's state. Delayed tasks are dropped on shutdown and
   * cancelled tasks are removed from the queue immediately, so stale attempt timers do not pile up.
   *
   * @param prefix thread-name prefix; blank selects {@code pipeline-dispatch}
   * @return configured scheduler backed by one daemon thread
   */
  public static ScheduledExecutorService newDispatcher(String prefix) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "pipeline-dispatch" : prefix;
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(1, daemonFactory(threadPrefix, DISPATCHER_INDEX));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return executor;
  }

  /**
   * Builds a small scheduler for resolver adapters that answer after a delay.
   *
   * @param size number of worker threads; must be positive
   * @param prefix thread-name prefix; blank selects {@code resolver-worker}
   * @return configured scheduler backed by daemon threads
   */
  public static ScheduledExecutorService newResolverPool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "resolver-worker" : prefix;
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(size, daemonFactory(threadPrefix, RESOLVER_INDEX));
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return executor;
  }

  /**
   * Builds a single background worker for one-off loads such as the content index.
   *
   * @param prefix thread-name prefix; blank selects {@code index-loader}
   * @return executor backed by one daemon thread that exits after 30 s idle
   */
  public static ExecutorService newLoader(String prefix) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "index-loader" : prefix;
    ThreadPoolExecutor executor = new ThreadPoolExecutor(
        1, 1, 30, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), daemonFactory(threadPrefix, LOADER_INDEX));
    executor.allowCoreThreadTimeOut(true);
    return executor;
  }

  private static ThreadFactory daemonFactory(String prefix, AtomicInteger index) {
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }
}
