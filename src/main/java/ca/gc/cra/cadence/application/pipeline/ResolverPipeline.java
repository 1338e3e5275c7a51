package ca.gc.cra.cadence.application.pipeline;

import ca.gc.cra.cadence.application.port.ContentIndexPort;
import ca.gc.cra.cadence.application.port.MetricsPort;
import ca.gc.cra.cadence.application.port.PipelineListener;
import ca.gc.cra.cadence.application.port.Query;
import ca.gc.cra.cadence.application.port.Resolver;
import ca.gc.cra.cadence.application.port.ResultReporter;
import ca.gc.cra.cadence.domain.query.QueryId;
import ca.gc.cra.cadence.domain.query.Result;
import ca.gc.cra.cadence.domain.query.ResultId;
import ca.gc.cra.cadence.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives queries through the registered resolvers, best weight first, until each query is satisfied or has used up
 * its attempts.
 * <p>All mutable state is owned by a single dispatcher thread (named {@code pipeline-dispatch-*}). Public methods
 * post events to that thread and return immediately; read-side accessors run on it and wait for the answer. Every
 * follow-up step (next dispatch pass, next resolver attempt) is posted as a new task instead of being called in
 * place, so no step ever recurses into another.</p>
 * <p>At most {@link #maxConcurrent()} queries occupy a concurrency slot at once. A query claims a slot when it
 * leaves the pending queue and keeps it until it is finalized. Its attempt budget is seeded with the number of
 * registered resolvers and shrinks by one for every empty answer, failed call, or timeout.</p>
 * <p>Metrics are emitted under {@code pipeline.*}.</p>
 *
 * @since 0.1.0
 */
public final class ResolverPipeline implements ResultReporter, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResolverPipeline.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final PipelineSettings settings;
  private final MetricsPort metrics;
  private final ScheduledExecutorService dispatcher;
  private final ResolverRegistry registry = new ResolverRegistry();
  private final PendingQueue pending = new PendingQueue();
  private final QueryLedger ledger = new QueryLedger();
  private final TemporaryQueryReaper reaper;
  private final List<PipelineListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicReference<Thread> dispatcherThread = new AtomicReference<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final Object lifecycleLock = new Object();

  private volatile boolean running;
  private long lifecycleGeneration;

  /**
   * Creates a stopped pipeline using default settings.
   *
   * @param metrics metrics sink; must not be {@code null}
   */
  public ResolverPipeline(MetricsPort metrics) {
    this(PipelineSettings.defaults(), metrics);
  }

  /**
   * Creates a stopped pipeline. Nothing is dispatched until {@link #start()} (directly or through
   * {@link #awaitIndex(ContentIndexPort)}).
   *
   * @param settings concurrency and sweep settings; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public ResolverPipeline(PipelineSettings settings, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.dispatcher = ExecutorFactories.newDispatcher("pipeline-dispatch");
    this.reaper =
        new TemporaryQueryReaper(dispatcher, settings.temporaryQueryTtl(), guarded(this::sweepTemporaryQueries));
    dispatcher.execute(() -> {
      dispatcherThread.set(Thread.currentThread());
      MDC.put("pipeline", "resolve");
    });
    log.info("Resolver pipeline using {} concurrent queries", settings.maxConcurrent());
  }

  /**
   * Starts dispatching once the content index reports readiness, then triggers the index load.
   *
   * @param index content index collaborator; must not be {@code null}
   */
  public void awaitIndex(ContentIndexPort index) {
    Objects.requireNonNull(index, "index");
    index.onIndexReady(this::start);
    index.loadIndex();
  }

  /**
   * Starts (or resumes) dispatching with a pass over whatever is pending. A {@link #stop()} or {@link #close()}
   * issued after this call wins even if the dispatcher has not processed the start yet.
   */
  public void start() {
    long generation;
    synchronized (lifecycleLock) {
      generation = lifecycleGeneration;
    }
    post(() -> {
      synchronized (lifecycleLock) {
        if (generation != lifecycleGeneration || closed.get()) {
          log.debug("Ignoring start superseded by a later stop");
          return;
        }
        running = true;
      }
      log.info("Starting resolver pipeline with {} pending queries", pending.size());
      shuntNext();
    });
  }

  /**
   * Stops dispatching. Resolver calls already issued are not cancelled; their answers are ignored.
   */
  public void stop() {
    halt();
    log.info("Resolver pipeline stopped");
  }

  /**
   * Indicates whether the pipeline dispatches queries.
   *
   * @return {@code true} between {@link #start()} and {@link #stop()}
   */
  public boolean isRunning() {
    return running;
  }

  /**
   * Stops the pipeline, cancels the temporary query sweep, and shuts the dispatcher thread down.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    halt();
    try {
      dispatcher.execute(reaper::cancel);
    } catch (RejectedExecutionException ignored) {
      log.debug("Dispatcher already shut down before reaper cancellation");
    }
    dispatcher.shutdown();
    try {
      if (!dispatcher.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Dispatcher still busy after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        forceShutdown();
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      forceShutdown();
    }
    log.info("Resolver pipeline closed");
  }

  private void halt() {
    synchronized (lifecycleLock) {
      lifecycleGeneration++;
      running = false;
    }
  }

  private void forceShutdown() {
    for (Runnable queued : dispatcher.shutdownNow()) {
      if (queued instanceof Future<?> future) {
        future.cancel(false);
      }
    }
  }

  /**
   * Registers a listener for pipeline notifications.
   *
   * @param listener listener to add; must not be {@code null}
   */
  public void addListener(PipelineListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Unregisters a listener.
   *
   * @param listener listener to remove
   */
  public void removeListener(PipelineListener listener) {
    listeners.remove(listener);
  }

  /**
   * Registers a resolver. Registering the same instance twice has no effect.
   *
   * @param resolver resolver to add; must not be {@code null}
   */
  public void addResolver(Resolver resolver) {
    Objects.requireNonNull(resolver, "resolver");
    post(() -> {
      if (registry.register(resolver)) {
        log.info("Adding resolver {} (weight {}, timeout {} ms)",
            resolver.name(), resolver.weight(), resolver.timeout().toMillis());
        notifyListeners(listener -> listener.resolverAdded(resolver));
      }
    });
  }

  /**
   * Unregisters a resolver. Answers it still delivers are accepted; queries are not dispatched to it again.
   *
   * @param resolver resolver to remove
   */
  public void removeResolver(Resolver resolver) {
    if (resolver == null) {
      return;
    }
    post(() -> {
      if (registry.unregister(resolver)) {
        log.info("Removing resolver {}", resolver.name());
        notifyListeners(listener -> listener.resolverRemoved(resolver));
      }
    });
  }

  /**
   * Returns the registered resolvers in registration order.
   *
   * @return immutable snapshot
   */
  public List<Resolver> resolvers() {
    return call(registry::snapshot);
  }

  /**
   * Submits a query for resolution. {@code null} is ignored.
   *
   * @param query query to resolve
   * @param prioritized {@code true} to queue ahead of everything already pending
   * @param temporary {@code true} if the query may be swept from the ledger after the quiet period
   */
  public void submit(Query query, boolean prioritized, boolean temporary) {
    if (query == null) {
      return;
    }
    submit(List.of(query), prioritized, temporary);
  }

  /**
   * Submits a batch of queries. Prioritized batches keep their relative order at the head of the queue; other
   * batches keep it at the tail. Queries already pending keep their position. {@code null} entries are ignored.
   *
   * @param queries queries to resolve; must not be {@code null}
   * @param prioritized {@code true} to queue ahead of everything already pending
   * @param temporary {@code true} if the queries may be swept from the ledger after the quiet period
   */
  public void submit(List<? extends Query> queries, boolean prioritized, boolean temporary) {
    Objects.requireNonNull(queries, "queries");
    List<Query> batch = new ArrayList<>(queries.size());
    for (Query query : queries) {
      if (query != null) {
        batch.add(query);
      }
    }
    if (batch.isEmpty()) {
      return;
    }
    post(() -> enqueue(batch, prioritized, temporary));
  }

  /**
   * Resubmits a query the ledger still tracks. Unknown ids are logged and ignored.
   *
   * @param queryId id of a tracked query; must not be {@code null}
   * @param prioritized {@code true} to queue ahead of everything already pending
   * @param temporary {@code true} if the query may be swept from the ledger after the quiet period
   */
  public void submit(QueryId queryId, boolean prioritized, boolean temporary) {
    Objects.requireNonNull(queryId, "queryId");
    post(() -> {
      Optional<Query> tracked = ledger.find(queryId);
      if (tracked.isEmpty()) {
        log.debug("Ignoring resubmission of unknown query {}", queryId);
        return;
      }
      enqueue(List.of(tracked.get()), prioritized, temporary);
    });
  }

  /**
   * Accepts the answer of one resolver attempt. Safe to call from any thread. Answers for unknown or finalized
   * queries, or arriving while the pipeline is stopped, are dropped.
   *
   * @param queryId id of the query the attempt belonged to; must not be {@code null}
   * @param results results found; {@code null} is treated as empty
   */
  @Override
  public void reportResults(QueryId queryId, List<Result> results) {
    Objects.requireNonNull(queryId, "queryId");
    List<Result> copy = results == null ? List.of() : List.copyOf(results);
    if (!running) {
      log.debug("Ignoring results for {} while stopped", queryId);
      return;
    }
    post(() -> handleResults(queryId, copy));
  }

  /**
   * Looks up a query tracked by the ledger.
   *
   * @param queryId query id
   * @return the query while it is pending, in flight, or temporary and not yet swept
   */
  public Optional<Query> query(QueryId queryId) {
    return call(() -> ledger.find(queryId));
  }

  /**
   * Looks up a result by id.
   *
   * @param resultId result id
   * @return the result while its owning query is tracked
   */
  public Optional<Result> result(ResultId resultId) {
    return call(() -> ledger.findResult(resultId));
  }

  /**
   * Returns the number of queries waiting for a concurrency slot.
   *
   * @return pending queue length
   */
  public int pendingCount() {
    return call(pending::size);
  }

  /**
   * Returns the number of queries currently occupying a concurrency slot.
   *
   * @return active query count
   */
  public int activeCount() {
    return call(ledger::slotCount);
  }

  /**
   * Returns the ids of pending queries in dispatch order.
   *
   * @return immutable snapshot of pending ids
   */
  public List<QueryId> pendingIds() {
    return call(() -> List.copyOf(pending.ids()));
  }

  /**
   * Returns the concurrency cap.
   *
   * @return maximum number of queries occupying a slot at once
   */
  public int maxConcurrent() {
    return settings.maxConcurrent();
  }

  private void enqueue(List<Query> batch, boolean prioritized, boolean temporary) {
    int insertAt = 0;
    for (Query candidate : batch) {
      Query query = ledger.track(candidate);
      QueryId id = query.id();
      metrics.increment("pipeline.query.submitted");
      if (pending.contains(id)) {
        continue;
      }
      if (ledger.occupiesSlot(id)) {
        log.debug("Query {} is already being resolved; not queueing it again", id);
        continue;
      }
      if (prioritized) {
        pending.insert(insertAt++, query);
      } else {
        pending.append(query);
      }
      if (temporary) {
        ledger.markTemporary(id);
        reaper.rearm();
      }
    }
    metrics.observe("pipeline.pending.depth", pending.size());
    shuntNext();
  }

  private void shuntNext() {
    if (!running) {
      return;
    }
    if (pending.isEmpty()) {
      if (ledger.slotCount() == 0) {
        notifyListeners(PipelineListener::idle);
      }
      return;
    }
    if (ledger.slotCount() >= settings.maxConcurrent()) {
      return;
    }
    Query query = pending.poll();
    query.setCurrentResolver(null);
    updateBudget(query, registry.size());
    metrics.observe("pipeline.slots.active", ledger.slotCount());
  }

  private void shunt(Query query) {
    if (!running) {
      return;
    }
    QueryId id = query.id();
    if (!ledger.occupiesSlot(id)) {
      return;
    }
    Resolver resolver =
        query.isExhaustiveSearch() || !query.isSatisfied() ? registry.nextResolver(query) : null;
    if (resolver == null) {
      updateBudget(query, 0);
      return;
    }

    log.debug("Dispatching {} to resolver {}", query, resolver.name());
    query.setCurrentResolver(resolver);
    ledger.markAwaitingAnswer(id);
    metrics.increment("pipeline.query.dispatched");
    boolean dispatched = invokeResolver(resolver, query);
    notifyListeners(listener -> listener.resolving(query));

    if (!dispatched) {
      post(() -> failAttempt(query, resolver));
    } else if (!resolver.timeout().isZero() && !resolver.timeout().isNegative()) {
      schedule(() -> onAttemptTimeout(query, resolver), resolver.timeout());
    }
    post(this::shuntNext);
  }

  private boolean invokeResolver(Resolver resolver, Query query) {
    try {
      resolver.resolve(query);
      return true;
    } catch (RuntimeException ex) {
      metrics.increment("pipeline.resolver.failure");
      log.warn("Resolver {} failed to accept query {}", resolver.name(), query.id(), ex);
      return false;
    }
  }

  private void onAttemptTimeout(Query query, Resolver resolver) {
    if (!running) {
      return;
    }
    if (ledger.isAwaitingAnswer(query.id()) && query.currentResolver() == resolver) {
      metrics.increment("pipeline.resolver.timeout");
      log.debug("Resolver {} timed out after {} ms on {}", resolver.name(), resolver.timeout().toMillis(), query.id());
      decrementBudget(query);
    }
  }

  private void failAttempt(Query query, Resolver resolver) {
    if (!running) {
      return;
    }
    if (ledger.isAwaitingAnswer(query.id()) && query.currentResolver() == resolver) {
      decrementBudget(query);
    }
  }

  private void handleResults(QueryId id, List<Result> results) {
    if (!running) {
      return;
    }
    Optional<Query> tracked = ledger.find(id);
    if (tracked.isEmpty()) {
      metrics.increment("pipeline.results.late");
      log.debug("Results arrived too late for {}", id);
      return;
    }
    Query query = tracked.get();
    if (!results.isEmpty()) {
      metrics.increment("pipeline.results.received");
      query.addResults(results);
      ledger.indexResults(id, results);
    }
    if (!ledger.occupiesSlot(id)) {
      metrics.increment("pipeline.results.late");
      log.debug("Recorded {} results for {} after it finished resolving", results.size(), id);
      return;
    }
    ledger.clearAwaitingAnswer(id);
    if (!results.isEmpty()) {
      if (query.isSatisfied() && !query.isExhaustiveSearch()) {
        updateBudget(query, 0);
        return;
      }
    }
    decrementBudget(query);
  }

  private void decrementBudget(Query query) {
    OptionalInt remaining = ledger.remainingAttempts(query.id());
    if (remaining.isEmpty()) {
      return;
    }
    updateBudget(query, remaining.getAsInt() - 1);
  }

  private void updateBudget(Query query, int attempts) {
    QueryId id = query.id();
    ledger.clearAwaitingAnswer(id);
    if (attempts > 0) {
      ledger.occupySlot(id, attempts);
      post(() -> shunt(query));
      return;
    }
    finalizeQuery(query);
  }

  private void finalizeQuery(Query query) {
    QueryId id = query.id();
    ledger.releaseSlot(id);
    metrics.increment("pipeline.query.finalized");
    metrics.increment(query.isSatisfied() ? "pipeline.query.satisfied" : "pipeline.query.exhausted");
    metrics.observe("pipeline.query.results", query.results().size());
    log.debug("Finished resolving {} with {} results", query, query.results().size());
    try {
      query.onResolvingFinished();
    } catch (RuntimeException ex) {
      log.warn("Query {} failed while handling resolving completion", id, ex);
    }
    if (!ledger.isTemporary(id)) {
      ledger.forget(id);
    }
    post(this::shuntNext);
  }

  private void sweepTemporaryQueries() {
    int evicted = ledger.evictTemporary(id -> !pending.contains(id) && !ledger.occupiesSlot(id));
    if (evicted > 0) {
      metrics.increment("pipeline.reaper.evicted");
      log.info("Swept {} temporary queries from the ledger", evicted);
    }
    if (ledger.hasTemporary()) {
      reaper.rearm();
    }
  }

  private void notifyListeners(Consumer<PipelineListener> notification) {
    for (PipelineListener listener : listeners) {
      try {
        notification.accept(listener);
      } catch (RuntimeException ex) {
        log.warn("Pipeline listener {} failed", listener.getClass().getName(), ex);
      }
    }
  }

  private void post(Runnable task) {
    try {
      dispatcher.execute(guarded(task));
    } catch (RejectedExecutionException ex) {
      log.debug("Dispatcher closed; dropping task");
    }
  }

  private void schedule(Runnable task, Duration delay) {
    try {
      dispatcher.schedule(guarded(task), delay.toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Dispatcher closed; dropping timer");
    }
  }

  private Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        metrics.increment("pipeline.dispatch.uncaught");
        log.error("Dispatcher task failed", ex);
      }
    };
  }

  private <T> T call(Supplier<T> read) {
    if (Thread.currentThread() == dispatcherThread.get()) {
      return read.get();
    }
    try {
      return dispatcher.submit(read::get).get();
    } catch (RejectedExecutionException | CancellationException ex) {
      return readAfterTermination(read);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while reading pipeline state", ie);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Failed to read pipeline state", cause);
    }
  }

  private <T> T readAfterTermination(Supplier<T> read) {
    try {
      if (!dispatcher.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new IllegalStateException("Pipeline dispatcher is still shutting down");
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while reading pipeline state", ie);
    }
    return read.get();
  }
}
