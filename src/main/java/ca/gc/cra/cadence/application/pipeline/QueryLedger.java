package ca.gc.cra.cadence.application.pipeline;

import ca.gc.cra.cadence.application.port.Query;
import ca.gc.cra.cadence.domain.query.QueryId;
import ca.gc.cra.cadence.domain.query.Result;
import ca.gc.cra.cadence.domain.query.ResultId;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Bookkeeping of every query the pipeline knows about.
 * <p>The attempt budget serves two purposes: presence of an entry means the query occupies one of the pipeline's
 * concurrency slots, and its value is the number of resolver attempts the query may still consume.</p>
 * <p>Results are indexed by id for as long as their owning query stays in the ledger.</p>
 * <p>Not thread-safe; confined to the pipeline dispatcher thread.</p>
 *
 * @since 0.1.0
 */
final class QueryLedger {
  private final Map<QueryId, Query> queries = new HashMap<>();
  private final Map<QueryId, Integer> budgets = new LinkedHashMap<>();
  private final Set<QueryId> awaitingAnswer = new HashSet<>();
  private final Set<QueryId> temporary = new LinkedHashSet<>();
  private final Map<ResultId, Result> results = new HashMap<>();
  private final Map<ResultId, QueryId> resultOwners = new HashMap<>();
  private final Map<QueryId, Set<ResultId>> resultsByQuery = new HashMap<>();

  /**
   * Starts tracking the query unless its id is already known.
   *
   * @param query query to track
   * @return the tracked instance for the query id (the existing one when already known)
   */
  Query track(Query query) {
    Objects.requireNonNull(query, "query");
    return queries.computeIfAbsent(query.id(), id -> query);
  }

  Optional<Query> find(QueryId id) {
    return Optional.ofNullable(queries.get(id));
  }

  Optional<Result> findResult(ResultId id) {
    return Optional.ofNullable(results.get(id));
  }

  int size() {
    return queries.size();
  }

  /**
   * Indexes results under their own ids. A result id reported again by another query moves to that query.
   *
   * @param owner query the results were reported for
   * @param added results to index
   */
  void indexResults(QueryId owner, List<Result> added) {
    Set<ResultId> owned = resultsByQuery.computeIfAbsent(owner, id -> new LinkedHashSet<>());
    for (Result result : added) {
      results.put(result.id(), result);
      resultOwners.put(result.id(), owner);
      owned.add(result.id());
    }
  }

  /**
   * Claims a concurrency slot for the query, or updates its remaining attempts when it already holds one.
   *
   * @param id query id
   * @param attempts remaining resolver attempts; must be positive
   */
  void occupySlot(QueryId id, int attempts) {
    if (attempts <= 0) {
      throw new IllegalArgumentException("attempts must be positive");
    }
    budgets.put(id, attempts);
  }

  boolean occupiesSlot(QueryId id) {
    return budgets.containsKey(id);
  }

  int slotCount() {
    return budgets.size();
  }

  /**
   * Returns the remaining attempts of a query holding a slot.
   *
   * @param id query id
   * @return remaining attempts, empty when the query holds no slot
   */
  OptionalInt remainingAttempts(QueryId id) {
    Integer attempts = budgets.get(id);
    return attempts == null ? OptionalInt.empty() : OptionalInt.of(attempts);
  }

  /**
   * Frees the query's slot and clears its awaiting-answer flag.
   *
   * @param id query id
   */
  void releaseSlot(QueryId id) {
    budgets.remove(id);
    awaitingAnswer.remove(id);
  }

  void markAwaitingAnswer(QueryId id) {
    awaitingAnswer.add(id);
  }

  boolean isAwaitingAnswer(QueryId id) {
    return awaitingAnswer.contains(id);
  }

  /**
   * Clears the awaiting-answer flag.
   *
   * @param id query id
   * @return {@code true} if the flag was set
   */
  boolean clearAwaitingAnswer(QueryId id) {
    return awaitingAnswer.remove(id);
  }

  void markTemporary(QueryId id) {
    temporary.add(id);
  }

  boolean isTemporary(QueryId id) {
    return temporary.contains(id);
  }

  boolean hasTemporary() {
    return !temporary.isEmpty();
  }

  /**
   * Stops tracking a query and drops the results it owns.
   *
   * @param id query id
   */
  void forget(QueryId id) {
    temporary.remove(id);
    drop(id);
  }

  private void drop(QueryId id) {
    queries.remove(id);
    Set<ResultId> owned = resultsByQuery.remove(id);
    if (owned != null) {
      for (ResultId resultId : owned) {
        if (resultOwners.remove(resultId, id)) {
          results.remove(resultId);
        }
      }
    }
  }

  /**
   * Forgets every temporary query accepted by {@code evictable}; the others stay marked temporary.
   *
   * @param evictable decides whether a temporary query may be evicted now
   * @return number of queries evicted
   */
  int evictTemporary(Predicate<QueryId> evictable) {
    int evicted = 0;
    Iterator<QueryId> it = temporary.iterator();
    while (it.hasNext()) {
      QueryId id = it.next();
      if (!evictable.test(id)) {
        continue;
      }
      it.remove();
      drop(id);
      evicted++;
    }
    return evicted;
  }
}
