package ca.gc.cra.cadence.application.pipeline;

import ca.gc.cra.cadence.application.port.Query;
import ca.gc.cra.cadence.domain.query.QueryId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered worklist of queries awaiting dispatch. A query id appears at most once.
 * <p>Not thread-safe; confined to the pipeline dispatcher thread.</p>
 *
 * @since 0.1.0
 */
final class PendingQueue {
  private final List<Query> queue = new ArrayList<>();
  private final Set<QueryId> ids = new HashSet<>();

  boolean contains(QueryId id) {
    return ids.contains(id);
  }

  /**
   * Inserts the query at {@code index}; callers inserting a prioritized batch pass increasing indexes so the batch
   * keeps its order ahead of everything already queued.
   *
   * @param index insertion position, {@code 0} for the head
   * @param query query to insert
   * @return {@code false} if the id was already queued
   */
  boolean insert(int index, Query query) {
    Objects.requireNonNull(query, "query");
    if (!ids.add(query.id())) {
      return false;
    }
    queue.add(Math.min(index, queue.size()), query);
    return true;
  }

  /**
   * Appends the query to the tail.
   *
   * @param query query to append
   * @return {@code false} if the id was already queued
   */
  boolean append(Query query) {
    Objects.requireNonNull(query, "query");
    if (!ids.add(query.id())) {
      return false;
    }
    queue.add(query);
    return true;
  }

  /**
   * Removes and returns the head of the queue.
   *
   * @return head query, or {@code null} when empty
   */
  Query poll() {
    if (queue.isEmpty()) {
      return null;
    }
    Query head = queue.remove(0);
    ids.remove(head.id());
    return head;
  }

  boolean isEmpty() {
    return queue.isEmpty();
  }

  int size() {
    return queue.size();
  }

  List<QueryId> ids() {
    List<QueryId> snapshot = new ArrayList<>(queue.size());
    for (Query query : queue) {
      snapshot.add(query.id());
    }
    return snapshot;
  }
}
