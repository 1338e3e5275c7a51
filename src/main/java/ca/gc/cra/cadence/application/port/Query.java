package ca.gc.cra.cadence.application.port;

import ca.gc.cra.cadence.domain.query.QueryId;
import ca.gc.cra.cadence.domain.query.Result;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Contract of a query object the pipeline drives through its resolvers.
 * <p><strong>Role:</strong> Externally owned, pipeline-mutated; the default implementation is
 * {@code ca.gc.cra.cadence.application.query.TrackQuery}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate reads from caller threads while the dispatcher
 * thread mutates them.</p>
 *
 * @since 0.1.0
 */
public interface Query {
  /**
   * Returns the identifier used to correlate reported results.
   *
   * @return query identifier; never {@code null}
   */
  QueryId id();

  /**
   * Appends results reported by a resolver.
   *
   * @param results results to add; never {@code null}
   */
  void addResults(List<Result> results);

  /**
   * Returns the results gathered so far.
   *
   * @return immutable snapshot of results
   */
  List<Result> results();

  /**
   * Indicates whether enough good results exist to stop trying further resolvers.
   *
   * @return {@code true} when satisfied
   */
  boolean isSatisfied();

  /**
   * Indicates whether every resolver must be tried even after the query is satisfied.
   *
   * @return {@code true} for exhaustive searches
   */
  boolean isExhaustiveSearch();

  /**
   * Returns the resolvers this query has been dispatched to, in dispatch order. The set only grows.
   *
   * @return immutable snapshot of attempted resolvers
   */
  Set<Resolver> resolvedBy();

  /**
   * Records the resolver currently working on this query. A non-null resolver is also recorded in
   * {@link #resolvedBy()}; {@code null} clears the current resolver only.
   *
   * @param resolver current resolver; may be {@code null}
   */
  void setCurrentResolver(Resolver resolver);

  /**
   * Returns the resolver currently working on this query.
   *
   * @return current resolver or {@code null}
   */
  Resolver currentResolver();

  /**
   * Invoked by the pipeline once no further resolver attempts will be made.
   */
  void onResolvingFinished();
}
