package ca.gc.cra.cadence.application.port;

import ca.gc.cra.cadence.domain.query.QueryId;
import ca.gc.cra.cadence.domain.query.Result;
import java.util.List;

/**
 * Inbound port through which resolvers deliver answers.
 * <p>Implementations must accept concurrent calls from any number of resolver threads. Answers for unknown or
 * already finalized queries are dropped.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ResultReporter {
  /**
   * Reports the results of one resolver attempt.
   *
   * @param queryId identifier of the query the attempt belonged to
   * @param results results found; empty when the resolver found nothing
   */
  void reportResults(QueryId queryId, List<Result> results);
}
