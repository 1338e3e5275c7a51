package ca.gc.cra.cadence.domain.query;

import java.util.Objects;

/**
 * Opaque identifier correlating a query with the results resolvers report for it.
 *
 * @param value identifier text; never blank
 * @since 0.1.0
 */
public record QueryId(String value) implements Comparable<QueryId> {

  /**
   * Validates the identifier text.
   */
  public QueryId {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("query id must not be blank");
    }
  }

  /**
   * Creates a fresh, time-ordered identifier.
   *
   * @return new query identifier
   */
  public static QueryId newId() {
    return new QueryId(Ulid.next());
  }

  @Override
  public int compareTo(QueryId other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
