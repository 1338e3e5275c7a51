package ca.gc.cra.cadence.domain.query;

import java.util.Objects;

/**
 * Opaque identifier under which a result is indexed while its owning query is tracked.
 *
 * @param value identifier text; never blank
 * @since 0.1.0
 */
public record ResultId(String value) {

  /**
   * Validates the identifier text.
   */
  public ResultId {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("result id must not be blank");
    }
  }

  /**
   * Creates a fresh, time-ordered identifier.
   *
   * @return new result identifier
   */
  public static ResultId newId() {
    return new ResultId(Ulid.next());
  }

  @Override
  public String toString() {
    return value;
  }
}
