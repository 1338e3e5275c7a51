package ca.gc.cra.cadence.domain.query;

import java.util.Objects;

/**
 * Immutable candidate answer produced by a resolver for a query.
 *
 * @param id identifier used to index the result while its query is tracked; never {@code null}
 * @param artist artist name as reported by the resolver; never {@code null}
 * @param track track title as reported by the resolver; never {@code null}
 * @param album album title; empty when unknown
 * @param score match confidence in {@code [0, 1]}; {@code 1.0} means an exact match
 * @param source name of the resolver that produced the result; never {@code null}
 * @since 0.1.0
 */
public record Result(ResultId id, String artist, String track, String album, float score, String source) {

  /**
   * Validates invariants and normalizes the optional album.
   */
  public Result {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(artist, "artist");
    Objects.requireNonNull(track, "track");
    Objects.requireNonNull(source, "source");
    album = album == null ? "" : album;
    if (Float.isNaN(score) || score < 0f || score > 1f) {
      throw new IllegalArgumentException("score must be within [0, 1] (was " + score + ")");
    }
  }

  /**
   * Creates a result with a freshly generated identifier.
   *
   * @param artist artist name
   * @param track track title
   * @param album album title; may be {@code null}
   * @param score match confidence in {@code [0, 1]}
   * @param source resolver name
   * @return new result
   */
  public static Result of(String artist, String track, String album, float score, String source) {
    return new Result(ResultId.newId(), artist, track, album, score, source);
  }
}
