package ca.gc.cra.cadence.application.query;

import ca.gc.cra.cadence.application.port.Query;
import ca.gc.cra.cadence.application.port.Resolver;
import ca.gc.cra.cadence.domain.query.QueryId;
import ca.gc.cra.cadence.domain.query.Result;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Default {@link Query} looking for a track either by artist and title or by free text.
 * <p>Results are kept ordered by descending score; ties keep arrival order. A query is satisfied once any
 * result reaches {@link #SATISFIED_SCORE}. Free-text queries are exhaustive: every resolver is asked even after a
 * satisfying result arrives.</p>
 * <p>Thread-safe; all state is guarded by the instance monitor.</p>
 *
 * @since 0.1.0
 */
public final class TrackQuery implements Query {
  /** Minimum score of a result that satisfies the query. */
  public static final float SATISFIED_SCORE = 0.99f;

  private static final Comparator<Result> BY_SCORE_DESC =
      Comparator.comparingDouble(Result::score).reversed();

  private final QueryId id;
  private final String artist;
  private final String track;
  private final String album;
  private final String fullText;
  private final List<Result> results = new ArrayList<>();
  private final Set<Resolver> resolvedBy = new LinkedHashSet<>();
  private final CompletableFuture<List<Result>> completion = new CompletableFuture<>();
  private Resolver currentResolver;
  private boolean resolvingFinished;

  private TrackQuery(QueryId id, String artist, String track, String album, String fullText) {
    this.id = Objects.requireNonNull(id, "id");
    this.artist = artist;
    this.track = track;
    this.album = album == null ? "" : album;
    this.fullText = fullText;
  }

  /**
   * Creates a query for a specific track.
   *
   * @param artist artist name; must not be blank
   * @param track track title; must not be blank
   * @param album album title; may be {@code null}
   * @return new query with a fresh identifier
   */
  public static TrackQuery of(String artist, String track, String album) {
    return of(QueryId.newId(), artist, track, album);
  }

  /**
   * Creates a query for a specific track under a caller-chosen identifier.
   *
   * @param id query identifier
   * @param artist artist name; must not be blank
   * @param track track title; must not be blank
   * @param album album title; may be {@code null}
   * @return new query
   */
  public static TrackQuery of(QueryId id, String artist, String track, String album) {
    return new TrackQuery(id, requireText("artist", artist), requireText("track", track), album, null);
  }

  /**
   * Creates an exhaustive free-text search.
   *
   * @param text search text; must not be blank
   * @return new query with a fresh identifier
   */
  public static TrackQuery fullText(String text) {
    return fullText(QueryId.newId(), text);
  }

  /**
   * Creates an exhaustive free-text search under a caller-chosen identifier.
   *
   * @param id query identifier
   * @param text search text; must not be blank
   * @return new query
   */
  public static TrackQuery fullText(QueryId id, String text) {
    return new TrackQuery(id, null, null, null, requireText("text", text));
  }

  @Override
  public QueryId id() {
    return id;
  }

  /**
   * Returns the artist searched for.
   *
   * @return artist, or {@code null} for free-text queries
   */
  public String artist() {
    return artist;
  }

  /**
   * Returns the track title searched for.
   *
   * @return track title, or {@code null} for free-text queries
   */
  public String track() {
    return track;
  }

  /**
   * Returns the album hint.
   *
   * @return album title; empty when unknown
   */
  public String album() {
    return album;
  }

  /**
   * Returns the free-text search.
   *
   * @return search text, or {@code null} for track queries
   */
  public String fullText() {
    return fullText;
  }

  @Override
  public synchronized void addResults(List<Result> newResults) {
    Objects.requireNonNull(newResults, "newResults");
    for (Result result : newResults) {
      results.add(Objects.requireNonNull(result, "result"));
    }
    results.sort(BY_SCORE_DESC);
  }

  @Override
  public synchronized List<Result> results() {
    return List.copyOf(results);
  }

  @Override
  public synchronized boolean isSatisfied() {
    for (Result result : results) {
      if (result.score() >= SATISFIED_SCORE) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean isExhaustiveSearch() {
    return fullText != null;
  }

  @Override
  public synchronized Set<Resolver> resolvedBy() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(resolvedBy));
  }

  @Override
  public synchronized void setCurrentResolver(Resolver resolver) {
    currentResolver = resolver;
    if (resolver != null) {
      resolvedBy.add(resolver);
    }
  }

  @Override
  public synchronized Resolver currentResolver() {
    return currentResolver;
  }

  @Override
  public void onResolvingFinished() {
    List<Result> snapshot;
    synchronized (this) {
      resolvingFinished = true;
      currentResolver = null;
      snapshot = List.copyOf(results);
    }
    completion.complete(snapshot);
  }

  /**
   * Indicates whether the pipeline has finished resolving this query at least once.
   *
   * @return {@code true} after {@link #onResolvingFinished()}
   */
  public synchronized boolean isResolvingFinished() {
    return resolvingFinished;
  }

  /**
   * Returns a future completed with the results when resolving first finishes.
   *
   * @return completion future; never completed exceptionally
   */
  public CompletableFuture<List<Result>> completion() {
    return completion;
  }

  @Override
  public String toString() {
    if (fullText != null) {
      return "TrackQuery{id=" + id + ", text='" + fullText + "'}";
    }
    return "TrackQuery{id=" + id + ", artist='" + artist + "', track='" + track + "'}";
  }

  private static String requireText(String name, String value) {
    Objects.requireNonNull(value, name);
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return trimmed;
  }
}
