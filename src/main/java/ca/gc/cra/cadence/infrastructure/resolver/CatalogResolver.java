package ca.gc.cra.cadence.infrastructure.resolver;

import ca.gc.cra.cadence.application.port.Query;
import ca.gc.cra.cadence.application.port.Resolver;
import ca.gc.cra.cadence.application.port.ResultReporter;
import ca.gc.cra.cadence.application.query.TrackQuery;
import ca.gc.cra.cadence.domain.query.QueryId;
import ca.gc.cra.cadence.domain.query.Result;
import ca.gc.cra.cadence.validation.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolver answering from a fixed in-memory catalog.
 * <p><strong>Matching:</strong> a track query matches entries whose artist and track equal the query's, ignoring
 * case, with score {@value #EXACT_SCORE}. A full-text query matches entries containing every search word in their
 * artist, track, or album, with score {@value #PARTIAL_SCORE}.</p>
 * <p><strong>Thread-safety:</strong> {@link #resolve(Query)} only schedules work; answers are reported from the
 * supplied executor after {@link #latency()}.</p>
 *
 * @since 0.1.0
 */
public final class CatalogResolver implements Resolver {
  private static final Logger log = LoggerFactory.getLogger(CatalogResolver.class);

  /** Score of an exact artist and track match. */
  public static final float EXACT_SCORE = 1.0f;
  /** Score of a full-text match. */
  public static final float PARTIAL_SCORE = 0.5f;

  private final String name;
  private final int weight;
  private final Duration timeout;
  private final Duration latency;
  private final List<CatalogEntry> entries;
  private final ScheduledExecutorService executor;
  private final ResultReporter reporter;

  /**
   * Creates a catalog resolver.
   *
   * @param name display name, also used as result source; must not be blank
   * @param weight selection priority; higher is tried first
   * @param timeout attempt timeout; must not be negative, zero disables it
   * @param latency delay before answering; must not be negative
   * @param entries catalog content; copied
   * @param executor scheduler delivering answers; must not be {@code null}
   * @param reporter sink for answers, usually the pipeline; must not be {@code null}
   */
  public CatalogResolver(
      String name,
      int weight,
      Duration timeout,
      Duration latency,
      List<CatalogEntry> entries,
      ScheduledExecutorService executor,
      ResultReporter reporter) {
    this.name = Strings.requireNonBlank("name", name);
    this.weight = weight;
    this.timeout = requireNonNegative("timeout", timeout);
    this.latency = requireNonNegative("latency", latency);
    this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    this.executor = Objects.requireNonNull(executor, "executor");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int weight() {
    return weight;
  }

  @Override
  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns the delay before answers are reported.
   *
   * @return answer latency
   */
  public Duration latency() {
    return latency;
  }

  /**
   * Returns the catalog content.
   *
   * @return immutable entries
   */
  public List<CatalogEntry> entries() {
    return entries;
  }

  @Override
  public void resolve(Query query) {
    Objects.requireNonNull(query, "query");
    QueryId id = query.id();
    List<Result> matches = match(query);
    log.debug("Resolver {} found {} matches for {}", name, matches.size(), id);
    executor.schedule(() -> reporter.reportResults(id, matches), latency.toNanos(), TimeUnit.NANOSECONDS);
  }

  List<Result> match(Query query) {
    if (!(query instanceof TrackQuery trackQuery)) {
      return List.of();
    }
    List<Result> matches = new ArrayList<>();
    if (trackQuery.isExhaustiveSearch()) {
      String[] words = trackQuery.fullText().toLowerCase(Locale.ROOT).split("\\s+");
      for (CatalogEntry entry : entries) {
        if (containsAll(haystack(entry), words)) {
          matches.add(toResult(entry, PARTIAL_SCORE));
        }
      }
      return matches;
    }
    for (CatalogEntry entry : entries) {
      if (entry.artist().equalsIgnoreCase(trackQuery.artist())
          && entry.track().equalsIgnoreCase(trackQuery.track())) {
        matches.add(toResult(entry, EXACT_SCORE));
      }
    }
    return matches;
  }

  @Override
  public String toString() {
    return "CatalogResolver{name=" + name + ", weight=" + weight + ", entries=" + entries.size() + '}';
  }

  private Result toResult(CatalogEntry entry, float score) {
    return Result.of(entry.artist(), entry.track(), entry.album(), score, name);
  }

  private static String haystack(CatalogEntry entry) {
    return (entry.artist() + ' ' + entry.track() + ' ' + entry.album()).toLowerCase(Locale.ROOT);
  }

  private static boolean containsAll(String haystack, String[] words) {
    for (String word : words) {
      if (!word.isEmpty() && !haystack.contains(word)) {
        return false;
      }
    }
    return true;
  }

  private static Duration requireNonNegative(String label, Duration value) {
    Objects.requireNonNull(value, label);
    if (value.isNegative()) {
      throw new IllegalArgumentException(label + " must not be negative");
    }
    return value;
  }
}
