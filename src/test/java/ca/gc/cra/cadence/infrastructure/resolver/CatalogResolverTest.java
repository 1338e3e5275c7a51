package ca.gc.cra.cadence.infrastructure.resolver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cadence.application.pipeline.PipelineSettings;
import ca.gc.cra.cadence.application.pipeline.ResolverPipeline;
import ca.gc.cra.cadence.application.query.TrackQuery;
import ca.gc.cra.cadence.domain.query.QueryId;
import ca.gc.cra.cadence.domain.query.Result;
import ca.gc.cra.cadence.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.cadence.testutil.Await;
import ca.gc.cra.cadence.testutil.RecordingMetricsPort;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CatalogResolverTest {
  private static final List<CatalogEntry> CATALOG = List.of(
      new CatalogEntry("Portishead", "Roads", "Dummy"),
      new CatalogEntry("Portishead", "Glory Box", "Dummy"),
      new CatalogEntry("Massive Attack", "Teardrop", "Mezzanine"));

  private final ScheduledExecutorService executor = ExecutorFactories.newResolverPool(1, "catalog-test");
  private final Map<QueryId, List<Result>> reported = new ConcurrentHashMap<>();
  private ResolverPipeline pipeline;

  @AfterEach
  void tearDown() {
    if (pipeline != null) {
      pipeline.close();
    }
    executor.shutdownNow();
  }

  @Test
  void exactMatchIgnoresCaseAndScoresOne() {
    CatalogResolver resolver = resolver("local", 100, Duration.ZERO);

    List<Result> matches = resolver.match(TrackQuery.of("portishead", "ROADS", null));

    assertEquals(1, matches.size());
    Result match = matches.get(0);
    assertEquals("Roads", match.track());
    assertEquals("Dummy", match.album());
    assertEquals(CatalogResolver.EXACT_SCORE, match.score());
    assertEquals("local", match.source());
  }

  @Test
  void fullTextRequiresEveryWordAndScoresHalf() {
    CatalogResolver resolver = resolver("local", 100, Duration.ZERO);

    List<Result> dummy = resolver.match(TrackQuery.fullText("portishead dummy"));
    List<Result> teardrop = resolver.match(TrackQuery.fullText("tear mezz"));
    List<Result> none = resolver.match(TrackQuery.fullText("portishead teardrop"));

    assertEquals(2, dummy.size());
    assertEquals(CatalogResolver.PARTIAL_SCORE, dummy.get(0).score());
    assertEquals(1, teardrop.size());
    assertTrue(none.isEmpty());
  }

  @Test
  void reportsAnswerAsynchronouslyAfterLatency() throws Exception {
    CatalogResolver resolver = resolver("slow", 10, Duration.ofMillis(50));
    TrackQuery query = TrackQuery.of("Massive Attack", "Teardrop", null);

    long started = System.nanoTime();
    resolver.resolve(query);
    assertTrue(reported.isEmpty(), "answer must not be delivered on the calling thread");

    Await.until(() -> reported.containsKey(query.id()), "catalog answer");
    assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) >= 45);
    assertEquals(1, reported.get(query.id()).size());
  }

  @Test
  void resolvesThroughPipelineAcrossCatalogs() throws Exception {
    pipeline = new ResolverPipeline(new PipelineSettings(2, Duration.ofMinutes(1)), new RecordingMetricsPort());
    CatalogResolver empty = new CatalogResolver(
        "empty", 90, Duration.ofSeconds(1), Duration.ZERO, List.of(), executor, pipeline);
    CatalogResolver full = new CatalogResolver(
        "full", 10, Duration.ofSeconds(1), Duration.ofMillis(5), CATALOG, executor, pipeline);
    pipeline.addResolver(empty);
    pipeline.addResolver(full);
    pipeline.start();

    TrackQuery query = TrackQuery.of("Portishead", "Glory Box", null);
    pipeline.submit(query, false, false);

    List<Result> results = query.completion().get(5, TimeUnit.SECONDS);
    assertEquals(1, results.size());
    assertEquals("full", results.get(0).source());
    assertEquals(List.of(empty, full), List.copyOf(query.resolvedBy()));
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class,
        () -> new CatalogResolver(" ", 1, Duration.ZERO, Duration.ZERO, CATALOG, executor, this::record));
    assertThrows(IllegalArgumentException.class,
        () -> new CatalogResolver("x", 1, Duration.ofMillis(-1), Duration.ZERO, CATALOG, executor, this::record));
    assertThrows(IllegalArgumentException.class, () -> new CatalogEntry("Artist", " ", null));
  }

  private CatalogResolver resolver(String name, int weight, Duration latency) {
    return new CatalogResolver(name, weight, Duration.ofSeconds(1), latency, CATALOG, executor, this::record);
  }

  private void record(QueryId id, List<Result> results) {
    reported.put(id, results);
  }
}
