package ca.gc.cra.cadence.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.cadence.application.query.TrackQuery;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ResolveCliTest {
  private static final String CATALOG = """
      resolvers:
        - name: local
          weight: 100
          timeoutMillis: 500
          tracks:
            - artist: Portishead
              track: Roads
              album: Dummy
        - name: slow
          weight: 10
          timeoutMillis: 0
          latencyMillis: 2000
          tracks:
            - artist: Massive Attack
              track: Teardrop
      """;

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ResolveCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, ResolveCli.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("CADENCE resolve"));
  }

  @Test
  void missingQueryReturnsInvalidArgs() throws IOException {
    Path catalog = writeCatalog();

    ExitCode code = ResolveCli.run(new String[] {"catalog=" + catalog, "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: resolve"));
    assertTrue(loggedError("artist and track, or q, are required"));
  }

  @Test
  void unknownFlagReturnsInvalidArgs() {
    ExitCode code = ResolveCli.run(new String[] {"q=roads", "--everything"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Unknown flags"));
  }

  @Test
  void missingCatalogArgumentReturnsInvalidArgs() {
    ExitCode code = ResolveCli.run(new String[] {"q=roads", "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("catalog is required"));
  }

  @Test
  void missingConfigFileReturnsInvalidArgs() {
    ExitCode code = ResolveCli.run(new String[] {"q=roads", "config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void malformedCatalogReturnsConfigError() throws IOException {
    Path catalog = tempDir.resolve("bad.yaml");
    Files.writeString(catalog, "resolvers:\n  - weight: 3\n");

    ExitCode code = ResolveCli.run(new String[] {"q=roads", "catalog=" + catalog, "metricsExporter=none"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void unreadableCatalogReturnsIoError() {
    ExitCode code = ResolveCli.run(new String[] {
        "q=roads", "catalog=" + tempDir.resolve("absent.yaml"), "metricsExporter=none"});

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void dryRunPrintsPlanWithoutResolving() throws IOException {
    Path catalog = writeCatalog();
    Path config = tempDir.resolve("cadence.yaml");
    Files.writeString(config, """
        common:
          metricsExporter: none
        resolve:
          maxConcurrent: 3
          waitMillis: 1500
        """);

    ExitCode code = ResolveCli.run(new String[] {
        "artist=Portishead", "track=Roads", "catalog=" + catalog, "config=" + config, "--dry-run", "--prioritized"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("Resolve dry-run"));
    assertTrue(output.contains("Max concurrent   : 3"));
    assertTrue(output.contains("Wait (ms)        : 1500"));
    assertTrue(output.contains("Prioritized      : true"));
    assertTrue(output.contains("Resolvers        : 2"));
    assertTrue(output.contains("local"));
    assertFalse(output.contains("result(s)"));
    assertEquals("none", System.getProperty("otel.metrics.exporter"));
  }

  @Test
  void resolvesAgainstCatalog() throws IOException {
    Path catalog = writeCatalog();

    ExitCode code = ResolveCli.run(new String[] {
        "artist=portishead", "track=roads", "catalog=" + catalog, "metricsExporter=none", "waitMillis=5000"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("1 result(s) (satisfied)"), output);
    assertTrue(output.contains("1.00  Portishead - Roads (Dummy)  [local]"), output);
  }

  @Test
  void slowResolverExceedingWaitReturnsRuntimeFailure() throws IOException {
    Path catalog = writeCatalog();

    ExitCode code = ResolveCli.run(new String[] {
        "artist=Massive Attack", "track=Teardrop", "catalog=" + catalog, "metricsExporter=none", "waitMillis=200"});

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    assertTrue(loggedError("did not finish within 200 ms"));
  }

  @Test
  void buildQueryPrefersFullText() {
    TrackQuery fullText = ResolveCli.buildQuery(Map.of("q", "roads dummy"));
    TrackQuery track = ResolveCli.buildQuery(Map.of("artist", "Portishead", "track", "Roads", "album", "Dummy"));

    assertTrue(fullText.isExhaustiveSearch());
    assertEquals("roads dummy", fullText.fullText());
    assertFalse(track.isExhaustiveSearch());
    assertEquals("Dummy", track.album());
  }

  private Path writeCatalog() throws IOException {
    Path catalog = tempDir.resolve("catalog.yaml");
    Files.writeString(catalog, CATALOG);
    return catalog;
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }
}
