package ca.gc.cra.cadence.api;

import ca.gc.cra.cadence.application.pipeline.ResolverPipeline;
import ca.gc.cra.cadence.application.query.TrackQuery;
import ca.gc.cra.cadence.config.CatalogLoader;
import ca.gc.cra.cadence.config.CompositionRoot;
import ca.gc.cra.cadence.config.ConfigMerger;
import ca.gc.cra.cadence.config.DefaultsForMode;
import ca.gc.cra.cadence.config.PipelineConfig;
import ca.gc.cra.cadence.config.ResolverDefinition;
import ca.gc.cra.cadence.config.YamlConfigLoader;
import ca.gc.cra.cadence.domain.query.Result;
import ca.gc.cra.cadence.logging.Logs;
import ca.gc.cra.cadence.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves one query against the resolvers declared in a catalog file and prints the results.
 *
 * @since 0.1.0
 */
public final class ResolveCli {
  private static final Logger log = LoggerFactory.getLogger(ResolveCli.class);
  private static final String MODE = "resolve";
  private static final Set<String> FLAGS = Set.of("--dry-run", "--prioritized", "--temporary");
  private static final String SUMMARY_USAGE =
      "usage: resolve catalog=PATH (artist=NAME track=TITLE [album=TITLE] | q=TEXT) [config=PATH] "
          + "[maxConcurrent=0-64] [waitMillis=N] [temporaryQueryTtlMillis=N] [--prioritized] [--temporary] "
          + "[--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      CADENCE resolve

      Usage:
        resolve catalog=PATH (artist=NAME track=TITLE | q=TEXT) [options]

      Required:
        catalog=PATH              YAML file declaring resolvers and their tracks
        artist=NAME track=TITLE   Track to resolve (album=TITLE optional)
        q=TEXT                    Full-text search instead of artist/track; asks every resolver

      Optional (validated):
        config=PATH               YAML configuration (common and resolve sections)
        maxConcurrent=0-64        Concurrency cap; 0 derives it from CPU cores (4-16)
        waitMillis=N              How long to wait for the query to finish (default 10000)
        temporaryQueryTtlMillis=N Quiet period before temporary queries are swept (default 300000)
        --prioritized             Queue ahead of pending queries
        --temporary               Keep the query in the ledger until the sweep
        --dry-run                 Validate inputs and print the plan without resolving
        metricsExporter=otlp|none Configure metrics exporter (default otlp)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ResolveCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the command and returns its exit code.
   *
   * @param args raw CLI arguments
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for resolve CLI");
    }
    List<String> unknown = input.unknownFlags(FLAGS);
    if (!unknown.isEmpty()) {
      log.error("Unknown flags: {}", unknown);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = kv.remove("config");
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    PipelineConfig config;
    try {
      effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      config = PipelineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid resolve arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    TrackQuery query;
    try {
      query = buildQuery(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid query: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String catalog = effective.getOrDefault("catalog", "").trim();
    if (catalog.isEmpty()) {
      log.error("catalog is required");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    List<ResolverDefinition> definitions;
    try {
      definitions = CatalogLoader.load(Path.of(catalog));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid catalog {}: {}", catalog, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read catalog {}", catalog, ex);
      return ExitCode.IO_ERROR;
    }

    boolean prioritized = input.hasFlag("--prioritized") || Boolean.parseBoolean(effective.get("prioritized"));
    boolean temporary = input.hasFlag("--temporary") || Boolean.parseBoolean(effective.get("temporary"));
    boolean dryRun = input.hasFlag("--dry-run") || Boolean.parseBoolean(effective.get("dryRun"));
    if (dryRun) {
      printDryRunPlan(config, query, definitions, prioritized, temporary);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      ResolverPipeline pipeline = root.start(definitions);
      log.info("Resolving {} with {} resolvers", Logs.truncate(query.toString(), 256), definitions.size());
      pipeline.submit(query, prioritized, temporary);
      List<Result> results = query.completion().get(config.queryWait().toMillis(), TimeUnit.MILLISECONDS);
      printResults(query, results);
      return ExitCode.SUCCESS;
    } catch (TimeoutException ex) {
      log.error("Query {} did not finish within {} ms", query.id(), config.queryWait().toMillis());
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Resolve interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (ExecutionException ex) {
      log.error("Query {} failed", query.id(), ex.getCause());
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while resolving", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static TrackQuery buildQuery(Map<String, String> settings) {
    String text = settings.get("q");
    if (text != null && !text.isBlank()) {
      return TrackQuery.fullText(text);
    }
    String artist = settings.get("artist");
    String track = settings.get("track");
    if (artist == null || artist.isBlank() || track == null || track.isBlank()) {
      throw new IllegalArgumentException("artist and track, or q, are required");
    }
    return TrackQuery.of(artist, track, settings.get("album"));
  }

  private static void printDryRunPlan(
      PipelineConfig config,
      TrackQuery query,
      List<ResolverDefinition> definitions,
      boolean prioritized,
      boolean temporary) {
    CliPrinter.printLines(
        "Resolve dry-run: no resolvers will be called.",
        " Query            : " + Logs.truncate(query.toString(), 256),
        " Max concurrent   : " + (config.maxConcurrent() == 0 ? "auto" : Integer.toString(config.maxConcurrent())),
        " Wait (ms)        : " + config.queryWait().toMillis(),
        " Temporary TTL(ms): " + config.temporaryQueryTtl().toMillis(),
        " Prioritized      : " + prioritized,
        " Temporary        : " + temporary,
        " Resolvers        : " + definitions.size());
    for (ResolverDefinition definition : definitions) {
      CliPrinter.printf("   %-14s weight=%d timeoutMs=%d tracks=%d",
          definition.name(), definition.weight(), definition.timeout().toMillis(), definition.entries().size());
    }
    CliPrinter.println(" Re-run without --dry-run to resolve.");
  }

  private static void printResults(TrackQuery query, List<Result> results) {
    CliPrinter.printf("%s: %d result(s)%s", query.id(), results.size(), query.isSatisfied() ? " (satisfied)" : "");
    for (Result result : results) {
      CliPrinter.printf("  %.2f  %s - %s%s  [%s]",
          result.score(),
          result.artist(),
          result.track(),
          result.album().isEmpty() ? "" : " (" + result.album() + ")",
          result.source());
    }
  }
}
