package ca.gc.cra.cadence.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithServiceResource() {
    adapter.increment("pipeline.query.finalized");
    adapter.increment("pipeline.query.finalized");
    adapter.increment("pipeline.query.finalized");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "pipeline.query.finalized");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());

    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("pipeline.query.finalized", point.getAttributes().get(AttributeKey.stringKey("cadence.metric.key")));

    assertEquals("cadence", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "Service instance id should be provided");
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("pipeline.pending.depth", 4);
    adapter.observe("pipeline.pending.depth", 6);

    MetricData histogram = find(reader.collectAllMetrics(), "pipeline.pending.depth");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(10.0, point.getSum());
  }

  @Test
  void sanitizeNameProducesInstrumentSafeNames() {
    assertEquals("pipeline.query.finalized", OpenTelemetryMetricsAdapter.sanitizeName("Pipeline.Query.Finalized"));
    assertEquals("m1st_metric", OpenTelemetryMetricsAdapter.sanitizeName("1st metric"));
    assertEquals("cadence.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void parsesResourceAttributesAndSkipsMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=test, broken, team = search ,=x");
    assertEquals(2, attributes.size());
    assertEquals("test", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("search", attributes.get(AttributeKey.stringKey("team")));
  }

  @Test
  void exporterModeParsing() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("NONE"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(null));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}
