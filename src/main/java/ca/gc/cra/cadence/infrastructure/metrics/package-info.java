/**
 * Metrics adapters implementing {@link ca.gc.cra.cadence.application.port.MetricsPort}.
 * <p>{@link ca.gc.cra.cadence.infrastructure.metrics.OpenTelemetryMetricsAdapter} exports through OTLP unless
 * {@code otel.metrics.exporter=none}, in which case a no-op meter discards every observation.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.infrastructure.metrics;
