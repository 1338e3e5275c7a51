/**
 * CLI entry points for CADENCE.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures logging and telemetry, and runs the
 * resolver pipeline through {@link ca.gc.cra.cadence.config.CompositionRoot}.</p>
 * <p><strong>Exit codes:</strong> see {@link ca.gc.cra.cadence.api.ExitCode}.</p>
 */
package ca.gc.cra.cadence.api;
