/**
 * Configuration records, loaders, and the composition root wiring the resolver pipeline for the CLI.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Precedence:</strong> CLI arguments override YAML, which overrides {@link
 * ca.gc.cra.cadence.config.DefaultsForMode} values.</p>
 */
package ca.gc.cra.cadence.config;
