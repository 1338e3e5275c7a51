/**
 * Resolver adapters. {@link ca.gc.cra.cadence.infrastructure.resolver.CatalogResolver} answers from an in-memory
 * catalog after a configurable latency and serves as the demo backend for the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.infrastructure.resolver;
