/**
 * Ports between the resolution pipeline and its collaborators: resolvers, queries, listeners, the content
 * index, and metrics.
 * <p>Ports keep the dispatcher free of backend, UI, and vendor SDK details; adapters live under
 * {@code ca.gc.cra.cadence.infrastructure}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.application.port;
