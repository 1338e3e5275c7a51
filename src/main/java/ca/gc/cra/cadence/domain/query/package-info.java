/**
 * Queries, results, and opaque identifiers exchanged between the pipeline and its resolvers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.domain.query;
