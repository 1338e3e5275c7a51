/**
 * Core domain model for CADENCE query resolution.
 * <p><strong>Role:</strong> Domain layer types describing queries, results, and their identifiers without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Identifiers and results are immutable; query implementations document their own
 * guarantees.</p>
 */
package ca.gc.cra.cadence.domain;
