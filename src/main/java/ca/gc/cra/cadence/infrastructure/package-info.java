/**
 * Adapters implementing the pipeline ports: metrics, listener notifications, the content index, and resolver
 * backends.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.infrastructure;
