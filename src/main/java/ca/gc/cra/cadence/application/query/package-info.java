/**
 * Default query implementations handed to the resolver pipeline.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.application.query;
