/**
 * Argument validation shared by the configuration and CLI layers. Failures surface as
 * {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.validation;
