/**
 * Logging helpers: truncation of user supplied text before it reaches log lines and runtime verbosity control for
 * the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.cadence.logging;
