/**
 * Thread and executor factories.
 */
package ca.gc.cra.cadence.infrastructure.exec;
