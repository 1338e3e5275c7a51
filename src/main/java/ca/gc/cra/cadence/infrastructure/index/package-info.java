/**
 * Content index adapters used to gate pipeline startup.
 */
package ca.gc.cra.cadence.infrastructure.index;
