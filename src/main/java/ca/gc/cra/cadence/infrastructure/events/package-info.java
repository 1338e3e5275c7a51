/**
 * Pipeline listener adapters.
 */
package ca.gc.cra.cadence.infrastructure.events;
