/**
 * Runtime logging configuration and log-hygiene helpers for BEACON's own SLF4J diagnostics.
 */
package ca.gc.cra.beacon.logging;
