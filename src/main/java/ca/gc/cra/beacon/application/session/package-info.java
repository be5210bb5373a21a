/**
 * Caller-facing sessions that filter by level, attach context, and build packets for the client.
 */
package ca.gc.cra.beacon.application.session;
