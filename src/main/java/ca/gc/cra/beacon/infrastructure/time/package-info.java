/**
 * Clock adapters implementing {@link ca.gc.cra.beacon.application.port.ClockPort}.
 */
package ca.gc.cra.beacon.infrastructure.time;
