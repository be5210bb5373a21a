/**
 * Command-line entry points: the {@code beacon} dispatcher and its {@code send} and {@code encode} commands.
 *
 * <p>Commands return an {@link ca.gc.cra.beacon.api.ExitCode} from {@code run} so tests can drive them without
 * exiting the JVM.</p>
 */
package ca.gc.cra.beacon.api;
