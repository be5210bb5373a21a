/**
 * Input validation helpers shared by configuration, sessions, and the CLI.
 * <p><strong>Concurrency:</strong> Stateless utilities; safe to call concurrently.</p>
 * <p><strong>Metrics:</strong> None; failures surface as {@link java.lang.IllegalArgumentException}.</p>
 */
package ca.gc.cra.beacon.validation;
