/**
 * Configuration parsing: connection descriptors, variable expansion, and client configuration files.
 * <p><strong>Role:</strong> Adapter-side configuration layer consumed by the client facade and the CLI.</p>
 * <p><strong>Concurrency:</strong> Parsers are stateless; {@link ca.gc.cra.beacon.config.VariableStore} is
 * thread-safe.</p>
 * <p><strong>Security:</strong> Descriptors may embed host names; avoid logging expanded values verbatim.</p>
 */
package ca.gc.cra.beacon.config;
