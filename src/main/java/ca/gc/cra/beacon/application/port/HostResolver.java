package ca.gc.cra.beacon.application.port;

/**
 * Maps the configured console host to the address actually dialled.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HostResolver {
  /**
   * Resolves the host to connect to.
   *
   * @param configuredHost host from configuration; {@code null} when none was given
   * @return host to dial; never {@code null}
   */
  String resolve(String configuredHost);

  /** Resolver returning the configured host, or loopback when none was given. */
  HostResolver IDENTITY = host -> host == null || host.isBlank() ? "127.0.0.1" : host;
}
