package ca.gc.cra.beacon.domain.context;

/**
 * Lexical region opened by a context or tracking call; closing it restores what was active before.
 *
 * <p>Intended for try-with-resources. Closing twice is a no-op.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Scope extends AutoCloseable {
  /** Scope that restores nothing. */
  Scope NOOP = () -> {};

  @Override
  void close();
}
