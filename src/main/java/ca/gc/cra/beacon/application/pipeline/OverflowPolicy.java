package ca.gc.cra.beacon.application.pipeline;

/**
 * Behaviour of the dispatch queue when a new frame does not fit.
 *
 * @since 0.1.0
 */
public enum OverflowPolicy {
  /** Producers block until the sender frees enough bytes. */
  THROTTLE,
  /** The oldest frames are evicted until the new frame fits. */
  DROP
}
