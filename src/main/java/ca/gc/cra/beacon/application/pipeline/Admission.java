package ca.gc.cra.beacon.application.pipeline;

/**
 * Outcome of offering a frame to a byte-bounded buffer.
 *
 * @param accepted whether the frame is now resident
 * @param evicted number of older frames discarded to make room
 * @since 0.1.0
 */
public record Admission(boolean accepted, int evicted) {
  static final Admission ACCEPTED = new Admission(true, 0);
  static final Admission REJECTED = new Admission(false, 0);

  static Admission acceptedAfterEvicting(int evicted) {
    return evicted == 0 ? ACCEPTED : new Admission(true, evicted);
  }
}
