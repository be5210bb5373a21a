package ca.gc.cra.beacon.api;

/**
 * Process status values returned by {@code beacon send} and {@code beacon encode}.
 *
 * <p>Scripts that smoke-test a console rely on these values staying stable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0),
  /** Unknown command, malformed {@code key=value} argument or out-of-range value. */
  INVALID_ARGS(2),
  /** The console could not be reached, or the frame file could not be written. */
  IO_ERROR(3),
  /** The connection descriptor or configuration file was rejected. */
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
