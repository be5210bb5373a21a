package ca.gc.cra.beacon.application.session;

import ca.gc.cra.beacon.domain.packet.Level;

/**
 * Admission rule shared by every session.
 *
 * @since 0.1.0
 */
public final class LevelFilter {
  private LevelFilter() {}

  /**
   * Decides whether a packet of {@code candidate} level is emitted.
   *
   * @param candidate level of the packet being produced
   * @param sessionLevel the session's active level
   * @param clientLevel the client-wide level
   * @return {@code true} for control packets, or when the candidate meets both thresholds
   */
  public static boolean admits(Level candidate, Level sessionLevel, Level clientLevel) {
    if (candidate == Level.CONTROL) {
      return true;
    }
    return candidate.isAtLeast(sessionLevel) && candidate.isAtLeast(clientLevel);
  }
}
