package ca.gc.cra.beacon.domain.packet;

/**
 * Console-side actions requested through a {@link ControlCommand}.
 *
 * @since 0.1.0
 */
public enum ControlCommandType {
  CLEAR_LOG,
  CLEAR_WATCHES,
  CLEAR_AUTO_VIEWS,
  CLEAR_ALL,
  CLEAR_PROCESS_FLOW;

  public int wireValue() {
    return ordinal();
  }

  public static ControlCommandType fromWire(int wireValue) {
    ControlCommandType[] all = values();
    if (wireValue < 0 || wireValue >= all.length) {
      throw new IllegalArgumentException("unknown control command " + wireValue);
    }
    return all[wireValue];
  }
}
