package ca.gc.cra.beacon.domain.packet;

/**
 * Kind of execution boundary described by a {@link ProcessFlow}.
 *
 * @since 0.1.0
 */
public enum ProcessFlowType {
  ENTER_METHOD,
  LEAVE_METHOD,
  ENTER_THREAD,
  LEAVE_THREAD,
  ENTER_PROCESS,
  LEAVE_PROCESS;

  public int wireValue() {
    return ordinal();
  }

  public static ProcessFlowType fromWire(int wireValue) {
    ProcessFlowType[] all = values();
    if (wireValue < 0 || wireValue >= all.length) {
      throw new IllegalArgumentException("unknown process flow type " + wireValue);
    }
    return all[wireValue];
  }
}
