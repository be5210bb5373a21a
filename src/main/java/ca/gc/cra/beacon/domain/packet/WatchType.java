package ca.gc.cra.beacon.domain.packet;

/**
 * Value type hint for a {@link Watch}.
 *
 * @since 0.1.0
 */
public enum WatchType {
  CHAR,
  STRING,
  INTEGER,
  FLOAT,
  BOOLEAN,
  ADDRESS,
  TIMESTAMP,
  OBJECT;

  public int wireValue() {
    return ordinal();
  }

  public static WatchType fromWire(int wireValue) {
    WatchType[] all = values();
    if (wireValue < 0 || wireValue >= all.length) {
      throw new IllegalArgumentException("unknown watch type " + wireValue);
    }
    return all[wireValue];
  }
}
