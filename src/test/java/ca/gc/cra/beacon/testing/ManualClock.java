package ca.gc.cra.beacon.testing;

import ca.gc.cra.beacon.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/** Clock that only moves when told to. */
public final class ManualClock implements ClockPort {
  private final AtomicLong millis;

  public ManualClock(long startMillis) {
    this.millis = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return millis.get();
  }

  public void advance(long deltaMillis) {
    millis.addAndGet(deltaMillis);
  }
}
