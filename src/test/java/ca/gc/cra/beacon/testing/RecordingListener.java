package ca.gc.cra.beacon.testing;

import ca.gc.cra.beacon.application.port.ConnectionListener;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records connection callbacks as short event strings plus the thread each ran on.
 */
public final class RecordingListener implements ConnectionListener {
  private final List<String> events = new CopyOnWriteArrayList<>();
  private final List<Exception> errors = new CopyOnWriteArrayList<>();
  private final List<String> threads = new CopyOnWriteArrayList<>();

  @Override
  public void onConnect(boolean reconnect) {
    record(reconnect ? "reconnect" : "connect");
  }

  @Override
  public void onDisconnect() {
    record("disconnect");
  }

  @Override
  public void onError(Exception error) {
    errors.add(error);
    record("error:" + error.getClass().getSimpleName());
  }

  public List<String> events() {
    return new ArrayList<>(events);
  }

  public List<Exception> errors() {
    return new ArrayList<>(errors);
  }

  public List<String> threads() {
    return new ArrayList<>(threads);
  }

  private void record(String event) {
    threads.add(Thread.currentThread().getName());
    events.add(event);
  }
}
