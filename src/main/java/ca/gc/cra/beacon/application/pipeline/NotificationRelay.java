package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.ConnectionListener;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queues listener callbacks so they run on the sender's context instead of the thread that raised them.
 *
 * <p>Callbacks are posted from any thread and executed in order by {@link #drain()}. In asynchronous mode the
 * sender thread drains on every loop iteration; in synchronous mode a dedicated notifier thread is woken through
 * the supplied signal. A listener that throws is logged and skipped.</p>
 */
public final class NotificationRelay implements ConnectionListener {
  private static final Logger log = LoggerFactory.getLogger(NotificationRelay.class);

  private final ConnectionListener target;
  private final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();
  private volatile Runnable signal = () -> {};

  /**
   * Creates a relay forwarding to {@code target}.
   *
   * @param target caller supplied listener; {@code null} means {@link ConnectionListener#NO_OP}
   */
  public NotificationRelay(ConnectionListener target) {
    this.target = Objects.requireNonNullElse(target, ConnectionListener.NO_OP);
  }

  /**
   * Installs the action run after each post, typically scheduling {@link #drain()} elsewhere.
   *
   * @param signal wake-up action
   */
  void onPost(Runnable signal) {
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  @Override
  public void onConnect(boolean reconnect) {
    post(() -> target.onConnect(reconnect));
  }

  @Override
  public void onDisconnect() {
    post(target::onDisconnect);
  }

  @Override
  public void onError(Exception error) {
    post(() -> target.onError(error));
  }

  /**
   * Runs every pending callback in posting order on the calling thread.
   *
   * @return number of callbacks run
   */
  public int drain() {
    int ran = 0;
    Runnable task;
    while ((task = pending.poll()) != null) {
      try {
        task.run();
      } catch (RuntimeException ex) {
        log.warn("Connection listener threw; continuing", ex);
      }
      ran++;
    }
    return ran;
  }

  boolean hasPending() {
    return !pending.isEmpty();
  }

  private void post(Runnable task) {
    pending.add(task);
    signal.run();
  }
}
