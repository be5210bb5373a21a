package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.config.ConnectionSettings;
import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Moves encoded packets from producers to the console, buffering them across outages.
 * <p><strong>Why:</strong> Keeps network latency and connection loss off the caller's thread while preserving
 * order: backlog content always goes out ahead of anything newer.</p>
 * <p><strong>Role:</strong> Application pipeline coordinator over {@link DispatchQueue}, {@link BacklogBuffer},
 * and {@link ConnectionManager}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Asynchronous mode: run one {@code beacon-sender} worker that polls the queue and delivers batches.</li>
 *   <li>Synchronous mode: deliver on the caller's thread under the send lock; failures go to the backlog.</li>
 *   <li>Replay the backlog after reconnecting and flush it when a flush-level packet arrives.</li>
 *   <li>Perform a best-effort final flush on shutdown, then close the connection for good.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Delivery runs under a single send lock. While holding it the sender calls into
 * at most one of the connection, backlog, or queue at a time and none of those call back, so producers blocked on
 * a throttled queue can never deadlock with the sender.</p>
 * <p><strong>Observability:</strong> Counts {@code sender.dropped} for packets with nowhere to go; buffer and
 * connection metrics come from the collaborating components.</p>
 *
 * @since 0.1.0
 */
public final class PacketSender implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PacketSender.class);
  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final int SEND_BATCH_SIZE = 256;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final String MDC_KEY = "beacon.session";

  private final ConnectionSettings settings;
  private final ConnectionManager connection;
  private final NotificationRelay relay;
  private final MetricsPort metrics;
  private final BacklogBuffer backlog;
  private final DispatchQueue queue;
  private final Object sendLock = new Object();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private volatile boolean flushOnStop = true;
  private ExecutorService worker;
  private ExecutorService notifier;

  /**
   * Creates a sender; call {@link #start()} before submitting.
   *
   * @param settings buffering and delivery policy
   * @param connection connection manager whose listener is {@code relay}
   * @param relay queued listener callbacks, drained on the sender's context
   * @param metrics metrics sink
   */
  public PacketSender(
      ConnectionSettings settings,
      ConnectionManager connection,
      NotificationRelay relay,
      MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.connection = Objects.requireNonNull(connection, "connection");
    this.relay = Objects.requireNonNull(relay, "relay");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    this.backlog = settings.backlogEnabled()
        ? new BacklogBuffer((int) settings.backlogBytes(), settings.flushOn(), this.metrics)
        : null;
    this.queue = settings.asyncEnabled()
        ? new DispatchQueue(
            settings.asyncQueueBytes(),
            settings.asyncThrottle() ? OverflowPolicy.THROTTLE : OverflowPolicy.DROP,
            this.metrics)
        : null;
  }

  /** Starts the sender thread (asynchronous mode) or the notifier thread (synchronous mode). */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (queue != null) {
      worker = ExecutorFactories.newSingleWorker("beacon-sender",
          (thread, ex) -> log.error("Sender thread {} terminated unexpectedly", thread.getName(), ex));
      worker.execute(new SenderWorker());
      log.debug("Started asynchronous sender with {} byte {} queue", queue.capacityBytes(), queue.policy());
    } else {
      notifier = ExecutorFactories.newSingleWorker("beacon-notifier",
          (thread, ex) -> log.error("Notifier thread {} terminated unexpectedly", thread.getName(), ex));
      relay.onPost(this::scheduleNotifications);
      log.debug("Started synchronous sender");
    }
  }

  /**
   * Hands a packet to the pipeline.
   *
   * <p>In asynchronous mode this blocks only when the queue is throttled and full. In synchronous mode the packet
   * is transmitted on the calling thread; transmission failures route it to the backlog.</p>
   *
   * @param packet encoded packet
   * @return {@code true} when the packet was accepted for delivery or buffering
   */
  public boolean submit(EncodedPacket packet) {
    Objects.requireNonNull(packet, "packet");
    if (stopRequested.get()) {
      metrics.increment("sender.dropped");
      return false;
    }
    if (queue != null) {
      try {
        return admitted(queue.put(packet));
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        metrics.increment("sender.dropped");
        log.debug("Interrupted while waiting for queue space; dropping {}", packet);
        return false;
      }
    }
    synchronized (sendLock) {
      deliverLocked(List.of(packet));
    }
    return true;
  }

  /**
   * Hands a packet to the pipeline without ever blocking on queue space.
   *
   * @param packet encoded packet
   * @return {@code true} when accepted
   * @throws QueueOverflowException when the queue is throttled and currently full
   */
  public boolean trySubmit(EncodedPacket packet) {
    Objects.requireNonNull(packet, "packet");
    if (queue == null || stopRequested.get()) {
      return submit(packet);
    }
    return admitted(queue.offer(packet));
  }

  private boolean admitted(Admission admission) {
    if (admission.evicted() > 0) {
      log.warn("Dispatch queue full; {} oldest packets evicted", admission.evicted());
      relay.onError(new QueueOverflowException(
          "dispatch queue full; " + admission.evicted() + " oldest packets evicted"));
    }
    return admission.accepted();
  }

  /**
   * Reports current buffer occupancy.
   *
   * @return queue and backlog counts
   */
  public QueueStats stats() {
    int backlogCount = backlog == null ? 0 : backlog.count();
    long backlogBytes = backlog == null ? 0 : backlog.residentBytes();
    int asyncCount = queue == null ? 0 : queue.size();
    long asyncBytes = queue == null ? 0 : queue.residentBytes();
    return new QueueStats(backlogCount, backlogBytes, asyncCount, asyncBytes);
  }

  public boolean isConnected() {
    return connection.isConnected();
  }

  /**
   * Controls whether {@link #close()} attempts a final flush of queue and backlog.
   *
   * @param flushOnStop {@code false} to discard buffered packets on close
   */
  public void setFlushOnStop(boolean flushOnStop) {
    this.flushOnStop = flushOnStop;
  }

  /**
   * Stops accepting packets, delivers what is buffered when possible, and closes the connection permanently.
   */
  @Override
  public void close() {
    if (!stopRequested.compareAndSet(false, true)) {
      return;
    }
    log.debug("Stopping sender");
    if (queue != null) {
      queue.close();
      stopWorker();
    } else {
      synchronized (sendLock) {
        finalFlushLocked();
      }
      ExecutorService exec = notifier;
      if (exec != null) {
        awaitShutdown(exec, "notifier");
      }
    }
    connection.shutdown();
    relay.drain();
  }

  private void stopWorker() {
    ExecutorService exec = worker;
    if (exec == null) {
      synchronized (sendLock) {
        finalFlushLocked();
      }
      return;
    }
    if (!awaitShutdown(exec, "sender")) {
      connection.shutdown();
      exec.shutdownNow();
    }
  }

  private boolean awaitShutdown(ExecutorService exec, String name) {
    exec.shutdown();
    try {
      if (exec.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("{} thread active after {} ms; forcing shutdown", name, SHUTDOWN_TIMEOUT.toMillis());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
    return false;
  }

  private void scheduleNotifications() {
    ExecutorService exec = notifier;
    if (exec == null || exec.isShutdown()) {
      return;
    }
    try {
      exec.execute(relay::drain);
    } catch (RejectedExecutionException ex) {
      log.debug("Notifier stopped; pending callbacks run at close");
    }
  }

  private void deliverLocked(List<EncodedPacket> batch) {
    if (backlog != null && !settings.keepOpen()) {
      retainLocked(batch);
      if (backlog.flushRequested()) {
        flushOnDemandLocked(false);
      }
      return;
    }
    if (!connection.isConnected() && !connection.tryConnect()) {
      retainLocked(batch);
      return;
    }
    transmitLocked(batch);
  }

  private void idleLocked() {
    if (backlog == null || backlog.isEmpty()) {
      return;
    }
    if (!settings.keepOpen()) {
      if (backlog.flushRequested()) {
        flushOnDemandLocked(false);
      }
      return;
    }
    if (!connection.isConnected() && connection.tryConnect()) {
      transmitLocked(List.of());
    }
  }

  private void flushOnDemandLocked(boolean finalFlush) {
    boolean connected = finalFlush ? connection.connectForFinalFlush() : connection.tryConnect();
    if (!connected) {
      return;
    }
    transmitLocked(List.of());
    connection.disconnect();
  }

  private boolean transmitLocked(List<EncodedPacket> batch) {
    List<EncodedPacket> burst = batch;
    if (backlog != null && !backlog.isEmpty()) {
      List<EncodedPacket> replay = backlog.drainAll();
      burst = new ArrayList<>(replay.size() + batch.size());
      burst.addAll(replay);
      burst.addAll(batch);
      log.debug("Replaying {} backlog frames ahead of {} new", replay.size(), batch.size());
    }
    if (burst.isEmpty() || connection.send(burst)) {
      return true;
    }
    if (queue != null && settings.asyncClearOnDisconnect()) {
      int discarded = queue.clear();
      if (discarded > 0) {
        log.info("Connection dropped; discarded {} queued packets", discarded);
      }
    }
    if (backlog == null) {
      dropLocked(burst);
    } else {
      reportEvictions(backlog.restore(burst));
    }
    return false;
  }

  private void retainLocked(List<EncodedPacket> packets) {
    if (backlog == null) {
      dropLocked(packets);
      return;
    }
    int evicted = 0;
    for (EncodedPacket packet : packets) {
      Admission admission = backlog.append(packet);
      evicted += admission.accepted() ? admission.evicted() : 1;
    }
    reportEvictions(evicted);
  }

  private void dropLocked(List<EncodedPacket> packets) {
    for (int i = 0; i < packets.size(); i++) {
      metrics.increment("sender.dropped");
    }
    log.debug("Not connected and backlog disabled; dropped {} packets", packets.size());
  }

  private void reportEvictions(int evicted) {
    if (evicted <= 0) {
      return;
    }
    log.warn("Backlog full; {} oldest packets evicted", evicted);
    relay.onError(new QueueOverflowException("backlog full; " + evicted + " oldest packets evicted"));
  }

  private void finalFlushLocked() {
    List<EncodedPacket> rest = new ArrayList<>();
    if (queue != null) {
      queue.drainTo(rest, Integer.MAX_VALUE);
    }
    boolean buffered = backlog != null && !backlog.isEmpty();
    if (rest.isEmpty() && !buffered) {
      return;
    }
    if (!flushOnStop) {
      discardAtShutdown(rest);
      return;
    }
    if (backlog != null && !settings.keepOpen()) {
      retainLocked(rest);
      flushOnDemandLocked(true);
    } else if (connection.isConnected() || connection.connectForFinalFlush()) {
      transmitLocked(rest);
    } else if (!rest.isEmpty()) {
      retainLocked(rest);
    }
    discardAtShutdown(List.of());
  }

  private void discardAtShutdown(List<EncodedPacket> rest) {
    int undelivered = rest.size();
    if (backlog != null) {
      undelivered += backlog.clear();
    }
    if (undelivered > 0) {
      for (int i = 0; i < undelivered; i++) {
        metrics.increment("sender.dropped");
      }
      log.info("{} packets undelivered at shutdown", undelivered);
    }
  }

  private final class SenderWorker implements Runnable {
    @Override
    public void run() {
      MDC.put(MDC_KEY, "sender");
      List<EncodedPacket> batch = new ArrayList<>(SEND_BATCH_SIZE);
      try {
        while (true) {
          relay.drain();
          if (stopRequested.get() && queue.isEmpty()) {
            break;
          }
          EncodedPacket next = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          synchronized (sendLock) {
            if (next == null) {
              idleLocked();
              continue;
            }
            batch.add(next);
            queue.drainTo(batch, SEND_BATCH_SIZE - 1);
            deliverLocked(batch);
            batch.clear();
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!stopRequested.get()) {
          log.warn("Sender thread interrupted before shutdown");
        }
      } finally {
        try {
          synchronized (sendLock) {
            finalFlushLocked();
          }
        } finally {
          relay.drain();
          MDC.remove(MDC_KEY);
        }
      }
    }
  }
}
