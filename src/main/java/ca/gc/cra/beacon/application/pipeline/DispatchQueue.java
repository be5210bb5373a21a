package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Byte-bounded FIFO between logging callers and the sender thread.
 * <p><strong>Why:</strong> Decouples producers from network latency while capping the memory held for
 * undelivered packets.</p>
 * <p><strong>Role:</strong> Application pipeline component; many producers, one consumer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Admit frames while resident bytes stay within capacity.</li>
 *   <li>Block producers ({@link OverflowPolicy#THROTTLE}) or evict oldest frames ({@link OverflowPolicy#DROP})
 *   when full.</li>
 *   <li>Reject frames larger than the whole capacity under either policy.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One {@link ReentrantLock} with {@code notEmpty}/{@code notFull}
 * conditions guards all state; the capacity invariant holds at every release of the lock.</p>
 * <p><strong>Performance:</strong> O(1) enqueue and dequeue; eviction is O(k) in frames evicted.</p>
 * <p><strong>Observability:</strong> Counts {@code queue.enqueued}, {@code queue.evicted},
 * {@code queue.rejected}, and {@code queue.cleared}; observes {@code queue.depth.bytes}.</p>
 *
 * @since 0.1.0
 */
public final class DispatchQueue {
  private static final Logger log = LoggerFactory.getLogger(DispatchQueue.class);

  private final long capacityBytes;
  private final OverflowPolicy policy;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Condition notFull = lock.newCondition();
  private final ArrayDeque<EncodedPacket> items = new ArrayDeque<>();
  private long residentBytes;
  private boolean closed;

  /**
   * Creates a queue.
   *
   * @param capacityBytes maximum resident bytes; must be positive
   * @param policy overflow behaviour
   * @param metrics metrics sink
   */
  public DispatchQueue(long capacityBytes, OverflowPolicy policy, MetricsPort metrics) {
    if (capacityBytes <= 0) {
      throw new IllegalArgumentException("capacityBytes must be positive");
    }
    this.capacityBytes = capacityBytes;
    this.policy = Objects.requireNonNull(policy, "policy");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Enqueues a frame, blocking under {@link OverflowPolicy#THROTTLE} until it fits.
   *
   * @param packet frame to enqueue
   * @return admission outcome; not accepted when the frame exceeds capacity or the queue is closed
   * @throws InterruptedException if interrupted while waiting for space
   */
  public Admission put(EncodedPacket packet) throws InterruptedException {
    Objects.requireNonNull(packet, "packet");
    if (packet.size() > capacityBytes) {
      return rejectOversize(packet);
    }
    lock.lockInterruptibly();
    try {
      if (policy == OverflowPolicy.THROTTLE) {
        while (!closed && residentBytes + packet.size() > capacityBytes) {
          notFull.await();
        }
      }
      return admitLocked(packet);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Enqueues a frame without blocking.
   *
   * @param packet frame to enqueue
   * @return admission outcome
   * @throws QueueOverflowException when the queue is throttled and the frame does not fit right now
   */
  public Admission offer(EncodedPacket packet) {
    Objects.requireNonNull(packet, "packet");
    if (packet.size() > capacityBytes) {
      return rejectOversize(packet);
    }
    lock.lock();
    try {
      if (policy == OverflowPolicy.THROTTLE && !closed && residentBytes + packet.size() > capacityBytes) {
        metrics.increment("queue.rejected");
        throw new QueueOverflowException("dispatch queue full (" + residentBytes + " of " + capacityBytes
            + " bytes resident, frame needs " + packet.size() + ")");
      }
      return admitLocked(packet);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the oldest frame, waiting up to {@code timeout} for one to arrive.
   *
   * @param timeout maximum wait
   * @param unit unit of {@code timeout}
   * @return oldest frame, or {@code null} on timeout or when closed and empty
   * @throws InterruptedException if interrupted while waiting
   */
  public EncodedPacket poll(long timeout, TimeUnit unit) throws InterruptedException {
    long nanos = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (items.isEmpty()) {
        if (closed || nanos <= 0) {
          return null;
        }
        nanos = notEmpty.awaitNanos(nanos);
      }
      return removeFirstLocked();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Moves up to {@code max} frames into {@code sink} without waiting.
   *
   * @param sink destination list
   * @param max maximum frames to move
   * @return number of frames moved
   */
  public int drainTo(List<EncodedPacket> sink, int max) {
    lock.lock();
    try {
      int moved = 0;
      while (moved < max && !items.isEmpty()) {
        sink.add(removeFirstLocked());
        moved++;
      }
      return moved;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Discards every resident frame and wakes blocked producers.
   *
   * @return number of frames discarded
   */
  public int clear() {
    lock.lock();
    try {
      int discarded = items.size();
      items.clear();
      residentBytes = 0;
      notFull.signalAll();
      if (discarded > 0) {
        metrics.increment("queue.cleared");
        log.debug("Dispatch queue cleared; {} frames discarded", discarded);
      }
      return discarded;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops accepting frames and wakes every waiting producer and consumer. Resident frames stay pollable.
   */
  public void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int size() {
    lock.lock();
    try {
      return items.size();
    } finally {
      lock.unlock();
    }
  }

  public long residentBytes() {
    lock.lock();
    try {
      return residentBytes;
    } finally {
      lock.unlock();
    }
  }

  public long capacityBytes() {
    return capacityBytes;
  }

  public OverflowPolicy policy() {
    return policy;
  }

  private Admission admitLocked(EncodedPacket packet) {
    if (closed) {
      metrics.increment("queue.rejected");
      return Admission.REJECTED;
    }
    int evicted = 0;
    while (residentBytes + packet.size() > capacityBytes) {
      EncodedPacket oldest = items.pollFirst();
      residentBytes -= oldest.size();
      evicted++;
      metrics.increment("queue.evicted");
    }
    if (evicted > 0) {
      log.debug("Dispatch queue evicted {} frames to admit {}", evicted, packet);
    }
    items.addLast(packet);
    residentBytes += packet.size();
    metrics.increment("queue.enqueued");
    metrics.observe("queue.depth.bytes", residentBytes);
    notEmpty.signal();
    return Admission.acceptedAfterEvicting(evicted);
  }

  private EncodedPacket removeFirstLocked() {
    EncodedPacket head = items.pollFirst();
    residentBytes -= head.size();
    notFull.signalAll();
    return head;
  }

  private Admission rejectOversize(EncodedPacket packet) {
    metrics.increment("queue.rejected");
    log.warn("Dropping {}: larger than dispatch queue capacity of {} bytes", packet, capacityBytes);
    return Admission.REJECTED;
  }
}
