package ca.gc.cra.beacon.application.pipeline;

import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.domain.packet.PacketKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fixed-capacity ring of encoded frames held while the console is unreachable.
 * <p><strong>Why:</strong> Packets produced during an outage are replayed, oldest first, ahead of new traffic once
 * the connection returns; memory stays bounded by evicting the oldest frames.</p>
 * <p><strong>Role:</strong> Application pipeline component owned by {@link PacketSender}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store frames contiguously in one byte arena addressed by head and used cursors.</li>
 *   <li>Evict oldest frames until a new one fits; reject frames larger than the arena.</li>
 *   <li>Raise a flush request when a frame at or above the flush level arrives.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All methods synchronize on this instance. Callers never hold another
 * pipeline lock while calling in.</p>
 * <p><strong>Performance:</strong> Appends copy the frame once into the arena; slot metadata lives in parallel
 * primitive rings that only grow when the frame count outgrows them.</p>
 * <p><strong>Observability:</strong> Counts {@code backlog.appended}, {@code backlog.evicted}, and
 * {@code backlog.flushed}.</p>
 *
 * @since 0.1.0
 */
public final class BacklogBuffer {
  private static final Logger log = LoggerFactory.getLogger(BacklogBuffer.class);
  private static final int INITIAL_SLOTS = 64;
  private static final PacketKind[] KINDS = PacketKind.values();

  private final Level flushOn;
  private final MetricsPort metrics;
  private byte[] arena;
  private int head;
  private int used;

  private int[] lengths = new int[INITIAL_SLOTS];
  private byte[] levels = new byte[INITIAL_SLOTS];
  private byte[] kinds = new byte[INITIAL_SLOTS];
  private int slotHead;
  private int count;
  private boolean flushRequested;

  /**
   * Creates a backlog.
   *
   * @param capacityBytes arena size in bytes; must be positive
   * @param flushOn level at or above which a flush is requested
   * @param metrics metrics sink
   */
  public BacklogBuffer(int capacityBytes, Level flushOn, MetricsPort metrics) {
    if (capacityBytes <= 0) {
      throw new IllegalArgumentException("capacityBytes must be positive");
    }
    this.arena = new byte[capacityBytes];
    this.flushOn = Objects.requireNonNull(flushOn, "flushOn");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Appends a frame, evicting the oldest frames until it fits.
   *
   * @param packet frame to retain
   * @return admission outcome; not accepted when the frame is larger than the arena
   */
  public synchronized Admission append(EncodedPacket packet) {
    Objects.requireNonNull(packet, "packet");
    int size = packet.size();
    if (size > arena.length) {
      log.warn("Dropping {}: larger than backlog capacity of {} bytes", packet, arena.length);
      metrics.increment("backlog.evicted");
      return Admission.REJECTED;
    }
    int evicted = 0;
    while (arena.length - used < size) {
      removeOldest();
      evicted++;
    }
    if (evicted > 0) {
      metrics.increment("backlog.evicted");
      log.debug("Backlog evicted {} oldest frames to admit {}", evicted, packet);
    }
    writeSlot(packet);
    if (packet.level().isAtLeast(flushOn)) {
      flushRequested = true;
    }
    metrics.increment("backlog.appended");
    return Admission.acceptedAfterEvicting(evicted);
  }

  /**
   * Removes every frame, oldest first, and clears the flush request.
   *
   * @return frames in arrival order
   */
  public synchronized List<EncodedPacket> drainAll() {
    if (count == 0) {
      flushRequested = false;
      return Collections.emptyList();
    }
    List<EncodedPacket> out = new ArrayList<>(count);
    while (count > 0) {
      out.add(readOldest());
    }
    head = 0;
    used = 0;
    flushRequested = false;
    metrics.increment("backlog.flushed");
    return out;
  }

  /**
   * Puts frames that failed to send back in front of the current content.
   *
   * <p>The restored frames are older than anything appended since they were drained, so if space runs short the
   * oldest restored frames are the first to go.</p>
   *
   * @param unsent frames in their original order
   * @return number of frames evicted while restoring
   */
  public synchronized int restore(List<EncodedPacket> unsent) {
    if (unsent == null || unsent.isEmpty()) {
      return 0;
    }
    List<EncodedPacket> newer = new ArrayList<>(count);
    while (count > 0) {
      newer.add(readOldest());
    }
    head = 0;
    used = 0;
    flushRequested = false;
    int evicted = 0;
    for (EncodedPacket packet : unsent) {
      Admission admission = append(packet);
      evicted += admission.accepted() ? admission.evicted() : 1;
    }
    for (EncodedPacket packet : newer) {
      evicted += append(packet).evicted();
    }
    return evicted;
  }

  /**
   * Discards every frame.
   *
   * @return number of frames discarded
   */
  public synchronized int clear() {
    int discarded = count;
    count = 0;
    slotHead = 0;
    head = 0;
    used = 0;
    flushRequested = false;
    return discarded;
  }

  /**
   * Resizes the arena, keeping the newest frames that fit.
   *
   * @param capacityBytes new arena size in bytes; must be positive
   * @return number of frames evicted to fit the new size
   */
  public synchronized int setCapacity(int capacityBytes) {
    if (capacityBytes <= 0) {
      throw new IllegalArgumentException("capacityBytes must be positive");
    }
    if (capacityBytes == arena.length) {
      return 0;
    }
    List<EncodedPacket> kept = new ArrayList<>(count);
    while (count > 0) {
      kept.add(readOldest());
    }
    arena = new byte[capacityBytes];
    head = 0;
    used = 0;
    boolean pendingFlush = flushRequested;
    long retained = 0;
    int start = kept.size();
    while (start > 0 && retained + kept.get(start - 1).size() <= capacityBytes) {
      retained += kept.get(start - 1).size();
      start--;
    }
    int evicted = start;
    for (int i = start; i < kept.size(); i++) {
      writeSlot(kept.get(i));
    }
    flushRequested = pendingFlush && count > 0;
    if (evicted > 0) {
      metrics.increment("backlog.evicted");
      log.debug("Backlog resized to {} bytes; {} oldest frames evicted", capacityBytes, evicted);
    }
    return evicted;
  }

  public synchronized boolean flushRequested() {
    return flushRequested;
  }

  public synchronized boolean isEmpty() {
    return count == 0;
  }

  public synchronized int count() {
    return count;
  }

  public synchronized long residentBytes() {
    return used;
  }

  public synchronized int capacityBytes() {
    return arena.length;
  }

  public Level flushOn() {
    return flushOn;
  }

  private void writeSlot(EncodedPacket packet) {
    if (count == lengths.length) {
      growSlots();
    }
    int size = packet.size();
    int tail = (head + used) % arena.length;
    int firstPart = Math.min(size, arena.length - tail);
    if (firstPart == size) {
      packet.copyTo(arena, tail);
    } else {
      byte[] frame = packet.frame();
      System.arraycopy(frame, 0, arena, tail, firstPart);
      System.arraycopy(frame, firstPart, arena, 0, size - firstPart);
    }
    used += size;
    int slot = (slotHead + count) % lengths.length;
    lengths[slot] = size;
    levels[slot] = (byte) packet.level().wireValue();
    kinds[slot] = (byte) packet.kind().ordinal();
    count++;
  }

  private EncodedPacket readOldest() {
    int size = lengths[slotHead];
    byte[] frame = new byte[size];
    int firstPart = Math.min(size, arena.length - head);
    System.arraycopy(arena, head, frame, 0, firstPart);
    if (firstPart < size) {
      System.arraycopy(arena, 0, frame, firstPart, size - firstPart);
    }
    EncodedPacket packet = new EncodedPacket(frame, Level.fromWire(levels[slotHead]), KINDS[kinds[slotHead]]);
    advance(size);
    return packet;
  }

  private void removeOldest() {
    advance(lengths[slotHead]);
  }

  private void advance(int size) {
    head = (head + size) % arena.length;
    used -= size;
    slotHead = (slotHead + 1) % lengths.length;
    count--;
    if (count == 0) {
      head = 0;
      slotHead = 0;
    }
  }

  private void growSlots() {
    int newSize = lengths.length * 2;
    int[] nextLengths = new int[newSize];
    byte[] nextLevels = new byte[newSize];
    byte[] nextKinds = new byte[newSize];
    for (int i = 0; i < count; i++) {
      int from = (slotHead + i) % lengths.length;
      nextLengths[i] = lengths[from];
      nextLevels[i] = levels[from];
      nextKinds[i] = kinds[from];
    }
    lengths = nextLengths;
    levels = nextLevels;
    kinds = nextKinds;
    slotHead = 0;
  }
}
