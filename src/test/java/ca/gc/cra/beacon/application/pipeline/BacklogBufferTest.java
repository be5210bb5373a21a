package ca.gc.cra.beacon.application.pipeline;

import static ca.gc.cra.beacon.testing.Frames.frame;
import static ca.gc.cra.beacon.testing.Frames.markers;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.testing.RecordingMetricsPort;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BacklogBufferTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void drainsInArrivalOrder() {
    BacklogBuffer backlog = new BacklogBuffer(4096, Level.ERROR, metrics);
    for (int i = 1; i <= 5; i++) {
      backlog.append(frame(100, i));
    }

    assertEquals(List.of(1, 2, 3, 4, 5), markers(backlog.drainAll()));
    assertTrue(backlog.isEmpty());
    assertEquals(0, backlog.residentBytes());
    assertEquals(1, metrics.count("backlog.flushed"));
  }

  @Test
  void evictsOldestFramesToAdmitNewOne() {
    BacklogBuffer backlog = new BacklogBuffer(1000, Level.ERROR, metrics);
    backlog.append(frame(300, 1));
    backlog.append(frame(300, 2));
    backlog.append(frame(300, 3));

    Admission admission = backlog.append(frame(300, 4));

    assertTrue(admission.accepted());
    assertEquals(1, admission.evicted());
    assertEquals(900, backlog.residentBytes());
    assertEquals(List.of(2, 3, 4), markers(backlog.drainAll()));
  }

  @Test
  void framesSpanningTheArenaEndComeBackIntact() {
    BacklogBuffer backlog = new BacklogBuffer(1000, Level.ERROR, metrics);
    EncodedPacket a = frame(400, 1);
    EncodedPacket b = frame(400, 2);
    EncodedPacket c = frame(400, 3);
    backlog.append(a);
    backlog.append(b);
    backlog.append(c);

    List<EncodedPacket> drained = backlog.drainAll();

    assertEquals(2, drained.size());
    assertArrayEquals(b.frame(), drained.get(0).frame());
    assertArrayEquals(c.frame(), drained.get(1).frame());
    assertEquals(Level.MESSAGE, drained.get(1).level());
  }

  @Test
  void rejectsFrameLargerThanCapacity() {
    BacklogBuffer backlog = new BacklogBuffer(100, Level.ERROR, metrics);
    backlog.append(frame(50, 1));

    Admission admission = backlog.append(frame(101, 2));

    assertFalse(admission.accepted());
    assertEquals(List.of(1), markers(backlog.drainAll()));
  }

  @Test
  void flushRequestedOnlyAtOrAboveFlushLevel() {
    BacklogBuffer backlog = new BacklogBuffer(4096, Level.ERROR, metrics);
    backlog.append(frame(10, 1, Level.WARNING));
    assertFalse(backlog.flushRequested());

    backlog.append(frame(10, 2, Level.ERROR));
    assertTrue(backlog.flushRequested());

    backlog.drainAll();
    assertFalse(backlog.flushRequested());

    backlog.append(frame(10, 3, Level.FATAL));
    assertTrue(backlog.flushRequested());
  }

  @Test
  void restorePutsUnsentFramesAheadOfNewerOnes() {
    BacklogBuffer backlog = new BacklogBuffer(4096, Level.ERROR, metrics);
    backlog.append(frame(100, 1));
    backlog.append(frame(100, 2));
    backlog.append(frame(100, 3));
    List<EncodedPacket> unsent = backlog.drainAll();
    backlog.append(frame(100, 4));

    assertEquals(0, backlog.restore(unsent));

    assertEquals(List.of(1, 2, 3, 4), markers(backlog.drainAll()));
  }

  @Test
  void restoreEvictsOldestRestoredFramesWhenShort() {
    BacklogBuffer backlog = new BacklogBuffer(300, Level.ERROR, metrics);
    backlog.append(frame(100, 1));
    backlog.append(frame(100, 2));
    List<EncodedPacket> unsent = backlog.drainAll();
    backlog.append(frame(100, 3));
    backlog.append(frame(100, 4));

    int evicted = backlog.restore(unsent);

    assertEquals(1, evicted);
    assertEquals(List.of(2, 3, 4), markers(backlog.drainAll()));
  }

  @Test
  void shrinkingCapacityKeepsNewestFrames() {
    BacklogBuffer backlog = new BacklogBuffer(2000, Level.ERROR, metrics);
    for (int i = 1; i <= 5; i++) {
      backlog.append(frame(300, i, i == 1 ? Level.ERROR : Level.MESSAGE));
    }

    assertEquals(3, backlog.setCapacity(700));

    assertEquals(700, backlog.capacityBytes());
    assertEquals(600, backlog.residentBytes());
    assertTrue(backlog.flushRequested());
    assertEquals(List.of(4, 5), markers(backlog.drainAll()));
  }

  @Test
  void growingCapacityKeepsEverything() {
    BacklogBuffer backlog = new BacklogBuffer(1000, Level.ERROR, metrics);
    backlog.append(frame(400, 1));
    backlog.append(frame(400, 2));

    assertEquals(0, backlog.setCapacity(5000));
    backlog.append(frame(400, 3));

    assertEquals(List.of(1, 2, 3), markers(backlog.drainAll()));
  }

  @Test
  void keepsOrderBeyondInitialSlotCount() {
    BacklogBuffer backlog = new BacklogBuffer(100_000, Level.ERROR, metrics);
    IntStream.rangeClosed(1, 120).forEach(i -> backlog.append(frame(10, i)));

    List<Integer> expected = IntStream.rangeClosed(1, 120).boxed().toList();
    assertEquals(expected, markers(backlog.drainAll()));
  }

  @Test
  void clearReportsDiscardedCount() {
    BacklogBuffer backlog = new BacklogBuffer(1000, Level.ERROR, metrics);
    backlog.append(frame(10, 1, Level.FATAL));
    backlog.append(frame(10, 2));

    assertEquals(2, backlog.clear());
    assertTrue(backlog.isEmpty());
    assertFalse(backlog.flushRequested());
  }
}
