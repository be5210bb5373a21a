package ca.gc.cra.beacon.application.pipeline;

import static ca.gc.cra.beacon.testing.Frames.frame;
import static ca.gc.cra.beacon.testing.Frames.markers;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.packet.EncodedPacket;
import ca.gc.cra.beacon.testing.RecordingMetricsPort;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DispatchQueueTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final ExecutorService producer = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    producer.shutdownNow();
  }

  @Test
  void dropPolicyNeverExceedsCapacityAndKeepsNewest() throws Exception {
    DispatchQueue queue = new DispatchQueue(2048, OverflowPolicy.DROP, metrics);

    for (int i = 1; i <= 20; i++) {
      Admission admission = queue.put(frame(300, i));
      assertTrue(admission.accepted());
      assertTrue(queue.residentBytes() <= 2048, "resident bytes exceeded capacity after frame " + i);
    }

    List<EncodedPacket> drained = new ArrayList<>();
    queue.drainTo(drained, Integer.MAX_VALUE);
    assertEquals(List.of(15, 16, 17, 18, 19, 20), markers(drained));
    assertEquals(14, metrics.count("queue.evicted"));
    assertEquals(20, metrics.count("queue.enqueued"));
    assertEquals(0, queue.residentBytes());
  }

  @Test
  void evictsOnlyAsManyFramesAsNeeded() throws Exception {
    DispatchQueue queue = new DispatchQueue(1000, OverflowPolicy.DROP, metrics);
    queue.put(frame(400, 1));
    queue.put(frame(400, 2));

    Admission admission = queue.put(frame(300, 3));

    assertEquals(1, admission.evicted());
    assertEquals(700, queue.residentBytes());
    assertEquals(2, queue.size());
  }

  @Test
  void oversizeFrameIsRejectedUnderEitherPolicy() throws Exception {
    DispatchQueue drop = new DispatchQueue(100, OverflowPolicy.DROP, metrics);
    DispatchQueue throttle = new DispatchQueue(100, OverflowPolicy.THROTTLE, metrics);

    assertFalse(drop.put(frame(101, 1)).accepted());
    assertFalse(throttle.put(frame(101, 1)).accepted());
    assertFalse(throttle.offer(frame(101, 1)).accepted());
    assertEquals(3, metrics.count("queue.rejected"));
    assertTrue(drop.isEmpty());
  }

  @Test
  void throttledProducerBlocksUntilConsumerFreesSpace() throws Exception {
    DispatchQueue queue = new DispatchQueue(1000, OverflowPolicy.THROTTLE, metrics);
    queue.put(frame(600, 1));

    Future<Admission> blocked = producer.submit(() -> queue.put(frame(600, 2)));
    assertThrows(TimeoutException.class, () -> blocked.get(150, TimeUnit.MILLISECONDS));
    assertEquals(1, queue.size());

    EncodedPacket first = queue.poll(1, TimeUnit.SECONDS);
    assertEquals(1, first.frame()[0]);

    Admission admission = blocked.get(2, TimeUnit.SECONDS);
    assertTrue(admission.accepted());
    assertEquals(0, admission.evicted());
    assertEquals(600, queue.residentBytes());
    assertEquals(0, metrics.count("queue.evicted"));
  }

  @Test
  void offerThrowsWhenThrottledQueueIsFull() throws Exception {
    DispatchQueue queue = new DispatchQueue(1000, OverflowPolicy.THROTTLE, metrics);
    queue.put(frame(800, 1));

    assertThrows(QueueOverflowException.class, () -> queue.offer(frame(300, 2)));
    assertEquals(1, metrics.count("queue.rejected"));
    assertTrue(queue.offer(frame(200, 3)).accepted());
    assertEquals(1000, queue.residentBytes());
  }

  @Test
  void offerEvictsUnderDropPolicy() {
    DispatchQueue queue = new DispatchQueue(1000, OverflowPolicy.DROP, metrics);
    queue.offer(frame(800, 1));

    Admission admission = queue.offer(frame(300, 2));

    assertTrue(admission.accepted());
    assertEquals(1, admission.evicted());
  }

  @Test
  void closeReleasesBlockedProducerWithRejection() throws Exception {
    DispatchQueue queue = new DispatchQueue(1000, OverflowPolicy.THROTTLE, metrics);
    queue.put(frame(900, 1));
    Future<Admission> blocked = producer.submit(() -> queue.put(frame(900, 2)));
    assertThrows(TimeoutException.class, () -> blocked.get(100, TimeUnit.MILLISECONDS));

    queue.close();

    assertFalse(blocked.get(2, TimeUnit.SECONDS).accepted());
    assertEquals(1, queue.size(), "resident frames stay pollable after close");
    assertEquals(1, queue.poll(10, TimeUnit.MILLISECONDS).frame()[0]);
    assertNull(queue.poll(1, TimeUnit.SECONDS), "closed and empty queue returns immediately");
  }

  @Test
  void clearDiscardsEverythingAndWakesProducers() throws Exception {
    DispatchQueue queue = new DispatchQueue(1000, OverflowPolicy.THROTTLE, metrics);
    queue.put(frame(700, 1));
    Future<Admission> blocked = producer.submit(() -> queue.put(frame(700, 2)));
    assertThrows(TimeoutException.class, () -> blocked.get(100, TimeUnit.MILLISECONDS));

    assertEquals(1, queue.clear());

    assertTrue(blocked.get(2, TimeUnit.SECONDS).accepted());
    assertEquals(List.of(2), markers(List.of(queue.poll(10, TimeUnit.MILLISECONDS))));
    assertEquals(1, metrics.count("queue.cleared"));
  }

  @Test
  void pollTimesOutWhenEmpty() throws Exception {
    DispatchQueue queue = new DispatchQueue(1000, OverflowPolicy.DROP, metrics);
    assertNull(queue.poll(20, TimeUnit.MILLISECONDS));
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new DispatchQueue(0, OverflowPolicy.DROP, metrics));
  }
}
