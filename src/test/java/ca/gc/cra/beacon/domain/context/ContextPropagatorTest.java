package ca.gc.cra.beacon.domain.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ContextPropagatorTest {
  private final ContextPropagator propagator = new ContextPropagator();

  @AfterEach
  void tearDown() {
    propagator.clear();
  }

  @Test
  void nestedScopesMergeAndInnerValuesWin() {
    try (Scope outer = propagator.scope(Map.of("tenant", "a", "region", "east"))) {
      try (Scope inner = propagator.scope(Map.of("tenant", "b"))) {
        assertEquals(Map.of("tenant", "b", "region", "east"), propagator.current());
      }
      assertEquals(Map.of("tenant", "a", "region", "east"), propagator.current());
    }
    assertTrue(propagator.current().isEmpty());
  }

  @Test
  void inlineTagsOverrideAmbientOnesForOneSnapshot() {
    try (Scope scope = propagator.scope(Map.of("tenant", "a", "user", "u1"))) {
      ContextSnapshot snapshot = propagator.snapshot(Map.of("tenant", "inline"));

      assertEquals(Map.of("tenant", "inline", "user", "u1"), snapshot.tags());
      assertEquals(Map.of("tenant", "a", "user", "u1"), propagator.current(), "ambient context unchanged");
    }
  }

  @Test
  void reservedInlineKeysSetCorrelationAndOperation() {
    Map<String, String> inline = new LinkedHashMap<>();
    inline.put(ContextPropagator.TRACE_ID_KEY, "trace-42");
    inline.put(ContextPropagator.SPAN_NAME_KEY, "checkout");
    inline.put("order", "17");

    ContextSnapshot snapshot = propagator.snapshot(inline);

    assertEquals("trace-42", snapshot.correlationId());
    assertEquals("checkout", snapshot.operationId());
    assertEquals(Map.of("order", "17"), snapshot.tags());
  }

  @Test
  void emptyContextYieldsSharedEmptySnapshot() {
    assertSame(ContextSnapshot.EMPTY, propagator.snapshot(null));
    assertSame(ContextSnapshot.EMPTY, propagator.snapshot(Map.of()));
  }

  @Test
  void nullTagValuesAreIgnored() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("kept", "1");
    tags.put("skipped", null);

    try (Scope scope = propagator.scope(tags)) {
      assertEquals(Map.of("kept", "1"), propagator.current());
    }
  }

  @Test
  void builderConvertsValuesToStrings() {
    try (Scope scope = propagator.builder().with("attempt", 3).with("ok", true).with("none", null).begin()) {
      assertEquals(Map.of("attempt", "3", "ok", "true"), propagator.current());
    }
  }

  @Test
  void correlationAndOperationsTrackDepth() {
    try (Scope correlation = propagator.beginCorrelation("request")) {
      assertNotNull(propagator.correlationId());
      assertEquals(32, propagator.correlationId().length());
      assertEquals("request", propagator.operationName());
      assertEquals(0, propagator.operationDepth());
      try (Scope op = propagator.beginOperation("load")) {
        try (Scope nested = propagator.beginOperation("parse")) {
          assertEquals("parse", propagator.operationName());
          assertEquals(2, propagator.operationDepth());
          assertEquals(2, propagator.snapshot(null).depth());
        }
        assertEquals("load", propagator.operationName());
      }
    }
    assertNull(propagator.correlationId());
    assertEquals(0, propagator.operationDepth());
  }

  @Test
  void closingScopeTwiceRestoresOnlyOnce() {
    Scope outer = propagator.scope("a", "1");
    Scope inner = propagator.scope("b", "2");
    inner.close();
    inner.close();

    assertEquals(Map.of("a", "1"), propagator.current());
    outer.close();
    assertTrue(propagator.current().isEmpty());
  }

  @Test
  void carrierReinstallsCapturedContextOnAnotherThread() throws Exception {
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try {
      ContextCarrier carrier;
      try (Scope scope = propagator.scope("tenant", "a")) {
        carrier = propagator.capture();
      }
      assertTrue(propagator.current().isEmpty());

      Callable<Map<String, String>> read = propagator::current;
      Map<String, String> seen = pool.submit(carrier.wrap(read)).get(2, TimeUnit.SECONDS);
      Map<String, String> after = pool.submit(read).get(2, TimeUnit.SECONDS);

      assertEquals(Map.of("tenant", "a"), seen);
      assertTrue(after.isEmpty(), "worker context restored after the task");
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void contextDoesNotLeakAcrossThreads() throws Exception {
    ExecutorService pool = Executors.newSingleThreadExecutor();
    try (Scope scope = propagator.scope("tenant", "a")) {
      Callable<Map<String, String>> read = propagator::current;
      Map<String, String> other = pool.submit(read).get(2, TimeUnit.SECONDS);
      assertTrue(other.isEmpty());
    } finally {
      pool.shutdownNow();
    }
  }
}
