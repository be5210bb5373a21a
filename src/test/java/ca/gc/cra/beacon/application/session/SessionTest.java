package ca.gc.cra.beacon.application.session;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.context.Scope;
import ca.gc.cra.beacon.domain.packet.Color;
import ca.gc.cra.beacon.domain.packet.ControlCommand;
import ca.gc.cra.beacon.domain.packet.ControlCommandType;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.domain.packet.LogEntry;
import ca.gc.cra.beacon.domain.packet.LogEntryType;
import ca.gc.cra.beacon.domain.packet.Packet;
import ca.gc.cra.beacon.domain.packet.ProcessFlow;
import ca.gc.cra.beacon.domain.packet.ProcessFlowType;
import ca.gc.cra.beacon.domain.packet.SourceId;
import ca.gc.cra.beacon.domain.packet.ViewerId;
import ca.gc.cra.beacon.domain.packet.Watch;
import ca.gc.cra.beacon.domain.packet.WatchType;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionTest {
  private RecordingSessionHost host;
  private Session session;

  @BeforeEach
  void setUp() {
    host = new RecordingSessionHost();
    session = new Session(host, "Orders");
  }

  @Test
  void suppressedLevelNeverBuildsTitle() {
    session.setLevel(Level.WARNING);
    AtomicInteger calls = new AtomicInteger();

    session.log(Level.DEBUG, () -> {
      calls.incrementAndGet();
      return "expensive";
    });

    assertEquals(0, calls.get());
    assertTrue(host.packets().isEmpty());
  }

  @Test
  void clientLevelAlsoFilters() {
    host.level = Level.ERROR;

    session.logWarning("w");
    session.logError("e");

    List<Packet> packets = host.packets();
    assertEquals(1, packets.size());
    assertEquals("e", ((LogEntry) packets.get(0)).title());
  }

  @Test
  void disabledHostOrInactiveSessionEmitsNothing() {
    host.enabled = false;
    session.logFatal("a");
    session.clearAll();
    host.enabled = true;
    session.setActive(false);
    session.logFatal("b");
    session.clearLog();

    assertTrue(host.packets().isEmpty());
    assertFalse(session.isOn());
  }

  @Test
  void controlCommandsIgnoreLevelThresholds() {
    session.setLevel(Level.FATAL);
    host.level = Level.FATAL;

    session.clearWatches();

    ControlCommand command = host.last(ControlCommand.class);
    assertEquals(ControlCommandType.CLEAR_WATCHES, command.commandType());
    assertEquals(Level.CONTROL, command.level());
    assertEquals("Orders", command.header().sessionName());
  }

  @Test
  void callerFacingApisRejectControlLevel() {
    assertThrows(IllegalArgumentException.class, () -> session.log(Level.CONTROL, "x"));
    assertThrows(IllegalArgumentException.class, () -> session.setLevel(Level.CONTROL));
    assertThrows(IllegalArgumentException.class, () -> session.metric("m").withLevel(Level.CONTROL));
  }

  @Test
  void fragmentsAreJoinedWithSpaces() {
    session.log(Level.MESSAGE, "order", "42", "accepted");

    LogEntry entry = host.last(LogEntry.class);
    assertEquals("order 42 accepted", entry.title());
    assertEquals(LogEntryType.MESSAGE, entry.entryType());
    assertEquals(ViewerId.TITLE, entry.viewerId());
    assertEquals("TestApp", entry.appName());
    assertEquals("test-host", entry.hostName());
    assertEquals(42, entry.processId());
    assertEquals(1_700_000_000_000_000L, entry.header().timestampMicros());
  }

  @Test
  void levelPicksMatchingEntryType() {
    session.logDebug("d");
    session.logVerbose("v");
    session.logWarning("w");
    session.logFatal("f");

    List<LogEntryType> types = host.packets().stream()
        .map(p -> ((LogEntry) p).entryType())
        .collect(Collectors.toList());
    assertEquals(List.of(LogEntryType.DEBUG, LogEntryType.VERBOSE, LogEntryType.WARNING, LogEntryType.FATAL),
        types);
  }

  @Test
  void inlineTagsMergeWithScopeAndReservedKeysMoveToHeader() {
    try (Scope ignored = host.context.scope("tenant", "acme")) {
      session.logMessage("hello", Map.of("_traceId", "abc123", "_spanName", "checkout", "step", "2"));
    }

    LogEntry entry = host.last(LogEntry.class);
    assertEquals(Map.of("tenant", "acme", "step", "2"), entry.header().context());
    assertEquals("abc123", entry.header().correlationId());
    assertEquals("checkout", entry.header().operationId());
  }

  @Test
  void operationDepthIsStampedOnEntries() {
    try (Scope c = host.context.beginCorrelation("batch");
        Scope op = host.context.beginOperation("load")) {
      session.logMessage("inside");
    }
    session.logMessage("outside");

    List<Packet> packets = host.packets();
    LogEntry inside = (LogEntry) packets.get(0);
    LogEntry outside = (LogEntry) packets.get(1);
    assertEquals("load", inside.header().operationId());
    assertEquals(32, inside.header().correlationId().length());
    assertTrue(inside.operationDepth() > outside.operationDepth());
    assertNull(outside.header().correlationId());
  }

  @Test
  void countersAccumulateAndReset() {
    session.incCounter("jobs");
    session.incCounter("jobs");
    session.decCounter("jobs");
    session.resetCounter("jobs");
    session.incCounter("jobs");

    List<String> values = host.packets().stream()
        .map(p -> ((Watch) p).value())
        .collect(Collectors.toList());
    assertEquals(List.of("1", "2", "1", "1"), values);
    assertEquals(WatchType.INTEGER, host.last(Watch.class).watchType());
  }

  @Test
  void checkpointsAreNumberedPerName() {
    session.addCheckpoint();
    session.addCheckpoint();
    session.addCheckpoint("load", null);
    session.addCheckpoint("load", "rows=10");
    session.resetCheckpoint("load");
    session.addCheckpoint("load");

    List<String> titles = host.packets().stream()
        .map(p -> ((LogEntry) p).title())
        .collect(Collectors.toList());
    assertEquals(List.of("Checkpoint #1", "Checkpoint #2", "load #1", "load #2 (rows=10)", "load #1"), titles);
    assertEquals(LogEntryType.CHECKPOINT, host.last(LogEntry.class).entryType());
  }

  @Test
  void timerWatchesElapsedMilliseconds() {
    session.timeStart("t");
    host.clock.advance(12);
    session.timeEnd("t");

    Watch watch = host.last(Watch.class);
    assertEquals("t", watch.name());
    assertEquals("12.0", watch.value());
    assertEquals(WatchType.FLOAT, watch.watchType());
    assertEquals("Timer \"t\": 12.000ms", host.last(LogEntry.class).title());
  }

  @Test
  void unknownTimerLogsWarning() {
    session.timeEnd("missing");

    LogEntry entry = host.last(LogEntry.class);
    assertEquals(Level.WARNING, entry.level());
    assertEquals("Timer \"missing\" not found", entry.title());
  }

  @Test
  void trackedMethodLeavesOnce() {
    Scope scope = session.trackMethod("Service.run");
    scope.close();
    scope.close();

    List<Packet> packets = host.packets();
    assertEquals(4, packets.size());
    assertEquals(LogEntryType.ENTER_METHOD, ((LogEntry) packets.get(0)).entryType());
    assertEquals(ProcessFlowType.ENTER_METHOD, ((ProcessFlow) packets.get(1)).flowType());
    assertEquals(LogEntryType.LEAVE_METHOD, ((LogEntry) packets.get(2)).entryType());
    assertEquals(ProcessFlowType.LEAVE_METHOD, ((ProcessFlow) packets.get(3)).flowType());
  }

  @Test
  void processMarkersWrapTheMainThread() {
    session.enterProcess();
    session.leaveProcess();

    List<String> flow = host.packets().stream()
        .map(p -> ((ProcessFlow) p).flowType() + ":" + ((ProcessFlow) p).title())
        .collect(Collectors.toList());
    assertEquals(List.of(
        "ENTER_PROCESS:TestApp",
        "ENTER_THREAD:Main Thread",
        "LEAVE_THREAD:Main Thread",
        "LEAVE_PROCESS:TestApp"), flow);
  }

  @Test
  void labelsWithNullEntriesStillEmitTheWatch() {
    Map<String, String> labels = new HashMap<>();
    labels.put(null, "orphan");
    labels.put("pool", null);
    labels.put("zone", "east");

    session.watchWithLabels("depth", 4, labels, Level.MESSAGE);

    Watch watch = host.last(Watch.class);
    assertEquals("4", watch.value());
    assertEquals(Map.of("zone", "east"), watch.labels());
  }

  @Test
  void watchTypeFollowsValueType() {
    session.watch("s", "text");
    session.watch("c", (Object) 'x');
    session.watch("b", true);
    session.watch("i", 7L);
    session.watch("f", 2.5d);
    session.watch("t", (Object) Instant.EPOCH);
    session.watch("o", (Object) List.of(1));

    List<WatchType> types = host.packets().stream()
        .map(p -> ((Watch) p).watchType())
        .collect(Collectors.toList());
    assertEquals(List.of(WatchType.STRING, WatchType.CHAR, WatchType.BOOLEAN, WatchType.INTEGER,
        WatchType.FLOAT, WatchType.TIMESTAMP, WatchType.OBJECT), types);
  }

  @Test
  void metricBuilderCarriesLabels() {
    session.metric("queue.depth").forInstance("node-1").withLabel("region", "ca").withLabel("zone", null).set(12);

    Watch watch = host.last(Watch.class);
    assertEquals("queue.depth", watch.name());
    assertEquals("12", watch.value());
    assertEquals(WatchType.INTEGER, watch.watchType());
    assertEquals(Map.of("instance", "node-1", "region", "ca", "zone", ""), watch.labels());
  }

  @Test
  void labelledObjectWatchIsSentAsString() {
    session.watchWithLabels("cfg", new StringBuilder("a=b"), null, Level.WARNING);

    Watch watch = host.last(Watch.class);
    assertEquals(WatchType.STRING, watch.watchType());
    assertEquals(Level.WARNING, watch.level());
  }

  @Test
  void textBodiesStartWithByteOrderMark() {
    session.logText("notes", "hi");
    session.logSource("query", "select 1", SourceId.SQL);

    List<Packet> packets = host.packets();
    LogEntry text = (LogEntry) packets.get(0);
    assertEquals(ViewerId.DATA, text.viewerId());
    assertArrayEquals(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'h', 'i'}, text.data());
    LogEntry source = (LogEntry) packets.get(1);
    assertEquals(ViewerId.SQL_SOURCE, source.viewerId());
    assertEquals("select 1",
        new String(Arrays.copyOfRange(source.data(), 3, source.data().length), StandardCharsets.UTF_8));
  }

  @Test
  void binarySliceIsClamped() {
    session.logBinary("blob", new byte[] {1, 2, 3, 4}, 2, 10);

    assertArrayEquals(new byte[] {3, 4}, host.last(LogEntry.class).data());
  }

  @Test
  void nullBinaryIsReportedAsInternalError() {
    session.logBinary("blob", (byte[]) null);

    LogEntry entry = host.last(LogEntry.class);
    assertEquals(LogEntryType.INTERNAL_ERROR, entry.entryType());
    assertEquals(Level.ERROR, entry.level());
  }

  @Test
  void exceptionCarriesStackTrace() {
    session.logException(new IllegalStateException("boom"));

    LogEntry entry = host.last(LogEntry.class);
    assertEquals("boom", entry.title());
    assertEquals(LogEntryType.ERROR, entry.entryType());
    String body = new String(entry.data(), StandardCharsets.UTF_8);
    assertTrue(body.contains("java.lang.IllegalStateException: boom"));
  }

  @Test
  void assertOnlyLogsWhenConditionFails() {
    session.logAssert(true, "fine");
    session.logAssert(false, "broken");

    List<Packet> packets = host.packets();
    assertEquals(1, packets.size());
    assertEquals(LogEntryType.ASSERT, ((LogEntry) packets.get(0)).entryType());
  }

  @Test
  void colorOverridesApplyPerEntry() {
    Color red = Color.of(255, 0, 0);
    session.logColored(red, "red");
    session.logMessage("plain");

    List<Packet> packets = host.packets();
    assertEquals(red, ((LogEntry) packets.get(0)).color());
    assertEquals(Color.DEFAULT, ((LogEntry) packets.get(1)).color());
  }
}
