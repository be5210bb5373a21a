package ca.gc.cra.beacon.application.session;

import ca.gc.cra.beacon.domain.context.ContextSnapshot;
import ca.gc.cra.beacon.domain.context.Scope;
import ca.gc.cra.beacon.domain.packet.Color;
import ca.gc.cra.beacon.domain.packet.ControlCommand;
import ca.gc.cra.beacon.domain.packet.ControlCommandType;
import ca.gc.cra.beacon.domain.packet.Level;
import ca.gc.cra.beacon.domain.packet.LogEntry;
import ca.gc.cra.beacon.domain.packet.LogEntryType;
import ca.gc.cra.beacon.domain.packet.PacketHeader;
import ca.gc.cra.beacon.domain.packet.ProcessFlow;
import ca.gc.cra.beacon.domain.packet.ProcessFlowType;
import ca.gc.cra.beacon.domain.packet.SourceId;
import ca.gc.cra.beacon.domain.packet.StreamPacket;
import ca.gc.cra.beacon.domain.packet.ViewerId;
import ca.gc.cra.beacon.domain.packet.Watch;
import ca.gc.cra.beacon.domain.packet.WatchType;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Named logging surface that turns caller intent into packets.
 * <p><strong>Why:</strong> Lets each subsystem of an application log under its own name and level while sharing one
 * client connection.</p>
 * <p><strong>Role:</strong> Caller-facing producer in front of the delivery pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply {@link LevelFilter} before building any payload; {@link Supplier} overloads defer construction
 *   until the call is known to be admitted.</li>
 *   <li>Freeze the caller's context into every packet header.</li>
 *   <li>Track per-session counters, checkpoints, and timers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Counter, checkpoint, and timer updates are serialized
 * on a per-session lock so no update is lost.</p>
 *
 * @since 0.1.0
 */
public final class Session {
  private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
  private static final String MAIN_THREAD = "Main Thread";

  private final SessionHost host;
  private final String name;
  private volatile Level level = Level.DEBUG;
  private volatile boolean active = true;
  private volatile Color color = Color.DEFAULT;

  private final Object stateLock = new Object();
  private final Map<String, Long> counters = new HashMap<>();
  private final Map<String, Integer> checkpoints = new HashMap<>();
  private final Map<String, Long> timers = new HashMap<>();
  private int checkpointCounter;

  /**
   * Creates a session bound to a host. Applications obtain sessions from the client instead.
   *
   * @param host client services
   * @param name session name
   */
  public Session(SessionHost host, String name) {
    this.host = Objects.requireNonNull(host, "host");
    this.name = Objects.requireNonNull(name, "name");
  }

  public String name() {
    return name;
  }

  public Level level() {
    return level;
  }

  /**
   * Sets the session threshold.
   *
   * @param level new threshold
   * @throws IllegalArgumentException for {@link Level#CONTROL}
   */
  public void setLevel(Level level) {
    this.level = Level.requireCallerLevel(level);
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public Color color() {
    return color;
  }

  public void setColor(Color color) {
    this.color = Objects.requireNonNullElse(color, Color.DEFAULT);
  }

  public void resetColor() {
    this.color = Color.DEFAULT;
  }

  /**
   * Returns whether the session emits anything at all.
   *
   * @return {@code true} when the session is active and the client enabled
   */
  public boolean isOn() {
    return active && host.isEnabled();
  }

  /**
   * Returns whether a packet of {@code candidate} level would be emitted.
   *
   * @param candidate level to test
   * @return {@code true} when admitted
   */
  public boolean isOn(Level candidate) {
    return isOn() && LevelFilter.admits(candidate, level, host.level());
  }

  // Messages

  public void logDebug(String title) {
    logEntry(Level.DEBUG, LogEntryType.DEBUG, title, null);
  }

  public void logDebug(String title, Map<String, String> inline) {
    logEntry(Level.DEBUG, LogEntryType.DEBUG, title, inline);
  }

  public void logVerbose(String title) {
    logEntry(Level.VERBOSE, LogEntryType.VERBOSE, title, null);
  }

  public void logVerbose(String title, Map<String, String> inline) {
    logEntry(Level.VERBOSE, LogEntryType.VERBOSE, title, inline);
  }

  public void logMessage(String title) {
    logEntry(Level.MESSAGE, LogEntryType.MESSAGE, title, null);
  }

  public void logMessage(String title, Map<String, String> inline) {
    logEntry(Level.MESSAGE, LogEntryType.MESSAGE, title, inline);
  }

  public void logWarning(String title) {
    logEntry(Level.WARNING, LogEntryType.WARNING, title, null);
  }

  public void logWarning(String title, Map<String, String> inline) {
    logEntry(Level.WARNING, LogEntryType.WARNING, title, inline);
  }

  public void logError(String title) {
    logEntry(Level.ERROR, LogEntryType.ERROR, title, null);
  }

  public void logError(String title, Map<String, String> inline) {
    logEntry(Level.ERROR, LogEntryType.ERROR, title, inline);
  }

  public void logFatal(String title) {
    logEntry(Level.FATAL, LogEntryType.FATAL, title, null);
  }

  public void logFatal(String title, Map<String, String> inline) {
    logEntry(Level.FATAL, LogEntryType.FATAL, title, inline);
  }

  /**
   * Logs fragments joined by single spaces, classified by {@code level}.
   *
   * @param level message level
   * @param fragments title fragments; {@code null} elements print as {@code null}
   */
  public void log(Level level, String... fragments) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    String title = fragments == null ? "" : String.join(" ", Arrays.asList(fragments));
    emitEntry(checked, LogEntryType.forLevel(checked), ViewerId.TITLE, title, null, null, null);
  }

  /**
   * Logs a lazily built title; the supplier runs only when the level is admitted.
   *
   * @param level message level
   * @param title title supplier
   */
  public void log(Level level, Supplier<String> title) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    emitEntry(checked, LogEntryType.forLevel(checked), ViewerId.TITLE, title.get(), null, null, null);
  }

  public void logSeparator() {
    logSeparator(host.defaultLevel());
  }

  public void logSeparator(Level level) {
    logEntry(Level.requireCallerLevel(level), LogEntryType.SEPARATOR, "", null);
  }

  /**
   * Reports a misuse of the logging API itself.
   *
   * @param title description of the problem
   */
  public void logInternalError(String title) {
    logEntry(Level.ERROR, LogEntryType.INTERNAL_ERROR, title, null);
  }

  /**
   * Logs {@code title} at error level when {@code condition} is false.
   *
   * @param condition asserted condition
   * @param title failure message
   */
  public void logAssert(boolean condition, String title) {
    if (!condition) {
      logEntry(Level.ERROR, LogEntryType.ASSERT, title, null);
    }
  }

  public void logAssert(boolean condition, Supplier<String> title) {
    if (!condition && isOn(Level.ERROR)) {
      emitEntry(Level.ERROR, LogEntryType.ASSERT, ViewerId.TITLE, title.get(), null, null, null);
    }
  }

  /**
   * Logs {@code title} at the default level when {@code condition} holds.
   *
   * @param condition guard
   * @param title message
   */
  public void logConditional(boolean condition, String title) {
    logConditional(host.defaultLevel(), condition, title);
  }

  public void logConditional(Level level, boolean condition, String title) {
    if (condition) {
      logEntry(Level.requireCallerLevel(level), LogEntryType.CONDITIONAL, title, null);
    }
  }

  public void logException(Throwable error) {
    logException(error, null);
  }

  /**
   * Logs an exception with its stack trace as the data block.
   *
   * @param error exception to log
   * @param title optional title; defaults to the exception message
   */
  public void logException(Throwable error, String title) {
    if (!isOn(Level.ERROR)) {
      return;
    }
    if (error == null) {
      logInternalError("logException: error argument is null");
      return;
    }
    String effectiveTitle = title;
    if (effectiveTitle == null || effectiveTitle.isEmpty()) {
      effectiveTitle = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
    StringWriter trace = new StringWriter();
    error.printStackTrace(new PrintWriter(trace));
    emitEntry(Level.ERROR, LogEntryType.ERROR, ViewerId.DATA, effectiveTitle, text(trace.toString()), null, null);
  }

  public void logText(String title, String text) {
    logText(host.defaultLevel(), title, text);
  }

  /**
   * Logs a block of plain text rendered by the data viewer.
   *
   * @param level entry level
   * @param title entry title
   * @param text body
   */
  public void logText(Level level, String title, String text) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    emitEntry(checked, LogEntryType.TEXT, ViewerId.DATA, title, text(String.valueOf(text)), null, null);
  }

  public void logSource(String title, String source, SourceId sourceId) {
    logSource(host.defaultLevel(), title, source, sourceId);
  }

  /**
   * Logs source code for the console's highlighting viewer.
   *
   * @param level entry level
   * @param title entry title
   * @param source source text
   * @param sourceId language of {@code source}
   */
  public void logSource(Level level, String title, String source, SourceId sourceId) {
    Level checked = Level.requireCallerLevel(level);
    Objects.requireNonNull(sourceId, "sourceId");
    if (!isOn(checked)) {
      return;
    }
    emitEntry(checked, LogEntryType.SOURCE, sourceId.viewer(), title, text(String.valueOf(source)), null, null);
  }

  public void logBinary(String title, byte[] data) {
    logBinary(host.defaultLevel(), title, data);
  }

  /**
   * Logs a slice of {@code data}; out of range bounds are clamped.
   *
   * @param title entry title
   * @param data buffer
   * @param offset first byte
   * @param count number of bytes
   */
  public void logBinary(String title, byte[] data, int offset, int count) {
    if (data == null) {
      logInternalError("logBinary: data argument is null");
      return;
    }
    if (!isOn(host.defaultLevel())) {
      return;
    }
    int from = Math.min(Math.max(0, offset), data.length);
    int to = Math.min(data.length, from + Math.max(0, count));
    emitEntry(host.defaultLevel(), LogEntryType.BINARY, ViewerId.BINARY, title,
        Arrays.copyOfRange(data, from, to), null, null);
  }

  public void logBinary(Level level, String title, byte[] data) {
    Level checked = Level.requireCallerLevel(level);
    if (data == null) {
      logInternalError("logBinary: data argument is null");
      return;
    }
    if (!isOn(checked)) {
      return;
    }
    emitEntry(checked, LogEntryType.BINARY, ViewerId.BINARY, title, data, null, null);
  }

  /**
   * Logs binary data produced only when the level is admitted.
   *
   * @param level entry level
   * @param title entry title
   * @param data payload supplier
   */
  public void logBinary(Level level, String title, Supplier<byte[]> data) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    byte[] bytes = data.get();
    if (bytes == null) {
      logInternalError("logBinary: supplier returned null");
      return;
    }
    emitEntry(checked, LogEntryType.BINARY, ViewerId.BINARY, title, bytes, null, null);
  }

  public void logColored(Color color, String title) {
    logColored(host.defaultLevel(), color, title);
  }

  public void logColored(Level level, Color color, String title) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    emitEntry(checked, LogEntryType.MESSAGE, ViewerId.TITLE, title, null, color, null);
  }

  public void resetCallstack() {
    resetCallstack(host.defaultLevel());
  }

  public void resetCallstack(Level level) {
    logEntry(Level.requireCallerLevel(level), LogEntryType.RESET_CALLSTACK, "", null);
  }

  // Watches

  public void watch(String name, String value) {
    watch(name, value, null);
  }

  public void watch(String name, String value, String group) {
    emitWatch(host.defaultLevel(), name, WatchType.STRING, value, group, null);
  }

  public void watch(String name, long value) {
    watch(name, value, null);
  }

  public void watch(String name, long value, String group) {
    Level defaultLevel = host.defaultLevel();
    if (isOn(defaultLevel)) {
      emitWatch(defaultLevel, name, WatchType.INTEGER, Long.toString(value), group, null);
    }
  }

  public void watch(String name, double value) {
    watch(name, value, null);
  }

  public void watch(String name, double value, String group) {
    Level defaultLevel = host.defaultLevel();
    if (isOn(defaultLevel)) {
      emitWatch(defaultLevel, name, WatchType.FLOAT, Double.toString(value), group, null);
    }
  }

  public void watch(String name, boolean value) {
    watch(name, value, null);
  }

  public void watch(String name, boolean value, String group) {
    emitWatch(host.defaultLevel(), name, WatchType.BOOLEAN, Boolean.toString(value), group, null);
  }

  public void watch(String name, Object value) {
    watch(name, value, null);
  }

  /**
   * Watches an arbitrary value; the watch type follows the runtime type of {@code value}.
   *
   * @param name watch name
   * @param value watched value
   * @param group optional group
   */
  public void watch(String name, Object value, String group) {
    Level defaultLevel = host.defaultLevel();
    if (!isOn(defaultLevel)) {
      return;
    }
    emitWatch(defaultLevel, name, watchTypeOf(value), String.valueOf(value), group, null);
  }

  /**
   * Watches a value carrying metric style labels.
   *
   * @param name watch name
   * @param value watched value
   * @param labels labels; may be {@code null}
   * @param level level, or {@code null} for the client default
   */
  public void watchWithLabels(String name, Object value, Map<String, String> labels, Level level) {
    Level effective = level == null ? host.defaultLevel() : Level.requireCallerLevel(level);
    if (!isOn(effective)) {
      return;
    }
    WatchType type = watchTypeOf(value);
    emitWatch(effective, name, type == WatchType.OBJECT ? WatchType.STRING : type, String.valueOf(value), null,
        labels);
  }

  public MetricBuilder metric(String name) {
    return new MetricBuilder(this, name);
  }

  // Counters, checkpoints, timers

  public void incCounter(String name) {
    incCounter(host.defaultLevel(), name);
  }

  public void incCounter(Level level, String name) {
    adjustCounter(Level.requireCallerLevel(level), name, 1);
  }

  public void decCounter(String name) {
    decCounter(host.defaultLevel(), name);
  }

  public void decCounter(Level level, String name) {
    adjustCounter(Level.requireCallerLevel(level), name, -1);
  }

  public void resetCounter(String name) {
    synchronized (stateLock) {
      counters.remove(name);
    }
  }

  /** Emits {@code Checkpoint #n} using the session's anonymous checkpoint counter. */
  public void addCheckpoint() {
    Level defaultLevel = host.defaultLevel();
    if (!isOn(defaultLevel)) {
      return;
    }
    int value;
    synchronized (stateLock) {
      value = ++checkpointCounter;
    }
    emitEntry(defaultLevel, LogEntryType.CHECKPOINT, ViewerId.TITLE, "Checkpoint #" + value, null, null, null);
  }

  public void addCheckpoint(String name) {
    addCheckpoint(host.defaultLevel(), name, null);
  }

  public void addCheckpoint(String name, String details) {
    addCheckpoint(host.defaultLevel(), name, details);
  }

  /**
   * Emits {@code <name> #n} where {@code n} counts calls with this name.
   *
   * @param level entry level
   * @param name checkpoint name
   * @param details optional suffix shown in parentheses
   */
  public void addCheckpoint(Level level, String name, String details) {
    Level checked = Level.requireCallerLevel(level);
    Objects.requireNonNull(name, "name");
    if (!isOn(checked)) {
      return;
    }
    int value;
    synchronized (stateLock) {
      value = checkpoints.merge(name, 1, Integer::sum);
    }
    String title = name + " #" + value;
    if (details != null && !details.isEmpty()) {
      title += " (" + details + ")";
    }
    emitEntry(checked, LogEntryType.CHECKPOINT, ViewerId.TITLE, title, null, null, null);
  }

  public void resetCheckpoint() {
    synchronized (stateLock) {
      checkpointCounter = 0;
    }
  }

  public void resetCheckpoint(String name) {
    synchronized (stateLock) {
      checkpoints.remove(name);
    }
  }

  /**
   * Starts (or restarts) a named timer.
   *
   * @param name timer name
   */
  public void timeStart(String name) {
    Objects.requireNonNull(name, "name");
    synchronized (stateLock) {
      timers.put(name, host.clock().nowMicros());
    }
    logMessage("Timer \"" + name + "\" started");
  }

  /**
   * Stops a named timer, watching and logging the elapsed milliseconds.
   *
   * @param name timer name
   */
  public void timeEnd(String name) {
    Long started;
    synchronized (stateLock) {
      started = timers.remove(name);
    }
    if (started == null) {
      logWarning("Timer \"" + name + "\" not found");
      return;
    }
    double elapsedMillis = (host.clock().nowMicros() - started) / 1_000.0;
    watch(name, elapsedMillis);
    logMessage(String.format(Locale.ROOT, "Timer \"%s\": %.3fms", name, elapsedMillis));
  }

  // Flow

  public void enterMethod(String methodName) {
    enterMethod(host.defaultLevel(), methodName);
  }

  /**
   * Marks entry into a method with a log entry and a process-flow packet.
   *
   * @param level entry level
   * @param methodName method name
   */
  public void enterMethod(Level level, String methodName) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    emitEntry(checked, LogEntryType.ENTER_METHOD, ViewerId.TITLE, methodName, null, null, null);
    emitFlow(checked, ProcessFlowType.ENTER_METHOD, methodName);
  }

  public void leaveMethod(String methodName) {
    leaveMethod(host.defaultLevel(), methodName);
  }

  public void leaveMethod(Level level, String methodName) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    emitEntry(checked, LogEntryType.LEAVE_METHOD, ViewerId.TITLE, methodName, null, null, null);
    emitFlow(checked, ProcessFlowType.LEAVE_METHOD, methodName);
  }

  public Scope trackMethod(String methodName) {
    return trackMethod(host.defaultLevel(), methodName);
  }

  /**
   * Enters a method now and leaves it when the returned scope closes.
   *
   * <pre>{@code
   * try (Scope ignored = session.trackMethod("TaxService.assess")) {
   *   ...
   * }
   * }</pre>
   *
   * @param level entry level
   * @param methodName method name
   * @return scope that emits the leave markers once
   */
  public Scope trackMethod(Level level, String methodName) {
    Level checked = Level.requireCallerLevel(level);
    enterMethod(checked, methodName);
    return new Scope() {
      private boolean closed;

      @Override
      public void close() {
        if (!closed) {
          closed = true;
          leaveMethod(checked, methodName);
        }
      }
    };
  }

  public void enterThread() {
    enterThread(host.defaultLevel(), MAIN_THREAD);
  }

  public void enterThread(String threadName) {
    enterThread(host.defaultLevel(), threadName);
  }

  public void enterThread(Level level, String threadName) {
    flowOnly(level, ProcessFlowType.ENTER_THREAD, threadName);
  }

  public void leaveThread() {
    leaveThread(host.defaultLevel(), MAIN_THREAD);
  }

  public void leaveThread(String threadName) {
    leaveThread(host.defaultLevel(), threadName);
  }

  public void leaveThread(Level level, String threadName) {
    flowOnly(level, ProcessFlowType.LEAVE_THREAD, threadName);
  }

  public void enterProcess() {
    enterProcess(host.defaultLevel(), host.appName());
  }

  public void enterProcess(String processName) {
    enterProcess(host.defaultLevel(), processName);
  }

  /**
   * Marks process start: an enter-process packet followed by an enter-thread packet for the main thread.
   *
   * @param level entry level
   * @param processName process name
   */
  public void enterProcess(Level level, String processName) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    emitFlow(checked, ProcessFlowType.ENTER_PROCESS, processName);
    emitFlow(checked, ProcessFlowType.ENTER_THREAD, MAIN_THREAD);
  }

  public void leaveProcess() {
    leaveProcess(host.defaultLevel(), host.appName());
  }

  public void leaveProcess(String processName) {
    leaveProcess(host.defaultLevel(), processName);
  }

  public void leaveProcess(Level level, String processName) {
    Level checked = Level.requireCallerLevel(level);
    if (!isOn(checked)) {
      return;
    }
    emitFlow(checked, ProcessFlowType.LEAVE_THREAD, MAIN_THREAD);
    emitFlow(checked, ProcessFlowType.LEAVE_PROCESS, processName);
  }

  // Streams

  public void logStream(String channel, String data) {
    logStream(host.defaultLevel(), channel, data, null, null);
  }

  /**
   * Appends data to a named console channel.
   *
   * @param level packet level
   * @param channel channel name
   * @param data payload
   * @param streamType optional content type hint
   * @param group optional group
   */
  public void logStream(Level level, String channel, String data, String streamType, String group) {
    Level checked = Level.requireCallerLevel(level);
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(data, "data");
    if (!isOn(checked)) {
      return;
    }
    host.submit(new StreamPacket(header(checked, Map.of()), channel, data, streamType, group));
  }

  // Control commands

  public void clearLog() {
    control(ControlCommandType.CLEAR_LOG);
  }

  public void clearWatches() {
    control(ControlCommandType.CLEAR_WATCHES);
  }

  public void clearAutoViews() {
    control(ControlCommandType.CLEAR_AUTO_VIEWS);
  }

  public void clearAll() {
    control(ControlCommandType.CLEAR_ALL);
  }

  public void clearProcessFlow() {
    control(ControlCommandType.CLEAR_PROCESS_FLOW);
  }

  @Override
  public String toString() {
    return "Session{" + name + ", level=" + level + ", active=" + active + '}';
  }

  private void logEntry(Level level, LogEntryType type, String title, Map<String, String> inline) {
    if (isOn(level)) {
      emitEntry(level, type, ViewerId.TITLE, title, null, null, inline);
    }
  }

  private void emitEntry(
      Level level,
      LogEntryType type,
      ViewerId viewer,
      String title,
      byte[] data,
      Color entryColor,
      Map<String, String> inline) {
    ContextSnapshot snapshot = host.context().snapshot(inline);
    PacketHeader header = headerFrom(level, snapshot);
    host.submit(new LogEntry(
        header,
        type,
        viewer,
        title == null ? "" : title,
        host.appName(),
        host.hostName(),
        host.processId(),
        currentThreadId(),
        entryColor != null ? entryColor : color,
        snapshot.depth(),
        data));
  }

  private void emitWatch(
      Level level, String watchName, WatchType type, String value, String group, Map<String, String> labels) {
    Objects.requireNonNull(watchName, "name");
    if (!isOn(level)) {
      return;
    }
    host.submit(new Watch(header(level, Map.of()), watchName, value, type, group, labels));
  }

  private void emitFlow(Level level, ProcessFlowType type, String title) {
    host.submit(new ProcessFlow(
        header(level, Map.of()), type, title, host.hostName(), host.processId(), currentThreadId()));
  }

  private void flowOnly(Level level, ProcessFlowType type, String title) {
    Level checked = Level.requireCallerLevel(level);
    if (isOn(checked)) {
      emitFlow(checked, type, title);
    }
  }

  private void adjustCounter(Level level, String counterName, long delta) {
    Objects.requireNonNull(counterName, "name");
    if (!isOn(level)) {
      return;
    }
    long value;
    synchronized (stateLock) {
      value = counters.merge(counterName, delta, Long::sum);
    }
    host.submit(new Watch(header(level, Map.of()), counterName, Long.toString(value), WatchType.INTEGER, null,
        null));
  }

  private void control(ControlCommandType type) {
    if (isOn()) {
      host.submit(new ControlCommand(header(Level.CONTROL, Map.of()), type, null));
    }
  }

  private PacketHeader header(Level level, Map<String, String> inline) {
    return headerFrom(level, host.context().snapshot(inline));
  }

  private PacketHeader headerFrom(Level level, ContextSnapshot snapshot) {
    return new PacketHeader(level, host.clock().nowMicros(), name, snapshot.tags(), snapshot.correlationId(),
        snapshot.operationId());
  }

  private static WatchType watchTypeOf(Object value) {
    if (value instanceof String) {
      return WatchType.STRING;
    }
    if (value instanceof Character) {
      return WatchType.CHAR;
    }
    if (value instanceof Boolean) {
      return WatchType.BOOLEAN;
    }
    if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
      return WatchType.INTEGER;
    }
    if (value instanceof Number) {
      return WatchType.FLOAT;
    }
    if (value instanceof TemporalAccessor) {
      return WatchType.TIMESTAMP;
    }
    return WatchType.OBJECT;
  }

  private static byte[] text(String body) {
    byte[] content = body.getBytes(StandardCharsets.UTF_8);
    byte[] out = new byte[UTF8_BOM.length + content.length];
    System.arraycopy(UTF8_BOM, 0, out, 0, UTF8_BOM.length);
    System.arraycopy(content, 0, out, UTF8_BOM.length, content.length);
    return out;
  }

  private static int currentThreadId() {
    return (int) Thread.currentThread().getId();
  }
}
