package ca.gc.cra.beacon.domain.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Owns the scoped context tags and correlation state of one client instance.
 * <p><strong>Why:</strong> Packets must carry the tags and correlation active where they were created, even when
 * the work hops between threads.</p>
 * <p><strong>Role:</strong> Domain service consulted by sessions when they stamp packet headers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Push and pop tag frames with inner-wins merging.</li>
 *   <li>Track correlation id, operation name, and operation depth.</li>
 *   <li>Freeze snapshots and carry captured state to other threads.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> State is immutable and held per thread; each thread sees only the scopes it
 * opened or installed through a {@link ContextCarrier}.</p>
 * <p><strong>Performance:</strong> Opening a scope copies the merged map once; snapshots reuse it.</p>
 *
 * @implNote Closing a scope restores the state captured when that scope was opened, so out-of-order closes never
 * leak tags from an inner frame.
 * @since 0.1.0
 */
public final class ContextPropagator {
  /** Inline key that overrides the correlation id of a single packet. */
  public static final String TRACE_ID_KEY = "_traceId";
  /** Inline key that overrides the operation name of a single packet. */
  public static final String SPAN_NAME_KEY = "_spanName";

  private final ThreadLocal<ContextState> current = ThreadLocal.withInitial(() -> ContextState.EMPTY);

  /**
   * Pushes a tag frame; {@code null} values are skipped.
   *
   * @param tags tags to add; inner frames win on key collision
   * @return scope restoring the previous frame on close
   */
  public Scope scope(Map<String, String> tags) {
    Objects.requireNonNull(tags, "tags");
    ContextState before = current.get();
    if (tags.isEmpty()) {
      return restoreTo(before);
    }
    Map<String, String> merged = new LinkedHashMap<>(before.tags());
    for (Map.Entry<String, String> entry : tags.entrySet()) {
      String key = Objects.requireNonNull(entry.getKey(), "tag key");
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    current.set(before.withTags(Collections.unmodifiableMap(merged)));
    return restoreTo(before);
  }

  /**
   * Pushes a single tag frame.
   *
   * @param key tag key
   * @param value tag value
   * @return scope restoring the previous frame on close
   */
  public Scope scope(String key, String value) {
    Map<String, String> single = new LinkedHashMap<>();
    single.put(Objects.requireNonNull(key, "key"), value);
    return scope(single);
  }

  /**
   * Starts collecting tags for a multi-key scope.
   *
   * @return builder bound to this propagator
   */
  public ContextBuilder builder() {
    return new ContextBuilder(this);
  }

  /**
   * Starts a new correlation with a random 32 character hex id and resets the operation depth.
   *
   * @param operationName optional operation name
   * @return scope restoring the previous correlation on close
   */
  public Scope beginCorrelation(String operationName) {
    ContextState before = current.get();
    String id = UUID.randomUUID().toString().replace("-", "");
    current.set(before.withCorrelation(id, operationName));
    return restoreTo(before);
  }

  /**
   * Enters a named operation under the current correlation, increasing the depth by one.
   *
   * @param name operation name
   * @return scope restoring the previous operation on close
   */
  public Scope beginOperation(String name) {
    Objects.requireNonNull(name, "name");
    ContextState before = current.get();
    current.set(before.withOperation(name));
    return restoreTo(before);
  }

  /**
   * Returns the merged tags visible to the caller.
   *
   * @return immutable tag map
   */
  public Map<String, String> current() {
    return current.get().tags();
  }

  public String correlationId() {
    return current.get().correlationId();
  }

  public String operationName() {
    return current.get().operationName();
  }

  public int operationDepth() {
    return current.get().depth();
  }

  /**
   * Freezes the active context merged with per-call tags.
   *
   * <p>Inline tags win on collision. The reserved keys {@value #TRACE_ID_KEY} and {@value #SPAN_NAME_KEY} override
   * the correlation id and operation name and are removed from the resulting tags.</p>
   *
   * @param inline per-call tags; may be {@code null}
   * @return frozen snapshot
   */
  public ContextSnapshot snapshot(Map<String, String> inline) {
    ContextState state = current.get();
    if (inline == null || inline.isEmpty()) {
      if (state.tags().isEmpty() && state.correlationId() == null && state.operationName() == null) {
        return ContextSnapshot.EMPTY;
      }
      return new ContextSnapshot(state.tags(), state.correlationId(), state.operationName(), state.depth());
    }
    Map<String, String> merged = new LinkedHashMap<>(state.tags());
    String correlationId = state.correlationId();
    String operation = state.operationName();
    for (Map.Entry<String, String> entry : inline.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (TRACE_ID_KEY.equals(key)) {
        correlationId = value;
      } else if (SPAN_NAME_KEY.equals(key)) {
        operation = value;
      } else {
        merged.put(key, value);
      }
    }
    return new ContextSnapshot(merged, correlationId, operation, state.depth());
  }

  /**
   * Captures the active context for use on another thread.
   *
   * @return carrier re-establishing this context
   */
  public ContextCarrier capture() {
    return new ContextCarrier(this, current.get());
  }

  /** Drops every frame on the calling thread. */
  public void clear() {
    current.remove();
  }

  Scope install(ContextState state) {
    ContextState before = current.get();
    current.set(state);
    return restoreTo(before);
  }

  private Scope restoreTo(ContextState before) {
    return new Scope() {
      private boolean closed;

      @Override
      public void close() {
        if (closed) {
          return;
        }
        closed = true;
        if (before == ContextState.EMPTY) {
          current.remove();
        } else {
          current.set(before);
        }
      }
    };
  }
}
