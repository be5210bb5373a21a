package ca.gc.cra.beacon.domain.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frozen view of the active context, copied into packets at creation time.
 *
 * @param tags merged tag map; never {@code null}
 * @param correlationId active correlation id or {@code null}
 * @param operationId active operation name or {@code null}
 * @param depth nesting depth of the active operation
 * @since 0.1.0
 */
public record ContextSnapshot(
    Map<String, String> tags, String correlationId, String operationId, int depth) {

  /** Snapshot with no tags and no correlation. */
  public static final ContextSnapshot EMPTY = new ContextSnapshot(Map.of(), null, null, 0);

  public ContextSnapshot {
    tags = tags == null || tags.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }
}
