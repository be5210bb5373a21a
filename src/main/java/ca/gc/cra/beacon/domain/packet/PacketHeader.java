package ca.gc.cra.beacon.domain.packet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Fields shared by every packet kind.
 * <p><strong>Why:</strong> Level, origin session, and the frozen context snapshot travel with each packet so the
 * console can filter and correlate regardless of kind.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the context map is copied and wrapped at construction. Entries
 * with a {@code null} key or value are left out of the copy, since the wire format cannot carry them.</p>
 *
 * @param level packet level; never {@code null}
 * @param timestampMicros creation time in microseconds since the Unix epoch
 * @param sessionName originating session name; never {@code null}
 * @param context merged context tags frozen at creation; never {@code null}
 * @param correlationId active correlation id or {@code null}
 * @param operationId active operation name or {@code null}
 * @since 0.1.0
 */
public record PacketHeader(
    Level level,
    long timestampMicros,
    String sessionName,
    Map<String, String> context,
    String correlationId,
    String operationId) {

  public PacketHeader {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(sessionName, "sessionName");
    context = copyTags(context);
  }

  static Map<String, String> copyTags(Map<String, String> tags) {
    if (tags == null || tags.isEmpty()) {
      return Map.of();
    }
    Map<String, String> copy = new LinkedHashMap<>(tags.size());
    tags.forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    return copy.isEmpty() ? Map.of() : Collections.unmodifiableMap(copy);
  }

  /**
   * Builds a header without context or correlation.
   *
   * @param level packet level
   * @param timestampMicros creation time in microseconds
   * @param sessionName originating session
   * @return header with empty context
   */
  public static PacketHeader of(Level level, long timestampMicros, String sessionName) {
    return new PacketHeader(level, timestampMicros, sessionName, Map.of(), null, null);
  }
}
