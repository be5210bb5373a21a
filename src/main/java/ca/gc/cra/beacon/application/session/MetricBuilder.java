package ca.gc.cra.beacon.application.session;

import ca.gc.cra.beacon.domain.packet.Level;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder for a labelled watch, obtained from {@link Session#metric(String)}.
 *
 * <pre>{@code
 * session.metric("http.requests").withLabel("route", "/tax").forInstance("pod-3").set(42);
 * }</pre>
 *
 * <p>Not thread-safe; build and {@link #set(Object)} on one thread.</p>
 *
 * @since 0.1.0
 */
public final class MetricBuilder {
  private final Session session;
  private final String name;
  private final Map<String, String> labels = new LinkedHashMap<>();
  private Level level;

  MetricBuilder(Session session, String name) {
    this.session = session;
    this.name = Objects.requireNonNull(name, "name");
  }

  /**
   * Adds a label; a {@code null} value is recorded as an empty string.
   *
   * @param key label name
   * @param value label value
   * @return this builder
   */
  public MetricBuilder withLabel(String key, Object value) {
    labels.put(Objects.requireNonNull(key, "key"), value == null ? "" : String.valueOf(value));
    return this;
  }

  /**
   * Shorthand for {@code withLabel("instance", instance)}.
   *
   * @param instance instance identifier
   * @return this builder
   */
  public MetricBuilder forInstance(String instance) {
    return withLabel("instance", instance);
  }

  public MetricBuilder withLevel(Level level) {
    this.level = Level.requireCallerLevel(level);
    return this;
  }

  /**
   * Emits the watch with the collected labels.
   *
   * @param value metric value
   */
  public void set(Object value) {
    session.watchWithLabels(name, value, labels, level);
  }
}
