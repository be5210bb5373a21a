package ca.gc.cra.beacon.domain.context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent collector of tags that opens a single scope.
 *
 * @since 0.1.0
 */
public final class ContextBuilder {
  private final ContextPropagator propagator;
  private final Map<String, String> tags = new LinkedHashMap<>();

  ContextBuilder(ContextPropagator propagator) {
    this.propagator = propagator;
  }

  /**
   * Adds a tag; {@code null} values are skipped.
   *
   * @param key tag key
   * @param value tag value, converted with {@link String#valueOf(Object)}
   * @return this builder
   */
  public ContextBuilder with(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (value != null) {
      tags.put(key, String.valueOf(value));
    }
    return this;
  }

  /**
   * Opens a scope carrying every tag added so far.
   *
   * @return scope to close when the region ends
   */
  public Scope begin() {
    return propagator.scope(tags);
  }
}
