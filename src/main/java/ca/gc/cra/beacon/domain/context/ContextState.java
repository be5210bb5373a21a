package ca.gc.cra.beacon.domain.context;

import java.util.Map;

/**
 * Immutable value held for one logical execution context. Tags are stored pre-merged so reads are O(1).
 */
record ContextState(
    Map<String, String> tags, String correlationId, String operationName, int depth) {

  static final ContextState EMPTY = new ContextState(Map.of(), null, null, 0);

  ContextState withTags(Map<String, String> merged) {
    return new ContextState(merged, correlationId, operationName, depth);
  }

  ContextState withCorrelation(String newCorrelationId, String newOperationName) {
    return new ContextState(tags, newCorrelationId, newOperationName, 0);
  }

  ContextState withOperation(String name) {
    return new ContextState(tags, correlationId, name, depth + 1);
  }
}
