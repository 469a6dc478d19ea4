package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Grouped rows (column order preserved) plus their attributes. Rows are read-only.
 */
public record AggregationResult(List<Map<String, Object>> rows, ResultAttributes attributes) {

  public AggregationResult {
    List<Map<String, Object>> copy = new ArrayList<>();
    if (rows != null) {
      for (Map<String, Object> r : rows) {
        copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
      }
    }
    rows = Collections.unmodifiableList(copy);
  }

  public static AggregationResult empty(AnalysisKind kind) {
    return new AggregationResult(List.of(), ResultAttributes.of(kind));
  }

  public AnalysisKind kind() {
    return attributes.kind();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public Map<String, Object> first() {
    return rows.isEmpty() ? Map.of() : rows.get(0);
  }

  public AggregationResult withAttributes(UnaryOperator<ResultAttributes> change) {
    return new AggregationResult(rows, change.apply(attributes));
  }
}
