package com.mobilitycopilot.backend.engine.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mobilitycopilot.backend.engine.AggregationResult;
import com.mobilitycopilot.backend.engine.AnalysisKind;
import com.mobilitycopilot.backend.engine.ResultAttributes;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

/**
 * Combined neighborhood score {@code 2 x collisions + requests}, missing side counted as 0.
 */
public final class NeighborhoodScoreAggregation implements Aggregation {
  static final int TOP_N = 8;
  static final int COLLISION_WEIGHT = 2;

  @Override
  public AggregationResult aggregate(AggregationInput input) {
    Map<String, int[]> byArea = new LinkedHashMap<>();
    for (IncidentRecord r : input.collisions()) {
      byArea.computeIfAbsent(r.neighborhood(), k -> new int[2])[0]++;
    }
    for (ServiceRequestRecord r : input.requests()) {
      byArea.computeIfAbsent(r.neighborhood(), k -> new int[2])[1]++;
    }

    List<Map.Entry<String, int[]>> sorted = new ArrayList<>(byArea.entrySet());
    sorted.sort(Comparator.comparingInt((Map.Entry<String, int[]> e) -> score(e.getValue())).reversed());

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map.Entry<String, int[]> e : sorted.subList(0, Math.min(TOP_N, sorted.size()))) {
      rows.add(Rows.row(
          "neighborhood", e.getKey(),
          "collisions", e.getValue()[0],
          "requests_311", e.getValue()[1],
          "score", score(e.getValue())));
    }
    return new AggregationResult(rows, ResultAttributes.of(AnalysisKind.NEIGHBORHOODS));
  }

  private static int score(int[] c) {
    return COLLISION_WEIGHT * c[0] + c[1];
  }
}
