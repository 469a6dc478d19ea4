package com.mobilitycopilot.backend.engine.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mobilitycopilot.backend.engine.AggregationResult;
import com.mobilitycopilot.backend.engine.AnalysisKind;
import com.mobilitycopilot.backend.engine.ResultAttributes;
import com.mobilitycopilot.backend.engine.WeatherFilter;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;

/**
 * Neighborhoods ranked by collisions under the requested condition.
 */
public final class NeighborhoodWeatherAggregation implements Aggregation {
  static final int TOP_N = 8;

  @Override
  public AggregationResult aggregate(AggregationInput input) {
    WeatherFilter wf = input.request().hasActiveWeatherFilter() ? input.request().weatherFilter() : null;
    List<IncidentRecord> src = Rows.byCondition(input.collisions(), wf);

    Map<String, int[]> byArea = new LinkedHashMap<>();
    for (IncidentRecord r : src) {
      int[] c = byArea.computeIfAbsent(r.neighborhood(), k -> new int[2]);
      c[0]++;
      if (r.isSevere()) {
        c[1]++;
      }
    }

    List<Map.Entry<String, int[]>> sorted = new ArrayList<>(byArea.entrySet());
    sorted.sort(Comparator.comparingInt((Map.Entry<String, int[]> e) -> e.getValue()[0]).reversed());

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map.Entry<String, int[]> e : sorted.subList(0, Math.min(TOP_N, sorted.size()))) {
      rows.add(Rows.row(
          "neighborhood", e.getKey(),
          "collisions", e.getValue()[0],
          "severe", e.getValue()[1]));
    }
    return new AggregationResult(rows, ResultAttributes.of(AnalysisKind.NEIGHBORHOODS_WEATHER)
        .withWeatherApplied(wf == null ? null : wf.describe()));
  }
}
