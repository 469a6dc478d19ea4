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
 * Collisions per condition label with the share of severe ones.
 */
public final class WeatherCorrelationAggregation implements Aggregation {

  @Override
  public AggregationResult aggregate(AggregationInput input) {
    WeatherFilter wf = input.request().hasActiveWeatherFilter() ? input.request().weatherFilter() : null;
    List<IncidentRecord> src = Rows.byCondition(input.collisions(), wf);

    Map<String, int[]> byCondition = new LinkedHashMap<>();
    for (IncidentRecord r : src) {
      int[] c = byCondition.computeIfAbsent(r.condition(), k -> new int[2]);
      c[0]++;
      if (r.isSevere()) {
        c[1]++;
      }
    }

    List<Map.Entry<String, int[]>> sorted = new ArrayList<>(byCondition.entrySet());
    sorted.sort(Comparator.comparingInt((Map.Entry<String, int[]> e) -> e.getValue()[0]).reversed());

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map.Entry<String, int[]> e : sorted) {
      int total = e.getValue()[0];
      int severe = e.getValue()[1];
      rows.add(Rows.row(
          "condition", e.getKey(),
          "total", total,
          "severe", severe,
          "severe_rate", Rows.round(100.0 * severe / total, 1)));
    }
    return new AggregationResult(rows, ResultAttributes.of(AnalysisKind.WEATHER_CORRELATION)
        .withWeatherApplied(wf == null ? null : wf.describe()));
  }
}
