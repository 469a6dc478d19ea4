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
 * Top locations by collision count. Serves both the plain and the weather-filtered kind.
 */
public final class HotspotAggregation implements Aggregation {
  static final int TOP_N = 5;

  private final AnalysisKind kind;

  public HotspotAggregation(AnalysisKind kind) {
    this.kind = kind;
  }

  private static final class Tally {
    int count;
    int severe;
    long hourSum;
  }

  @Override
  public AggregationResult aggregate(AggregationInput input) {
    WeatherFilter wf = input.request().hasActiveWeatherFilter() ? input.request().weatherFilter() : null;
    List<IncidentRecord> src = Rows.byCondition(input.collisions(), wf);

    Map<String, Tally> byLocation = new LinkedHashMap<>();
    for (IncidentRecord r : src) {
      Tally t = byLocation.computeIfAbsent(r.location(), k -> new Tally());
      t.count++;
      t.hourSum += r.hour();
      if (r.isSevere()) {
        t.severe++;
      }
    }

    List<Map.Entry<String, Tally>> sorted = new ArrayList<>(byLocation.entrySet());
    sorted.sort(Comparator.comparingInt((Map.Entry<String, Tally> e) -> e.getValue().count).reversed());

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map.Entry<String, Tally> e : sorted.subList(0, Math.min(TOP_N, sorted.size()))) {
      Tally t = e.getValue();
      rows.add(Rows.row(
          "location", e.getKey(),
          "total_collisions", t.count,
          "severe", t.severe,
          "mean_hour", Rows.round((double) t.hourSum / t.count, 1)));
    }
    return new AggregationResult(rows,
        ResultAttributes.of(kind).withWeatherApplied(wf == null ? null : wf.describe()));
  }
}
