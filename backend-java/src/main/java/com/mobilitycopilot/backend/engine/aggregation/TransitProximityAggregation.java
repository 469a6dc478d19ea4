package com.mobilitycopilot.backend.engine.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.mobilitycopilot.backend.engine.AggregationResult;
import com.mobilitycopilot.backend.engine.AnalysisKind;
import com.mobilitycopilot.backend.engine.ResultAttributes;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.TransitStopRecord;

/**
 * Collisions near transit stops, approximated by a shared coordinate grid
 * (no distance computation). Only cells holding both stops and collisions are kept.
 */
public final class TransitProximityAggregation implements Aggregation {
  static final double LAT_STEP = 0.008;
  static final double LON_STEP = 0.010;
  static final int TOP_N = 5;
  static final int NAMES_PER_CELL = 2;

  record Cell(long lat, long lon) {
    static Cell of(double latitude, double longitude) {
      return new Cell((long) Math.rint(latitude / LAT_STEP), (long) Math.rint(longitude / LON_STEP));
    }
  }

  private static final class Tally {
    int count;
    int severe;
  }

  @Override
  public AggregationResult aggregate(AggregationInput input) {
    Map<Cell, Set<String>> stops = new LinkedHashMap<>();
    Map<Cell, Integer> stopCounts = new LinkedHashMap<>();
    for (TransitStopRecord s : input.store().transitStops()) {
      Cell c = Cell.of(s.latitude(), s.longitude());
      // label lists distinct names; stop_count keeps every stop
      stops.computeIfAbsent(c, k -> new LinkedHashSet<>()).add(s.stopName());
      stopCounts.merge(c, 1, Integer::sum);
    }

    Map<Cell, Tally> collisions = new LinkedHashMap<>();
    for (IncidentRecord r : input.collisions()) {
      Cell c = Cell.of(r.latitude(), r.longitude());
      if (!stops.containsKey(c)) {
        continue;
      }
      Tally t = collisions.computeIfAbsent(c, k -> new Tally());
      t.count++;
      if (r.isSevere()) {
        t.severe++;
      }
    }

    List<Map.Entry<Cell, Tally>> sorted = new ArrayList<>(collisions.entrySet());
    sorted.sort(Comparator.comparingInt((Map.Entry<Cell, Tally> e) -> e.getValue().count).reversed());

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map.Entry<Cell, Tally> e : sorted.subList(0, Math.min(TOP_N, sorted.size()))) {
      Cell c = e.getKey();
      List<String> names = new ArrayList<>(stops.get(c));
      rows.add(Rows.row(
          "stop_name", String.join(", ", names.subList(0, Math.min(NAMES_PER_CELL, names.size()))),
          "total", e.getValue().count,
          "severe", e.getValue().severe,
          "stop_count", stopCounts.get(c),
          "lat_zone", Rows.round(c.lat() * LAT_STEP, 4),
          "lon_zone", Rows.round(c.lon() * LON_STEP, 4)));
    }
    return new AggregationResult(rows, ResultAttributes.of(AnalysisKind.TRANSIT_PROXIMITY));
  }
}
