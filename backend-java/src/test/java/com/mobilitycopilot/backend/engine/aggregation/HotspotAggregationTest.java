package com.mobilitycopilot.backend.engine.aggregation;

import static com.mobilitycopilot.backend.engine.Fixtures.ANCHOR;
import static com.mobilitycopilot.backend.engine.Fixtures.collision;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mobilitycopilot.backend.engine.AggregationEngine;
import com.mobilitycopilot.backend.engine.AggregationResult;
import com.mobilitycopilot.backend.engine.AnalysisKind;
import com.mobilitycopilot.backend.engine.AnalysisRequest;
import com.mobilitycopilot.backend.engine.Fixtures;
import com.mobilitycopilot.backend.engine.PeriodResolver;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.RecordStore;

class HotspotAggregationTest {
  private final PeriodResolver periods = Fixtures.periods();
  private final AggregationEngine engine = new AggregationEngine(periods);

  private static void add(List<IncidentRecord> out, String location, int n, String condition) {
    for (int i = 0; i < n; i++) {
      out.add(collision(ANCHOR.minusDays(i), location, "Ville-Marie", condition, i == 0 ? 3 : 1));
    }
  }

  @Test
  @DisplayName("top five locations by count, ties keep first-seen order")
  void topFiveStableOnTies() {
    List<IncidentRecord> rows = new ArrayList<>();
    add(rows, "Saint-Denis / Sherbrooke", 3, "Sèche");
    add(rows, "Pie-IX / Jean-Talon", 3, "Sèche");
    add(rows, "Papineau / Ontario", 5, "Sèche");
    add(rows, "Décarie / Côte-Vertu", 1, "Sèche");
    add(rows, "Sherbrooke / Pie-IX", 2, "Sèche");
    add(rows, "Rachel / Papineau", 2, "Sèche");
    add(rows, "Atwater / Notre-Dame", 1, "Sèche");
    RecordStore store = new RecordStore(rows, List.of(), List.of(), List.of());

    AggregationResult r = engine.run(store,
        AnalysisRequest.forQuestion(AnalysisKind.HOTSPOTS, periods.named(PeriodResolver.LAST_30_DAYS), "top"));

    assertEquals(5, r.rows().size());
    List<String> order = r.rows().stream().map(m -> (String) m.get("location")).toList();
    assertEquals(List.of("Papineau / Ontario", "Saint-Denis / Sherbrooke", "Pie-IX / Jean-Talon",
        "Sherbrooke / Pie-IX", "Rachel / Papineau"), order);

    Map<String, Object> top = r.first();
    assertEquals(5, top.get("total_collisions"));
    assertEquals(1, top.get("severe"));
    assertEquals(8.0, top.get("mean_hour"));
    assertEquals(List.of("location", "total_collisions", "severe", "mean_hour"), List.copyOf(top.keySet()));
  }

  @Test
  @DisplayName("weather variant keeps only matching surface conditions")
  void weatherFilter() {
    List<IncidentRecord> rows = new ArrayList<>();
    add(rows, "Saint-Denis / Sherbrooke", 4, "Sèche");
    add(rows, "Pie-IX / Jean-Talon", 2, "Enneigée");
    RecordStore store = new RecordStore(rows, List.of(), List.of(), List.of());

    AggregationResult r = engine.run(store, AnalysisRequest.forQuestion(AnalysisKind.HOTSPOTS_WEATHER,
        periods.named(PeriodResolver.LAST_30_DAYS), "Quelles rues quand il neige ?"));

    assertEquals(1, r.rows().size());
    assertEquals("Pie-IX / Jean-Talon", r.first().get("location"));
    assertEquals("enneig|neige", r.attributes().weatherFilterApplied());
    assertEquals("enneig|neige", r.attributes().weatherFilterRequested());
    assertFalse(r.attributes().weatherRelaxed());
  }

  @Test
  void emptyWindowGivesNoRows() {
    AggregationResult r = engine.run(RecordStore.empty(),
        AnalysisRequest.forQuestion(AnalysisKind.HOTSPOTS, periods.named(PeriodResolver.LAST_7_DAYS), "top"));
    assertTrue(r.isEmpty());
    assertEquals(PeriodResolver.LAST_7_DAYS, r.attributes().period());
  }
}
