package com.mobilitycopilot.backend.engine.aggregation;

import static com.mobilitycopilot.backend.engine.Fixtures.ANCHOR;
import static com.mobilitycopilot.backend.engine.Fixtures.collision;
import static com.mobilitycopilot.backend.engine.Fixtures.request;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

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
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

class NeighborhoodScoreAggregationTest {
  private final PeriodResolver periods = Fixtures.periods();

  @Test
  @DisplayName("score is twice the collisions plus the 311 requests, missing side counts as zero")
  void scoreFormula() {
    List<IncidentRecord> collisions = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      collisions.add(collision(ANCHOR, "A", "Plateau", "Sèche"));
    }
    collisions.add(collision(ANCHOR, "B", "Verdun", "Sèche"));
    List<ServiceRequestRecord> requests = new ArrayList<>();
    requests.add(request(ANCHOR, "Nids-de-poule", "Plateau", 1.0));
    for (int i = 0; i < 6; i++) {
      requests.add(request(ANCHOR, "Nids-de-poule", "Verdun", 1.0));
    }
    requests.add(request(ANCHOR, "Éclairage", "Anjou", null));
    requests.add(request(ANCHOR, "Éclairage", "Anjou", null));
    RecordStore store = new RecordStore(collisions, requests, List.of(), List.of());

    AggregationResult r = new AggregationEngine(periods).run(store, AnalysisRequest.forQuestion(
        AnalysisKind.NEIGHBORHOODS, periods.named(PeriodResolver.LAST_30_DAYS), "Quels quartiers ?"));

    List<String> order = r.rows().stream().map(m -> (String) m.get("neighborhood")).toList();
    assertEquals(List.of("Verdun", "Plateau", "Anjou"), order);
    assertEquals(8, r.rows().get(0).get("score"));
    assertEquals(7, r.rows().get(1).get("score"));
    assertEquals(0, r.rows().get(2).get("collisions"));
    assertEquals(2, r.rows().get(2).get("score"));
  }
}
