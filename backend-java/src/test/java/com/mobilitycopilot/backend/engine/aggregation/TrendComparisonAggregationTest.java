package com.mobilitycopilot.backend.engine.aggregation;

import static com.mobilitycopilot.backend.engine.Fixtures.ANCHOR;
import static com.mobilitycopilot.backend.engine.Fixtures.collision;
import static com.mobilitycopilot.backend.engine.Fixtures.request;
import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mobilitycopilot.backend.engine.AggregationEngine;
import com.mobilitycopilot.backend.engine.AggregationResult;
import com.mobilitycopilot.backend.engine.AnalysisKind;
import com.mobilitycopilot.backend.engine.AnalysisRequest;
import com.mobilitycopilot.backend.engine.Confidence;
import com.mobilitycopilot.backend.engine.ConfidenceEvaluator;
import com.mobilitycopilot.backend.engine.ConfidenceLevel;
import com.mobilitycopilot.backend.engine.Fixtures;
import com.mobilitycopilot.backend.engine.PeriodResolver;
import com.mobilitycopilot.backend.engine.TimeWindow;
import com.mobilitycopilot.backend.engine.TrendScope;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.RecordStore;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

class TrendComparisonAggregationTest {
  private final PeriodResolver periods = Fixtures.periods();
  private final AggregationEngine engine = new AggregationEngine(periods);

  @Test
  @DisplayName("current and previous windows are contiguous and of equal length")
  void windowsAreContiguous() {
    List<IncidentRecord> rows = new ArrayList<>();
    for (int i = 0; i < 14; i++) {
      rows.add(collision(ANCHOR.minusDays(i), "A", i < 7 ? "Plateau" : "Verdun", "Sèche"));
    }
    rows.add(collision(ANCHOR.minusDays(1), "A", "Plateau", "Sèche"));
    RecordStore store = new RecordStore(rows, List.of(), List.of(), List.of());

    AggregationResult r = engine.run(store, AnalysisRequest.forQuestion(AnalysisKind.TREND_INCIDENTS,
        periods.named(PeriodResolver.LAST_7_DAYS), "Les collisions augmentent-elles ?"));

    Map<String, Object> total = r.first();
    assertEquals("Collisions (total)", total.get("segment"));
    assertEquals("2024-03-25 -> 2024-03-31", total.get("window_current"));
    assertEquals("2024-03-18 -> 2024-03-24", total.get("window_previous"));
    assertEquals(8, total.get("current"));
    assertEquals(7, total.get("previous"));
    assertEquals(1, total.get("delta"));
    assertEquals(14.3, (double) total.get("pct"), 1e-9);
    assertEquals("Quartier en hausse: Plateau", r.rows().get(1).get("segment"));
    assertEquals(TrendScope.COLLISIONS, r.attributes().trendScope());
    assertEquals("2024-03-25 -> 2024-03-31", r.attributes().window());
    assertEquals("2024-03-18 -> 2024-03-24", r.attributes().previousWindow());
  }

  @Test
  @DisplayName("drop to zero: delta -12, pct -100, partial but not insufficient")
  void dropToZero() {
    List<IncidentRecord> rows = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      rows.add(collision(LocalDate.of(2024, 3, 18).plusDays(i % 7), "A", "Plateau", "Sèche"));
    }
    rows.add(collision(LocalDate.of(2024, 4, 20), "A", "Plateau", "Sèche"));
    RecordStore store = new RecordStore(rows, List.of(), List.of(), List.of());
    TimeWindow custom = new TimeWindow(LocalDate.of(2024, 3, 25), LocalDate.of(2024, 3, 31));

    AggregationResult r = engine.run(store, AnalysisRequest.forQuestion(AnalysisKind.TREND_INCIDENTS,
        periods.custom(custom), "Les collisions augmentent-elles ?"));

    Map<String, Object> total = r.first();
    assertEquals(0, total.get("current"));
    assertEquals(12, total.get("previous"));
    assertEquals(-12, total.get("delta"));
    assertEquals(-100.0, (double) total.get("pct"), 1e-9);

    Confidence c = ConfidenceEvaluator.evaluate(r);
    assertEquals(ConfidenceLevel.PARTIAL, c.level());
  }

  @Test
  @DisplayName("311 and collision words compare both sources, each on its own anchor")
  void bothSources() {
    List<IncidentRecord> collisions = List.of(collision(ANCHOR, "A", "Plateau", "Sèche"));
    List<ServiceRequestRecord> requests = new ArrayList<>();
    LocalDate requestsAnchor = ANCHOR.minusDays(60);
    for (int i = 0; i < 3; i++) {
      requests.add(request(requestsAnchor.minusDays(i), "Nids-de-poule", "Verdun", 2.0));
    }
    RecordStore store = new RecordStore(collisions, requests, List.of(), List.of());

    AggregationResult r = engine.run(store, AnalysisRequest.forQuestion(AnalysisKind.TREND_INCIDENTS,
        periods.named(PeriodResolver.LAST_7_DAYS), "Collisions et requêtes 311 en hausse ?"));

    assertEquals(TrendScope.BOTH, r.attributes().trendScope());
    Map<String, Object> req = r.rows().stream()
        .filter(m -> "Requêtes 311 (total)".equals(m.get("segment"))).findFirst().orElseThrow();
    assertEquals(3, req.get("current"));
    assertEquals(100.0, (double) req.get("pct"), 1e-9);
    assertEquals("2024-01-25 -> 2024-01-31", req.get("window_current"));
    assertNotNull(r.attributes().alignmentCaveat());
  }

  @Test
  @DisplayName("percentage rule for zero previous counts")
  void pctRule() {
    assertTrue(Double.isNaN(TrendComparisonAggregation.pct(0, 0)));
    assertEquals(100.0, TrendComparisonAggregation.pct(5, 0));
    assertEquals(-50.0, TrendComparisonAggregation.pct(5, 10));
  }

  @Test
  void noDataInEitherWindowIsEmpty() {
    AggregationResult r = engine.run(RecordStore.empty(), AnalysisRequest.forQuestion(AnalysisKind.TREND_INCIDENTS,
        periods.named(PeriodResolver.LAST_7_DAYS), "Les collisions augmentent-elles ?"));
    assertTrue(r.isEmpty());
  }
}
