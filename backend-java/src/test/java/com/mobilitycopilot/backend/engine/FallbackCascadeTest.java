package com.mobilitycopilot.backend.engine;

import static com.mobilitycopilot.backend.engine.Fixtures.ANCHOR;
import static com.mobilitycopilot.backend.engine.Fixtures.collision;
import static com.mobilitycopilot.backend.engine.Fixtures.request;
import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mobilitycopilot.backend.engine.model.RecordStore;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

class FallbackCascadeTest {
  private final PeriodResolver periods = Fixtures.periods();
  private final AggregationEngine engine = new AggregationEngine(periods);
  private final FallbackCascade cascade = new FallbackCascade(engine, periods);

  private final RecordStore dryOnly = new RecordStore(List.of(
      collision(ANCHOR, "Saint-Denis / Sherbrooke", "Plateau", "Sèche"),
      collision(ANCHOR.minusDays(1), "Saint-Denis / Sherbrooke", "Plateau", "Sèche"),
      collision(ANCHOR.minusDays(2), "Pie-IX / Jean-Talon", "Rosemont", "Sèche")),
      List.of(), List.of(), List.of());

  @Test
  @DisplayName("snow filter with no snowy collisions is relaxed and says so")
  void weatherRelaxation() {
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.HOTSPOTS_WEATHER,
        periods.named(PeriodResolver.LAST_30_DAYS), "Quelles intersections ont le plus de collisions quand il neige ?");

    FallbackCascade.Outcome out = cascade.execute(dryOnly, req);

    AggregationResult r = out.result();
    assertFalse(r.isEmpty());
    assertEquals(AnalysisKind.HOTSPOTS_WEATHER, r.kind());
    assertEquals("enneig|neige", r.attributes().weatherFilterRequested());
    assertNull(r.attributes().weatherFilterApplied());
    assertTrue(r.attributes().weatherRelaxed());
    assertEquals(List.of(FallbackCascade.NOTE_WEATHER_RELAXED), r.attributes().notes());
    assertTrue(r.attributes().notes().get(0).contains("filtre météo"));
    assertNull(out.finalRequest().weatherFilter());
    assertNotNull(out.finalRequest().requestedWeather());
    assertEquals(ConfidenceLevel.PARTIAL, ConfidenceEvaluator.evaluate(r).level());
  }

  @Test
  @DisplayName("running the cascade twice on the same input gives the same result")
  void idempotent() {
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.HOTSPOTS_WEATHER,
        periods.named(PeriodResolver.LAST_30_DAYS), "Quelles rues quand il pleut ?");
    AggregationResult first = cascade.execute(dryOnly, req).result();
    AggregationResult second = cascade.execute(dryOnly, req).result();
    assertEquals(first, second);
  }

  @Test
  @DisplayName("non-empty first run is returned untouched")
  void noFallbackNeeded() {
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.HOTSPOTS,
        periods.named(PeriodResolver.LAST_30_DAYS), "Top 5 intersections");
    FallbackCascade.Outcome out = cascade.execute(dryOnly, req);
    assertTrue(out.result().attributes().notes().isEmpty());
    assertSame(req, out.finalRequest());
  }

  @Test
  @DisplayName("temperature-less recent requests fall back to the widest period")
  void widensPeriod() {
    RecordStore store = new RecordStore(List.of(), List.of(
        request(ANCHOR, "Nids-de-poule", "Verdun", null),
        request(LocalDate.of(2023, 12, 1), "Déneigement", "Verdun", -3.0)), List.of(), List.of());
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.REQUESTS_TEMPERATURE,
        periods.named(PeriodResolver.LAST_30_DAYS), "Combien de requêtes 311 ?");

    FallbackCascade.Outcome out = cascade.execute(store, req);

    assertEquals(AnalysisKind.REQUESTS_TEMPERATURE, out.result().kind());
    assertEquals(1, out.result().rows().size());
    assertEquals(PeriodResolver.LAST_12_MONTHS, out.result().attributes().period());
    assertEquals(List.of(FallbackCascade.NOTE_PERIOD_WIDENED), out.result().attributes().notes());
  }

  @Test
  @DisplayName("311 type analysis falls back to temperature bands before widening")
  void typesToBands() {
    RecordStore store = new RecordStore(List.of(), List.of(
        request(ANCHOR, "Nids-de-poule", "Verdun", 4.0),
        request(ANCHOR, "Nids-de-poule", "Verdun", 6.0)), List.of(), List.of());
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.REQUEST_TYPES_WEATHER,
        periods.named(PeriodResolver.LAST_30_DAYS), "Quels types de requêtes 311 quand il neige ?");

    AggregationResult r = cascade.execute(store, req).result();

    assertEquals(AnalysisKind.REQUESTS_TEMPERATURE, r.kind());
    assertEquals(List.of(FallbackCascade.NOTE_TYPES_TO_BANDS), r.attributes().notes());
  }

  @Test
  @DisplayName("311 type analysis with older snow-day requests widens the period and keeps its kind")
  void typesWidenBeforeBands() {
    List<ServiceRequestRecord> requests = new ArrayList<>();
    requests.add(request(ANCHOR, "Nids-de-poule", "Verdun", null));
    for (int i = 0; i < 6; i++) {
      requests.add(request(ANCHOR.minusDays(100), "Déneigement", "Verdun", -4.0));
    }
    RecordStore store = new RecordStore(List.of(), requests, List.of(), List.of());
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.REQUEST_TYPES_WEATHER,
        periods.named(PeriodResolver.LAST_30_DAYS), "Quels types de requêtes 311 quand il neige ?");

    FallbackCascade.Outcome out = cascade.execute(store, req);

    AggregationResult r = out.result();
    assertEquals(AnalysisKind.REQUEST_TYPES_WEATHER, r.kind());
    assertEquals("Déneigement", r.first().get("category"));
    assertEquals(PeriodResolver.LAST_12_MONTHS, r.attributes().period());
    assertEquals(List.of(FallbackCascade.NOTE_PERIOD_WIDENED), r.attributes().notes());
    assertEquals(AnalysisKind.REQUEST_TYPES_WEATHER, out.finalRequest().kind());
  }

  @Test
  @DisplayName("an empty band retry leaves no band note in the trace")
  void emptyBandsLeaveNoNote() {
    RecordStore store = new RecordStore(List.of(collision(ANCHOR, "A", "Plateau", "Sèche")),
        List.of(request(ANCHOR, "Nids-de-poule", "Verdun", null)), List.of(), List.of());
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.REQUEST_TYPES_WEATHER,
        periods.named(PeriodResolver.LAST_30_DAYS), "Quels types de requêtes 311 quand il neige ?");

    AggregationResult r = cascade.execute(store, req).result();

    assertEquals(AnalysisKind.HOTSPOTS, r.kind());
    assertEquals(List.of(FallbackCascade.NOTE_DEFAULT_DIAGNOSTIC), r.attributes().notes());
  }

  @Test
  @DisplayName("nothing usable anywhere ends on the default diagnostic")
  void defaultDiagnostic() {
    RecordStore store = new RecordStore(List.of(collision(ANCHOR, "A", "Plateau", "Sèche")),
        List.of(request(ANCHOR, "Nids-de-poule", "Verdun", null)), List.of(), List.of());
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.REQUESTS_TEMPERATURE,
        periods.named(PeriodResolver.LAST_30_DAYS), "Combien de requêtes 311 ?");

    FallbackCascade.Outcome out = cascade.execute(store, req);

    assertEquals(AnalysisKind.HOTSPOTS, out.result().kind());
    assertFalse(out.result().isEmpty());
    List<String> notes = out.result().attributes().notes();
    assertEquals(FallbackCascade.NOTE_DEFAULT_DIAGNOSTIC, notes.get(notes.size() - 1));
    assertEquals(ConfidenceLevel.PARTIAL, ConfidenceEvaluator.evaluate(out.result()).level());
  }

  @Test
  void emptyStoreIsInsufficient() {
    AnalysisRequest req = AnalysisRequest.forQuestion(AnalysisKind.HOTSPOTS,
        periods.named(PeriodResolver.LAST_30_DAYS), "Top 5 intersections");
    FallbackCascade.Outcome out = cascade.execute(RecordStore.empty(), req);
    assertTrue(out.result().isEmpty());
    assertEquals(ConfidenceLevel.INSUFFICIENT, ConfidenceEvaluator.evaluate(out.result()).level());
  }
}
