package com.mobilitycopilot.backend.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mobilitycopilot.backend.engine.model.RecordStore;

class PeriodResolverTest {
  private final PeriodResolver resolver = Fixtures.periods();

  @Test
  @DisplayName("fixed buckets map to their day counts, unknown labels to 30 days")
  void buckets() {
    assertEquals(7, resolver.resolve(PeriodResolver.LAST_7_DAYS, "", null).days());
    assertEquals(90, resolver.resolve(PeriodResolver.LAST_3_MONTHS, "", null).days());
    assertEquals(365, resolver.resolve(PeriodResolver.LAST_12_MONTHS, "", null).days());

    ResolvedPeriod unknown = resolver.resolve("depuis toujours", "", null);
    assertEquals(PeriodResolver.LAST_30_DAYS, unknown.label());
    assertEquals(30, unknown.days());
    assertEquals(List.of("7 derniers jours", "30 derniers jours", "3 derniers mois", "12 derniers mois"),
        PeriodResolver.bucketLabels());
  }

  @Test
  @DisplayName("a period named in the question wins over the sidebar")
  void questionOverride() {
    assertEquals(PeriodResolver.LAST_7_DAYS,
        resolver.resolve(PeriodResolver.LAST_12_MONTHS, "Collisions cette semaine ?", null).label());
    assertEquals(PeriodResolver.LAST_3_MONTHS,
        resolver.resolve(PeriodResolver.LAST_7_DAYS, "Tendance sur le trimestre", null).label());
    assertEquals(PeriodResolver.LAST_12_MONTHS,
        resolver.resolve(PeriodResolver.LAST_7_DAYS, "Bilan de l'année", null).label());
    assertEquals(PeriodResolver.LAST_30_DAYS,
        resolver.resolve(PeriodResolver.LAST_7_DAYS, "Top zones sur 30j", null).label());
  }

  @Test
  @DisplayName("custom range is inclusive and used verbatim as window")
  void customRange() {
    ResolvedPeriod p = resolver.resolve("Personnalisée : 2024-03-01 -> 2024-03-10", "Top zones", null);
    assertTrue(p.isCustom());
    assertEquals(10, p.days());
    TimeWindow w = p.windowFor(LocalDate.of(2025, 1, 1));
    assertEquals(LocalDate.of(2024, 3, 1), w.start());
    assertEquals(LocalDate.of(2024, 3, 10), w.end());
    assertFalse(p.isWidest());
  }

  @Test
  @DisplayName("broken custom label falls back to the last valid range, else to 30 days")
  void brokenCustomFallsBack() {
    TimeWindow lastValid = new TimeWindow(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
    ResolvedPeriod withStored = resolver.resolve("Personnalisée : 2024-13-01 -> nope", "Top zones", lastValid);
    assertEquals(lastValid, withStored.customRange());
    assertEquals(31, withStored.days());

    ResolvedPeriod without = resolver.resolve("Personnalisée : 2024-13-01 -> nope", "Top zones", null);
    assertEquals(PeriodResolver.LAST_30_DAYS, without.label());
    assertFalse(without.isCustom());
  }

  @Test
  @DisplayName("named window covers N calendar days ending at the anchor")
  void namedWindow() {
    TimeWindow w = resolver.named(PeriodResolver.LAST_7_DAYS).windowFor(Fixtures.ANCHOR);
    assertEquals(LocalDate.of(2024, 3, 25), w.start());
    assertEquals(Fixtures.ANCHOR, w.end());
    assertEquals(7, w.lengthDays());
    assertEquals(new TimeWindow(LocalDate.of(2024, 3, 18), LocalDate.of(2024, 3, 24)), w.previous());
  }

  @Test
  @DisplayName("empty store anchors on the clock")
  void anchorOnEmptyStore() {
    assertEquals(LocalDate.of(2024, 4, 15), resolver.anchor(RecordStore.empty()));
    assertTrue(resolver.widest().isWidest());
  }
}
