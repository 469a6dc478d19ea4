package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mobilitycopilot.backend.engine.model.RecordStore;

/**
 * Relaxes an empty result step by step until something can be shown:
 * weather filter, then the 311 type analysis, then the period, then a plain hotspot diagnostic.
 * Every step recomputes from the store; nothing computed earlier is modified.
 */
public final class FallbackCascade {
  private static final Logger log = LoggerFactory.getLogger(FallbackCascade.class);

  static final String NOTE_WEATHER_RELAXED =
      "Aucune ligne trouvée pour la condition météo demandée sur cette fenêtre : filtre météo assoupli, "
          + "résultats affichés sans condition météo.";
  static final String NOTE_TYPES_TO_BANDS =
      "Pas assez de signalements météo ciblés par type : affichage du profil 311 par tranche de température.";
  static final String NOTE_PERIOD_WIDENED =
      "Aucun résultat sur la période demandée : fenêtre élargie à " + PeriodResolver.LAST_12_MONTHS + ".";
  static final String NOTE_WEATHER_RELAXED_WIDEST =
      "Même sur " + PeriodResolver.LAST_12_MONTHS + ", aucune ligne pour la condition météo demandée : "
          + "filtre météo assoupli.";
  static final String NOTE_DEFAULT_DIAGNOSTIC =
      "Analyse demandée sans résultat exploitable : diagnostic par défaut des zones de collisions (fallback).";

  public record Outcome(AggregationResult result, AnalysisRequest finalRequest) {}

  private final AggregationEngine engine;
  private final PeriodResolver periods;

  public FallbackCascade(AggregationEngine engine, PeriodResolver periods) {
    this.engine = engine;
    this.periods = periods;
  }

  public Outcome execute(RecordStore store, AnalysisRequest request) {
    AnalysisRequest current = request;
    AggregationResult result = engine.run(store, current);
    if (!result.isEmpty()) {
      return new Outcome(result, current);
    }
    List<String> notes = new ArrayList<>();

    // 1. weather filter
    if (current.hasActiveWeatherFilter()) {
      AnalysisRequest relaxed = current.withoutWeatherFilter();
      AggregationResult r = engine.run(store, relaxed);
      log.debug("cascade weather relaxation kind={} rows={}", relaxed.kind().code(), r.rows().size());
      if (!r.isEmpty()) {
        return done(r, relaxed, notes, NOTE_WEATHER_RELAXED);
      }
    }

    // 2. 311 types -> temperature bands
    if (current.kind() == AnalysisKind.REQUEST_TYPES_WEATHER) {
      AnalysisRequest bands = current.withKind(AnalysisKind.REQUESTS_TEMPERATURE);
      AggregationResult r = engine.run(store, bands);
      log.debug("cascade 311 bands rows={}", r.rows().size());
      if (!r.isEmpty()) {
        return done(r, bands, notes, NOTE_TYPES_TO_BANDS);
      }
    }

    // 3. widest period, keeping the filter first
    if (!current.period().isWidest()) {
      AnalysisRequest wide = current.withPeriod(periods.widest());
      AggregationResult r = engine.run(store, wide);
      log.debug("cascade widest period kind={} rows={}", wide.kind().code(), r.rows().size());
      if (!r.isEmpty()) {
        return done(r, wide, notes, NOTE_PERIOD_WIDENED);
      }
      if (wide.hasActiveWeatherFilter()) {
        AnalysisRequest wideRelaxed = wide.withoutWeatherFilter();
        AggregationResult r2 = engine.run(store, wideRelaxed);
        if (!r2.isEmpty()) {
          notes.add(NOTE_PERIOD_WIDENED);
          return done(r2, wideRelaxed, notes, NOTE_WEATHER_RELAXED_WIDEST);
        }
      }
      if (wide.kind() == AnalysisKind.REQUEST_TYPES_WEATHER) {
        AnalysisRequest wideBands = wide.withKind(AnalysisKind.REQUESTS_TEMPERATURE);
        AggregationResult r3 = engine.run(store, wideBands);
        if (!r3.isEmpty()) {
          notes.add(NOTE_PERIOD_WIDENED);
          return done(r3, wideBands, notes, NOTE_TYPES_TO_BANDS);
        }
      }
    }

    // 4. default diagnostic
    AnalysisRequest diag = new AnalysisRequest(AnalysisKind.HOTSPOTS, current.period(), null, null,
        current.weatherTag(), current.trendScope());
    AggregationResult r = engine.run(store, diag);
    if (r.isEmpty() && !diag.period().isWidest()) {
      diag = diag.withPeriod(periods.widest());
      r = engine.run(store, diag);
    }
    log.debug("cascade default diagnostic rows={}", r.rows().size());
    return done(r, diag, notes, NOTE_DEFAULT_DIAGNOSTIC);
  }

  private static Outcome done(AggregationResult r, AnalysisRequest req, List<String> notes, String last) {
    List<String> all = new ArrayList<>(notes);
    all.add(last);
    return new Outcome(r.withAttributes(a -> a.withNotes(all)), req);
  }
}
