package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to tell what was filtered, relaxed or widened to get a result.
 * Also serialized as the response trace.
 */
public record ResultAttributes(
    AnalysisKind kind,
    String period,
    String window,
    String previousWindow,
    String weatherFilterRequested,
    String weatherFilterApplied,
    WeatherTag weatherTag,
    TrendScope trendScope,
    List<String> notes,
    String alignmentCaveat) {

  public ResultAttributes {
    notes = notes == null ? List.of() : List.copyOf(notes);
  }

  public static ResultAttributes of(AnalysisKind kind) {
    return new ResultAttributes(kind, null, null, null, null, null, null, null, List.of(), null);
  }

  public boolean weatherRelaxed() {
    return weatherFilterRequested != null && weatherFilterApplied == null;
  }

  public ResultAttributes withPeriod(String p, String w, String previous) {
    return new ResultAttributes(kind, p, w, previous, weatherFilterRequested, weatherFilterApplied,
        weatherTag, trendScope, notes, alignmentCaveat);
  }

  public ResultAttributes withWeatherRequested(String requested) {
    return new ResultAttributes(kind, period, window, previousWindow, requested, weatherFilterApplied,
        weatherTag, trendScope, notes, alignmentCaveat);
  }

  public ResultAttributes withWeatherApplied(String applied) {
    return new ResultAttributes(kind, period, window, previousWindow, weatherFilterRequested, applied,
        weatherTag, trendScope, notes, alignmentCaveat);
  }

  public ResultAttributes withWeatherTag(WeatherTag tag) {
    return new ResultAttributes(kind, period, window, previousWindow, weatherFilterRequested, weatherFilterApplied,
        tag, trendScope, notes, alignmentCaveat);
  }

  public ResultAttributes withTrendScope(TrendScope scope) {
    return new ResultAttributes(kind, period, window, previousWindow, weatherFilterRequested, weatherFilterApplied,
        weatherTag, scope, notes, alignmentCaveat);
  }

  public ResultAttributes withAlignmentCaveat(String caveat) {
    return new ResultAttributes(kind, period, window, previousWindow, weatherFilterRequested, weatherFilterApplied,
        weatherTag, trendScope, notes, caveat);
  }

  public ResultAttributes withNotes(List<String> more) {
    if (more == null || more.isEmpty()) {
      return this;
    }
    List<String> all = new ArrayList<>(notes);
    all.addAll(more);
    return new ResultAttributes(kind, period, window, previousWindow, weatherFilterRequested, weatherFilterApplied,
        weatherTag, trendScope, all, alignmentCaveat);
  }

  public ResultAttributes withNote(String note) {
    return withNotes(List.of(note));
  }
}
