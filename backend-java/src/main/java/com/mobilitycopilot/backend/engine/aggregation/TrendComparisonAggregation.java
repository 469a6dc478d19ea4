package com.mobilitycopilot.backend.engine.aggregation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.mobilitycopilot.backend.engine.AggregationResult;
import com.mobilitycopilot.backend.engine.AnalysisKind;
import com.mobilitycopilot.backend.engine.AnalysisRequest;
import com.mobilitycopilot.backend.engine.ResolvedPeriod;
import com.mobilitycopilot.backend.engine.ResultAttributes;
import com.mobilitycopilot.backend.engine.TimeWindow;
import com.mobilitycopilot.backend.engine.TrendScope;
import com.mobilitycopilot.backend.engine.WeatherFilter;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

/**
 * Current vs previous window on the full history of each source in scope.
 *
 * <p>Windows are anchored on each source's own latest date, never on the clock:
 * current = {@code (anchor - N, anchor]}, previous = {@code (anchor - 2N, anchor - N]}.
 * Neighborhood rows list the fastest risers of each source.
 */
public final class TrendComparisonAggregation implements Aggregation {
  static final int MAX_RISING = 4;
  static final int MIN_ALIGNMENT_GAP_DAYS = 14;

  static final String COLLISIONS_SEGMENT = "Collisions (total)";
  static final String REQUESTS_SEGMENT = "Requêtes 311 (total)";
  static final String COLLISIONS_RISING = "Quartier en hausse: ";
  static final String REQUESTS_RISING = "Quartier 311 en hausse: ";

  @Override
  public AggregationResult aggregate(AggregationInput input) {
    AnalysisRequest req = input.request();
    TrendScope scope = req.trendScope() == null ? TrendScope.COLLISIONS : req.trendScope();
    WeatherFilter wf = req.hasActiveWeatherFilter() && scope.includesCollisions() ? req.weatherFilter() : null;

    Optional<LocalDate> collisionsAnchor = scope.includesCollisions() ? input.store().collisionsAnchor() : Optional.empty();
    Optional<LocalDate> requestsAnchor = scope.includesRequests() ? input.store().requestsAnchor() : Optional.empty();

    List<Map<String, Object>> totals = new ArrayList<>();
    List<Map<String, Object>> rising = new ArrayList<>();
    TimeWindow primary = null;
    boolean anyData = false;

    if (collisionsAnchor.isPresent()) {
      TimeWindow current = currentWindow(req.period(), collisionsAnchor.get());
      TimeWindow previous = current.previous();
      primary = current;
      List<IncidentRecord> src = Rows.byCondition(input.store().collisions(), wf);
      anyData |= compare(src, IncidentRecord::date, IncidentRecord::neighborhood, current, previous,
          COLLISIONS_SEGMENT, COLLISIONS_RISING, totals, rising);
    }
    if (requestsAnchor.isPresent()) {
      TimeWindow current = currentWindow(req.period(), requestsAnchor.get());
      TimeWindow previous = current.previous();
      if (primary == null) {
        primary = current;
      }
      anyData |= compare(input.store().serviceRequests(), ServiceRequestRecord::date,
          ServiceRequestRecord::neighborhood, current, previous, REQUESTS_SEGMENT, REQUESTS_RISING, totals, rising);
    }
    if (primary == null) {
      primary = input.slice().collisionsWindow();
    }

    List<Map<String, Object>> rows = new ArrayList<>();
    if (anyData) {
      rows.addAll(totals);
      rows.addAll(rising);
    }

    ResultAttributes attrs = ResultAttributes.of(AnalysisKind.TREND_INCIDENTS)
        .withTrendScope(scope)
        .withWeatherApplied(wf == null ? null : wf.describe())
        .withPeriod(req.period().label(), primary.label(), primary.previous().label());

    if (scope == TrendScope.BOTH && collisionsAnchor.isPresent() && requestsAnchor.isPresent()) {
      long gap = Math.abs(ChronoUnit.DAYS.between(collisionsAnchor.get(), requestsAnchor.get()));
      if (gap > Math.max(MIN_ALIGNMENT_GAP_DAYS, req.period().days())) {
        attrs = attrs.withAlignmentCaveat(
            "Comparaison multi-sources affichée en lecture séparée: les ancres temporelles diffèrent (collisions="
                + collisionsAnchor.get() + " vs 311=" + requestsAnchor.get() + ").");
      }
    }
    return new AggregationResult(rows, attrs);
  }

  static TimeWindow currentWindow(ResolvedPeriod period, LocalDate anchor) {
    if (period.isCustom()) {
      return period.customRange();
    }
    return TimeWindow.endingAt(anchor, period.days());
  }

  static double pct(int current, int previous) {
    if (previous == 0) {
      return current == 0 ? Double.NaN : 100.0;
    }
    return Rows.round(100.0 * (current - previous) / previous, 1);
  }

  /** Appends the total row and rising rows of one source; true when either window holds records. */
  private static <T> boolean compare(
      List<T> records,
      Function<T, LocalDate> date,
      Function<T, String> neighborhood,
      TimeWindow current,
      TimeWindow previous,
      String segment,
      String risingPrefix,
      List<Map<String, Object>> totals,
      List<Map<String, Object>> rising) {
    int cur = 0;
    int prev = 0;
    Map<String, int[]> byArea = new LinkedHashMap<>();
    for (T r : records) {
      LocalDate d = date.apply(r);
      if (current.contains(d)) {
        cur++;
        byArea.computeIfAbsent(neighborhood.apply(r), k -> new int[2])[0]++;
      } else if (previous.contains(d)) {
        prev++;
        byArea.computeIfAbsent(neighborhood.apply(r), k -> new int[2])[1]++;
      }
    }
    totals.add(row(segment, cur, prev, current, previous));

    List<Map.Entry<String, int[]>> up = new ArrayList<>();
    for (Map.Entry<String, int[]> e : byArea.entrySet()) {
      if (e.getValue()[0] > e.getValue()[1]) {
        up.add(e);
      }
    }
    up.sort(Comparator.comparingInt((Map.Entry<String, int[]> e) -> e.getValue()[0] - e.getValue()[1]).reversed());
    for (Map.Entry<String, int[]> e : up.subList(0, Math.min(MAX_RISING, up.size()))) {
      rising.add(row(risingPrefix + e.getKey(), e.getValue()[0], e.getValue()[1], current, previous));
    }
    return cur + prev > 0;
  }

  private static Map<String, Object> row(String segment, int cur, int prev, TimeWindow current, TimeWindow previous) {
    return Rows.row(
        "segment", segment,
        "current", cur,
        "previous", prev,
        "delta", cur - prev,
        "pct", pct(cur, prev),
        "window_current", current.label(),
        "window_previous", previous.label());
  }
}
