package com.mobilitycopilot.backend.engine.aggregation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mobilitycopilot.backend.engine.AggregationResult;
import com.mobilitycopilot.backend.engine.AnalysisKind;
import com.mobilitycopilot.backend.engine.ResultAttributes;
import com.mobilitycopilot.backend.engine.WeatherTag;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

/**
 * 311 categories over-represented on weather-targeted days.
 *
 * <p>{@code lift = (cw / nW) / ((co + 1) / nO)} where cw/co are the category counts on
 * targeted/other days and nW/nO the set sizes (floored at 1).
 */
public final class WeatherLiftAggregation implements Aggregation {
  static final int MIN_WEATHER_COUNT = 5;
  static final int TOP_N = 8;

  @Override
  public AggregationResult aggregate(AggregationInput input) {
    WeatherTag tag = input.request().weatherTag() == null ? WeatherTag.SNOW : input.request().weatherTag();

    Map<String, int[]> counts = new LinkedHashMap<>();
    int weatherTotal = 0;
    int otherTotal = 0;
    for (ServiceRequestRecord r : input.requests()) {
      if (r.temperature() == null || r.temperature().isNaN()) {
        continue;
      }
      int[] c = counts.computeIfAbsent(r.category(), k -> new int[2]);
      if (tag.matches(r.temperature())) {
        c[0]++;
        weatherTotal++;
      } else {
        c[1]++;
        otherTotal++;
      }
    }

    record Lift(String category, int weather, int other, double lift) {}
    List<Lift> lifts = new ArrayList<>();
    double wN = Math.max(weatherTotal, 1);
    double oN = Math.max(otherTotal, 1);
    for (Map.Entry<String, int[]> e : counts.entrySet()) {
      int cw = e.getValue()[0];
      int co = e.getValue()[1];
      if (cw < MIN_WEATHER_COUNT) {
        continue;
      }
      double lift = (cw / wN) / ((co + 1) / oN);
      lifts.add(new Lift(e.getKey(), cw, co, Rows.round(lift, 2)));
    }
    lifts.sort(Comparator.comparingDouble(Lift::lift).reversed()
        .thenComparing(Comparator.comparingInt(Lift::weather).reversed()));

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Lift l : lifts.subList(0, Math.min(TOP_N, lifts.size()))) {
      rows.add(Rows.row(
          "category", l.category(),
          "count_weather", l.weather(),
          "count_other", l.other(),
          "lift", l.lift()));
    }
    return new AggregationResult(rows, ResultAttributes.of(AnalysisKind.REQUEST_TYPES_WEATHER).withWeatherTag(tag));
  }
}
