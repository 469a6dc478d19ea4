package com.mobilitycopilot.backend.engine;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.mobilitycopilot.backend.engine.aggregation.Aggregation;
import com.mobilitycopilot.backend.engine.aggregation.AggregationInput;
import com.mobilitycopilot.backend.engine.aggregation.HotspotAggregation;
import com.mobilitycopilot.backend.engine.aggregation.NeighborhoodScoreAggregation;
import com.mobilitycopilot.backend.engine.aggregation.NeighborhoodWeatherAggregation;
import com.mobilitycopilot.backend.engine.aggregation.TemperatureBandAggregation;
import com.mobilitycopilot.backend.engine.aggregation.TransitProximityAggregation;
import com.mobilitycopilot.backend.engine.aggregation.TrendComparisonAggregation;
import com.mobilitycopilot.backend.engine.aggregation.WeatherCorrelationAggregation;
import com.mobilitycopilot.backend.engine.aggregation.WeatherLiftAggregation;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.RecordStore;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

/**
 * Slices the store on the request's period and dispatches to the kind's aggregation.
 */
public final class AggregationEngine {
  private final PeriodResolver periods;
  private final Map<AnalysisKind, Aggregation> dispatch = new EnumMap<>(AnalysisKind.class);

  public AggregationEngine(PeriodResolver periods) {
    this.periods = periods;
    dispatch.put(AnalysisKind.HOTSPOTS, new HotspotAggregation(AnalysisKind.HOTSPOTS));
    dispatch.put(AnalysisKind.HOTSPOTS_WEATHER, new HotspotAggregation(AnalysisKind.HOTSPOTS_WEATHER));
    dispatch.put(AnalysisKind.TREND_INCIDENTS, new TrendComparisonAggregation());
    dispatch.put(AnalysisKind.WEATHER_CORRELATION, new WeatherCorrelationAggregation());
    dispatch.put(AnalysisKind.REQUESTS_TEMPERATURE, new TemperatureBandAggregation());
    dispatch.put(AnalysisKind.REQUEST_TYPES_WEATHER, new WeatherLiftAggregation());
    dispatch.put(AnalysisKind.NEIGHBORHOODS, new NeighborhoodScoreAggregation());
    dispatch.put(AnalysisKind.NEIGHBORHOODS_WEATHER, new NeighborhoodWeatherAggregation());
    dispatch.put(AnalysisKind.TRANSIT_PROXIMITY, new TransitProximityAggregation());
  }

  public AggregationResult run(RecordStore store, AnalysisRequest request) {
    PeriodSlice slice = slice(store, request.period());
    AggregationResult raw = dispatch.get(request.kind()).aggregate(new AggregationInput(store, slice, request));

    String requested = request.kind().supportsWeatherFilter() && request.requestedWeather() != null
        ? request.requestedWeather().describe()
        : null;
    TimeWindow window = request.kind() == AnalysisKind.REQUESTS_TEMPERATURE
        || request.kind() == AnalysisKind.REQUEST_TYPES_WEATHER
        ? slice.requestsWindow()
        : slice.collisionsWindow();

    return raw.withAttributes(a -> {
      ResultAttributes out = a.withWeatherRequested(requested);
      if (a.window() == null) {
        out = out.withPeriod(request.period().label(), window.label(), null);
      }
      return out;
    });
  }

  /** Records of each source inside the period, each anchored on its own latest date. */
  public PeriodSlice slice(RecordStore store, ResolvedPeriod period) {
    LocalDate fallback = periods.anchor(store);
    TimeWindow cw = period.windowFor(store.collisionsAnchor().orElse(fallback));
    TimeWindow rw = period.windowFor(store.requestsAnchor().orElse(fallback));
    List<IncidentRecord> collisions = store.collisionsIn(cw);
    List<ServiceRequestRecord> requests = store.requestsIn(rw);
    return new PeriodSlice(collisions, requests, cw, rw);
  }
}
