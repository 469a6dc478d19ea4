package com.mobilitycopilot.backend.engine.aggregation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.mobilitycopilot.backend.engine.AggregationResult;
import com.mobilitycopilot.backend.engine.AnalysisKind;
import com.mobilitycopilot.backend.engine.ResultAttributes;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

/**
 * 311 requests counted per temperature band. Bands are right-inclusive and open at both ends.
 */
public final class TemperatureBandAggregation implements Aggregation {

  static final double[] UPPER_BOUNDS = {-5, 0, 5, 15};
  static final String[] LABELS = {"< -5°C", "-5 à 0°C", "0 à 5°C", "5 à 15°C", "> 15°C"};

  static int band(double temperature) {
    for (int i = 0; i < UPPER_BOUNDS.length; i++) {
      if (temperature <= UPPER_BOUNDS[i]) {
        return i;
      }
    }
    return LABELS.length - 1;
  }

  @Override
  public AggregationResult aggregate(AggregationInput input) {
    int[] counts = new int[LABELS.length];
    for (ServiceRequestRecord r : input.requests()) {
      if (r.temperature() == null || r.temperature().isNaN()) {
        continue;
      }
      counts[band(r.temperature())]++;
    }
    List<Map<String, Object>> rows = new ArrayList<>();
    for (int i = 0; i < LABELS.length; i++) {
      if (counts[i] > 0) {
        rows.add(Rows.row("band", LABELS[i], "count", counts[i]));
      }
    }
    return new AggregationResult(rows, ResultAttributes.of(AnalysisKind.REQUESTS_TEMPERATURE));
  }
}
