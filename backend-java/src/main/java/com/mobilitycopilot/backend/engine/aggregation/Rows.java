package com.mobilitycopilot.backend.engine.aggregation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.mobilitycopilot.backend.engine.WeatherFilter;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;

final class Rows {
  private Rows() {}

  static Map<String, Object> row(Object... keyValues) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      m.put((String) keyValues[i], keyValues[i + 1]);
    }
    return m;
  }

  static double round(double v, int places) {
    double f = Math.pow(10, places);
    return Math.round(v * f) / f;
  }

  static List<IncidentRecord> byCondition(List<IncidentRecord> rows, WeatherFilter filter) {
    if (filter == null) {
      return rows;
    }
    return rows.stream().filter(r -> filter.matches(r.condition())).toList();
  }

  static int intValue(Map<String, Object> row, String key) {
    Object v = row.get(key);
    return v instanceof Number n ? n.intValue() : 0;
  }
}
