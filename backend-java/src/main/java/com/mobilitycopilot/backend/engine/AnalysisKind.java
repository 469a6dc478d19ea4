package com.mobilitycopilot.backend.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalysisKind {
  HOTSPOTS("hotspots", false),
  HOTSPOTS_WEATHER("hotspots_meteo", true),
  TREND_INCIDENTS("trend_incidents", true),
  WEATHER_CORRELATION("meteo_collision", true),
  REQUESTS_TEMPERATURE("311_temperature", false),
  REQUEST_TYPES_WEATHER("311_types_weather", false),
  NEIGHBORHOODS("quartiers", false),
  NEIGHBORHOODS_WEATHER("quartiers_meteo", true),
  TRANSIT_PROXIMITY("stm", false);

  private final String code;
  private final boolean weatherFilterable;

  AnalysisKind(String code, boolean weatherFilterable) {
    this.code = code;
    this.weatherFilterable = weatherFilterable;
  }

  @JsonValue
  public String code() {
    return code;
  }

  /** Whether a collision condition filter narrows this kind's input. */
  public boolean supportsWeatherFilter() {
    return weatherFilterable;
  }

  /** Correlation-style kinds whose figures are not normalized. */
  public boolean isDescriptive() {
    return this != HOTSPOTS && this != TREND_INCIDENTS;
  }

  public static AnalysisKind fromCode(String code) {
    for (AnalysisKind k : values()) {
      if (k.code.equalsIgnoreCase(code)) {
        return k;
      }
    }
    throw new IllegalArgumentException("unknown analysis kind: " + code);
  }
}
