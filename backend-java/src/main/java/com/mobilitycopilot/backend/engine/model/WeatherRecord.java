package com.mobilitycopilot.backend.engine.model;

import java.time.LocalDate;
import java.util.Objects;

public record WeatherRecord(
    LocalDate date,
    Double maxTemperature,
    Double minTemperature,
    double precipitationMm,
    double snowfallCm,
    String station,
    String condition) {

  public WeatherRecord {
    Objects.requireNonNull(date, "date");
    station = station == null ? "" : station;
    if (condition == null || condition.isBlank()) {
      condition = deriveCondition(snowfallCm, precipitationMm, maxTemperature);
    }
  }

  public static String deriveCondition(double snowfallCm, double precipitationMm, Double maxTemperature) {
    if (snowfallCm > 2) {
      return "Enneigée";
    }
    if (snowfallCm > 0) {
      return "Neige légère";
    }
    if (precipitationMm > 10) {
      return "Pluie forte";
    }
    if (precipitationMm > 1) {
      return "Pluie légère";
    }
    if (maxTemperature != null && maxTemperature < -5) {
      return "Glacée/Verglacée";
    }
    return "Sèche";
  }
}
