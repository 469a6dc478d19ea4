package com.mobilitycopilot.backend.engine.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One road collision as loaded from the store.
 */
public record IncidentRecord(
    LocalDate date,
    int hour,
    double latitude,
    double longitude,
    String neighborhood,
    String location,
    int severity,
    String condition,
    boolean pedestrianInvolved,
    boolean cyclistInvolved) {

  public static final int SEVERE_THRESHOLD = 3;
  public static final String DEFAULT_NEIGHBORHOOD = "Montréal";
  public static final String UNKNOWN_CONDITION = "Inconnue";

  public IncidentRecord {
    Objects.requireNonNull(date, "date");
    hour = Math.max(0, Math.min(23, hour));
    severity = Math.max(1, severity);
    neighborhood = neighborhood == null || neighborhood.isBlank() ? DEFAULT_NEIGHBORHOOD : neighborhood;
    location = location == null || location.isBlank() ? neighborhood + " — secteur" : location;
    condition = condition == null || condition.isBlank() ? UNKNOWN_CONDITION : condition;
  }

  public boolean isSevere() {
    return severity >= SEVERE_THRESHOLD;
  }

  /** Weighted victim count: fatal x4, severe x3, minor x2, never below 1. */
  public static int severityScore(int fatal, int severe, int minor) {
    return Math.max(1, 4 * Math.max(0, fatal) + 3 * Math.max(0, severe) + 2 * Math.max(0, minor));
  }
}
