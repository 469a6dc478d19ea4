package com.mobilitycopilot.backend.engine.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A 311 citizen request. {@code temperature} is the day's ambient temperature proxy
 * and may be null when the ETL could not join one.
 */
public record ServiceRequestRecord(
    LocalDate date,
    String category,
    String neighborhood,
    String status,
    Double temperature) {

  public static final String DEFAULT_CATEGORY = "Non spécifié";

  public ServiceRequestRecord {
    Objects.requireNonNull(date, "date");
    category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    neighborhood = neighborhood == null || neighborhood.isBlank() ? IncidentRecord.DEFAULT_NEIGHBORHOOD : neighborhood;
    status = status == null ? "" : status;
  }
}
