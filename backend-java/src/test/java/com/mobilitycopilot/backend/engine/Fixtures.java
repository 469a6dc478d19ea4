package com.mobilitycopilot.backend.engine;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;
import com.mobilitycopilot.backend.engine.model.TransitStopRecord;

/**
 * Small record builders shared by the engine tests.
 */
public final class Fixtures {
  private Fixtures() {}

  public static final LocalDate ANCHOR = LocalDate.of(2024, 3, 31);
  public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-04-15T12:00:00Z"), ZoneOffset.UTC);

  public static IncidentRecord collision(LocalDate date, String location, String neighborhood, String condition) {
    return collision(date, location, neighborhood, condition, 1);
  }

  public static IncidentRecord collision(
      LocalDate date, String location, String neighborhood, String condition, int severity) {
    return new IncidentRecord(date, 8, 45.52, -73.57, neighborhood, location, severity, condition, false, false);
  }

  public static IncidentRecord collisionAt(LocalDate date, double lat, double lon, int severity) {
    return new IncidentRecord(date, 17, lat, lon, "Ville-Marie", null, severity, "Sèche", false, false);
  }

  public static ServiceRequestRecord request(LocalDate date, String category, String neighborhood, Double temperature) {
    return new ServiceRequestRecord(date, category, neighborhood, "Terminée", temperature);
  }

  public static TransitStopRecord stop(String id, String name, double lat, double lon) {
    return new TransitStopRecord(id, name, lat, lon, "1");
  }

  public static PeriodResolver periods() {
    return new PeriodResolver(CLOCK);
  }
}
