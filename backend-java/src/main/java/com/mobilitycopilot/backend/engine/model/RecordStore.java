package com.mobilitycopilot.backend.engine.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

import com.mobilitycopilot.backend.engine.TimeWindow;

/**
 * Read-only snapshot of the four record sets. Built once, shared by every request.
 */
public final class RecordStore {
  private final List<IncidentRecord> collisions;
  private final List<ServiceRequestRecord> serviceRequests;
  private final List<TransitStopRecord> transitStops;
  private final List<WeatherRecord> weather;

  private final LocalDate collisionsMin;
  private final LocalDate collisionsMax;
  private final LocalDate requestsMin;
  private final LocalDate requestsMax;
  private final LocalDate weatherMin;
  private final LocalDate weatherMax;

  public RecordStore(
      List<IncidentRecord> collisions,
      List<ServiceRequestRecord> serviceRequests,
      List<TransitStopRecord> transitStops,
      List<WeatherRecord> weather) {
    this.collisions = collisions == null ? List.of() : List.copyOf(collisions);
    this.serviceRequests = serviceRequests == null ? List.of() : List.copyOf(serviceRequests);
    this.transitStops = transitStops == null ? List.of() : List.copyOf(transitStops);
    this.weather = weather == null ? List.of() : List.copyOf(weather);

    this.collisionsMin = bound(this.collisions, IncidentRecord::date, false);
    this.collisionsMax = bound(this.collisions, IncidentRecord::date, true);
    this.requestsMin = bound(this.serviceRequests, ServiceRequestRecord::date, false);
    this.requestsMax = bound(this.serviceRequests, ServiceRequestRecord::date, true);
    this.weatherMin = bound(this.weather, WeatherRecord::date, false);
    this.weatherMax = bound(this.weather, WeatherRecord::date, true);
  }

  public static RecordStore empty() {
    return new RecordStore(List.of(), List.of(), List.of(), List.of());
  }

  public List<IncidentRecord> collisions() {
    return collisions;
  }

  public List<ServiceRequestRecord> serviceRequests() {
    return serviceRequests;
  }

  public List<TransitStopRecord> transitStops() {
    return transitStops;
  }

  public List<WeatherRecord> weather() {
    return weather;
  }

  public Optional<LocalDate> collisionsAnchor() {
    return Optional.ofNullable(collisionsMax);
  }

  public Optional<LocalDate> requestsAnchor() {
    return Optional.ofNullable(requestsMax);
  }

  public Optional<LocalDate> collisionsStart() {
    return Optional.ofNullable(collisionsMin);
  }

  public Optional<LocalDate> requestsStart() {
    return Optional.ofNullable(requestsMin);
  }

  public Optional<LocalDate> weatherStart() {
    return Optional.ofNullable(weatherMin);
  }

  public Optional<LocalDate> weatherAnchor() {
    return Optional.ofNullable(weatherMax);
  }

  /** Latest date over all sources. */
  public Optional<LocalDate> latestDate() {
    return Stream.of(collisionsMax, requestsMax, weatherMax)
        .filter(d -> d != null)
        .max(Comparator.naturalOrder());
  }

  /** Earliest date over all sources. */
  public Optional<LocalDate> earliestDate() {
    return Stream.of(collisionsMin, requestsMin, weatherMin)
        .filter(d -> d != null)
        .min(Comparator.naturalOrder());
  }

  public List<IncidentRecord> collisionsIn(TimeWindow window) {
    return collisions.stream().filter(r -> window.contains(r.date())).toList();
  }

  public List<ServiceRequestRecord> requestsIn(TimeWindow window) {
    return serviceRequests.stream().filter(r -> window.contains(r.date())).toList();
  }

  private static <T> LocalDate bound(List<T> rows, Function<T, LocalDate> date, boolean max) {
    Stream<LocalDate> dates = rows.stream().map(date);
    Optional<LocalDate> out = max ? dates.max(Comparator.naturalOrder()) : dates.min(Comparator.naturalOrder());
    return out.orElse(null);
  }
}
