package com.mobilitycopilot.backend.service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.mobilitycopilot.backend.domain.CollisionEntity;
import com.mobilitycopilot.backend.domain.ServiceRequestEntity;
import com.mobilitycopilot.backend.domain.TransitStopEntity;
import com.mobilitycopilot.backend.domain.WeatherDailyEntity;
import com.mobilitycopilot.backend.dto.RecordDtos.RecordsSummaryOut;
import com.mobilitycopilot.backend.dto.RecordDtos.SourceSummary;
import com.mobilitycopilot.backend.engine.PeriodResolver;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.RecordStore;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;
import com.mobilitycopilot.backend.engine.model.TransitStopRecord;
import com.mobilitycopilot.backend.engine.model.WeatherRecord;
import com.mobilitycopilot.backend.repo.CollisionRepository;
import com.mobilitycopilot.backend.repo.ServiceRequestRepository;
import com.mobilitycopilot.backend.repo.TransitStopRepository;
import com.mobilitycopilot.backend.repo.WeatherDailyRepository;
import com.mobilitycopilot.backend.util.TextNormalizer;

/**
 * Loads the four ETL tables into one {@link RecordStore} snapshot, on first use.
 */
@Service
public class RecordStoreService {
  private static final Logger log = LoggerFactory.getLogger(RecordStoreService.class);

  static final int DEFAULT_HOUR = 12;

  // Official surface-state codification of the collision dataset.
  static final Map<String, String> SURFACE_MAP = Map.of(
      "10", "Sèche",
      "11", "Mouillée",
      "12", "Boueuse",
      "13", "Enneigée",
      "14", "Glacée/Verglacée",
      "16", "Huileuse");

  public record SkipCounts(int collisions, int serviceRequests, int transitStops, int weather) {
    public int total() {
      return collisions + serviceRequests + transitStops + weather;
    }
  }

  private record Snapshot(RecordStore store, SkipCounts skipped) {}

  private final CollisionRepository collisionRepository;
  private final ServiceRequestRepository serviceRequestRepository;
  private final TransitStopRepository transitStopRepository;
  private final WeatherDailyRepository weatherDailyRepository;

  private volatile Snapshot snapshot;

  public RecordStoreService(
      CollisionRepository collisionRepository,
      ServiceRequestRepository serviceRequestRepository,
      TransitStopRepository transitStopRepository,
      WeatherDailyRepository weatherDailyRepository) {
    this.collisionRepository = collisionRepository;
    this.serviceRequestRepository = serviceRequestRepository;
    this.transitStopRepository = transitStopRepository;
    this.weatherDailyRepository = weatherDailyRepository;
  }

  @Transactional(readOnly = true)
  public RecordStore store() {
    Snapshot s = snapshot;
    if (s == null) {
      synchronized (this) {
        s = snapshot;
        if (s == null) {
          s = load();
          snapshot = s;
        }
      }
    }
    return s.store();
  }

  /** Drops the cached snapshot and reads the tables again. */
  @Transactional(readOnly = true)
  public synchronized RecordStore reload() {
    snapshot = load();
    return snapshot.store();
  }

  public SkipCounts skipped() {
    store();
    return snapshot.skipped();
  }

  public RecordsSummaryOut summary() {
    RecordStore st = store();
    SkipCounts sk = skipped();
    return new RecordsSummaryOut(
        new SourceSummary(st.collisions().size(),
            text(st.collisionsStart()), text(st.collisionsAnchor()), sk.collisions()),
        new SourceSummary(st.serviceRequests().size(),
            text(st.requestsStart()), text(st.requestsAnchor()), sk.serviceRequests()),
        new SourceSummary(st.transitStops().size(), null, null, sk.transitStops()),
        new SourceSummary(st.weather().size(),
            text(st.weatherStart()), text(st.weatherAnchor()), sk.weather()),
        text(st.earliestDate()),
        text(st.latestDate()),
        PeriodResolver.bucketLabels());
  }

  private Snapshot load() {
    int skippedCollisions = 0;
    List<IncidentRecord> collisions = new ArrayList<>();
    for (CollisionEntity e : collisionRepository.findAll()) {
      IncidentRecord r = toRecord(e);
      if (r == null) {
        skippedCollisions++;
      } else {
        collisions.add(r);
      }
    }

    int skippedRequests = 0;
    List<ServiceRequestRecord> requests = new ArrayList<>();
    for (ServiceRequestEntity e : serviceRequestRepository.findAll()) {
      ServiceRequestRecord r = toRecord(e);
      if (r == null) {
        skippedRequests++;
      } else {
        requests.add(r);
      }
    }

    int skippedStops = 0;
    List<TransitStopRecord> stops = new ArrayList<>();
    for (TransitStopEntity e : transitStopRepository.findAll()) {
      TransitStopRecord r = toRecord(e);
      if (r == null) {
        skippedStops++;
      } else {
        stops.add(r);
      }
    }

    int skippedWeather = 0;
    List<WeatherRecord> weather = new ArrayList<>();
    for (WeatherDailyEntity e : weatherDailyRepository.findAll()) {
      WeatherRecord r = toRecord(e);
      if (r == null) {
        skippedWeather++;
      } else {
        weather.add(r);
      }
    }

    SkipCounts skipped = new SkipCounts(skippedCollisions, skippedRequests, skippedStops, skippedWeather);
    if (skipped.total() > 0) {
      log.warn("skipped rows without usable date or coordinates: collisions={} service_requests={} "
          + "transit_stops={} weather_daily={}",
          skipped.collisions(), skipped.serviceRequests(), skipped.transitStops(), skipped.weather());
    }
    RecordStore store = new RecordStore(collisions, requests, stops, weather);
    log.info("record store loaded: collisions={} service_requests={} transit_stops={} weather_daily={} latest={}",
        collisions.size(), requests.size(), stops.size(), weather.size(), text(store.latestDate()));
    return new Snapshot(store, skipped);
  }

  static IncidentRecord toRecord(CollisionEntity e) {
    LocalDate date = parseDate(e.getDate());
    if (date == null || e.getLatitude() == null || e.getLongitude() == null) {
      return null;
    }
    int severity = IncidentRecord.severityScore(
        nz(e.getFatalities()), nz(e.getSevereInjuries()), nz(e.getMinorInjuries()));
    return new IncidentRecord(
        date,
        e.getHour() == null ? DEFAULT_HOUR : e.getHour(),
        e.getLatitude(),
        e.getLongitude(),
        TextNormalizer.orDefault(e.getNeighborhood(), null),
        TextNormalizer.orDefault(e.getLocation(), null),
        severity,
        surfaceLabel(e.getSurfaceCondition()),
        nz(e.getPedestrians()) > 0,
        nz(e.getCyclists()) > 0);
  }

  static ServiceRequestRecord toRecord(ServiceRequestEntity e) {
    LocalDate date = parseDate(e.getDate());
    if (date == null) {
      return null;
    }
    return new ServiceRequestRecord(
        date,
        TextNormalizer.orDefault(e.getCategory(), null),
        TextNormalizer.orDefault(e.getNeighborhood(), null),
        e.getStatus(),
        e.getTemperature());
  }

  static TransitStopRecord toRecord(TransitStopEntity e) {
    if (e.getLatitude() == null || e.getLongitude() == null) {
      return null;
    }
    String id = TextNormalizer.orDefault(e.getStopId(), String.valueOf(e.getId()));
    return new TransitStopRecord(id, TextNormalizer.blankToNull(e.getStopName()), e.getLatitude(),
        e.getLongitude(), e.getLine());
  }

  static WeatherRecord toRecord(WeatherDailyEntity e) {
    LocalDate date = parseDate(e.getDate());
    if (date == null) {
      return null;
    }
    double precip = e.getPrecipitationMm() == null ? 0.0 : e.getPrecipitationMm();
    double snow = e.getSnowfallCm() == null ? 0.0 : e.getSnowfallCm();
    return new WeatherRecord(date, e.getMaxTemperature(), e.getMinTemperature(), precip, snow,
        e.getStation(), null);
  }

  /**
   * Surface code ("11", "11.0") to its label; free text is kept as is.
   */
  static String surfaceLabel(String raw) {
    String t = TextNormalizer.orDefault(raw, null);
    if (t == null) {
      return IncidentRecord.UNKNOWN_CONDITION;
    }
    try {
      long code = Math.round(Double.parseDouble(t));
      return SURFACE_MAP.getOrDefault(String.valueOf(code), IncidentRecord.UNKNOWN_CONDITION);
    } catch (NumberFormatException e) {
      return t;
    }
  }

  static LocalDate parseDate(String raw) {
    String t = TextNormalizer.blankToNull(raw);
    if (t == null) {
      return null;
    }
    if (t.length() > 10) {
      t = t.substring(0, 10);
    }
    try {
      return LocalDate.parse(t.replace('/', '-'));
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static int nz(Integer v) {
    return v == null ? 0 : v;
  }

  private static String text(Optional<LocalDate> d) {
    return d.map(LocalDate::toString).orElse(null);
  }
}
