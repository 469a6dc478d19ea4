package com.mobilitycopilot.backend.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mobilitycopilot.backend.domain.CollisionEntity;
import com.mobilitycopilot.backend.domain.ServiceRequestEntity;
import com.mobilitycopilot.backend.domain.TransitStopEntity;
import com.mobilitycopilot.backend.domain.WeatherDailyEntity;
import com.mobilitycopilot.backend.dto.RecordDtos.RecordsSummaryOut;
import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.RecordStore;
import com.mobilitycopilot.backend.repo.CollisionRepository;
import com.mobilitycopilot.backend.repo.ServiceRequestRepository;
import com.mobilitycopilot.backend.repo.TransitStopRepository;
import com.mobilitycopilot.backend.repo.WeatherDailyRepository;

class RecordStoreServiceTest {

  private static CollisionEntity collision(String date, String surface) {
    CollisionEntity e = new CollisionEntity();
    e.setDate(date);
    e.setLatitude(45.52);
    e.setLongitude(-73.57);
    e.setNeighborhood("Plateau-Mont-Royal");
    e.setSevereInjuries(1);
    e.setSurfaceCondition(surface);
    e.setPedestrians(1);
    return e;
  }

  private static ServiceRequestEntity request(String date) {
    ServiceRequestEntity e = new ServiceRequestEntity();
    e.setDate(date);
    e.setCategory("Nids-de-poule");
    e.setTemperature(-2.0);
    return e;
  }

  @Test
  @DisplayName("collision row gets severity, default hour, location and surface label")
  void collisionDefaults() {
    IncidentRecord r = RecordStoreService.toRecord(collision("2024-03-05", "14"));
    assertNotNull(r);
    assertEquals(LocalDate.of(2024, 3, 5), r.date());
    assertEquals(RecordStoreService.DEFAULT_HOUR, r.hour());
    assertEquals(3, r.severity());
    assertTrue(r.isSevere());
    assertEquals("Glacée/Verglacée", r.condition());
    assertEquals("Plateau-Mont-Royal — secteur", r.location());
    assertTrue(r.pedestrianInvolved());
    assertFalse(r.cyclistInvolved());
  }

  @Test
  void surfaceCodes() {
    assertEquals("Mouillée", RecordStoreService.surfaceLabel("11"));
    assertEquals("Enneigée", RecordStoreService.surfaceLabel("13.0"));
    assertEquals(IncidentRecord.UNKNOWN_CONDITION, RecordStoreService.surfaceLabel("99"));
    assertEquals(IncidentRecord.UNKNOWN_CONDITION, RecordStoreService.surfaceLabel(null));
    assertEquals("Sèche", RecordStoreService.surfaceLabel("Sèche"));
  }

  @Test
  void dates() {
    assertEquals(LocalDate.of(2024, 3, 5), RecordStoreService.parseDate("2024-03-05T08:15:00"));
    assertEquals(LocalDate.of(2024, 3, 5), RecordStoreService.parseDate("2024/03/05"));
    assertNull(RecordStoreService.parseDate("05 mars"));
    assertNull(RecordStoreService.parseDate(" "));
  }

  @Test
  @DisplayName("rows without a usable date are skipped and counted, the snapshot is cached")
  void loadAndSkip() {
    CollisionRepository collisions = mock(CollisionRepository.class);
    ServiceRequestRepository requests = mock(ServiceRequestRepository.class);
    TransitStopRepository stops = mock(TransitStopRepository.class);
    WeatherDailyRepository weather = mock(WeatherDailyRepository.class);

    when(collisions.findAll()).thenReturn(List.of(
        collision("2024-03-05", "10"), collision("2024-03-09", "11"), collision("pas une date", "10")));
    when(requests.findAll()).thenReturn(List.of(request("2024-02-01"), request(null)));
    TransitStopEntity stop = new TransitStopEntity();
    stop.setStopId("51234");
    stop.setStopName("Berri-UQAM");
    stop.setLatitude(45.515);
    stop.setLongitude(-73.561);
    when(stops.findAll()).thenReturn(List.of(stop));
    WeatherDailyEntity day = new WeatherDailyEntity();
    day.setDate("2024-03-09");
    day.setSnowfallCm(5.0);
    day.setMaxTemperature(-4.0);
    when(weather.findAll()).thenReturn(List.of(day));

    RecordStoreService service = new RecordStoreService(collisions, requests, stops, weather);
    RecordStore store = service.store();

    assertEquals(2, store.collisions().size());
    assertEquals(1, store.serviceRequests().size());
    assertEquals(1, store.transitStops().size());
    assertEquals("Enneigée", store.weather().get(0).condition());
    assertEquals(1, service.skipped().collisions());
    assertEquals(1, service.skipped().serviceRequests());
    assertEquals(2, service.skipped().total());

    assertSame(store, service.store());
    verify(collisions, times(1)).findAll();

    RecordsSummaryOut summary = service.summary();
    assertEquals(2, summary.collisions().rows());
    assertEquals("2024-03-05", summary.collisions().minDate());
    assertEquals("2024-03-09", summary.collisions().maxDate());
    assertEquals("2024-02-01", summary.earliestDate());
    assertEquals("2024-03-09", summary.latestDate());
    assertEquals(4, summary.periods().size());

    service.reload();
    verify(collisions, times(2)).findAll();
  }
}
