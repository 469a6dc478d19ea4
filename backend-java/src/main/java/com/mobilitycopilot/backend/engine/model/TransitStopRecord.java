package com.mobilitycopilot.backend.engine.model;

public record TransitStopRecord(String stopId, String stopName, double latitude, double longitude, String line) {

  public TransitStopRecord {
    stopName = stopName == null || stopName.isBlank() ? stopId : stopName;
    line = line == null ? "" : line;
  }
}
