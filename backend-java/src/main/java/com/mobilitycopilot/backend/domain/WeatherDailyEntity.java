package com.mobilitycopilot.backend.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "weather_daily")
public class WeatherDailyEntity {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "date")
  private String date;

  @Column(name = "max_temperature")
  private Double maxTemperature;

  @Column(name = "min_temperature")
  private Double minTemperature;

  @Column(name = "precipitation_mm")
  private Double precipitationMm;

  @Column(name = "snowfall_cm")
  private Double snowfallCm;

  @Column(name = "station")
  private String station;

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getDate() {
    return date;
  }

  public void setDate(String date) {
    this.date = date;
  }

  public Double getMaxTemperature() {
    return maxTemperature;
  }

  public void setMaxTemperature(Double maxTemperature) {
    this.maxTemperature = maxTemperature;
  }

  public Double getMinTemperature() {
    return minTemperature;
  }

  public void setMinTemperature(Double minTemperature) {
    this.minTemperature = minTemperature;
  }

  public Double getPrecipitationMm() {
    return precipitationMm;
  }

  public void setPrecipitationMm(Double precipitationMm) {
    this.precipitationMm = precipitationMm;
  }

  public Double getSnowfallCm() {
    return snowfallCm;
  }

  public void setSnowfallCm(Double snowfallCm) {
    this.snowfallCm = snowfallCm;
  }

  public String getStation() {
    return station;
  }

  public void setStation(String station) {
    this.station = station;
  }
}
