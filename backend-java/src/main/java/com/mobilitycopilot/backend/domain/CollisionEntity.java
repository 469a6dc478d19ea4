package com.mobilitycopilot.backend.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(
    name = "collisions",
    indexes = {
        @Index(name = "idx_collisions_date", columnList = "date"),
        @Index(name = "idx_collisions_neighborhood", columnList = "neighborhood")
    })
public class CollisionEntity {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  // YYYY-MM-DD
  @Column(name = "date")
  private String date;

  @Column(name = "hour")
  private Integer hour;

  @Column(name = "latitude")
  private Double latitude;

  @Column(name = "longitude")
  private Double longitude;

  @Column(name = "neighborhood")
  private String neighborhood;

  @Column(name = "location")
  private String location;

  @Column(name = "fatalities")
  private Integer fatalities;

  @Column(name = "severe_injuries")
  private Integer severeInjuries;

  @Column(name = "minor_injuries")
  private Integer minorInjuries;

  @Column(name = "surface_condition")
  private String surfaceCondition;

  @Column(name = "pedestrians")
  private Integer pedestrians;

  @Column(name = "cyclists")
  private Integer cyclists;

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

  public Integer getHour() {
    return hour;
  }

  public void setHour(Integer hour) {
    this.hour = hour;
  }

  public Double getLatitude() {
    return latitude;
  }

  public void setLatitude(Double latitude) {
    this.latitude = latitude;
  }

  public Double getLongitude() {
    return longitude;
  }

  public void setLongitude(Double longitude) {
    this.longitude = longitude;
  }

  public String getNeighborhood() {
    return neighborhood;
  }

  public void setNeighborhood(String neighborhood) {
    this.neighborhood = neighborhood;
  }

  public String getLocation() {
    return location;
  }

  public void setLocation(String location) {
    this.location = location;
  }

  public Integer getFatalities() {
    return fatalities;
  }

  public void setFatalities(Integer fatalities) {
    this.fatalities = fatalities;
  }

  public Integer getSevereInjuries() {
    return severeInjuries;
  }

  public void setSevereInjuries(Integer severeInjuries) {
    this.severeInjuries = severeInjuries;
  }

  public Integer getMinorInjuries() {
    return minorInjuries;
  }

  public void setMinorInjuries(Integer minorInjuries) {
    this.minorInjuries = minorInjuries;
  }

  public String getSurfaceCondition() {
    return surfaceCondition;
  }

  public void setSurfaceCondition(String surfaceCondition) {
    this.surfaceCondition = surfaceCondition;
  }

  public Integer getPedestrians() {
    return pedestrians;
  }

  public void setPedestrians(Integer pedestrians) {
    this.pedestrians = pedestrians;
  }

  public Integer getCyclists() {
    return cyclists;
  }

  public void setCyclists(Integer cyclists) {
    this.cyclists = cyclists;
  }
}
