package com.mobilitycopilot.backend.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceLevel {
  VERIFIED("verified"),
  PARTIAL("partial"),
  INSUFFICIENT("insufficient");

  private final String code;

  ConfidenceLevel(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
