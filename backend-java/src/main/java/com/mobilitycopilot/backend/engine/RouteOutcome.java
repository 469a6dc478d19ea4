package com.mobilitycopilot.backend.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RouteOutcome {
  SMALLTALK("smalltalk"),
  OFF_TOPIC("off_topic"),
  NEEDS_CLARIFICATION("needs_clarification"),
  ANALYSIS("analysis");

  private final String code;

  RouteOutcome(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
