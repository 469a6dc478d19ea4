package com.mobilitycopilot.backend.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseType {
  ANSWER("answer"),
  SMALLTALK("smalltalk"),
  OFF_TOPIC("off_topic"),
  NEEDS_CLARIFICATION("needs_clarification"),
  AMBIGUOUS("ambiguous");

  private final String code;

  ResponseType(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
