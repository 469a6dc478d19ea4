package com.mobilitycopilot.backend.engine;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendScope {
  COLLISIONS("collisions"),
  REQUESTS("req311"),
  BOTH("both");

  private static final Lexicon REQUEST_WORDS = Lexicon.stems("311", "requete", "signalement");
  private static final Lexicon COLLISION_WORDS = Lexicon.stems("collision", "accident", "carambol");

  private final String code;

  TrendScope(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }

  public boolean includesCollisions() {
    return this != REQUESTS;
  }

  public boolean includesRequests() {
    return this != COLLISIONS;
  }

  public static TrendScope fromQuestion(String question) {
    NormalizedText q = NormalizedText.of(question);
    boolean requests = REQUEST_WORDS.matches(q);
    boolean collisions = COLLISION_WORDS.matches(q);
    if (requests && collisions) {
      return BOTH;
    }
    if (requests) {
      return REQUESTS;
    }
    return COLLISIONS;
  }
}
