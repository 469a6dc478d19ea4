package com.mobilitycopilot.backend.engine;

import java.util.function.DoublePredicate;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Temperature proxy used to split 311 requests into weather-targeted days and the rest.
 */
public enum WeatherTag {
  SNOW("snow", t -> t <= 0),
  ICE("ice", t -> t >= -5 && t <= 1),
  RAIN("rain", t -> t > 0 && t <= 12),
  COLD("cold", t -> t <= -8);

  private static final Lexicon SNOW_WORDS = Lexicon.stems("neige", "enneig", "tempete", "deneig").words("snow");
  private static final Lexicon ICE_WORDS = Lexicon.stems("verglas", "glace", "gel").words("ice");
  private static final Lexicon RAIN_WORDS = Lexicon.stems("pluie", "pleu", "mouill", "averse").words("rain", "wet");
  private static final Lexicon COLD_WORDS = Lexicon.stems("froid", "0°c", "zero").words("cold");

  private final String code;
  private final DoublePredicate proxy;

  WeatherTag(String code, DoublePredicate proxy) {
    this.code = code;
    this.proxy = proxy;
  }

  @JsonValue
  public String code() {
    return code;
  }

  public boolean matches(Double temperature) {
    return temperature != null && proxy.test(temperature);
  }

  public static WeatherTag fromQuestion(String question) {
    NormalizedText q = NormalizedText.of(question);
    if (SNOW_WORDS.matches(q)) {
      return SNOW;
    }
    if (ICE_WORDS.matches(q)) {
      return ICE;
    }
    if (RAIN_WORDS.matches(q)) {
      return RAIN;
    }
    if (COLD_WORDS.matches(q)) {
      return COLD;
    }
    return SNOW;
  }
}
