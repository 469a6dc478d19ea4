package com.mobilitycopilot.backend.engine;

/**
 * Topic flags read off a question. Each flag is one lexicon hit.
 */
public record QuestionSignals(
    boolean requests,
    boolean weather,
    boolean collision,
    boolean asksType,
    boolean trend,
    boolean street,
    boolean area,
    boolean transit,
    boolean risk,
    boolean now) {

  static final Lexicon REQUESTS = Lexicon.stems("311", "requete", "requetes", "signalement", "nid", "deneig", "eclair");
  static final Lexicon WEATHER = Lexicon
      .stems("pluie", "pleu", "averse", "mouill", "neige", "enneig", "verglas", "glace", "gel", "meteo",
          "temperature", "conditions", "froid", "weather")
      .words("rain", "wet", "snow", "ice");
  static final Lexicon COLLISION = Lexicon.stems("collision", "accident", "incident", "carambol", "crash");
  static final Lexicon ASKS_TYPE = Lexicon.stems("categorie", "explos", "hausse", "augment", "increase", "spike")
      .words("type", "types");
  static final Lexicon TREND = Lexicon.stems("hausse", "augment", "baisse", "evolution", "tendance", "variation", "trend");
  static final Lexicon STREET = Lexicon
      .stems("rue", "intersection", "boulevard", "avenue", "route", "autoroute", "carrefour", "street", "road")
      .words("boul", "axe");
  static final Lexicon AREA = Lexicon.stems("quartier", "secteur", "arrondissement", "zone", "district", "borough",
      "neighborhood", "neighbourhood");
  static final Lexicon TRANSIT = Lexicon.stems("stm", "arret", "ligne", "metro", "station").words("bus");
  static final Lexicon RISK = Lexicon.stems("dangereux", "dangereuse", "danger", "risque", "prioritaire", "critique")
      .words("top", "plus", "most");
  static final Lexicon NOW = Lexicon.stems("en ce moment", "actuellement", "maintenant", "right now", "currently");

  public static QuestionSignals detect(NormalizedText q) {
    return new QuestionSignals(
        REQUESTS.matches(q),
        WEATHER.matches(q),
        COLLISION.matches(q),
        ASKS_TYPE.matches(q),
        TREND.matches(q),
        STREET.matches(q),
        AREA.matches(q),
        TRANSIT.matches(q),
        RISK.matches(q),
        NOW.matches(q));
  }

  public boolean incidentsOrRequests() {
    return collision || requests;
  }
}
