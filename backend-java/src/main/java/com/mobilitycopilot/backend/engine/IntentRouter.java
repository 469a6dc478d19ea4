package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Lexical question classifier. Filters run first (smalltalk, off topic, vague), then the
 * first matching kind rule wins. The last rule always matches.
 */
public final class IntentRouter {

  private record Rule(String name, Predicate<QuestionSignals> when, AnalysisKind kind) {}

  private static final List<Rule> RULES = List.of(
      new Rule("requests_weather_or_type", s -> s.requests() && (s.weather() || s.asksType()),
          AnalysisKind.REQUEST_TYPES_WEATHER),
      new Rule("right_now", s -> s.now() && s.incidentsOrRequests(), AnalysisKind.TREND_INCIDENTS),
      new Rule("trend_words", s -> s.trend() && s.incidentsOrRequests(), AnalysisKind.TREND_INCIDENTS),
      new Rule("street_weather", s -> s.weather() && s.street() && (s.collision() || s.risk()),
          AnalysisKind.HOTSPOTS_WEATHER),
      new Rule("requests_only", QuestionSignals::requests, AnalysisKind.REQUESTS_TEMPERATURE),
      new Rule("transit", QuestionSignals::transit, AnalysisKind.TRANSIT_PROXIMITY),
      new Rule("area_weather", s -> s.area() && s.weather(), AnalysisKind.NEIGHBORHOODS_WEATHER),
      new Rule("area", QuestionSignals::area, AnalysisKind.NEIGHBORHOODS),
      new Rule("weather", QuestionSignals::weather, AnalysisKind.WEATHER_CORRELATION),
      new Rule("default_hotspots", s -> true, AnalysisKind.HOTSPOTS));

  private static final List<String> SMALLTALK_TOKENS = List.of(
      "bonjour", "bonsoir", "salut", "hello", "hey", "merci", "ok", "ca va", "test", "ping");

  private static final Lexicon SMALLTALK_BLOCKERS = Lexicon.stems(
      "mobilite", "collision", "accident", "incident", "311", "stm", "trafic", "route", "quartier",
      "pluie", "neige", "meteo", "arret");

  private static final Lexicon MOBILITY_CONTEXT = Lexicon.stems(
      "collision", "accident", "incident", "trafic", "embouteill", "route", "intersection", "quartier",
      "arrondissement", "zone", "311", "requete", "signalement", "deneig", "nid", "eclair", "stm",
      "metro", "arret", "ligne", "transport", "meteo", "pluie", "neige", "verglas", "temperature", "gel",
      "froid", "voirie", "circulation", "congestion", "ralentiss", "coince", "bloque", "bouchon", "mobilite",
      "deplacement")
      .words("rue", "rues", "bus");

  private static final Lexicon ANALYTIC_INTENT = Lexicon.stems(
      "combien", "quel", "top", "plus", "moins", "hausse", "baisse", "augmente", "diminue", "tendance",
      "evolution", "variation", "compar", "autour", "impact", "corr", "risque", "hotspot", "coince",
      "explose", "beaucoup", "en ce moment", "actuellement", "maintenant")
      .words("ou");

  private static final Pattern TRAILING_PUNCT = Pattern.compile("[\\s!?.,;:…]+$");

  static final String CLARIFICATION_REASON =
      "La question est comprise, mais l'angle d'analyse n'est pas assez précis "
          + "(tendance, top zones, météo, STM, 311). Choisissez une option pour lancer "
          + "une requête validée sur les données.";

  private static final int MAX_OPTIONS = 4;

  public Route route(String question) {
    NormalizedText q = NormalizedText.of(question);
    if (isSmalltalk(q)) {
      return Route.control(RouteOutcome.SMALLTALK);
    }
    if (!MOBILITY_CONTEXT.matches(q)) {
      return Route.control(RouteOutcome.OFF_TOPIC);
    }
    if (!ANALYTIC_INTENT.matches(q)) {
      return Route.control(RouteOutcome.NEEDS_CLARIFICATION);
    }
    return select(QuestionSignals.detect(q));
  }

  /** Kind selection alone, without the filters. */
  public Route select(QuestionSignals signals) {
    for (Rule r : RULES) {
      if (r.when().test(signals)) {
        return Route.analysis(r.kind(), r.name());
      }
    }
    throw new IllegalStateException("default rule did not match");
  }

  boolean isSmalltalk(NormalizedText q) {
    if (q.isBlank()) {
      return true;
    }
    if (SMALLTALK_BLOCKERS.matches(q)) {
      return false;
    }
    String s = TRAILING_PUNCT.matcher(q.folded()).replaceAll("");
    for (String tok : SMALLTALK_TOKENS) {
      if (s.equals(tok) || s.startsWith(tok + " ")) {
        return true;
      }
    }
    return false;
  }

  /**
   * Up to four refined questions for a question that names a topic but no analytic angle.
   */
  public Ambiguity clarify(String question, String periodLabel) {
    NormalizedText q = NormalizedText.of(question);
    String p = periodLabel == null ? PeriodResolver.LAST_30_DAYS : periodLabel;
    boolean requests = Lexicon.stems("311", "requete", "signalement", "deneig", "nid").matches(q);
    boolean collision = Lexicon.stems("collision", "accident", "incident", "carambol").matches(q);
    boolean transit = Lexicon.stems("stm", "metro", "arret", "station", "ligne").words("bus").matches(q);
    boolean weather = Lexicon.stems("pluie", "pleu", "neige", "verglas", "glace", "gel", "froid", "meteo",
        "temperature", "weather").words("rain", "snow", "ice", "cold").matches(q);

    WeatherFilter.Family family = WeatherFilter.Family.firstIn(q);
    String weatherDesc;
    String weatherClause;
    if (family != null) {
      weatherDesc = family.label();
      weatherClause = family.clause();
    } else if (Lexicon.stems("froid", "temperature", "meteo", "weather").words("cold").matches(q)) {
      weatherDesc = "météo dégradée";
      weatherClause = "en météo dégradée";
    } else {
      weatherDesc = "météo ciblée";
      weatherClause = "en météo dégradée";
    }

    List<ChoiceOption> options = new ArrayList<>();
    if (collision || (!requests && !transit)) {
      options.add(new ChoiceOption("Comparer l'évolution récente des collisions",
          "Les collisions augmentent-elles sur " + p + " ?"));
      options.add(new ChoiceOption("Voir les 5 intersections les plus touchées",
          "Top 5 intersections avec le plus de collisions sur " + p));
      options.add(new ChoiceOption("Voir les quartiers les plus touchés",
          "Quels quartiers ont le plus de collisions sur " + p + " ?"));
      if (weather) {
        options.add(1, new ChoiceOption("Voir les rues/intersections les plus exposées (" + weatherDesc + ")",
            "Quelles rues/intersections ont le plus de collisions " + weatherClause + " sur " + p + " ?"));
      }
    }
    if (requests) {
      options.add(new ChoiceOption("Voir les types 311 dominants",
          "Quels types de requêtes 311 dominent sur " + p + " ?"));
      options.add(new ChoiceOption("Comparer l'évolution des requêtes 311",
          "Les requêtes 311 augmentent-elles sur " + p + " ?"));
      if (weather) {
        options.add(new ChoiceOption("Voir les types 311 sensibles (" + weatherDesc + ")",
            "Quels types de requêtes 311 augmentent " + weatherClause + " sur " + p + " ?"));
      }
    }
    if (transit) {
      options.add(new ChoiceOption("Voir les arrêts STM proches des zones de collisions",
          "Autour de quels arrêts STM observe-t-on le plus de collisions sur " + p + " ?"));
      options.add(new ChoiceOption("Voir les hotspots collisions pour orienter STM",
          "Top 5 intersections avec le plus de collisions sur " + p));
    }

    Set<String> seen = new LinkedHashSet<>();
    List<ChoiceOption> out = new ArrayList<>();
    for (ChoiceOption o : options) {
      String key = o.label().trim().toLowerCase(Locale.ROOT) + "\n" + o.refinedQuestion().trim().toLowerCase(Locale.ROOT);
      if (!seen.add(key)) {
        continue;
      }
      out.add(new ChoiceOption(o.label().trim(), o.refinedQuestion().trim()));
      if (out.size() >= MAX_OPTIONS) {
        break;
      }
    }
    return new Ambiguity(true, CLARIFICATION_REASON, out);
  }
}
