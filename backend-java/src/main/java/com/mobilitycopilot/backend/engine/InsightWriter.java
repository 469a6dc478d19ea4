package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.mobilitycopilot.backend.engine.model.IncidentRecord;
import com.mobilitycopilot.backend.engine.model.ServiceRequestRecord;

/**
 * Deterministic French texts around a result: lead sentence, key points, caveats, evidence.
 */
public final class InsightWriter {
  static final int AGGREGATE_LINES = 3;
  static final int SOURCE_LINES = 2;

  private static final Map<AnalysisKind, Caveats> CAVEATS = new EnumMap<>(AnalysisKind.class);

  static final Caveats DEFAULT_CAVEATS = new Caveats(
      "Données limitées à la période sélectionnée; interprétation prudente requise.",
      "Contrôler cohérence temporelle et complétude des sources avant décision.",
      "Utiliser ces résultats comme signal initial, puis confirmer par un indicateur normalisé.");

  static {
    CAVEATS.put(AnalysisKind.HOTSPOTS, new Caveats(
        "Le classement reflète des volumes observés de collisions déclarées, sans normalisation par trafic, "
            + "population ou longueur de voirie.",
        "Croiser les zones avec le trafic réel et les collisions graves avant priorisation finale.",
        "Pré-cibler signalisation/contrôle vitesse sur les 2 premières zones, puis confirmer avec un indicateur "
            + "normalisé de risque."));
    CAVEATS.put(AnalysisKind.HOTSPOTS_WEATHER, new Caveats(
        "Le classement identifie des rues/intersections avec plus de collisions observées sous météo ciblée, "
            + "sans démontrer une causalité directe.",
        "Comparer ces zones aux mêmes zones hors météo dégradée et normaliser par trafic/longueur de voirie.",
        "Lancer un ciblage préventif (signalisation, vitesse, inspection) sur les 2 premières zones puis valider "
            + "l'effet sur 2 fenêtres successives."));
    CAVEATS.put(AnalysisKind.TREND_INCIDENTS, new Caveats(
        "Une hausse/baisse brute peut provenir de saisonnalité, de variations de signalement ou de changements "
            + "de collecte.",
        "Vérifier la persistance sur plusieurs fenêtres glissantes et contrôler l'effet calendrier.",
        "Déclencher une alerte opérationnelle seulement si la tendance se maintient sur au moins 2 périodes "
            + "consécutives."));
    CAVEATS.put(AnalysisKind.WEATHER_CORRELATION, new Caveats(
        "La relation météo-collision ici est observationnelle et ne démontre pas une causalité directe.",
        "Comparer les taux rapportés au volume de trafic estimé par condition météo.",
        "Renforcer prévention et communication lors des conditions les plus corrélées, avec revue hebdomadaire "
            + "des taux normalisés."));
    CAVEATS.put(AnalysisKind.REQUESTS_TEMPERATURE, new Caveats(
        "Les volumes 311 reflètent aussi la propension à signaler; ils ne mesurent pas à eux seuls la gravité "
            + "du problème terrain.",
        "Contrôler le délai météo -> signalement et croiser avec inspections voirie.",
        "Pré-positionner les équipes sur les tranches météo les plus contributrices, puis valider par retours "
            + "terrain."));
    CAVEATS.put(AnalysisKind.REQUEST_TYPES_WEATHER, new Caveats(
        "Le classement repose sur un proxy météo (température) et un lift statistique, sans preuve causale "
            + "directe.",
        "Croiser avec observations météo locales (pluie/neige) et volumes absolus par type.",
        "Prioriser temporairement les 3 types les plus sur-représentés en météo dégradée, puis ajuster après "
            + "contrôle terrain."));
    CAVEATS.put(AnalysisKind.NEIGHBORHOODS, new Caveats(
        "Le score combiné est un indicateur de volume agrégé, non un taux de risque normalisé.",
        "Normaliser par population, trafic ou linéaire de voirie pour comparer équitablement.",
        "Utiliser ce classement comme pré-filtre de priorisation, puis arbitrer avec indicateurs normalisés."));
    CAVEATS.put(AnalysisKind.NEIGHBORHOODS_WEATHER, new Caveats(
        "Le classement compare des volumes observés en contexte météo dégradé et ne démontre pas une causalité "
            + "directe.",
        "Comparer ces volumes à des périodes météo neutres et à des taux normalisés.",
        "Lancer des actions ciblées sur les 2-3 quartiers en tête en mode pilote, puis mesurer l'impact avant "
            + "généralisation."));
    CAVEATS.put(AnalysisKind.TRANSIT_PROXIMITY, new Caveats(
        "La proximité arrêt STM-collision est approchée par une grille de coordonnées et n'implique pas une "
            + "causalité; elle peut refléter la densité de fréquentation.",
        "Ventiler par type de collision et créneau horaire pour isoler les situations réellement critiques.",
        "Programmer un audit sécurité autour des arrêts prioritaires et ajuster signalisation/patrouilles selon "
            + "les créneaux critiques."));
  }

  public Caveats caveats(AnalysisKind kind) {
    return CAVEATS.getOrDefault(kind, DEFAULT_CAVEATS);
  }

  public String lead(AggregationResult result) {
    if (result.isEmpty()) {
      return "";
    }
    ResultAttributes a = result.attributes();
    Map<String, Object> top = result.first();
    String period = a.period() == null ? "la période" : a.period().toLowerCase(Locale.ROOT);
    return switch (a.kind()) {
      case HOTSPOTS -> "Sur " + period + ", la zone la plus exposée est " + top.get("location")
          + " avec " + top.get("total_collisions") + " collisions.";
      case HOTSPOTS_WEATHER -> weatherHotspotLead(a, top);
      case TREND_INCIDENTS -> trendLead(result);
      case WEATHER_CORRELATION -> "La condition la plus associée aux collisions sur " + period + " est "
          + top.get("condition") + " (" + top.get("total") + " collisions).";
      case REQUESTS_TEMPERATURE -> {
        Map<String, Object> peak = peak(result, "count");
        yield "Les signalements 311 se concentrent surtout dans la tranche " + peak.get("band")
            + " (" + peak.get("count") + " requêtes).";
      }
      case REQUEST_TYPES_WEATHER -> "Le type 311 le plus sensible à cette météo est " + top.get("category")
          + " (" + top.get("count_weather") + " signalements ciblés).";
      case NEIGHBORHOODS -> neighborhoodLead(top);
      case NEIGHBORHOODS_WEATHER -> "En météo dégradée, le quartier le plus touché est " + top.get("neighborhood")
          + " (" + top.get("collisions") + " collisions).";
      case TRANSIT_PROXIMITY -> "Sur " + period + ", la concentration principale se situe autour de "
          + top.get("stop_name") + " (" + top.get("total") + " collisions).";
    };
  }

  private static String weatherHotspotLead(ResultAttributes a, Map<String, Object> top) {
    String name = String.valueOf(top.get("location"));
    Object total = top.get("total_collisions");
    if (a.weatherFilterRequested() != null && a.weatherFilterApplied() != null) {
      return "Sous conditions météo demandées, la zone la plus exposée est " + name + " avec " + total
          + " collisions.";
    }
    if (a.weatherRelaxed()) {
      return "Le filtre météo n'a pas pu être conservé sur cette fenêtre; la zone globale la plus exposée est "
          + name + " avec " + total + " collisions.";
    }
    return "Sans condition météo explicite dans la question, la zone globale la plus exposée est " + name
        + " avec " + total + " collisions.";
  }

  private static String neighborhoodLead(Map<String, Object> top) {
    int collisions = intOf(top, "collisions");
    int requests = intOf(top, "requests_311");
    if (collisions == 0 && requests > 0) {
      return "Aucune collision enregistrée sur cette période; le classement est basé uniquement sur les "
          + "requêtes 311 (quartier en tête: " + top.get("neighborhood") + ", " + requests + " signalements).";
    }
    return "Le quartier ressortant en premier sur le score combiné est " + top.get("neighborhood")
        + " (score " + top.get("score") + ").";
  }

  private String trendLead(AggregationResult result) {
    ResultAttributes a = result.attributes();
    boolean requests = a.trendScope() == TrendScope.REQUESTS;
    Map<String, Object> row = result.first();
    int current = intOf(row, "current");
    int previous = intOf(row, "previous");
    String singular = requests ? "requête 311" : "collision";
    String plural = requests ? "requêtes 311" : "collisions";
    String prefix = "";
    if (a.weatherFilterRequested() != null && a.weatherFilterApplied() != null) {
      prefix = "Sous conditions météo demandées, ";
    } else if (a.weatherRelaxed()) {
      prefix = "Le filtre météo n'a pas pu être conservé sur cette fenêtre; ";
    }
    String text;
    if (current == 0 && previous == 0) {
      text = "aucune " + singular + " enregistrée sur la période courante ni sur la période précédente.";
    } else if (current == 0) {
      text = "aucune " + singular + " enregistrée sur la période courante (contre " + previous
          + " sur la période précédente).";
    } else {
      text = "comparaison période courante vs précédente : " + plural + " "
          + String.format(Locale.ROOT, "%+d", intOf(row, "delta")) + " (" + pctText(row.get("pct")) + ").";
    }
    String out = prefix + text;
    return Character.toUpperCase(out.charAt(0)) + out.substring(1);
  }

  public List<String> keyPoints(AggregationResult result) {
    List<String> points = new ArrayList<>();
    ResultAttributes a = result.attributes();
    points.add("Période analysée: " + (a.period() == null ? "n/a" : a.period()) + ".");
    if (result.isEmpty()) {
      points.add("Aucun volume exploitable sur la fenêtre courante.");
      return points;
    }
    Map<String, Object> top = result.first();
    switch (a.kind()) {
      case HOTSPOTS -> {
        points.add("Zone prioritaire: " + top.get("location") + " (" + top.get("total_collisions")
            + " collisions, " + top.get("severe") + " graves).");
        points.add("Heure dominante observée: autour de " + Math.round(doubleOf(top, "mean_hour")) + "h.");
      }
      case HOTSPOTS_WEATHER -> {
        if (a.weatherRelaxed()) {
          points.add("Filtre météo assoupli: classement global collisions, zone en tête " + top.get("location")
              + " (" + top.get("total_collisions") + " collisions).");
        } else {
          points.add("Zone prioritaire sous météo demandée: " + top.get("location") + " ("
              + top.get("total_collisions") + " collisions, " + top.get("severe") + " graves).");
        }
      }
      case TREND_INCIDENTS -> {
        for (Map<String, Object> row : result.rows().subList(0, Math.min(2, result.rows().size()))) {
          points.add(row.get("segment") + ": " + row.get("current") + " vs " + row.get("previous") + " ("
              + String.format(Locale.ROOT, "%+d", intOf(row, "delta")) + ", " + pctText(row.get("pct")) + ").");
        }
      }
      case WEATHER_CORRELATION -> points.add("Condition dominante: " + top.get("condition") + " ("
          + top.get("total") + " collisions, "
          + String.format(Locale.ROOT, "%.1f", doubleOf(top, "severe_rate")) + "% graves).");
      case REQUESTS_TEMPERATURE -> {
        Map<String, Object> peak = peak(result, "count");
        points.add("Tranche thermique dominante: " + peak.get("band") + " (" + peak.get("count")
            + " requêtes 311).");
      }
      case REQUEST_TYPES_WEATHER -> points.add("Type 311 dominant en météo ciblée: " + top.get("category") + " ("
          + top.get("count_weather") + " signalements, lift x"
          + String.format(Locale.ROOT, "%.2f", doubleOf(top, "lift")) + ").");
      case NEIGHBORHOODS -> points.add("Quartier prioritaire: " + top.get("neighborhood") + " (score "
          + top.get("score") + ", collisions " + top.get("collisions") + ", req.311 " + top.get("requests_311") + ").");
      case NEIGHBORHOODS_WEATHER -> points.add("Quartier le plus exposé en météo dégradée: " + top.get("neighborhood")
          + " (" + top.get("collisions") + " collisions, " + top.get("severe") + " graves).");
      case TRANSIT_PROXIMITY -> points.add("Zone STM prioritaire: " + top.get("stop_name") + " (" + top.get("total")
          + " collisions, " + top.get("severe") + " graves).");
    }
    return points;
  }

  public Evidence evidence(AggregationResult result, PeriodSlice slice) {
    List<String> aggregates = new ArrayList<>();
    List<String> sources = new ArrayList<>();
    AnalysisKind kind = result.kind();

    List<Map<String, Object>> top = result.rows().subList(0, Math.min(AGGREGATE_LINES, result.rows().size()));
    for (int i = 0; i < top.size(); i++) {
      Map<String, Object> row = top.get(i);
      String line;
      if (kind == AnalysisKind.HOTSPOTS || kind == AnalysisKind.HOTSPOTS_WEATHER) {
        line = row.get("location") + ": " + row.get("total_collisions") + " collisions, " + row.get("severe") + " graves.";
      } else if (kind == AnalysisKind.TRANSIT_PROXIMITY) {
        line = row.get("stop_name") + ": " + row.get("total") + " collisions, " + row.get("severe") + " graves.";
      } else {
        List<String> cols = new ArrayList<>();
        for (Map.Entry<String, Object> e : row.entrySet()) {
          if (cols.size() >= 4) {
            break;
          }
          cols.add(e.getKey() + "=" + scalar(e.getValue()));
        }
        line = String.join(", ", cols);
      }
      aggregates.add("[AGR-" + (i + 1) + "] " + line);
    }

    if (kind == AnalysisKind.TREND_INCIDENTS) {
      TrendScope scope = result.attributes().trendScope() == null ? TrendScope.COLLISIONS : result.attributes().trendScope();
      if (scope.includesCollisions() && !slice.collisions().isEmpty()) {
        sources.add("[LIG-C1] " + collisionLine(slice.collisions().get(0)));
      }
      if (scope.includesRequests() && !slice.requests().isEmpty()) {
        sources.add("[LIG-R1] " + requestLine(slice.requests().get(0)));
      }
    } else if (kind == AnalysisKind.REQUESTS_TEMPERATURE || kind == AnalysisKind.REQUEST_TYPES_WEATHER) {
      List<ServiceRequestRecord> rs = slice.requests();
      for (int i = 0; i < Math.min(SOURCE_LINES, rs.size()); i++) {
        sources.add("[LIG-" + (i + 1) + "] " + requestLine(rs.get(i)));
      }
    } else {
      List<IncidentRecord> cs = slice.collisions();
      for (int i = 0; i < Math.min(SOURCE_LINES, cs.size()); i++) {
        sources.add("[LIG-" + (i + 1) + "] " + collisionLine(cs.get(i)));
      }
    }
    return new Evidence(aggregates, sources);
  }

  private static String collisionLine(IncidentRecord r) {
    return "collisions: date=" + r.date() + ", intersection=" + r.location() + ", quartier=" + r.neighborhood()
        + ", gravite=" + r.severity();
  }

  private static String requestLine(ServiceRequestRecord r) {
    return "req311: date=" + r.date() + ", quartier=" + r.neighborhood() + ", type=" + r.category()
        + ", statut=" + r.status();
  }

  static String pctText(Object pct) {
    if (!(pct instanceof Number n) || Double.isNaN(n.doubleValue())) {
      return "n/a";
    }
    return String.format(Locale.ROOT, "%+.1f%%", n.doubleValue());
  }

  private static String scalar(Object v) {
    if (v instanceof Double d) {
      return Double.isNaN(d) ? "n/a" : String.format(Locale.ROOT, "%.2f", d);
    }
    return String.valueOf(v);
  }

  private static Map<String, Object> peak(AggregationResult result, String key) {
    Map<String, Object> best = result.first();
    for (Map<String, Object> row : result.rows()) {
      if (intOf(row, key) > intOf(best, key)) {
        best = row;
      }
    }
    return best;
  }

  private static int intOf(Map<String, Object> row, String key) {
    Object v = row.get(key);
    return v instanceof Number n ? n.intValue() : 0;
  }

  private static double doubleOf(Map<String, Object> row, String key) {
    Object v = row.get(key);
    return v instanceof Number n ? n.doubleValue() : 0.0;
  }
}
