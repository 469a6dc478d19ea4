package com.mobilitycopilot.backend.engine;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the confidence of a result from its rows and attributes only.
 */
public final class ConfidenceEvaluator {
  private ConfidenceEvaluator() {}

  private static final List<String> HYPOTHESIS_MARKERS =
      List.of("ambigu", "elargi", "élargi", "fallback", "par défaut", "assoupli", "tranche de température");

  public static Confidence evaluate(AggregationResult result) {
    if (result == null || result.isEmpty()) {
      return new Confidence(ConfidenceLevel.INSUFFICIENT, "Données insuffisantes",
          "Aucun résultat exploitable sur la fenêtre sélectionnée : élargir la période ou reformuler la question.");
    }
    ResultAttributes a = result.attributes();
    if (a.weatherRelaxed()) {
      return new Confidence(ConfidenceLevel.PARTIAL, "Analyse partielle",
          "Filtre météo demandé assoupli faute d'échantillon suffisant; lecture descriptive à confirmer.");
    }
    String notes = String.join(" ", a.notes()).toLowerCase(Locale.ROOT);
    for (String m : HYPOTHESIS_MARKERS) {
      if (notes.contains(m)) {
        return new Confidence(ConfidenceLevel.PARTIAL, "Analyse partielle",
            "Analyse déclenchée avec hypothèse de routage; valider l'intention métier avant décision.");
      }
    }
    if (a.kind() == AnalysisKind.TREND_INCIDENTS && currentIsZero(result)) {
      return new Confidence(ConfidenceLevel.PARTIAL, "Analyse partielle",
          "Aucun enregistrement sur la période courante alors que la période précédente en contient : "
              + "vérifier la fraîcheur des données avant de conclure à une baisse.");
    }
    if (a.alignmentCaveat() != null) {
      return new Confidence(ConfidenceLevel.PARTIAL, "Analyse partielle", a.alignmentCaveat());
    }
    if (a.kind().isDescriptive()) {
      return new Confidence(ConfidenceLevel.PARTIAL, "Analyse partielle",
          "Corrélation descriptive, données non normalisées (population, trafic, longueur de voirie).");
    }
    return new Confidence(ConfidenceLevel.VERIFIED, "Analyse vérifiée",
        "Calculs reproduits sur données filtrées avec trace d'exécution et preuves affichées.");
  }

  private static boolean currentIsZero(AggregationResult result) {
    Map<String, Object> first = result.first();
    Object cur = first.get("current");
    Object prev = first.get("previous");
    return cur instanceof Number c && prev instanceof Number p && c.intValue() == 0 && p.intValue() > 0;
  }
}
