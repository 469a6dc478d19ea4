package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static knowledge about the datasets, retrieved by keyword and handed to the paraphrase prompt.
 */
public final class GlossaryCorpus {
  static final int MAX_ENTRIES = 3;

  record Entry(String title, String description, List<String> extras) {}

  private static final Map<String, Entry> ENTRIES = new LinkedHashMap<>();
  private static final Map<String, String> KEYWORDS = new LinkedHashMap<>();

  static {
    ENTRIES.put("dataset_311", new Entry(
        "Requêtes 311 – Ville de Montréal",
        "Le service 311 reçoit les demandes citoyennes pour des problèmes urbains non urgents. "
            + "Chaque requête contient : type de service, date, arrondissement, statut de traitement.",
        List.of("Catégories: Nids-de-poule, Déneigement, Éclairage défectueux, Aqueduc/Fuite, "
            + "Collecte des ordures, Entretien trottoir")));
    ENTRIES.put("dataset_collisions", new Entry(
        "Collisions routières – Ville de Montréal",
        "Données géolocalisées des accidents de la route sur l'île de Montréal. Gravité : dommages matériels, "
            + "blessés légers, blessés graves, mortel. Heure de survenance 0–23, pics 7h–9h et 16h–19h.",
        List.of()));
    ENTRIES.put("dataset_stm", new Entry(
        "Transport collectif STM – GTFS",
        "Arrêts du réseau de bus et métro de la Société de transport de Montréal (identifiant, nom, coordonnées, ligne).",
        List.of()));
    ENTRIES.put("dataset_meteo", new Entry(
        "Météo Canada – observations quotidiennes",
        "Observations climatiques quotidiennes sur l'île de Montréal : température max/min (°C), "
            + "précipitations totales (mm), chutes de neige (cm), station d'observation.",
        List.of("Seuils critiques: verglas entre -5°C et 2°C avec précipitations; tempête de neige au-delà de "
            + "15 cm en 24h; pluie forte au-delà de 10 mm; grand froid sous -15°C.")));
    ENTRIES.put("definitions", new Entry(
        "Définitions",
        "Hotspot : zone présentant une concentration anormalement élevée d'incidents sur une période donnée. "
            + "Signal faible : tendance émergente de faible volume mais persistante. "
            + "Tendance : évolution d'un indicateur comparée à une période de référence.",
        List.of()));

    for (String k : List.of("311", "requete", "nid", "deneig", "ordure", "trottoir")) {
      KEYWORDS.put(k, "dataset_311");
    }
    for (String k : List.of("collision", "accident", "gravite", "pieton", "cycliste")) {
      KEYWORDS.put(k, "dataset_collisions");
    }
    for (String k : List.of("stm", "bus", "arret", "metro")) {
      KEYWORDS.put(k, "dataset_stm");
    }
    for (String k : List.of("meteo", "pluie", "neige", "temperature", "verglas")) {
      KEYWORDS.put(k, "dataset_meteo");
    }
    for (String k : List.of("hotspot", "signal", "tendance")) {
      KEYWORDS.put(k, "definitions");
    }
  }

  /** Formatted context for a question; collisions and 311 when nothing matches. */
  public String context(String question) {
    String q = NormalizedText.of(question).folded();
    Set<String> keys = new LinkedHashSet<>();
    for (Map.Entry<String, String> e : KEYWORDS.entrySet()) {
      if (q.contains(e.getKey())) {
        keys.add(e.getValue());
      }
    }
    if (keys.isEmpty()) {
      keys.add("dataset_collisions");
      keys.add("dataset_311");
    }
    List<String> parts = new ArrayList<>();
    for (String k : keys) {
      if (parts.size() >= MAX_ENTRIES) {
        break;
      }
      Entry e = ENTRIES.get(k);
      StringBuilder sb = new StringBuilder("[SOURCE: ").append(e.title()).append("]\n").append(e.description());
      for (String x : e.extras()) {
        sb.append('\n').append(x);
      }
      parts.add(sb.toString());
    }
    return String.join("\n\n", parts);
  }
}
