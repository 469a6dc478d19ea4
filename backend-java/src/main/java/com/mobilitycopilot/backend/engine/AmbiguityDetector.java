package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.mobilitycopilot.backend.util.TextNormalizer;

/**
 * Catalogue of vague phrasings with their candidate readings. Only consulted for
 * questions that fell through to the default hotspot kind.
 */
public final class AmbiguityDetector {

  private record Phrase(String pattern, String reason, List<String> options) {}

  private static final List<String> CONGESTION_OPTIONS = List.of(
      "Embouteillages / ralentissements de trafic",
      "Zones à fort taux de collisions",
      "Secteurs avec beaucoup de requêtes 311 non résolues");

  private static final List<Phrase> CATALOGUE = List.of(
      new Phrase("ça coince", "L'expression 'ça coince' peut désigner plusieurs phénomènes.", CONGESTION_OPTIONS),
      new Phrase("ça bloque", "L'expression 'ça bloque' peut désigner plusieurs phénomènes.", CONGESTION_OPTIONS),
      new Phrase("incidents", "Le terme 'incidents' peut couvrir différents types de données.", List.of(
          "Collisions routières (base de données accidents)",
          "Requêtes 311 (problèmes signalés par citoyens)",
          "Perturbations du réseau STM")),
      new Phrase("problèmes", "Plusieurs types de problèmes sont disponibles dans les données.", List.of(
          "Problèmes de voirie (nids-de-poule, trottoirs)",
          "Problèmes de sécurité (collisions, zones dangereuses)",
          "Problèmes d'infrastructure (éclairage, aqueduc)")));

  private static final Pattern CONGESTION_VARIANT = Pattern.compile("\\b(ca|ça)\\s+(coince|bloque)\\b");

  public Ambiguity detect(String question) {
    NormalizedText q = NormalizedText.of(question);
    for (Phrase p : CATALOGUE) {
      String folded = TextNormalizer.fold(p.pattern());
      if (q.lower().contains(p.pattern()) || q.folded().contains(folded)) {
        return build(question, p);
      }
    }
    if (CONGESTION_VARIANT.matcher(q.lower()).find() || CONGESTION_VARIANT.matcher(q.folded()).find()) {
      return build(question, CATALOGUE.get(0));
    }
    return Ambiguity.NONE;
  }

  private static Ambiguity build(String question, Phrase p) {
    List<ChoiceOption> options = new ArrayList<>();
    for (String label : p.options()) {
      options.add(new ChoiceOption(label, refine(question, label)));
    }
    return new Ambiguity(true, p.reason(), options);
  }

  /** Rewrites the question with an orientation clause picked from the chosen label. */
  static String refine(String question, String choice) {
    String q = question == null ? "" : question.trim();
    String c = choice.toLowerCase(Locale.ROOT);
    if (c.contains("requête") || c.contains("311")) {
      return "Analyse orientée requêtes 311: " + q;
    }
    if (c.contains("stm") || c.contains("bus") || c.contains("métro")) {
      return "Analyse orientée STM: " + q;
    }
    if (c.contains("embouteill") || c.contains("trafic")) {
      return "Analyse orientée congestion routière (proxy collisions): " + q;
    }
    if (c.contains("collision") || c.contains("sécurité")) {
      return "Analyse orientée collisions routières: " + q;
    }
    return "Analyse orientée: " + choice + ". Question: " + q;
  }
}
