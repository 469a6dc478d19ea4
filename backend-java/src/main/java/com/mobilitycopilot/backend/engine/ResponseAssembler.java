package com.mobilitycopilot.backend.engine;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packages a final result: confidence, lead, key points, caveats, evidence, optional paraphrase.
 */
public final class ResponseAssembler {
  private static final Logger log = LoggerFactory.getLogger(ResponseAssembler.class);

  static final int PARAPHRASE_MAX_TOKENS = 420;
  static final double PARAPHRASE_TEMPERATURE = 0.1;
  static final int MIN_PARAPHRASE_LENGTH = 70;
  static final int MIN_UNPUNCTUATED_LENGTH = 140;
  static final int PREVIEW_ROWS = 6;

  static final String NOTE_UNAVAILABLE = "Assistant de rédaction indisponible : réponse chiffrée seule.";
  static final String NOTE_NOT_CONFIGURED =
      "Assistant de rédaction indisponible : aucun fournisseur de texte configuré.";
  static final String NOTE_REJECTED =
      "Assistant de rédaction indisponible : texte généré trop court pour être affiché.";

  static final String SYSTEM_PROMPT = "Tu es un analyste mobilité pour Montréal. "
      + "Tu dois répondre uniquement à partir des données fournies ci-dessous. "
      + "N'invente rien. Si une info manque, dis-le explicitement. "
      + "Réponse courte, factuelle, en français.";

  private final TextGenerator generator;
  private final InsightWriter insights;
  private final GlossaryCorpus glossary;

  public ResponseAssembler(TextGenerator generator) {
    this.generator = generator == null ? TextGenerator.disabled() : generator;
    this.insights = new InsightWriter();
    this.glossary = new GlossaryCorpus();
  }

  record Paraphrase(String text, String note) {}

  public CopilotResponse assemble(String question, AggregationResult result, PeriodSlice slice) {
    Confidence confidence = ConfidenceEvaluator.evaluate(result);
    String lead = insights.lead(result);
    Paraphrase p = result.isEmpty() ? new Paraphrase(null, null) : paraphrase(question, result);
    return new CopilotResponse(
        ResponseType.ANSWER,
        question,
        lead.isEmpty() ? confidence.detail() : lead,
        lead,
        result.rows(),
        confidence,
        result.attributes(),
        insights.keyPoints(result),
        insights.caveats(result.kind()),
        insights.evidence(result, slice),
        p.text(),
        p.note(),
        null,
        List.of());
  }

  Paraphrase paraphrase(String question, AggregationResult result) {
    if (!generator.isEnabled()) {
      return new Paraphrase(null, NOTE_NOT_CONFIGURED);
    }
    String out;
    try {
      out = generator.generate(SYSTEM_PROMPT, userPrompt(question, result), PARAPHRASE_MAX_TOKENS,
          PARAPHRASE_TEMPERATURE);
    } catch (RuntimeException e) {
      log.warn("paraphrase failed: {}", e.toString());
      out = null;
    }
    if (out == null || out.isBlank()) {
      return new Paraphrase(null, NOTE_UNAVAILABLE);
    }
    if (!acceptable(out)) {
      log.debug("paraphrase rejected, {} chars", out.length());
      return new Paraphrase(null, NOTE_REJECTED);
    }
    return new Paraphrase(out.strip(), null);
  }

  static boolean acceptable(String text) {
    String clean = String.join(" ", text.replace("\r", "").trim().split("\\s+"));
    if (clean.length() < MIN_PARAPHRASE_LENGTH) {
      return false;
    }
    boolean punctuated = clean.indexOf('.') >= 0 || clean.indexOf('!') >= 0 || clean.indexOf('?') >= 0;
    return punctuated || clean.length() >= MIN_UNPUNCTUATED_LENGTH;
  }

  private String userPrompt(String question, AggregationResult result) {
    String context = glossary.context(question);
    if (context.length() > 1200) {
      context = context.substring(0, 1200);
    }
    return "Question utilisateur: " + question + "\n"
        + "Type d'analyse: " + result.kind().code() + "\n"
        + "Période: " + result.attributes().period() + "\n\n"
        + "Contexte:\n" + context + "\n\n"
        + "Aperçu chiffré:\n" + preview(result) + "\n\n"
        + "Rédige:\n"
        + "1) Réponse directe (2 phrases max).\n"
        + "2) 2 points clés en liste.\n"
        + "3) 1 prudence méthodologique (1 phrase).";
  }

  static String preview(AggregationResult result) {
    if (result.isEmpty()) {
      return "Aucun résultat chiffré.";
    }
    List<Map<String, Object>> rows = result.rows().subList(0, Math.min(PREVIEW_ROWS, result.rows().size()));
    String header = String.join(",", rows.get(0).keySet());
    String body = rows.stream()
        .map(r -> r.values().stream().map(String::valueOf).collect(Collectors.joining(",")))
        .collect(Collectors.joining("\n"));
    return header + "\n" + body;
  }
}
