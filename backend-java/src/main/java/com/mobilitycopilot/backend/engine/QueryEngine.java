package com.mobilitycopilot.backend.engine;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mobilitycopilot.backend.engine.model.RecordStore;

/**
 * Question in, answer out: period, routing, ambiguity check, aggregation with fallback, assembly.
 * Stateless; conversation state travels in {@link SessionContext}.
 */
public final class QueryEngine {
  private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

  static final List<String> EXAMPLES = List.of(
      "Quels quartiers ont le plus d'incidents par temps de pluie ?",
      "Quels incidents augmentent sur 7 jours ?",
      "Autour de quels arrêts STM observe-t-on le plus de collisions ?");
  static final List<String> CLARIFICATION_EXAMPLES = List.of(
      "Top 5 intersections avec le plus de collisions",
      "Quels types de requêtes 311 augmentent quand il neige ?",
      "Évolution des incidents sur 30 derniers jours");

  static final String AMBIGUITY_NOTE =
      "Question ambiguë : diagnostic par défaut des zones de collisions affiché en attendant votre choix.";
  static final String FAILURE_NOTE =
      "Le calcul n'a pas pu aboutir sur ces données; aucun chiffre n'est affiché.";

  public record Answer(CopilotResponse response, SessionContext session) {}

  private final PeriodResolver periods;
  private final IntentRouter router;
  private final AmbiguityDetector ambiguity;
  private final AggregationEngine aggregations;
  private final FallbackCascade cascade;
  private final ResponseAssembler assembler;
  private final int historyLimit;

  public QueryEngine(Clock clock, TextGenerator generator, int historyLimit) {
    this.periods = new PeriodResolver(clock);
    this.router = new IntentRouter();
    this.ambiguity = new AmbiguityDetector();
    this.aggregations = new AggregationEngine(periods);
    this.cascade = new FallbackCascade(aggregations, periods);
    this.assembler = new ResponseAssembler(generator);
    this.historyLimit = historyLimit;
  }

  public Answer answer(
      RecordStore store,
      String question,
      String periodLabel,
      boolean skipAmbiguity,
      SessionContext session) {
    SessionContext s = session == null ? SessionContext.empty() : session;
    String label = periodLabel == null || periodLabel.isBlank() ? s.selectedPeriod() : periodLabel;
    ResolvedPeriod period = periods.resolve(label, question, s.lastValidCustomRange());
    TimeWindow validCustom = periods.parseCustom(label).orElse(s.lastValidCustomRange());
    SessionContext next = s.withPeriod(label, validCustom);

    Route route = router.route(question);
    log.info("routed outcome={} kind={} rule={} period={}",
        route.outcome().code(), route.kind() == null ? "-" : route.kind().code(), route.rule(), period.label());

    CopilotResponse response;
    switch (route.outcome()) {
      case SMALLTALK -> {
        response = CopilotResponse.control(ResponseType.SMALLTALK, question,
            "Je suis prêt pour une analyse mobilité. Posez une question précise sur Montréal (période active : "
                + period.label() + ").", EXAMPLES);
        next = next.withoutPending();
      }
      case OFF_TOPIC -> {
        response = CopilotResponse.control(ResponseType.OFF_TOPIC, question,
            "Question hors périmètre. Je peux répondre uniquement sur la mobilité montréalaise : "
                + "collisions, requêtes 311, STM et météo.", EXAMPLES);
        next = next.withoutPending();
      }
      case NEEDS_CLARIFICATION -> {
        Ambiguity choices = router.clarify(question, period.label());
        response = CopilotResponse.clarification(question,
            "Question trop vague pour lancer l'analyse. Ajoutez une intention claire (top, évolution, "
                + "comparaison, période, zone), par exemple : " + String.join(" ; ", CLARIFICATION_EXAMPLES) + ".",
            choices);
        next = next.withPending(new PendingChoice(question, choices));
      }
      default -> {
        AnalysisKind kind = route.kind();
        Ambiguity amb = !skipAmbiguity && kind == AnalysisKind.HOTSPOTS ? ambiguity.detect(question) : Ambiguity.NONE;
        if (amb.ambiguous()) {
          response = analyze(store, question, kind, period, AMBIGUITY_NOTE).asAmbiguous(amb);
          next = next.withPending(new PendingChoice(question, amb));
        } else {
          response = analyze(store, question, kind, period, null);
          next = next.withoutPending();
        }
      }
    }

    ChatTurn turn = new ChatTurn(question, response.type(),
        response.trace() == null ? null : response.trace().kind(),
        response.confidence() == null ? null : response.confidence().level());
    return new Answer(response, next.withTurn(turn, historyLimit));
  }

  /**
   * Runs the refined question of the pending option {@code optionIndex}, skipping the ambiguity check.
   *
   * @throws IllegalArgumentException when nothing is pending or the index is out of range
   */
  public Answer choose(RecordStore store, int optionIndex, String periodLabel, SessionContext session) {
    SessionContext s = session == null ? SessionContext.empty() : session;
    if (s.pendingChoice() == null || s.pendingChoice().choices() == null) {
      throw new IllegalArgumentException("no pending choice in this session");
    }
    ChoiceOption option = s.pendingChoice().choices().option(optionIndex);
    return answer(store, option.refinedQuestion(), periodLabel, true, s.withoutPending());
  }

  private CopilotResponse analyze(
      RecordStore store,
      String question,
      AnalysisKind kind,
      ResolvedPeriod period,
      String extraNote) {
    AnalysisRequest request = AnalysisRequest.forQuestion(kind, period, question);
    try {
      FallbackCascade.Outcome outcome = cascade.execute(store, request);
      AggregationResult result = outcome.result();
      if (extraNote != null) {
        result = result.withAttributes(a -> a.withNote(extraNote));
      }
      PeriodSlice slice = aggregations.slice(store, outcome.finalRequest().period());
      return assembler.assemble(question, result, slice);
    } catch (RuntimeException e) {
      log.warn("analysis failed kind={}: {}", kind.code(), e.toString(), e);
      AggregationResult failed = AggregationResult.empty(kind)
          .withAttributes(a -> a.withPeriod(period.label(), null, null).withNote(FAILURE_NOTE));
      return assembler.assemble(question, failed, new PeriodSlice(List.of(), List.of(), null, null));
    }
  }
}
