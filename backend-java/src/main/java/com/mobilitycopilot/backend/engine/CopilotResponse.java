package com.mobilitycopilot.backend.engine;

import java.util.List;
import java.util.Map;

/**
 * Payload of one question. Control states (smalltalk, off topic, clarification) carry a
 * message and examples or options; analyses carry rows, confidence and trace.
 * While an ambiguity is pending both the options and a default diagnostic are present.
 */
public record CopilotResponse(
    ResponseType type,
    String question,
    String message,
    String leadInsight,
    List<Map<String, Object>> rows,
    Confidence confidence,
    ResultAttributes trace,
    List<String> keyPoints,
    Caveats caveats,
    Evidence evidence,
    String paraphrase,
    String paraphraseNote,
    Ambiguity choices,
    List<String> examples) {

  public static CopilotResponse control(ResponseType type, String question, String message, List<String> examples) {
    return new CopilotResponse(type, question, message, null, List.of(), null, null, List.of(), null, null,
        null, null, null, examples);
  }

  public static CopilotResponse clarification(String question, String message, Ambiguity choices) {
    return new CopilotResponse(ResponseType.NEEDS_CLARIFICATION, question, message, null, List.of(), null, null,
        List.of(), null, null, null, null, choices, List.of());
  }

  public CopilotResponse asAmbiguous(Ambiguity choices) {
    return new CopilotResponse(ResponseType.AMBIGUOUS, question, choices.reason(), leadInsight, rows, confidence,
        trace, keyPoints, caveats, evidence, paraphrase, paraphraseNote, choices, examples);
  }
}
