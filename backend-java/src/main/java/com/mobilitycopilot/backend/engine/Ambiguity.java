package com.mobilitycopilot.backend.engine;

import java.util.List;

/**
 * Options offered to the user when a question cannot be run as is. Used both for
 * vague phrasings and for questions without an analytic angle.
 */
public record Ambiguity(boolean ambiguous, String reason, List<ChoiceOption> options) {

  public static final Ambiguity NONE = new Ambiguity(false, null, List.of());

  public Ambiguity {
    options = options == null ? List.of() : List.copyOf(options);
  }

  public ChoiceOption option(int index) {
    if (index < 0 || index >= options.size()) {
      throw new IllegalArgumentException("option index " + index + " out of range (0.." + (options.size() - 1) + ")");
    }
    return options.get(index);
  }
}
