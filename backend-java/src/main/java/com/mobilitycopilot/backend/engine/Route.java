package com.mobilitycopilot.backend.engine;

/**
 * Router verdict. {@code kind} is set only when {@code outcome} is {@link RouteOutcome#ANALYSIS};
 * {@code rule} names the rule that fired.
 */
public record Route(RouteOutcome outcome, AnalysisKind kind, String rule) {

  public static Route control(RouteOutcome outcome) {
    return new Route(outcome, null, outcome.code());
  }

  public static Route analysis(AnalysisKind kind, String rule) {
    return new Route(RouteOutcome.ANALYSIS, kind, rule);
  }

  public boolean isAnalysis() {
    return outcome == RouteOutcome.ANALYSIS;
  }
}
