package com.mobilitycopilot.backend.engine;

/**
 * What to aggregate. {@code requestedWeather} is what the question asked for and survives
 * relaxation; {@code weatherFilter} is what is still active.
 */
public record AnalysisRequest(
    AnalysisKind kind,
    ResolvedPeriod period,
    WeatherFilter requestedWeather,
    WeatherFilter weatherFilter,
    WeatherTag weatherTag,
    TrendScope trendScope) {

  public static AnalysisRequest forQuestion(AnalysisKind kind, ResolvedPeriod period, String question) {
    WeatherFilter wf = kind.supportsWeatherFilter() ? WeatherFilter.fromQuestion(question).orElse(null) : null;
    return new AnalysisRequest(kind, period, wf, wf,
        WeatherTag.fromQuestion(question), TrendScope.fromQuestion(question));
  }

  public boolean hasActiveWeatherFilter() {
    return weatherFilter != null && kind.supportsWeatherFilter();
  }

  public AnalysisRequest withKind(AnalysisKind k) {
    return new AnalysisRequest(k, period, requestedWeather, weatherFilter, weatherTag, trendScope);
  }

  public AnalysisRequest withPeriod(ResolvedPeriod p) {
    return new AnalysisRequest(kind, p, requestedWeather, weatherFilter, weatherTag, trendScope);
  }

  public AnalysisRequest withoutWeatherFilter() {
    return new AnalysisRequest(kind, period, requestedWeather, null, weatherTag, trendScope);
  }
}
