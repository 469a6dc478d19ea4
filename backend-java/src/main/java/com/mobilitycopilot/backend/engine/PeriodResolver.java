package com.mobilitycopilot.backend.engine;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.mobilitycopilot.backend.engine.model.RecordStore;
import com.mobilitycopilot.backend.util.CustomPeriodParser;
import com.mobilitycopilot.backend.util.TextNormalizer;

/**
 * Turns the sidebar period and the question text into an effective period.
 */
public final class PeriodResolver {
  public static final String LAST_7_DAYS = "7 derniers jours";
  public static final String LAST_30_DAYS = "30 derniers jours";
  public static final String LAST_3_MONTHS = "3 derniers mois";
  public static final String LAST_12_MONTHS = "12 derniers mois";

  public static final int DEFAULT_DAYS = 30;
  public static final int WIDEST_DAYS = 365;

  private static final Map<String, Integer> BUCKETS = new LinkedHashMap<>();

  static {
    BUCKETS.put(LAST_7_DAYS, 7);
    BUCKETS.put(LAST_30_DAYS, 30);
    BUCKETS.put(LAST_3_MONTHS, 90);
    BUCKETS.put(LAST_12_MONTHS, WIDEST_DAYS);
  }

  private record PeriodKeywords(String label, List<String> keywords) {}

  private static final List<PeriodKeywords> QUESTION_OVERRIDES = List.of(
      new PeriodKeywords(LAST_7_DAYS, List.of("7 jours", "7j", "7 derniers jours", "cette semaine", "semaine")),
      new PeriodKeywords(LAST_30_DAYS, List.of("30 jours", "30j", "30 derniers jours")),
      new PeriodKeywords(LAST_3_MONTHS, List.of("3 mois", "90 jours", "trimestre")),
      new PeriodKeywords(LAST_12_MONTHS, List.of("12 mois", "365 jours", "1 an", "un an", "annee")));

  private final Clock clock;

  public PeriodResolver(Clock clock) {
    this.clock = clock;
  }

  public static List<String> bucketLabels() {
    return List.copyOf(BUCKETS.keySet());
  }

  /**
   * @param uiLabel sidebar label, one of the four buckets or a custom range
   * @param question free text; an explicit period keyword wins over the sidebar
   * @param lastValidCustom last custom range that parsed, used when {@code uiLabel} is a broken custom label
   */
  public ResolvedPeriod resolve(String uiLabel, String question, TimeWindow lastValidCustom) {
    Optional<ResolvedPeriod> fromQuestion = fromQuestion(question);
    if (fromQuestion.isPresent()) {
      return fromQuestion.get();
    }
    if (CustomPeriodParser.looksCustom(uiLabel)) {
      Optional<TimeWindow> parsed = parseCustom(uiLabel);
      if (parsed.isPresent()) {
        return custom(parsed.get());
      }
      if (lastValidCustom != null) {
        return custom(lastValidCustom);
      }
      return named(LAST_30_DAYS);
    }
    return named(uiLabel);
  }

  public Optional<TimeWindow> parseCustom(String label) {
    return CustomPeriodParser.parse(label).map(r -> new TimeWindow(r.start(), r.end()));
  }

  public ResolvedPeriod named(String label) {
    Integer days = label == null ? null : BUCKETS.get(label.trim());
    if (days == null) {
      return new ResolvedPeriod(LAST_30_DAYS, DEFAULT_DAYS, null);
    }
    return new ResolvedPeriod(label.trim(), days, null);
  }

  public ResolvedPeriod widest() {
    return named(LAST_12_MONTHS);
  }

  public ResolvedPeriod custom(TimeWindow window) {
    return new ResolvedPeriod(
        CustomPeriodParser.format(window.start(), window.end()),
        (int) window.lengthDays(),
        window);
  }

  /** Latest record date of the store, or today when the store holds nothing. */
  public LocalDate anchor(RecordStore store) {
    return store.latestDate().orElseGet(() -> LocalDate.now(clock));
  }

  public LocalDate today() {
    return LocalDate.now(clock);
  }

  private static Optional<ResolvedPeriod> fromQuestion(String question) {
    String q = TextNormalizer.fold(question);
    if (q.isEmpty()) {
      return Optional.empty();
    }
    for (PeriodKeywords o : QUESTION_OVERRIDES) {
      for (String k : o.keywords()) {
        if (q.contains(k)) {
          return Optional.of(new ResolvedPeriod(o.label(), BUCKETS.get(o.label()), null));
        }
      }
    }
    return Optional.empty();
  }
}
