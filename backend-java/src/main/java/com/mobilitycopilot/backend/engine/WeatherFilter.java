package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.mobilitycopilot.backend.util.TextNormalizer;

/**
 * Condition-label filter for collisions, built from the weather words of a question.
 * A record matches when its folded condition contains any of the terms.
 */
public record WeatherFilter(List<Family> families, List<String> terms) {

  public enum Family {
    SNOW("neige", "quand il neige",
        Lexicon.stems("neige", "enneig", "tempete").words("snow"),
        List.of("enneig", "neige")),
    RAIN("pluie", "quand il pleut",
        Lexicon.stems("pluie", "pleu", "mouill", "averse").words("rain", "wet"),
        List.of("mouill", "pluie", "averse")),
    ICE("verglas", "en cas de verglas",
        Lexicon.stems("verglas", "glace", "gel").words("ice"),
        List.of("glac", "verglas", "gel")),
    DRY("sec", "par temps sec",
        Lexicon.stems().words("sec", "seche", "dry"),
        List.of("seche", "sec"));

    private final String label;
    private final String clause;
    private final Lexicon trigger;
    private final List<String> terms;

    Family(String label, String clause, Lexicon trigger, List<String> terms) {
      this.label = label;
      this.clause = clause;
      this.trigger = trigger;
      this.terms = terms;
    }

    public String label() {
      return label;
    }

    public String clause() {
      return clause;
    }

    public List<String> terms() {
      return terms;
    }

    /** First family named in the question, in declaration order, or null. */
    public static Family firstIn(NormalizedText q) {
      for (Family f : values()) {
        if (f.trigger.matches(q)) {
          return f;
        }
      }
      return null;
    }
  }

  public WeatherFilter {
    families = List.copyOf(families);
    terms = List.copyOf(terms);
  }

  public static Optional<WeatherFilter> fromQuestion(String question) {
    NormalizedText q = NormalizedText.of(question);
    List<Family> found = new ArrayList<>();
    Set<String> terms = new LinkedHashSet<>();
    for (Family f : Family.values()) {
      if (f.trigger.matches(q)) {
        found.add(f);
        terms.addAll(f.terms());
      }
    }
    if (found.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new WeatherFilter(found, new ArrayList<>(terms)));
  }

  public static WeatherFilter of(Family family) {
    return new WeatherFilter(List.of(family), family.terms());
  }

  public boolean matches(String condition) {
    String c = TextNormalizer.fold(condition);
    for (String t : terms) {
      if (c.contains(t)) {
        return true;
      }
    }
    return false;
  }

  /** Terms joined as an alternation, e.g. {@code enneig|neige}. */
  public String describe() {
    return String.join("|", terms);
  }
}
