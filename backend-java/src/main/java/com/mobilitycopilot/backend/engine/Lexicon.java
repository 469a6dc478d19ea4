package com.mobilitycopilot.backend.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.mobilitycopilot.backend.util.TextNormalizer;

/**
 * Word list matched against the folded question. Stems match as substrings,
 * words only as whole words ("sec" must not fire on "secteur").
 */
public final class Lexicon {
  private final List<String> stems;
  private final List<Pattern> words;

  private Lexicon(List<String> stems, List<Pattern> words) {
    this.stems = stems;
    this.words = words;
  }

  public static Lexicon stems(String... stems) {
    List<String> folded = new ArrayList<>();
    for (String s : stems) {
      folded.add(TextNormalizer.fold(s));
    }
    return new Lexicon(List.copyOf(folded), List.of());
  }

  public Lexicon words(String... words) {
    List<Pattern> out = new ArrayList<>(this.words);
    for (String w : words) {
      out.add(Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(TextNormalizer.fold(w)) + "(?![\\p{L}\\p{N}])"));
    }
    return new Lexicon(stems, List.copyOf(out));
  }

  public boolean matches(NormalizedText text) {
    return matches(text.folded());
  }

  public boolean matches(String folded) {
    for (String s : stems) {
      if (folded.contains(s)) {
        return true;
      }
    }
    for (Pattern p : words) {
      if (p.matcher(folded).find()) {
        return true;
      }
    }
    return false;
  }
}
