package com.mobilitycopilot.backend.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-casing and accent folding shared by the lexical matchers.
 *
 * "Météo", "meteo" and "METEO" all fold to "meteo".
 */
public final class TextNormalizer {
  private TextNormalizer() {}

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern SPACES = Pattern.compile("\\s+");

  public static String lower(String text) {
    if (text == null) {
      return "";
    }
    return SPACES.matcher(text.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
  }

  public static String fold(String text) {
    String l = lower(text);
    if (l.isEmpty()) {
      return l;
    }
    String decomposed = Normalizer.normalize(l, Normalizer.Form.NFKD);
    return COMBINING_MARKS.matcher(decomposed).replaceAll("");
  }

  public static String blankToNull(String text) {
    if (text == null) {
      return null;
    }
    String t = text.trim();
    return t.isEmpty() ? null : t;
  }

  public static String orDefault(String text, String fallback) {
    String t = blankToNull(text);
    if (t == null || t.equalsIgnoreCase("nan") || t.equalsIgnoreCase("none")) {
      return fallback;
    }
    return t;
  }
}
