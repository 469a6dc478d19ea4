package com.mobilitycopilot.backend.engine;

import com.mobilitycopilot.backend.util.TextNormalizer;

/**
 * A question in its lower-cased and accent-folded forms.
 */
public record NormalizedText(String raw, String lower, String folded) {

  public static NormalizedText of(String raw) {
    String r = raw == null ? "" : raw;
    return new NormalizedText(r, TextNormalizer.lower(r), TextNormalizer.fold(r));
  }

  public boolean isBlank() {
    return folded.isBlank();
  }
}
