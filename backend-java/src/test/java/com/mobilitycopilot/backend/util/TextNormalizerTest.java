package com.mobilitycopilot.backend.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

  @Test
  @DisplayName("fold strips accents, lower-cases and collapses spaces")
  void fold() {
    assertEquals("meteo", TextNormalizer.fold("Météo"));
    assertEquals("ou ca coince ?", TextNormalizer.fold("  Où   ça coince ?"));
    assertEquals("", TextNormalizer.fold(null));
  }

  @Test
  void orDefaultTreatsNanAndBlankAsMissing() {
    assertEquals("x", TextNormalizer.orDefault("nan", "x"));
    assertEquals("x", TextNormalizer.orDefault("  ", "x"));
    assertEquals("Rosemont", TextNormalizer.orDefault(" Rosemont ", "x"));
    assertNull(TextNormalizer.blankToNull(" "));
  }
}
