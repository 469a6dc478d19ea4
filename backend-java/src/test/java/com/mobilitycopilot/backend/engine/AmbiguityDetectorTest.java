package com.mobilitycopilot.backend.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AmbiguityDetectorTest {
  private final AmbiguityDetector detector = new AmbiguityDetector();

  @Test
  @DisplayName("'où ça coince' offers three distinct readings")
  void congestionPhrase() {
    Ambiguity a = detector.detect("Où ça coince ?");
    assertTrue(a.ambiguous());
    assertEquals(3, a.options().size());

    Set<String> refined = new HashSet<>();
    for (ChoiceOption o : a.options()) {
      assertTrue(o.refinedQuestion().endsWith("Où ça coince ?"));
      refined.add(o.refinedQuestion());
    }
    assertEquals(3, refined.size());
    assertTrue(a.options().get(0).refinedQuestion().startsWith("Analyse orientée congestion routière"));
    assertTrue(a.options().get(1).refinedQuestion().startsWith("Analyse orientée collisions routières"));
    assertTrue(a.options().get(2).refinedQuestion().startsWith("Analyse orientée requêtes 311"));
  }

  @Test
  @DisplayName("unaccented variants are caught too")
  void unaccentedVariant() {
    assertTrue(detector.detect("ou ca bloque le plus").ambiguous());
    assertTrue(detector.detect("Quels problemes sur le reseau ?").ambiguous());
  }

  @Test
  void preciseQuestionIsNotAmbiguous() {
    assertFalse(detector.detect("Top 5 intersections avec le plus de collisions").ambiguous());
    assertSame(Ambiguity.NONE, detector.detect("Top 5 intersections avec le plus de collisions"));
  }

  @Test
  @DisplayName("STM reading and generic reading get their own orientation")
  void refineOrientation() {
    assertEquals("Analyse orientée STM: x", AmbiguityDetector.refine("x", "Perturbations du réseau STM"));
    assertEquals("Analyse orientée: Autre chose. Question: x", AmbiguityDetector.refine(" x ", "Autre chose"));
  }

  @Test
  void optionIndexOutOfRange() {
    Ambiguity a = detector.detect("Où ça coince ?");
    assertThrows(IllegalArgumentException.class, () -> a.option(3));
    assertThrows(IllegalArgumentException.class, () -> a.option(-1));
  }
}
