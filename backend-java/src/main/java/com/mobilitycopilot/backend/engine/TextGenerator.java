package com.mobilitycopilot.backend.engine;

/**
 * Optional text-generation collaborator used to paraphrase an already computed result.
 * Returns null on any failure; callers treat null and exceptions the same way.
 */
public interface TextGenerator {

  String generate(String systemPrompt, String userPrompt, int maxTokens, double temperature);

  /** False when no provider is configured; the engine then skips the call. */
  default boolean isEnabled() {
    return true;
  }

  static TextGenerator disabled() {
    return new TextGenerator() {
      @Override
      public String generate(String systemPrompt, String userPrompt, int maxTokens, double temperature) {
        return null;
      }

      @Override
      public boolean isEnabled() {
        return false;
      }
    };
  }
}
