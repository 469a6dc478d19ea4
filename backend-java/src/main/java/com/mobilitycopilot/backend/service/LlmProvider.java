package com.mobilitycopilot.backend.service;

import java.util.Locale;

public enum LlmProvider {
  GEMINI("gemini", "gemini-2.5-flash-lite", "https://generativelanguage.googleapis.com/v1beta", "GEMINI_API_KEY"),
  ANTHROPIC("anthropic", "claude-3-5-sonnet-latest", "https://api.anthropic.com", "ANTHROPIC_API_KEY"),
  OPENAI("openai", "gpt-4o-mini", "https://api.openai.com/v1", "OPENAI_API_KEY");

  private final String code;
  private final String defaultModel;
  private final String defaultBaseUrl;
  private final String keyEnv;

  LlmProvider(String code, String defaultModel, String defaultBaseUrl, String keyEnv) {
    this.code = code;
    this.defaultModel = defaultModel;
    this.defaultBaseUrl = defaultBaseUrl;
    this.keyEnv = keyEnv;
  }

  public String code() {
    return code;
  }

  public String defaultModel() {
    return defaultModel;
  }

  public String defaultBaseUrl() {
    return defaultBaseUrl;
  }

  public String keyEnv() {
    return keyEnv;
  }

  /** Null for blank or unknown names. */
  public static LlmProvider fromCode(String code) {
    if (code == null) {
      return null;
    }
    String c = code.trim().toLowerCase(Locale.ROOT);
    for (LlmProvider p : values()) {
      if (p.code.equals(c)) {
        return p;
      }
    }
    return null;
  }
}
