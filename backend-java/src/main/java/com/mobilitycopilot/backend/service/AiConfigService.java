package com.mobilitycopilot.backend.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobilitycopilot.backend.util.SharedBackendPaths;

/**
 * Text-generation settings: environment first, then the local {@code config.json}, then defaults.
 */
@Service
public class AiConfigService {
  private final ObjectMapper objectMapper;

  @Value("${app.llm.enabled:true}")
  private boolean enabled;

  @Value("${app.llm.local-config-path:./config.json}")
  private String localConfigPath;

  @Value("${app.llm.connect-timeout-ms:5000}")
  private long connectTimeoutMs;

  @Value("${app.llm.request-timeout-ms:12000}")
  private long requestTimeoutMs;

  public AiConfigService(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String getEnv(String... names) {
    for (String n : names) {
      String v = System.getenv(n);
      if (v != null && !v.trim().isEmpty()) {
        return v.trim();
      }
    }
    return null;
  }

  public boolean isLlmEnabled() {
    String env = getEnv("APP_LLM_ENABLED", "LLM_ENABLED");
    if (env != null) {
      String v = env.trim().toLowerCase(Locale.ROOT);
      return v.equals("1") || v.equals("true") || v.equals("yes") || v.equals("y") || v.equals("on");
    }
    return enabled;
  }

  public long connectTimeoutMs() {
    return connectTimeoutMs;
  }

  public long requestTimeoutMs() {
    String sec = getEnv("LLM_TIMEOUT_SEC");
    if (sec != null) {
      try {
        return Math.round(Double.parseDouble(sec) * 1000);
      } catch (NumberFormatException e) {
        return requestTimeoutMs;
      }
    }
    return requestTimeoutMs;
  }

  /**
   * Explicit {@code LLM_PROVIDER} (or {@code llm.provider}), else the first provider with a key.
   * Null when nothing is configured.
   */
  public LlmProvider provider() {
    LlmProvider explicit = LlmProvider.fromCode(firstNonNull(getEnv("LLM_PROVIDER"), getCfg("llm.provider")));
    if (explicit != null) {
      return explicit;
    }
    for (LlmProvider p : LlmProvider.values()) {
      if (apiKey(p) != null) {
        return p;
      }
    }
    return null;
  }

  public String apiKey(LlmProvider p) {
    return firstNonNull(getEnv(p.keyEnv()), getCfg(p.code() + ".api_key"));
  }

  public String model(LlmProvider p) {
    return firstNonNull(getEnv("LLM_MODEL"), getCfg(p.code() + ".model"), getCfg("llm.model"), p.defaultModel());
  }

  public String baseUrl(LlmProvider p) {
    return firstNonNull(getEnv("LLM_BASE_URL"), getCfg(p.code() + ".base_url"), p.defaultBaseUrl());
  }

  private static String firstNonNull(String... values) {
    if (values == null) {
      return null;
    }
    for (String v : values) {
      if (v != null && !v.trim().isEmpty()) {
        return v.trim();
      }
    }
    return null;
  }

  public String getCfg(String path) {
    Map<String, Object> cfg = loadLocalConfig();
    if (cfg == null) {
      return null;
    }
    Object cur = cfg;
    for (String part : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m) || !m.containsKey(part)) {
        return null;
      }
      cur = m.get(part);
    }
    if (cur == null) {
      return null;
    }
    String s = cur.toString().trim();
    return s.isEmpty() ? null : s;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> loadLocalConfig() {
    try {
      Path p = SharedBackendPaths.resolveExistingFile(localConfigPath, List.of("backend-java/config.json"));
      if (p == null || !Files.exists(p)) {
        return Map.of();
      }
      Object data = objectMapper.readValue(Files.readString(p), new TypeReference<Map<String, Object>>() {});
      return data instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    } catch (IOException e) {
      return Map.of();
    }
  }
}
