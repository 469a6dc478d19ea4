package com.mobilitycopilot.backend.service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobilitycopilot.backend.engine.TextGenerator;

/**
 * Chat-completion client for OpenAI, Anthropic or Gemini. Never throws: failures return null
 * and are kept as {@link #status()}'s last error.
 */
@Service
public class LlmChatClient implements TextGenerator {
  private static final Logger log = LoggerFactory.getLogger(LlmChatClient.class);

  static final String ANTHROPIC_VERSION = "2023-06-01";

  public record LlmStatus(
      boolean enabled,
      boolean configured,
      String provider,
      String model,
      String baseUrl,
      long timeoutMs,
      String lastError,
      Long lastElapsedMs
  ) {}

  private record Call(HttpRequest request, LlmProvider provider) {}

  private final AiConfigService aiConfig;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  private volatile String lastError;
  private volatile Long lastElapsedMs;

  public LlmChatClient(AiConfigService aiConfig, ObjectMapper objectMapper) {
    this.aiConfig = aiConfig;
    this.objectMapper = objectMapper;
    this.httpClient = HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(500L, aiConfig.connectTimeoutMs())))
        .build();
  }

  @Override
  public boolean isEnabled() {
    LlmProvider p = aiConfig.provider();
    return aiConfig.isLlmEnabled() && p != null && aiConfig.apiKey(p) != null;
  }

  @Override
  public String generate(String systemPrompt, String userPrompt, int maxTokens, double temperature) {
    if (!aiConfig.isLlmEnabled()) {
      return fail("disabled", null);
    }
    LlmProvider provider = aiConfig.provider();
    String apiKey = provider == null ? null : aiConfig.apiKey(provider);
    if (apiKey == null) {
      return fail("missing api_key", null);
    }

    long timeoutMs = Math.max(1000L, aiConfig.requestTimeoutMs());
    long startNs = System.nanoTime();
    Call call;
    try {
      call = buildCall(provider, apiKey, systemPrompt, userPrompt, maxTokens, temperature, timeoutMs);
    } catch (IOException e) {
      return fail("json_encode_failed", startNs);
    }

    try {
      HttpResponse<String> resp = httpClient.send(call.request(), HttpResponse.BodyHandlers.ofString());
      if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
        return fail("http_" + resp.statusCode(), startNs);
      }
      String content = extractContent(provider, resp.body());
      if (content == null || content.isBlank()) {
        return fail("empty_response", startNs);
      }
      lastError = null;
      lastElapsedMs = elapsedMs(startNs);
      return content.trim();
    } catch (HttpTimeoutException e) {
      return fail("timeout", startNs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return fail("interrupted", startNs);
    } catch (IOException e) {
      return fail("request_failed", startNs);
    } catch (RuntimeException e) {
      return fail("parse_failed", startNs);
    }
  }

  /**
   * Current enable/config status without making any network calls.
   */
  public LlmStatus status() {
    LlmProvider p = aiConfig.provider();
    boolean configured = p != null && aiConfig.apiKey(p) != null;
    return new LlmStatus(
        aiConfig.isLlmEnabled(),
        configured,
        p == null ? "" : p.code(),
        p == null ? "" : aiConfig.model(p),
        p == null ? "" : aiConfig.baseUrl(p),
        Math.max(1000L, aiConfig.requestTimeoutMs()),
        lastError,
        lastElapsedMs);
  }

  private Call buildCall(
      LlmProvider provider,
      String apiKey,
      String system,
      String user,
      int maxTokens,
      double temperature,
      long timeoutMs) throws IOException {
    String model = aiConfig.model(provider);
    String base = normalizeBaseUrl(aiConfig.baseUrl(provider));
    HttpRequest.Builder b = HttpRequest.newBuilder()
        .timeout(Duration.ofMillis(timeoutMs))
        .header("Content-Type", "application/json");

    switch (provider) {
      case OPENAI -> {
        Map<String, Object> req = Map.of(
            "model", model,
            "temperature", temperature,
            "max_tokens", maxTokens,
            "messages", List.of(
                Map.of("role", "system", "content", system),
                Map.of("role", "user", "content", user)));
        b.uri(URI.create(base + "/chat/completions"))
            .header("Authorization", "Bearer " + apiKey)
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(req)));
      }
      case ANTHROPIC -> {
        Map<String, Object> req = Map.of(
            "model", model,
            "temperature", temperature,
            "max_tokens", maxTokens,
            "system", system,
            "messages", List.of(Map.of("role", "user", "content", user)));
        b.uri(URI.create(base + "/v1/messages"))
            .header("x-api-key", apiKey)
            .header("anthropic-version", ANTHROPIC_VERSION)
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(req)));
      }
      case GEMINI -> {
        Map<String, Object> req = Map.of(
            "systemInstruction", Map.of("parts", List.of(Map.of("text", system))),
            "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", user)))),
            "generationConfig", Map.of("temperature", temperature, "maxOutputTokens", maxTokens));
        String url = base + "/models/" + URLEncoder.encode(model, StandardCharsets.UTF_8)
            + ":generateContent?key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        b.uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(req)));
      }
    }
    return new Call(b.build(), provider);
  }

  String extractContent(LlmProvider provider, String json) throws IOException {
    Map<String, Object> resp = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
    return switch (provider) {
      case OPENAI -> {
        Object c0 = first(resp.get("choices"));
        if (!(c0 instanceof Map<?, ?> c0m) || !(c0m.get("message") instanceof Map<?, ?> mm)) {
          yield null;
        }
        Object content = mm.get("content");
        yield content == null ? null : content.toString();
      }
      case ANTHROPIC -> {
        StringBuilder sb = new StringBuilder();
        if (resp.get("content") instanceof List<?> blocks) {
          for (Object block : blocks) {
            if (block instanceof Map<?, ?> bm && "text".equals(bm.get("type")) && bm.get("text") != null) {
              sb.append(bm.get("text"));
            }
          }
        }
        yield sb.length() == 0 ? null : sb.toString();
      }
      case GEMINI -> {
        Object cand = first(resp.get("candidates"));
        if (!(cand instanceof Map<?, ?> cm) || !(cm.get("content") instanceof Map<?, ?> content)) {
          yield null;
        }
        StringBuilder sb = new StringBuilder();
        if (content.get("parts") instanceof List<?> parts) {
          for (Object part : parts) {
            if (part instanceof Map<?, ?> pm && pm.get("text") != null) {
              sb.append(pm.get("text"));
            }
          }
        }
        yield sb.length() == 0 ? null : sb.toString();
      }
    };
  }

  private static Object first(Object list) {
    if (list instanceof List<?> l && !l.isEmpty()) {
      return l.get(0);
    }
    return null;
  }

  private String fail(String error, Long startNs) {
    lastError = error;
    lastElapsedMs = startNs == null ? null : elapsedMs(startNs);
    if (startNs != null) {
      log.warn("text generation failed: {} after {} ms", error, lastElapsedMs);
    }
    return null;
  }

  private static Long elapsedMs(long startNs) {
    return Math.max(0L, (System.nanoTime() - startNs) / 1_000_000L);
  }

  private static String normalizeBaseUrl(String baseUrl) {
    String u = baseUrl.trim();
    while (u.endsWith("/")) {
      u = u.substring(0, u.length() - 1);
    }
    return u;
  }
}
