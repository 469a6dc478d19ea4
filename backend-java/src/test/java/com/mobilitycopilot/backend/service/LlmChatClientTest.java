package com.mobilitycopilot.backend.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mobilitycopilot.backend.service.LlmChatClient.LlmStatus;

class LlmChatClientTest {
  private AiConfigService aiConfig;
  private LlmChatClient client;

  @BeforeEach
  void setUp() {
    aiConfig = mock(AiConfigService.class);
    when(aiConfig.connectTimeoutMs()).thenReturn(2000L);
    when(aiConfig.requestTimeoutMs()).thenReturn(5000L);
    client = new LlmChatClient(aiConfig, new ObjectMapper());
  }

  @Test
  @DisplayName("disabled client returns null and records why")
  void disabled() {
    when(aiConfig.isLlmEnabled()).thenReturn(false);
    assertNull(client.generate("s", "u", 100, 0.1));
    assertFalse(client.isEnabled());
    LlmStatus st = client.status();
    assertFalse(st.enabled());
    assertEquals("disabled", st.lastError());
  }

  @Test
  @DisplayName("enabled without any key is not configured and never calls out")
  void missingKey() {
    when(aiConfig.isLlmEnabled()).thenReturn(true);
    when(aiConfig.provider()).thenReturn(null);
    assertNull(client.generate("s", "u", 100, 0.1));
    assertFalse(client.isEnabled());
    LlmStatus st = client.status();
    assertFalse(st.configured());
    assertEquals("", st.provider());
    assertEquals("missing api_key", st.lastError());
  }

  @Test
  void statusWithProvider() {
    when(aiConfig.isLlmEnabled()).thenReturn(true);
    when(aiConfig.provider()).thenReturn(LlmProvider.OPENAI);
    when(aiConfig.apiKey(LlmProvider.OPENAI)).thenReturn("sk-test");
    when(aiConfig.model(LlmProvider.OPENAI)).thenReturn("gpt-4o-mini");
    when(aiConfig.baseUrl(LlmProvider.OPENAI)).thenReturn("https://api.openai.com/v1");

    assertTrue(client.isEnabled());
    LlmStatus st = client.status();
    assertTrue(st.configured());
    assertEquals("openai", st.provider());
    assertEquals("gpt-4o-mini", st.model());
    assertEquals(5000L, st.timeoutMs());
    assertNull(st.lastError());
  }

  @Test
  @DisplayName("reply text is read from each provider's response shape")
  void extractContent() throws Exception {
    assertEquals("Bonjour.", client.extractContent(LlmProvider.OPENAI,
        "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Bonjour.\"}}]}"));
    assertEquals("Deux parties.", client.extractContent(LlmProvider.ANTHROPIC,
        "{\"content\":[{\"type\":\"text\",\"text\":\"Deux \"},{\"type\":\"text\",\"text\":\"parties.\"}]}"));
    assertEquals("Texte Gemini.", client.extractContent(LlmProvider.GEMINI,
        "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Texte Gemini.\"}]}}]}"));
    assertNull(client.extractContent(LlmProvider.OPENAI, "{\"choices\":[]}"));
  }

  @Test
  void providerCodes() {
    assertEquals(LlmProvider.ANTHROPIC, LlmProvider.fromCode(" Anthropic "));
    assertNull(LlmProvider.fromCode("mistral"));
    assertNull(LlmProvider.fromCode(null));
  }
}
