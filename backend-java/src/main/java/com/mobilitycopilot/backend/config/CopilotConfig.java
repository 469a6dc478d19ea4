package com.mobilitycopilot.backend.config;

import java.time.Clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.mobilitycopilot.backend.engine.QueryEngine;
import com.mobilitycopilot.backend.service.LlmChatClient;

@Configuration
public class CopilotConfig {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  public QueryEngine queryEngine(
      Clock clock,
      LlmChatClient llmChatClient,
      @Value("${app.copilot.history-limit:20}") int historyLimit) {
    return new QueryEngine(clock, llmChatClient, historyLimit);
  }
}
