package com.mobilitycopilot.backend.config;

import java.time.LocalDate;

import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;

@Configuration
public class JacksonConfig {
  @Bean
  public Jackson2ObjectMapperBuilderCustomizer localDateLenientCustomizer() {
    return builder -> {
      SimpleModule m = new SimpleModule("lenient-local-date");
      m.addDeserializer(LocalDate.class, new LenientLocalDateDeserializer());
      // keep Spring Boot's default modules (JavaTimeModule)
      builder.modulesToInstall(m);
      builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    };
  }
}
