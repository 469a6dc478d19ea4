package com.mobilitycopilot.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MobilityCopilotApplication {

  public static void main(String[] args) {
    SpringApplication.run(MobilityCopilotApplication.class, args);
  }
}
