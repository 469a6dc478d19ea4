package com.mobilitycopilot.backend.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.core.io.ClassPathResource;

class ApplicationYamlTest {

  private static Properties load() {
    YamlPropertiesFactoryBean yaml = new YamlPropertiesFactoryBean();
    yaml.setResources(new ClassPathResource("application.yml"));
    return yaml.getObject();
  }

  @Test
  @DisplayName("hibernate never creates or alters the ETL tables")
  void schemaIsLeftAlone() {
    assertEquals("none", load().getProperty("spring.jpa.hibernate.ddl-auto"));
  }

  @Test
  void sqliteDialect() {
    assertEquals("org.hibernate.community.dialect.SQLiteDialect",
        load().getProperty("spring.jpa.database-platform"));
  }
}
