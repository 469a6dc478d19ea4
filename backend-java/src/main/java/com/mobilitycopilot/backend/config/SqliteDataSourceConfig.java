package com.mobilitycopilot.backend.config;

import java.nio.file.Path;
import java.util.List;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;

import com.mobilitycopilot.backend.util.SharedBackendPaths;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

@Configuration
public class SqliteDataSourceConfig {
  private static final Logger log = LoggerFactory.getLogger(SqliteDataSourceConfig.class);

  @Bean
  @Primary
  public DataSource dataSource(Environment env) {
    String override = firstNonBlank(
        env.getProperty("app.db.path"),
        System.getenv("APP_DB_PATH")
    );

    Path db;
    if (override != null) {
      db = SharedBackendPaths.resolveDbFilePath(override, List.of("../" + SharedBackendPaths.DEFAULT_DB));
    } else {
      // written by the ETL job
      db = SharedBackendPaths.repoPath(SharedBackendPaths.DEFAULT_DB);
    }

    String busyTimeout = firstNonBlank(env.getProperty("app.sqlite.busy-timeout-ms"), "10000");
    log.info("sqlite database {}", db);

    HikariConfig cfg = new HikariConfig();
    cfg.setJdbcUrl("jdbc:sqlite:" + db + "?busy_timeout=" + busyTimeout);
    cfg.setDriverClassName("org.sqlite.JDBC");
    // single writer
    cfg.setMaximumPoolSize(1);
    return new HikariDataSource(cfg);
  }

  private static String firstNonBlank(String... values) {
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
}
