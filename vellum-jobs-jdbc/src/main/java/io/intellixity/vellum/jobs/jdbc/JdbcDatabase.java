package io.intellixity.vellum.jobs.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.Objects;

/** Connection settings for one database: the broker's or a site's. */
public record JdbcDatabase(String jdbcUrl, String username, String password, int maximumPoolSize) {
  public JdbcDatabase {
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    if (jdbcUrl.isBlank()) throw new IllegalArgumentException("jdbcUrl is blank");
    if (maximumPoolSize <= 0) maximumPoolSize = 10;
  }

  HikariDataSource open(String poolName) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName(poolName);
    hc.setJdbcUrl(jdbcUrl);
    hc.setUsername(username);
    hc.setPassword(password);
    hc.setMaximumPoolSize(maximumPoolSize);
    return new HikariDataSource(hc);
  }
}
