package io.intellixity.vellum.jobs.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.vellum.jobs.exec.JobSession;
import io.intellixity.vellum.jobs.exec.JobSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Opens {@link JdbcJobSession}s against the site's own database.\n
 *
 * Site-per-database: each site resolves to its own pool, created on first use and kept until
 * {@link #close()}.
 */
public final class JdbcJobSessionFactory implements JobSessionFactory, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcJobSessionFactory.class);

  private final Function<String, DataSource> poolFactory;
  private final Map<String, DataSource> pools = new ConcurrentHashMap<>();

  public JdbcJobSessionFactory(Function<String, DataSource> poolFactory) {
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
  }

  /** Hikari pool per site from {@code sites}; unknown sites are rejected. */
  public static JdbcJobSessionFactory hikari(Map<String, JdbcDatabase> sites) {
    Map<String, JdbcDatabase> copy = Map.copyOf(sites);
    return new JdbcJobSessionFactory(site -> {
      JdbcDatabase db = copy.get(site);
      if (db == null) throw new IllegalArgumentException("Unknown site: " + site);
      return db.open("vellum-site-" + site);
    });
  }

  @Override
  public JobSession open(String site) {
    Objects.requireNonNull(site, "site");
    DataSource ds = pools.computeIfAbsent(site, s -> {
      log.info("vellum.jobs.jdbc opening pool site={}", s);
      return poolFactory.apply(s);
    });
    try {
      return JdbcJobSession.open(site, ds.getConnection());
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  public void close() {
    List<RuntimeException> failures = new ArrayList<>();
    for (DataSource ds : pools.values()) {
      if (ds instanceof HikariDataSource h) {
        try {
          h.close();
        } catch (RuntimeException e) {
          failures.add(e);
        }
      }
    }
    pools.clear();
    if (!failures.isEmpty()) {
      RuntimeException first = failures.get(0);
      for (int i = 1; i < failures.size(); i++) first.addSuppressed(failures.get(i));
      throw first;
    }
  }
}
