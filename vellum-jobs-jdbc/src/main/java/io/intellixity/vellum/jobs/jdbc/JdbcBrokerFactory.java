package io.intellixity.vellum.jobs.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import io.intellixity.vellum.jobs.broker.BrokerUnavailableException;
import io.intellixity.vellum.jobs.broker.QueueBroker;
import io.intellixity.vellum.jobs.broker.QueueBrokerFactory;

import java.util.Objects;

/** Opens a pooled {@link JdbcQueueBroker}; a pool that cannot connect is a {@link BrokerUnavailableException}. */
public final class JdbcBrokerFactory implements QueueBrokerFactory {
  private final JdbcDatabase database;
  private final ObjectMapper mapper;
  private final boolean createSchema;

  public JdbcBrokerFactory(JdbcDatabase database, ObjectMapper mapper, boolean createSchema) {
    this.database = Objects.requireNonNull(database, "database");
    this.mapper = mapper == null ? new ObjectMapper() : mapper;
    this.createSchema = createSchema;
  }

  @Override
  public QueueBroker connect() {
    HikariDataSource ds;
    try {
      ds = database.open("vellum-broker");
    } catch (HikariPool.PoolInitializationException e) {
      throw new BrokerUnavailableException("Queue database unreachable at " + database.jdbcUrl(), e);
    }
    try {
      if (createSchema) JdbcSchema.create(ds);
    } catch (RuntimeException e) {
      ds.close();
      throw e;
    }
    return new JdbcQueueBroker(ds, mapper, ds);
  }
}
