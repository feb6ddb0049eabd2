package io.intellixity.vellum.jobs.jdbc;

import io.intellixity.vellum.jobs.broker.BrokerUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcBrokerFactoryTest {

  @Test
  void unreachableDatabase_isBrokerUnavailable() {
    JdbcDatabase db = new JdbcDatabase("jdbc:postgresql://127.0.0.1:1/vellum", "vellum", "secret", 1);
    JdbcBrokerFactory factory = new JdbcBrokerFactory(db, null, false);

    assertThrows(BrokerUnavailableException.class, factory::connect);
  }

  @Test
  void schemaScript_hasJobAndErrorTables() {
    List<String> ddl = JdbcSchema.statements();
    assertEquals(3, ddl.size());
    assertTrue(ddl.get(0).startsWith("create table if not exists vellum_job"));
    assertTrue(ddl.get(2).startsWith("create table if not exists vellum_error_log"));
  }

  @Test
  void poolSizeDefaultsToTen() {
    assertEquals(10, new JdbcDatabase("jdbc:postgresql://db/site1", null, null, 0).maximumPoolSize());
  }
}
