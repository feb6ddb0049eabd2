package io.intellixity.vellum.sql.jdbc;

import io.intellixity.vellum.meta.MissingTableException;
import io.intellixity.vellum.sql.SqlStatement;
import io.intellixity.vellum.sql.StatementRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/** Plain JDBC runner: one pooled connection per statement, literals already inlined. */
public final class JdbcStatementRunner implements StatementRunner {
  private static final Logger log = LoggerFactory.getLogger(JdbcStatementRunner.class);

  /** MySQL / MariaDB and Postgres codes for "table does not exist". */
  private static final Set<String> MISSING_TABLE_STATES = Set.of("42S02", "42P01");

  private final DataSource ds;

  public JdbcStatementRunner(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  @Override
  public List<Map<String, Object>> queryForMaps(SqlStatement statement) {
    return run(statement, rs -> {
      try {
        ResultSetMetaData md = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++) row.put(md.getColumnLabel(i), rs.getObject(i));
        return row;
      } catch (SQLException e) {
        throw new RuntimeException(e);
      }
    });
  }

  @Override
  public List<List<Object>> queryForLists(SqlStatement statement) {
    return run(statement, rs -> {
      try {
        int n = rs.getMetaData().getColumnCount();
        List<Object> row = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) row.add(rs.getObject(i));
        return row;
      } catch (SQLException e) {
        throw new RuntimeException(e);
      }
    });
  }

  private <T> List<T> run(SqlStatement ss, Function<ResultSet, T> reader) {
    long start = System.nanoTime();
    try (Connection c = ds.getConnection();
         Statement st = c.createStatement();
         ResultSet rs = st.executeQuery(ss.sql())) {
      List<T> out = new ArrayList<>();
      while (rs.next()) out.add(reader.apply(rs));
      if (log.isDebugEnabled()) {
        log.debug("vellum.jdbc_done op=select entity={} durationMs={} rows={}",
            ss.entityType(), (System.nanoTime() - start) / 1_000_000.0, out.size());
      }
      return out;
    } catch (SQLException e) {
      if (e.getSQLState() != null && MISSING_TABLE_STATES.contains(e.getSQLState())) {
        MissingTableException missing = new MissingTableException(ss.entityType());
        missing.initCause(e);
        throw missing;
      }
      throw new RuntimeException(e);
    }
  }
}
