package io.intellixity.vellum.jobs.jdbc;

import io.intellixity.vellum.jobs.exec.JobSession;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.UUID;

/**
 * One job attempt on one pooled connection, auto-commit off.\n
 *
 * - the acting user is exposed to SQL as {@code current_setting('vellum.user')} and cleared on
 *   {@link #close()} before the connection goes back to the pool\n
 * - document locks are Postgres advisory locks, released by {@link #releaseLocks()}\n
 * - error entries go to {@code vellum_error_log} inside the session transaction\n
 */
public final class JdbcJobSession implements JobSession {
  static final String SET_USER = "select set_config('vellum.user', ?, false)";
  static final String RESET_USER = "select set_config('vellum.user', '', false)";
  static final String UNLOCK_ALL = "select pg_advisory_unlock_all()";
  static final String INSERT_ERROR =
      "insert into vellum_error_log (id, site, title, error, traceback) values (?, ?, ?, ?, ?)";

  private final String site;
  private final Connection connection;
  private String user;

  public JdbcJobSession(String site, Connection connection) {
    this.site = site;
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  static JdbcJobSession open(String site, Connection connection) {
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      closeAfterFailure(connection, e);
      throw new RuntimeException(e);
    }
    return new JdbcJobSession(site, connection);
  }

  @Override public String site() { return site; }
  public String user() { return user; }
  public Connection connection() { return connection; }

  @Override
  public void setUser(String user) {
    try (PreparedStatement ps = connection.prepareStatement(SET_USER)) {
      ps.setString(1, user);
      ps.execute();
      this.user = user;
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  public void commit() {
    try { connection.commit(); } catch (SQLException e) { throw new RuntimeException(e); }
  }

  @Override
  public void rollback() {
    try { connection.rollback(); } catch (SQLException e) { throw new RuntimeException(e); }
  }

  @Override
  public void logError(String title, Throwable error) {
    try (PreparedStatement ps = connection.prepareStatement(INSERT_ERROR)) {
      ps.setString(1, UUID.randomUUID().toString());
      ps.setString(2, site);
      ps.setString(3, title);
      ps.setString(4, error == null ? null : error.toString());
      ps.setString(5, error == null ? null : traceback(error));
      ps.executeUpdate();
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  public void releaseLocks() {
    try (Statement st = connection.createStatement()) {
      st.execute(UNLOCK_ALL);
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  public void close() {
    RuntimeException failure = null;
    if (user != null) {
      try {
        resetUser();
      } catch (SQLException e) {
        failure = new RuntimeException(e);
        // A connection still carrying the user must not be reused.
        abort(failure);
      }
    }
    try {
      connection.close();
    } catch (SQLException e) {
      if (failure == null) failure = new RuntimeException(e);
      else failure.addSuppressed(e);
    }
    if (failure != null) throw failure;
  }

  private void resetUser() throws SQLException {
    try (PreparedStatement ps = connection.prepareStatement(RESET_USER)) {
      ps.execute();
    }
    connection.commit();
    user = null;
  }

  private void abort(RuntimeException failure) {
    try {
      connection.abort(Runnable::run);
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  static String traceback(Throwable error) {
    StringWriter sw = new StringWriter();
    error.printStackTrace(new PrintWriter(sw));
    return sw.toString();
  }

  private static void closeAfterFailure(Connection connection, SQLException cause) {
    try {
      connection.close();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
