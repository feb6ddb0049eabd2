package io.intellixity.vellum.jobs.jdbc;

import io.intellixity.vellum.jobs.JobDescriptor;
import io.intellixity.vellum.jobs.broker.BrokerUnavailableException;
import io.intellixity.vellum.jobs.broker.JobStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

final class JdbcQueueBrokerTest {
  private static final JobDescriptor JOB = new JobDescriptor("j-1", "site1", "Administrator", "app.reports.build",
      null, "monthly", true, "long", 1500, Map.of("month", 5));

  private final DataSource ds = mock(DataSource.class);
  private final Connection connection = mock(Connection.class);
  private final JdbcQueueBroker broker = new JdbcQueueBroker(ds);

  @Test
  void push_storesJsonPayloadWithQueuePosition() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    when(ds.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(JdbcQueueBroker.INSERT)).thenReturn(ps);

    broker.push("bench-a:long", JOB, true);

    ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
    verify(ps).setString(1, "j-1");
    verify(ps).setString(2, "bench-a:long");
    verify(ps).setBoolean(3, true);
    verify(ps).setString(4, "bench-a:long");
    verify(ps).setString(eq(5), payload.capture());
    verify(ps).executeUpdate();
    verify(connection).close();
    assertEquals(JOB, broker.read(payload.getValue()));
    assertFalse(payload.getValue().contains("\"event\""));
  }

  @Test
  void poll_claimsFirstQueueWithWork_andCommits() throws SQLException {
    PreparedStatement claim = mock(PreparedStatement.class);
    PreparedStatement mark = mock(PreparedStatement.class);
    ResultSet empty = mock(ResultSet.class);
    ResultSet one = mock(ResultSet.class);
    when(ds.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(JdbcQueueBroker.CLAIM)).thenReturn(claim);
    when(connection.prepareStatement(JdbcQueueBroker.MARK_RUNNING)).thenReturn(mark);
    when(claim.executeQuery()).thenReturn(empty, one);
    when(empty.next()).thenReturn(false);
    when(one.next()).thenReturn(true);
    when(one.getString(1)).thenReturn("j-1");
    when(one.getString(2)).thenReturn(broker.write(JOB));

    Optional<JobDescriptor> job = broker.poll(List.of("bench-a:short", "bench-a:long"));

    assertEquals(Optional.of(JOB), job);
    InOrder order = inOrder(connection, claim, mark);
    order.verify(connection).setAutoCommit(false);
    order.verify(claim).setString(1, "bench-a:short");
    order.verify(claim).setString(1, "bench-a:long");
    order.verify(mark).setString(1, "j-1");
    order.verify(mark).executeUpdate();
    order.verify(connection).commit();
    verify(connection, never()).rollback();
  }

  @Test
  void poll_rollsBackOnFailure() throws SQLException {
    when(ds.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(JdbcQueueBroker.CLAIM)).thenThrow(new SQLException("syntax", "42601"));

    RuntimeException e = assertThrows(RuntimeException.class, () -> broker.poll(List.of("bench-a:default")));

    assertInstanceOf(SQLException.class, e.getCause());
    verify(connection).rollback();
    verify(connection).close();
  }

  @Test
  void connectionFailure_isBrokerUnavailable() throws SQLException {
    when(ds.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));

    assertThrows(BrokerUnavailableException.class, () -> broker.queued("bench-a:default"));
    assertThrows(BrokerUnavailableException.class, () -> broker.push("bench-a:default", JOB, false));
  }

  @Test
  void queuedAndRunning_readByStatus() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    ResultSet rs = mock(ResultSet.class);
    when(ds.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(JdbcQueueBroker.BY_STATUS)).thenReturn(ps);
    when(ps.executeQuery()).thenReturn(rs);
    when(rs.next()).thenReturn(true, false);
    when(rs.getString(1)).thenReturn(broker.write(JOB));

    assertEquals(List.of(JOB), broker.running("bench-a:long"));
    verify(ps).setString(2, "RUNNING");
  }

  @Test
  void status_andStopFlag() throws SQLException {
    PreparedStatement status = mock(PreparedStatement.class);
    PreparedStatement stop = mock(PreparedStatement.class);
    ResultSet statusRs = mock(ResultSet.class);
    ResultSet stopRs = mock(ResultSet.class);
    when(ds.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(JdbcQueueBroker.STATUS)).thenReturn(status);
    when(connection.prepareStatement(JdbcQueueBroker.STOP_REQUESTED)).thenReturn(stop);
    when(status.executeQuery()).thenReturn(statusRs);
    when(stop.executeQuery()).thenReturn(stopRs);
    when(statusRs.next()).thenReturn(true);
    when(statusRs.getString(1)).thenReturn("FAILED");
    when(stopRs.next()).thenReturn(true);
    when(stopRs.getBoolean(1)).thenReturn(true);

    assertEquals(Optional.of(JobStatus.FAILED), broker.status("j-1"));
    assertTrue(broker.isStopRequested("j-1"));
  }

  @Test
  void markFailed_recordsError() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    when(ds.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(ps);

    broker.markFailed("j-1", "boom");

    verify(ps).setString(1, "FAILED");
    verify(ps).setString(2, "boom");
    verify(ps).setString(3, "j-1");
  }

  @Test
  void close_closesOwnedPool() throws Exception {
    AutoCloseable pool = mock(AutoCloseable.class);
    new JdbcQueueBroker(ds, null, pool).close();
    verify(pool).close();
  }
}
