package io.intellixity.vellum.jobs.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vellum.jobs.JobDescriptor;
import io.intellixity.vellum.jobs.broker.BrokerUnavailableException;
import io.intellixity.vellum.jobs.broker.JobStatus;
import io.intellixity.vellum.jobs.broker.QueueBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Queue broker over the {@code vellum_job} table.\n
 *
 * - descriptors are stored as Jackson JSON in {@code payload}\n
 * - FIFO by {@code position}; {@code atFront} takes the queue's minimum position minus one\n
 * - {@link #poll} claims with {@code for update skip locked}, so concurrent workers never share a job\n
 * - connection failures (SQLState class 08) surface as {@link BrokerUnavailableException}\n
 */
public final class JdbcQueueBroker implements QueueBroker {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueueBroker.class);

  static final String INSERT =
      "insert into vellum_job (id, qname, position, status, payload) values (?, ?, "
          + "(select coalesce(case when ? then min(position) - 1 else max(position) + 1 end, 0) "
          + "from vellum_job where qname = ?), 'QUEUED', ?)";
  static final String CLAIM =
      "select id, payload from vellum_job where qname = ? and status = 'QUEUED' "
          + "order by position, enqueued_at limit 1 for update skip locked";
  static final String MARK_RUNNING =
      "update vellum_job set status = 'RUNNING', started_at = now() where id = ?";
  static final String BY_STATUS =
      "select payload from vellum_job where qname = ? and status = ? order by position, enqueued_at";
  static final String STATUS = "select status from vellum_job where id = ?";
  static final String FINISH =
      "update vellum_job set status = ?, error = ?, stop_requested = false, ended_at = now() where id = ?";
  static final String REQUEST_STOP =
      "update vellum_job set stop_requested = true where id = ? and status = 'RUNNING'";
  static final String STOP_REQUESTED = "select stop_requested from vellum_job where id = ?";

  private final DataSource ds;
  private final ObjectMapper mapper;
  private final AutoCloseable owned;

  /**
   * @param owned closed with the broker (typically the pool behind {@code ds}); may be null
   */
  public JdbcQueueBroker(DataSource ds, ObjectMapper mapper, AutoCloseable owned) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.mapper = mapper == null ? new ObjectMapper() : mapper;
    this.owned = owned;
  }

  public JdbcQueueBroker(DataSource ds) {
    this(ds, new ObjectMapper(), null);
  }

  @Override
  public void push(String qname, JobDescriptor job, boolean atFront) {
    String payload = write(job);
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(INSERT)) {
      ps.setString(1, job.id());
      ps.setString(2, qname);
      ps.setBoolean(3, atFront);
      ps.setString(4, qname);
      ps.setString(5, payload);
      ps.executeUpdate();
    } catch (SQLException e) {
      throw translate(e);
    }
    if (log.isDebugEnabled()) log.debug("vellum.jobs.jdbc push queue={} job={} atFront={}", qname, job.id(), atFront);
  }

  @Override
  public Optional<JobDescriptor> poll(List<String> qnames) {
    try (Connection c = ds.getConnection()) {
      c.setAutoCommit(false);
      try {
        for (String qname : qnames) {
          Optional<JobDescriptor> claimed = claim(c, qname);
          if (claimed.isPresent()) {
            c.commit();
            return claimed;
          }
        }
        c.commit();
        return Optional.empty();
      } catch (SQLException | RuntimeException e) {
        rollback(c, e);
        throw e;
      }
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  private Optional<JobDescriptor> claim(Connection c, String qname) throws SQLException {
    String id;
    String payload;
    try (PreparedStatement ps = c.prepareStatement(CLAIM)) {
      ps.setString(1, qname);
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) return Optional.empty();
        id = rs.getString(1);
        payload = rs.getString(2);
      }
    }
    try (PreparedStatement ps = c.prepareStatement(MARK_RUNNING)) {
      ps.setString(1, id);
      ps.executeUpdate();
    }
    return Optional.of(read(payload));
  }

  @Override
  public List<JobDescriptor> queued(String qname) {
    return byStatus(qname, JobStatus.QUEUED);
  }

  @Override
  public List<JobDescriptor> running(String qname) {
    return byStatus(qname, JobStatus.RUNNING);
  }

  private List<JobDescriptor> byStatus(String qname, JobStatus status) {
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(BY_STATUS)) {
      ps.setString(1, qname);
      ps.setString(2, status.name());
      try (ResultSet rs = ps.executeQuery()) {
        List<JobDescriptor> out = new ArrayList<>();
        while (rs.next()) out.add(read(rs.getString(1)));
        return out;
      }
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  @Override
  public Optional<JobStatus> status(String jobId) {
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(STATUS)) {
      ps.setString(1, jobId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(JobStatus.valueOf(rs.getString(1))) : Optional.empty();
      }
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  @Override
  public void markFinished(String jobId) {
    finish(jobId, JobStatus.FINISHED, null);
  }

  @Override
  public void markFailed(String jobId, String error) {
    finish(jobId, JobStatus.FAILED, error);
  }

  private void finish(String jobId, JobStatus status, String error) {
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(FINISH)) {
      ps.setString(1, status.name());
      ps.setString(2, error);
      ps.setString(3, jobId);
      ps.executeUpdate();
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  @Override
  public void requestStop(String jobId) {
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(REQUEST_STOP)) {
      ps.setString(1, jobId);
      ps.executeUpdate();
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  @Override
  public boolean isStopRequested(String jobId) {
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(STOP_REQUESTED)) {
      ps.setString(1, jobId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() && rs.getBoolean(1);
      }
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  @Override
  public void close() {
    if (owned == null) return;
    try {
      owned.close();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to close broker pool", e);
    }
  }

  String write(JobDescriptor job) {
    try {
      return mapper.writeValueAsString(job);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Job descriptor is not serializable: " + job.id(), e);
    }
  }

  JobDescriptor read(String payload) {
    try {
      return mapper.readValue(payload, JobDescriptor.class);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Malformed job payload", e);
    }
  }

  static RuntimeException translate(SQLException e) {
    String state = e.getSQLState();
    if (state != null && state.startsWith("08")) {
      return new BrokerUnavailableException("Queue database unreachable: " + e.getMessage(), e);
    }
    return new RuntimeException(e);
  }

  private static void rollback(Connection c, Exception cause) {
    try {
      c.rollback();
    } catch (SQLException r) {
      cause.addSuppressed(r);
    }
  }
}
