package io.intellixity.vellum.jobs.exec;

import io.intellixity.vellum.jobs.JobDescriptor;
import io.intellixity.vellum.jobs.JobFailedException;
import io.intellixity.vellum.jobs.JobTargetRegistry;
import io.intellixity.vellum.jobs.RetryJobException;
import io.intellixity.vellum.jobs.Sleeper;
import io.intellixity.vellum.jobs.TransientStorageException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class JobExecutorTest {
  private final RecordingSessionFactory sessions = new RecordingSessionFactory();
  private final List<Duration> sleeps = new ArrayList<>();
  private final Sleeper sleeper = sleeps::add;

  private static JobDescriptor job(String method, String user) {
    return new JobDescriptor("j-1", "site1", user, method, null, null, true, "default", 300, Map.of("n", 7));
  }

  private JobExecutor executor(JobTargetRegistry targets, RetryPolicy policy) {
    return new JobExecutor(targets, sessions, policy, sleeper);
  }

  @Test
  void deadlockOnFirstThreeAttempts_commitsOnFourth() {
    AtomicInteger calls = new AtomicInteger();
    JobTargetRegistry targets = JobTargetRegistry.builder()
        .register("app.tasks.rebuild", kwargs -> {
          if (calls.incrementAndGet() <= 3) {
            throw new IllegalStateException("update failed", new SQLException("Deadlock found", "40001", 1213));
          }
          return "done:" + kwargs.get("n");
        })
        .build();

    Object result = executor(targets, RetryPolicy.defaults()).execute(job("app.tasks.rebuild", null));

    assertEquals("done:7", result);
    assertEquals(4, calls.get());
    assertEquals(4, sessions.opened);
    assertEquals(3, sessions.count("rollback"));
    assertEquals(1, sessions.count("commit"));
    assertEquals(4, sessions.count("releaseLocks"));
    assertEquals(4, sessions.count("close"));
    assertTrue(sessions.errorTitles.isEmpty());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3)), sleeps);
  }

  @Test
  void eachAttemptIsTornDownBeforeTheBackoff() {
    AtomicInteger calls = new AtomicInteger();
    JobTargetRegistry targets = JobTargetRegistry.builder()
        .register("m", kwargs -> {
          if (calls.incrementAndGet() == 1) throw new RetryJobException("busy");
          return null;
        })
        .build();

    executor(targets, RetryPolicy.defaults()).execute(job("m", null));

    assertEquals(List.of(
        "open:site1", "rollback", "releaseLocks", "close",
        "open:site1", "commit", "releaseLocks", "close"), sessions.events);
  }

  @Test
  void nonRetryableFailure_rollsBackLogsCommitsAndRethrows() {
    IllegalStateException boom = new IllegalStateException("boom");
    JobTargetRegistry targets = JobTargetRegistry.builder()
        .register("app.mail.send", kwargs -> { throw boom; })
        .build();

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> executor(targets, RetryPolicy.defaults()).execute(job("app.mail.send", null)));

    assertSame(boom, thrown);
    assertEquals(List.of(
        "open:site1", "rollback", "logError:app.mail.send", "commit", "releaseLocks", "close"), sessions.events);
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void retriesExhausted_logsAndRethrowsLastFailure() {
    JobTargetRegistry targets = JobTargetRegistry.builder()
        .register("m", kwargs -> { throw new TransientStorageException("lock wait timeout"); })
        .build();

    assertThrows(TransientStorageException.class, () -> executor(targets, new RetryPolicy(2)).execute(job("m", null)));

    assertEquals(3, sessions.opened);
    assertEquals(3, sessions.count("rollback"));
    assertEquals(List.of("m"), sessions.errorTitles);
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
  }

  @Test
  void checkedFailure_isWrapped() {
    JobTargetRegistry targets = JobTargetRegistry.builder()
        .register("m", kwargs -> { throw new IOException("disk"); })
        .build();

    JobFailedException e = assertThrows(JobFailedException.class,
        () -> executor(targets, RetryPolicy.defaults()).execute(job("m", null)));

    assertEquals("m", e.method());
    assertInstanceOf(IOException.class, e.getCause());
  }

  @Test
  void failingRollback_isAttachedAsSuppressed() {
    JobSessionFactory broken = site -> new JobSession() {
      @Override public String site() { return site; }
      @Override public void setUser(String user) {}
      @Override public void commit() {}
      @Override public void rollback() { throw new IllegalStateException("connection lost"); }
      @Override public void logError(String title, Throwable error) {}
      @Override public void releaseLocks() {}
      @Override public void close() {}
    };
    JobTargetRegistry targets = JobTargetRegistry.builder()
        .register("m", kwargs -> { throw new IllegalArgumentException("bad input"); })
        .build();

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> new JobExecutor(targets, broken, RetryPolicy.defaults(), sleeper).execute(job("m", null)));

    assertEquals(1, e.getSuppressed().length);
    assertEquals("connection lost", e.getSuppressed()[0].getMessage());
  }

  @Test
  void impersonatesJobUser() {
    JobTargetRegistry targets = JobTargetRegistry.builder().register("m", kwargs -> 1).build();

    executor(targets, RetryPolicy.defaults()).execute(job("m", "jane@example.com"));

    assertEquals("user:jane@example.com", sessions.events.get(1));
  }

  @Test
  void unknownMethod_isRejectedBeforeOpeningASession() {
    JobTargetRegistry targets = JobTargetRegistry.builder().build();

    assertThrows(IllegalArgumentException.class,
        () -> executor(targets, RetryPolicy.defaults()).execute(job("missing", null)));
    assertEquals(0, sessions.opened);
  }
}
