package io.intellixity.vellum.jobs.exec;

import io.intellixity.vellum.jobs.JobDescriptor;
import io.intellixity.vellum.jobs.JobFailedException;
import io.intellixity.vellum.jobs.JobTarget;
import io.intellixity.vellum.jobs.JobTargetRegistry;
import io.intellixity.vellum.jobs.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs one job inside per-attempt datastore sessions.\n
 *
 * Outcomes:\n
 * - target returns: commit\n
 * - retryable failure below the retry ceiling: rollback, close, pause {@code attempt + 1} s, run again\n
 * - any other failure: rollback, durable error entry titled with the method, commit, rethrow\n
 *
 * Locks are released and the session is closed after every attempt, whatever the outcome.
 */
public final class JobExecutor {
  private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

  private final JobTargetRegistry targets;
  private final JobSessionFactory sessions;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public JobExecutor(JobTargetRegistry targets, JobSessionFactory sessions, RetryPolicy retryPolicy, Sleeper sleeper) {
    this.targets = Objects.requireNonNull(targets, "targets");
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public JobExecutor(JobTargetRegistry targets, JobSessionFactory sessions) {
    this(targets, sessions, RetryPolicy.defaults(), Sleeper.system());
  }

  /**
   * @return the target's return value from the committed attempt
   * @throws RuntimeException the job's own unchecked failure, or {@link JobFailedException} wrapping a checked one
   */
  public Object execute(JobDescriptor job) {
    Objects.requireNonNull(job, "job");
    JobTarget target = targets.resolve(job.method());

    for (int attempt = 0; ; attempt++) {
      JobSession session = sessions.open(job.site());
      long started = System.nanoTime();
      log.info("vellum.jobs.start method={} site={} job={} attempt={}", job.method(), job.site(), job.id(), attempt);
      try {
        if (job.user() != null && !job.user().isBlank()) session.setUser(job.user());
        Object result = target.call(job.kwargs());
        session.commit();
        return result;
      } catch (Exception e) {
        rollback(session, e);
        if (!RetryableErrors.isRetryable(e) || !retryPolicy.canRetry(attempt)) {
          throw fail(session, job, e);
        }
        log.warn("vellum.jobs.retry method={} site={} job={} attempt={}: {}",
            job.method(), job.site(), job.id(), attempt, e.toString());
      } finally {
        try {
          session.releaseLocks();
        } finally {
          session.close();
          log.info("vellum.jobs.stop method={} site={} job={} durationMs={}",
              job.method(), job.site(), job.id(), Duration.ofNanos(System.nanoTime() - started).toMillis());
        }
      }
      pause(job, retryPolicy.backoff(attempt));
    }
  }

  private static void rollback(JobSession session, Exception cause) {
    try {
      session.rollback();
    } catch (RuntimeException r) {
      cause.addSuppressed(r);
    }
  }

  private static RuntimeException fail(JobSession session, JobDescriptor job, Exception e) {
    log.error("vellum.jobs.failed method={} site={} job={}", job.method(), job.site(), job.id(), e);
    try {
      session.logError(job.method(), e);
      session.commit();
    } catch (RuntimeException logFailure) {
      e.addSuppressed(logFailure);
    }
    return e instanceof RuntimeException re ? re : new JobFailedException(job.method(), e);
  }

  private void pause(JobDescriptor job, Duration backoff) {
    try {
      sleeper.sleep(backoff);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new JobFailedException(job.method(), e);
    }
  }
}
