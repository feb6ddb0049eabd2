package io.intellixity.vellum.jobs;

/**
 * Outcome of {@link JobDispatcher#enqueue}: a queued job, a job buffered until commit, or the
 * direct return value of a target that ran inline.
 */
public record EnqueueResult(Outcome outcome, JobDescriptor job, Object result) {
  public enum Outcome { QUEUED, DEFERRED, EXECUTED }

  public static EnqueueResult queued(JobDescriptor job) { return new EnqueueResult(Outcome.QUEUED, job, null); }
  public static EnqueueResult deferred(JobDescriptor job) { return new EnqueueResult(Outcome.DEFERRED, job, null); }
  public static EnqueueResult executed(Object result) { return new EnqueueResult(Outcome.EXECUTED, null, result); }

  public boolean isQueued() { return outcome == Outcome.QUEUED; }
  public boolean isExecuted() { return outcome == Outcome.EXECUTED; }
}
