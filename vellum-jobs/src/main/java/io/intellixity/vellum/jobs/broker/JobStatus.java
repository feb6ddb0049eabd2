package io.intellixity.vellum.jobs.broker;

public enum JobStatus {
  QUEUED,
  RUNNING,
  FINISHED,
  FAILED
}
