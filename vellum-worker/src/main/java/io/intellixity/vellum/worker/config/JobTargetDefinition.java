package io.intellixity.vellum.worker.config;

import io.intellixity.vellum.jobs.JobTarget;

import java.util.Objects;

/** Declare one as a bean to make {@code target} runnable under {@code method}. */
public record JobTargetDefinition(String method, JobTarget target) {
  public JobTargetDefinition {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(target, "target");
  }
}
