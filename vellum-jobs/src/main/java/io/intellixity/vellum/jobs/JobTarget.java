package io.intellixity.vellum.jobs;

import java.util.Map;

/** A callable a job can run. Bodies must be safe to repeat: a retried job runs from the start. */
@FunctionalInterface
public interface JobTarget {
  Object call(Map<String, Object> kwargs) throws Exception;
}
