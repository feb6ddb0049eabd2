package io.intellixity.vellum.jobs.exec;

@FunctionalInterface
public interface JobSessionFactory {
  JobSession open(String site);
}
