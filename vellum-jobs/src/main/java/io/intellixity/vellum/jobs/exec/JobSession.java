package io.intellixity.vellum.jobs.exec;

/**
 * Datastore session scoped to one job attempt and one site.\n
 *
 * Opened by {@link JobSessionFactory}, closed by the executor after every attempt.
 */
public interface JobSession extends AutoCloseable {

  String site();

  /** Runs the job as {@code user} instead of the session default. */
  void setUser(String user);

  void commit();

  void rollback();

  /** Writes a durable error entry keyed by {@code title}; visible after the next commit. */
  void logError(String title, Throwable error);

  /** Releases document locks taken during the attempt. Called on every outcome. */
  void releaseLocks();

  @Override
  void close();
}
