package io.intellixity.vellum.worker.runner;

import io.intellixity.vellum.jobs.worker.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs the {@link JobWorker} on its own thread for the lifetime of the application context.
 * Stopping lets the current job finish; the thread is interrupted only if that takes longer than
 * {@code shutdownWait}.
 */
public final class WorkerRunner implements SmartLifecycle {
  private static final Logger log = LoggerFactory.getLogger(WorkerRunner.class);

  private final JobWorker worker;
  private final boolean enabled;
  private final Duration shutdownWait;
  private Thread thread;

  public WorkerRunner(JobWorker worker, boolean enabled, Duration shutdownWait) {
    this.worker = Objects.requireNonNull(worker, "worker");
    this.enabled = enabled;
    this.shutdownWait = Objects.requireNonNull(shutdownWait, "shutdownWait");
  }

  @Override
  public synchronized void start() {
    if (!enabled) {
      log.info("vellum.worker disabled");
      return;
    }
    if (thread != null) return;
    thread = new Thread(worker, "vellum-worker");
    thread.start();
  }

  @Override
  public synchronized void stop() {
    if (thread == null) return;
    worker.stop();
    try {
      thread.join(shutdownWait.toMillis());
      if (thread.isAlive()) {
        thread.interrupt();
        thread.join(shutdownWait.toMillis());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      if (thread.isAlive()) log.warn("vellum.worker did not stop within {}", shutdownWait);
      thread = null;
    }
  }

  @Override
  public synchronized boolean isRunning() {
    return thread != null && thread.isAlive();
  }
}
