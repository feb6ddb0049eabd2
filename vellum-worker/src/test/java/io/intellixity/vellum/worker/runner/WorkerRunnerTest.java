package io.intellixity.vellum.worker.runner;

import io.intellixity.vellum.jobs.JobDescriptor;
import io.intellixity.vellum.jobs.JobTargetRegistry;
import io.intellixity.vellum.jobs.Sleeper;
import io.intellixity.vellum.jobs.broker.BrokerConnection;
import io.intellixity.vellum.jobs.broker.BrokerSettings;
import io.intellixity.vellum.jobs.broker.InMemoryQueueBroker;
import io.intellixity.vellum.jobs.broker.JobStatus;
import io.intellixity.vellum.jobs.exec.JobExecutor;
import io.intellixity.vellum.jobs.exec.JobSession;
import io.intellixity.vellum.jobs.exec.JobSessionFactory;
import io.intellixity.vellum.jobs.exec.RetryPolicy;
import io.intellixity.vellum.jobs.queue.QueueRegistry;
import io.intellixity.vellum.jobs.worker.JobWorker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class WorkerRunnerTest {
  private final QueueRegistry queues = QueueRegistry.of("bench-a");
  private final InMemoryQueueBroker broker = new InMemoryQueueBroker();
  private final BrokerConnection connection = new BrokerConnection(() -> broker, BrokerSettings.defaults(), d -> {});
  private final CountDownLatch ran = new CountDownLatch(1);

  private final JobSessionFactory sessions = site -> new JobSession() {
    @Override public String site() { return site; }
    @Override public void setUser(String user) {}
    @Override public void commit() {}
    @Override public void rollback() {}
    @Override public void logError(String title, Throwable error) {}
    @Override public void releaseLocks() {}
    @Override public void close() {}
  };

  private JobWorker worker() {
    JobTargetRegistry targets = JobTargetRegistry.builder()
        .register("app.ping", kwargs -> {
          ran.countDown();
          return null;
        })
        .build();
    JobExecutor executor = new JobExecutor(targets, sessions, RetryPolicy.defaults(), d -> {});
    return new JobWorker(connection, queues, null, executor, Duration.ofMillis(10), false, Sleeper.system());
  }

  @Test
  void runsJobsUntilStopped() throws InterruptedException {
    broker.push("bench-a:default",
        new JobDescriptor("j-1", "site1", null, "app.ping", null, null, true, "default", 60, Map.of()), false);
    WorkerRunner runner = new WorkerRunner(worker(), true, Duration.ofSeconds(5));

    runner.start();
    assertTrue(runner.isRunning());
    assertTrue(ran.await(5, TimeUnit.SECONDS));

    runner.stop();
    assertFalse(runner.isRunning());
    assertEquals(Optional.of(JobStatus.FINISHED), broker.status("j-1"));
  }

  @Test
  void disabledRunner_neverStarts() {
    WorkerRunner runner = new WorkerRunner(worker(), false, Duration.ofSeconds(1));
    runner.start();
    assertFalse(runner.isRunning());
    runner.stop();
  }
}
