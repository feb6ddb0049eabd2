package io.intellixity.vellum.jobs.worker;

import io.intellixity.vellum.jobs.JobDescriptor;
import io.intellixity.vellum.jobs.Sleeper;
import io.intellixity.vellum.jobs.broker.BrokerConnection;
import io.intellixity.vellum.jobs.broker.QueueBroker;
import io.intellixity.vellum.jobs.exec.JobExecutor;
import io.intellixity.vellum.jobs.queue.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pulls jobs from its queues, in listed order, and runs them one at a time.\n
 *
 * Each job gets its own thread so the worker can enforce the job timeout and honour a broker stop
 * request. Termination interrupts that thread and waits up to the cancel grace for it to exit; a
 * body that outlives the grace stops the worker, so no second job ever runs beside it. In burst
 * mode {@link #run()} returns once every queue is empty.
 */
public final class JobWorker implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(JobWorker.class);
  static final Duration DEFAULT_CANCEL_GRACE = Duration.ofSeconds(10);

  private final String name;
  private final BrokerConnection broker;
  private final List<String> qnames;
  private final JobExecutor executor;
  private final Duration pollInterval;
  private final boolean burst;
  private final Sleeper sleeper;
  private final Duration cancelGrace;
  private final ExecutorService jobThreads;

  private volatile boolean stopped;

  public JobWorker(BrokerConnection broker,
                   QueueRegistry queues,
                   List<String> queueNames,
                   JobExecutor executor,
                   Duration pollInterval,
                   boolean burst,
                   Sleeper sleeper) {
    this(broker, queues, queueNames, executor, pollInterval, burst, sleeper, DEFAULT_CANCEL_GRACE);
  }

  public JobWorker(BrokerConnection broker,
                   QueueRegistry queues,
                   List<String> queueNames,
                   JobExecutor executor,
                   Duration pollInterval,
                   boolean burst,
                   Sleeper sleeper,
                   Duration cancelGrace) {
    this.broker = Objects.requireNonNull(broker, "broker");
    Objects.requireNonNull(queues, "queues");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    if (pollInterval.isNegative() || pollInterval.isZero()) throw new IllegalArgumentException("pollInterval must be > 0");
    this.burst = burst;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.cancelGrace = Objects.requireNonNull(cancelGrace, "cancelGrace");

    List<String> names = queues.queueList(queueNames);
    List<String> q = new ArrayList<>(names.size());
    for (String n : names) q.add(queues.qname(n));
    this.qnames = List.copyOf(q);
    this.name = WorkerNames.create(queueNames != null && queueNames.size() == 1 ? q.get(0) : null);

    AtomicInteger seq = new AtomicInteger();
    this.jobThreads = Executors.newCachedThreadPool(r -> {
      Thread t = new Thread(r, "vellum-job-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  public String name() { return name; }
  public List<String> qnames() { return qnames; }
  public boolean isStopped() { return stopped; }

  @Override
  public void run() {
    log.info("vellum.jobs.worker started name={} queues={} burst={}", name, qnames, burst);
    try {
      while (!stopped && !Thread.currentThread().isInterrupted()) {
        if (processNext()) continue;
        if (burst) break;
        sleeper.sleep(pollInterval);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      jobThreads.shutdownNow();
      log.info("vellum.jobs.worker stopped name={}", name);
    }
  }

  /** Asks {@link #run()} to return after the current job. */
  public void stop() {
    stopped = true;
  }

  /**
   * Claims and runs at most one job.
   *
   * @return false when every queue was empty
   */
  public boolean processNext() throws InterruptedException {
    QueueBroker b = broker.get();
    Optional<JobDescriptor> next = b.poll(qnames);
    if (next.isEmpty()) return false;
    runJob(b, next.get());
    return true;
  }

  private void runJob(QueueBroker b, JobDescriptor job) throws InterruptedException {
    RunningJob running = new RunningJob(executor, job);
    Future<Object> f = jobThreads.submit(running);
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(job.timeoutSeconds());
    while (true) {
      long remaining = deadline - System.nanoTime();
      long slice = Math.max(1, Math.min(pollInterval.toNanos(), remaining));
      try {
        f.get(slice, TimeUnit.NANOSECONDS);
        b.markFinished(job.id());
        return;
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        b.markFailed(job.id(), cause.toString());
        log.warn("vellum.jobs.worker job failed name={} job={} method={}: {}", name, job.id(), job.method(), cause.toString());
        return;
      } catch (TimeoutException e) {
        if (b.isStopRequested(job.id())) {
          terminate(f, running, job);
          b.markFailed(job.id(), "Stopped on request");
          log.info("vellum.jobs.worker job stopped name={} job={} method={}", name, job.id(), job.method());
          return;
        }
        if (System.nanoTime() - deadline >= 0) {
          terminate(f, running, job);
          b.markFailed(job.id(), "Job exceeded timeout of " + job.timeoutSeconds() + " seconds");
          log.warn("vellum.jobs.worker job timed out name={} job={} method={} timeout={}s",
              name, job.id(), job.method(), job.timeoutSeconds());
          return;
        }
      } catch (InterruptedException e) {
        f.cancel(true);
        b.markFailed(job.id(), "Worker interrupted");
        throw e;
      }
    }
  }

  private void terminate(Future<Object> f, RunningJob running, JobDescriptor job) throws InterruptedException {
    f.cancel(true);
    if (!running.awaitExit(cancelGrace)) {
      stopped = true;
      log.error("vellum.jobs.worker job ignored interrupt name={} job={} method={} graceMs={}, worker stopping",
          name, job.id(), job.method(), cancelGrace.toMillis());
    }
  }

  /** Runs the job at most once; a job cancelled before it starts never runs. */
  private static final class RunningJob implements Callable<Object> {
    private static final int PENDING = 0;
    private static final int RUNNING = 1;
    private static final int DONE = 2;

    private final JobExecutor executor;
    private final JobDescriptor job;
    private final AtomicInteger state = new AtomicInteger(PENDING);
    private final CountDownLatch exited = new CountDownLatch(1);

    RunningJob(JobExecutor executor, JobDescriptor job) {
      this.executor = executor;
      this.job = job;
    }

    @Override
    public Object call() {
      if (!state.compareAndSet(PENDING, RUNNING)) return null;
      try {
        return executor.execute(job);
      } finally {
        state.set(DONE);
        exited.countDown();
      }
    }

    boolean awaitExit(Duration grace) throws InterruptedException {
      if (state.compareAndSet(PENDING, DONE)) return true;
      return exited.await(grace.toNanos(), TimeUnit.NANOSECONDS);
    }
  }
}
