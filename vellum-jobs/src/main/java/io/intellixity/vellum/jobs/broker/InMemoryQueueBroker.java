package io.intellixity.vellum.jobs.broker;

import io.intellixity.vellum.jobs.JobDescriptor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Single-process broker for tests and embedded use. All state is lost on {@link #close()}.
 */
public final class InMemoryQueueBroker implements QueueBroker {
  private final Map<String, Deque<JobDescriptor>> queues = new HashMap<>();
  private final Map<String, Running> running = new LinkedHashMap<>();
  private final Map<String, JobStatus> statuses = new HashMap<>();
  private final Map<String, String> errors = new HashMap<>();
  private final Set<String> stopRequests = new HashSet<>();
  private boolean closed;

  private record Running(String qname, JobDescriptor job) {}

  @Override
  public synchronized void push(String qname, JobDescriptor job, boolean atFront) {
    ensureOpen();
    Deque<JobDescriptor> q = queues.computeIfAbsent(qname, k -> new ArrayDeque<>());
    if (atFront) q.addFirst(job); else q.addLast(job);
    statuses.put(job.id(), JobStatus.QUEUED);
  }

  @Override
  public synchronized Optional<JobDescriptor> poll(List<String> qnames) {
    ensureOpen();
    for (String qname : qnames) {
      Deque<JobDescriptor> q = queues.get(qname);
      if (q == null || q.isEmpty()) continue;
      JobDescriptor job = q.pollFirst();
      running.put(job.id(), new Running(qname, job));
      statuses.put(job.id(), JobStatus.RUNNING);
      return Optional.of(job);
    }
    return Optional.empty();
  }

  @Override
  public synchronized List<JobDescriptor> queued(String qname) {
    ensureOpen();
    Deque<JobDescriptor> q = queues.get(qname);
    return q == null ? List.of() : List.copyOf(q);
  }

  @Override
  public synchronized List<JobDescriptor> running(String qname) {
    ensureOpen();
    List<JobDescriptor> out = new ArrayList<>();
    for (Running r : running.values()) {
      if (r.qname().equals(qname)) out.add(r.job());
    }
    return out;
  }

  @Override
  public synchronized Optional<JobStatus> status(String jobId) {
    ensureOpen();
    return Optional.ofNullable(statuses.get(jobId));
  }

  @Override
  public synchronized void markFinished(String jobId) {
    ensureOpen();
    finish(jobId, JobStatus.FINISHED);
  }

  @Override
  public synchronized void markFailed(String jobId, String error) {
    ensureOpen();
    finish(jobId, JobStatus.FAILED);
    errors.put(jobId, error);
  }

  /** Failure text recorded by {@link #markFailed}, or null. */
  public synchronized String error(String jobId) {
    return errors.get(jobId);
  }

  @Override
  public synchronized void requestStop(String jobId) {
    ensureOpen();
    if (running.containsKey(jobId)) stopRequests.add(jobId);
  }

  @Override
  public synchronized boolean isStopRequested(String jobId) {
    ensureOpen();
    return stopRequests.contains(jobId);
  }

  @Override
  public synchronized void close() {
    closed = true;
    queues.clear();
    running.clear();
    statuses.clear();
    errors.clear();
    stopRequests.clear();
  }

  private void finish(String jobId, JobStatus status) {
    running.remove(jobId);
    stopRequests.remove(jobId);
    if (statuses.containsKey(jobId)) statuses.put(jobId, status);
  }

  private void ensureOpen() {
    if (closed) throw new BrokerUnavailableException("broker is closed");
  }
}
