package io.intellixity.vellum.jobs;

import io.intellixity.vellum.jobs.broker.BrokerConnection;
import io.intellixity.vellum.jobs.broker.BrokerUnavailableException;
import io.intellixity.vellum.jobs.broker.QueueBroker;
import io.intellixity.vellum.jobs.queue.QueueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Submits jobs for the current site.\n
 *
 * Paths:\n
 * - {@code now} or not async: the target runs inline and its value is returned\n
 * - broker unreachable: logged, then the target runs inline\n
 * - {@code deferUntilCommit}: buffered in {@link PendingJobs}\n
 * - otherwise: pushed to {@code <namespace>:<queue>}\n
 */
public final class JobDispatcher {
  private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

  public static final String DEFAULT_LIST_KEY = "method";

  private final QueueRegistry queues;
  private final BrokerConnection broker;
  private final JobTargetRegistry targets;
  private final PendingJobs pending;
  private final String site;
  private final Supplier<String> currentUser;

  public JobDispatcher(QueueRegistry queues,
                       BrokerConnection broker,
                       JobTargetRegistry targets,
                       PendingJobs pending,
                       String site,
                       Supplier<String> currentUser) {
    this.queues = Objects.requireNonNull(queues, "queues");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.targets = Objects.requireNonNull(targets, "targets");
    this.pending = Objects.requireNonNull(pending, "pending");
    this.site = Objects.requireNonNull(site, "site");
    this.currentUser = currentUser == null ? () -> null : currentUser;
  }

  public String site() { return site; }
  public QueueRegistry queues() { return queues; }
  public PendingJobs pending() { return pending; }

  public EnqueueResult enqueue(EnqueueRequest request) {
    Objects.requireNonNull(request, "request");
    JobTarget target = targets.resolve(request.method());

    if (!request.async() && !request.now()) {
      log.warn("vellum.jobs enqueue with async=false runs {} inline; prefer now=true", request.method());
    }
    if (request.now() || !request.async()) {
      return EnqueueResult.executed(callDirectly(request.method(), target, request.kwargs()));
    }

    String qname = queues.qname(request.queue());
    QueueBroker b;
    try {
      b = broker.get();
    } catch (BrokerUnavailableException e) {
      log.warn("vellum.jobs queue is unreachable: executing {} synchronously", request.method(), e);
      return EnqueueResult.executed(callDirectly(request.method(), target, request.kwargs()));
    }

    JobDescriptor job = describe(request);
    if (request.deferUntilCommit()) {
      pending.add(new PendingJobs.Entry(qname, job, request.atFront()));
      return EnqueueResult.deferred(job);
    }

    b.push(qname, job, request.atFront());
    if (log.isDebugEnabled()) {
      log.debug("vellum.jobs.enqueue method={} site={} queue={} job={} atFront={}",
          job.method(), site, qname, job.id(), request.atFront());
    }
    return EnqueueResult.queued(job);
  }

  /** Queues {@code docMethod} on one document with extra keyword arguments. */
  public EnqueueResult enqueueForDocument(String entityType, String name, String docMethod, Map<String, ?> kwargs) {
    return enqueue(EnqueueRequest.forDocument(entityType, name, docMethod).withKwargs(kwargs));
  }

  /**
   * Queued and running jobs grouped by site, each job represented by its {@code key} attribute
   * (a descriptor field such as {@code method} or {@code job_name}, else a keyword argument).
   *
   * @param site only this site, or all sites when null
   * @param queue only this queue, or every recognised queue when null
   */
  public Map<String, List<Object>> listJobs(String site, String queue, String key) {
    String k = key == null || key.isBlank() ? DEFAULT_LIST_KEY : key;
    QueueBroker b = broker.get();
    Map<String, List<Object>> out = new LinkedHashMap<>();
    for (String q : queues.queueList(queue == null ? null : List.of(queue))) {
      String qname = queues.qname(q);
      List<JobDescriptor> jobs = new ArrayList<>(b.queued(qname));
      jobs.addAll(b.running(qname));
      for (JobDescriptor job : jobs) {
        if (job.site() == null || job.site().isBlank()) {
          log.warn("vellum.jobs no site found in job id={} queue={}", job.id(), qname);
          continue;
        }
        if (site != null && !site.equals(job.site())) continue;
        Object value = job.attribute(k);
        if (value != null) out.computeIfAbsent(job.site(), s -> new ArrayList<>()).add(value);
      }
    }
    return out;
  }

  /** True when a job named {@code jobName} of this site waits in any recognised queue. */
  public boolean isJobQueued(String jobName) {
    Objects.requireNonNull(jobName, "jobName");
    QueueBroker b = broker.get();
    for (String q : queues.queueNames()) {
      for (JobDescriptor job : b.queued(queues.qname(q))) {
        if (jobName.equals(job.jobName()) && site.equals(job.site())) return true;
      }
    }
    return false;
  }

  private JobDescriptor describe(EnqueueRequest request) {
    Integer timeout = request.timeoutSeconds();
    int seconds = timeout != null && timeout > 0 ? timeout : queues.timeoutSeconds(request.queue());
    String user = request.user() != null ? request.user() : currentUser.get();
    return new JobDescriptor(UUID.randomUUID().toString(), site, user, request.method(), request.event(),
        request.jobName(), request.async(), request.queue(), seconds, request.kwargs());
  }

  private static Object callDirectly(String method, JobTarget target, Map<String, Object> kwargs) {
    try {
      return target.call(kwargs);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new JobFailedException(method, e);
    }
  }
}
