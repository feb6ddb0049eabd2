package io.intellixity.vellum.jobs;

import io.intellixity.vellum.jobs.queue.QueueRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Arguments of one {@link JobDispatcher#enqueue} call.\n
 *
 * Defaults: queue {@code default}, queue timeout, async, job name = method, run through the broker.
 */
public final class EnqueueRequest {
  private final String method;
  private String queue = QueueRegistry.DEFAULT;
  private Integer timeoutSeconds;
  private String event;
  private boolean async = true;
  private String jobName;
  private boolean now;
  private boolean deferUntilCommit;
  private boolean atFront;
  private String user;
  private final Map<String, Object> kwargs = new LinkedHashMap<>();

  private EnqueueRequest(String method) {
    this.method = Objects.requireNonNull(method, "method");
    if (method.isBlank()) throw new IllegalArgumentException("method is blank");
  }

  public static EnqueueRequest of(String method) { return new EnqueueRequest(method); }

  /** Calls {@code docMethod} on document {@code entityType/name} through the built-in target. */
  public static EnqueueRequest forDocument(String entityType, String name, String docMethod) {
    return of(DocumentMethodInvoker.RUN_DOCUMENT_METHOD)
        .withTimeoutSeconds(QueueRegistry.DEFAULT_TIMEOUT_SECONDS)
        .withKwarg(DocumentMethodInvoker.ENTITY_TYPE, Objects.requireNonNull(entityType, "entityType"))
        .withKwarg(DocumentMethodInvoker.NAME, name)
        .withKwarg(DocumentMethodInvoker.DOC_METHOD, Objects.requireNonNull(docMethod, "docMethod"));
  }

  public String method() { return method; }
  public String queue() { return queue; }
  /** Null means the queue's configured timeout. */
  public Integer timeoutSeconds() { return timeoutSeconds; }
  public String event() { return event; }
  public boolean async() { return async; }
  public String jobName() { return jobName; }
  public boolean now() { return now; }
  public boolean deferUntilCommit() { return deferUntilCommit; }
  public boolean atFront() { return atFront; }
  public String user() { return user; }
  public Map<String, Object> kwargs() { return kwargs; }

  public EnqueueRequest withQueue(String queue) { this.queue = queue; return this; }
  public EnqueueRequest withTimeoutSeconds(Integer timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; return this; }
  public EnqueueRequest withEvent(String event) { this.event = event; return this; }
  public EnqueueRequest withAsync(boolean async) { this.async = async; return this; }
  public EnqueueRequest withJobName(String jobName) { this.jobName = jobName; return this; }
  public EnqueueRequest withNow(boolean now) { this.now = now; return this; }
  public EnqueueRequest withDeferUntilCommit(boolean deferUntilCommit) { this.deferUntilCommit = deferUntilCommit; return this; }
  public EnqueueRequest withAtFront(boolean atFront) { this.atFront = atFront; return this; }
  public EnqueueRequest withUser(String user) { this.user = user; return this; }
  public EnqueueRequest withKwarg(String key, Object value) { this.kwargs.put(Objects.requireNonNull(key, "key"), value); return this; }
  public EnqueueRequest withKwargs(Map<String, ?> kwargs) { if (kwargs != null) this.kwargs.putAll(kwargs); return this; }
}
