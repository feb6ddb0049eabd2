package io.intellixity.vellum.jobs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable description of one background job.\n
 *
 * {@code method} names a target registered in {@link JobTargetRegistry}; {@code kwargs} are passed
 * to it unchanged on every attempt. {@code jobName} defaults to the method name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobDescriptor(String id,
                            String site,
                            String user,
                            String method,
                            String event,
                            String jobName,
                            boolean async,
                            String queue,
                            int timeoutSeconds,
                            Map<String, Object> kwargs) {
  public JobDescriptor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(method, "method");
    if (method.isBlank()) throw new IllegalArgumentException("method is blank");
    jobName = jobName == null || jobName.isBlank() ? method : jobName;
    queue = queue == null || queue.isBlank() ? "default" : queue;
    kwargs = kwargs == null ? Map.of() : new LinkedHashMap<>(kwargs);
  }

  /**
   * Value used to group jobs in listings: a top-level attribute ({@code method}, {@code job_name},
   * {@code site}, ...) or else a keyword argument of the same name. Null when neither exists.
   */
  public Object attribute(String key) {
    switch (key) {
      case "id": return id;
      case "site": return site;
      case "user": return user;
      case "method": return method;
      case "event": return event;
      case "job_name": return jobName;
      case "queue": return queue;
      case "timeout": return timeoutSeconds;
      default: return kwargs.get(key);
    }
  }
}
