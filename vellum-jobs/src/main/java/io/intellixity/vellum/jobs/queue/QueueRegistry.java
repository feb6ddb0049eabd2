package io.intellixity.vellum.jobs.queue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recognised queue names, their timeouts and their physical (namespaced) names.\n
 *
 * Built-in queues: {@code default} and {@code short} (300 s), {@code long} (1500 s).\n
 * Custom queues are appended in declaration order; a custom queue may not redefine a built-in one.\n
 * Physical name: {@code <namespace>:<queue>}.\n
 */
public final class QueueRegistry {
  public static final String DEFAULT = "default";
  public static final String SHORT = "short";
  public static final String LONG = "long";
  public static final int DEFAULT_TIMEOUT_SECONDS = 300;

  private final String namespace;
  private final Map<String, Integer> timeouts;

  public QueueRegistry(String namespace, Map<String, Integer> customQueues) {
    Objects.requireNonNull(namespace, "namespace");
    if (namespace.isBlank()) throw new IllegalArgumentException("namespace is blank");
    this.namespace = namespace.strip();

    Map<String, Integer> t = new LinkedHashMap<>();
    t.put(DEFAULT, DEFAULT_TIMEOUT_SECONDS);
    t.put(SHORT, 300);
    t.put(LONG, 1500);
    if (customQueues != null) {
      for (Map.Entry<String, Integer> e : customQueues.entrySet()) {
        String name = e.getKey() == null ? "" : e.getKey().strip();
        if (name.isEmpty() || name.contains(":")) {
          throw new IllegalArgumentException("Invalid queue name: '" + e.getKey() + "'");
        }
        if (t.containsKey(name)) throw new IllegalArgumentException("Queue already defined: " + name);
        Integer timeout = e.getValue();
        t.put(name, timeout == null || timeout <= 0 ? DEFAULT_TIMEOUT_SECONDS : timeout);
      }
    }
    this.timeouts = Collections.unmodifiableMap(t);
  }

  public static QueueRegistry of(String namespace) {
    return new QueueRegistry(namespace, Map.of());
  }

  public String namespace() { return namespace; }

  /** Queue names in declaration order, built-ins first. */
  public List<String> queueNames() { return List.copyOf(timeouts.keySet()); }

  public int timeoutSeconds(String queue) {
    validate(queue);
    return timeouts.get(queue);
  }

  /** @throws IllegalArgumentException naming the recognised queues */
  public void validate(String queue) {
    if (queue == null || !timeouts.containsKey(queue)) {
      throw new IllegalArgumentException("Queue should be one of " + String.join(", ", timeouts.keySet()));
    }
  }

  /** Validated subset, or every queue when {@code queues} is null or empty. */
  public List<String> queueList(Collection<String> queues) {
    if (queues == null || queues.isEmpty()) return queueNames();
    List<String> out = new ArrayList<>(queues.size());
    for (String q : queues) {
      validate(q);
      out.add(q);
    }
    return out;
  }

  public String qname(String queue) {
    validate(queue);
    return namespace + ":" + queue;
  }

  /** Logical queue of a physical name in this namespace. */
  public String queueOf(String qname) {
    if (!isAccessible(qname)) throw new IllegalArgumentException("Queue not accessible: " + qname);
    return qname.substring(namespace.length() + 1);
  }

  /** True only for physical names of this namespace's recognised queues. */
  public boolean isAccessible(String qname) {
    if (qname == null || !qname.startsWith(namespace + ":")) return false;
    return timeouts.containsKey(qname.substring(namespace.length() + 1));
  }
}
