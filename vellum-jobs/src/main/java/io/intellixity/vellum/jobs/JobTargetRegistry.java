package io.intellixity.vellum.jobs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named job targets, registered at startup.\n
 *
 * Job descriptors only carry the method name; workers resolve it here.
 */
public final class JobTargetRegistry {
  private final Map<String, JobTarget> targets;

  private JobTargetRegistry(Map<String, JobTarget> targets) {
    this.targets = Map.copyOf(targets);
  }

  public static Builder builder() { return new Builder(); }

  public boolean contains(String method) { return targets.containsKey(method); }

  public Set<String> methods() { return targets.keySet(); }

  public JobTarget resolve(String method) {
    JobTarget t = targets.get(method);
    if (t == null) throw new IllegalArgumentException("Unknown job target: " + method);
    return t;
  }

  public static final class Builder {
    private final Map<String, JobTarget> targets = new LinkedHashMap<>();

    private Builder() {}

    public Builder register(String method, JobTarget target) {
      Objects.requireNonNull(method, "method");
      Objects.requireNonNull(target, "target");
      if (targets.putIfAbsent(method, target) != null) {
        throw new IllegalArgumentException("Job target already registered: " + method);
      }
      return this;
    }

    /** Registers {@value DocumentMethodInvoker#RUN_DOCUMENT_METHOD} backed by {@code invoker}. */
    public Builder documentMethods(DocumentMethodInvoker invoker) {
      Objects.requireNonNull(invoker, "invoker");
      return register(DocumentMethodInvoker.RUN_DOCUMENT_METHOD, invoker::run);
    }

    public JobTargetRegistry build() {
      return new JobTargetRegistry(targets);
    }
  }
}
