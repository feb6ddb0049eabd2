package io.intellixity.vellum.permission;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered registry of {@link PermissionQueryHook}s per entity type, built once at startup.
 */
public final class PermissionQueryHooks {
  private static final PermissionQueryHooks EMPTY = new PermissionQueryHooks(Map.of());

  private final Map<String, List<PermissionQueryHook>> hooks;

  private PermissionQueryHooks(Map<String, List<PermissionQueryHook>> hooks) {
    this.hooks = hooks;
  }

  public static PermissionQueryHooks empty() { return EMPTY; }

  public static Builder builder() { return new Builder(); }

  /** Non-blank hook predicates for the entity type, in registration order. */
  public List<String> conditions(String entityType, String user) {
    List<PermissionQueryHook> list = hooks.getOrDefault(entityType, List.of());
    List<String> out = new ArrayList<>(list.size());
    for (PermissionQueryHook h : list) {
      String c = h.condition(user);
      if (c != null && !c.isBlank()) out.add(c);
    }
    return out;
  }

  public static final class Builder {
    private final Map<String, List<PermissionQueryHook>> hooks = new LinkedHashMap<>();

    public Builder register(String entityType, PermissionQueryHook hook) {
      Objects.requireNonNull(entityType, "entityType");
      Objects.requireNonNull(hook, "hook");
      hooks.computeIfAbsent(entityType, k -> new ArrayList<>()).add(hook);
      return this;
    }

    public PermissionQueryHooks build() {
      Map<String, List<PermissionQueryHook>> copy = new LinkedHashMap<>();
      hooks.forEach((k, v) -> copy.put(k, List.copyOf(v)));
      return new PermissionQueryHooks(Map.copyOf(copy));
    }
  }
}
