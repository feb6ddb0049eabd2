package io.intellixity.vellum.permission;

/** Contributes an extra SQL predicate restricting rows of one entity type for a user. */
@FunctionalInterface
public interface PermissionQueryHook {

  /** @return a predicate fragment, or null / blank when no restriction applies */
  String condition(String user);
}
