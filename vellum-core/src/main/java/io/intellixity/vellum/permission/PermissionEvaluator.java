package io.intellixity.vellum.permission;

import java.util.List;
import java.util.Map;

/**
 * Permission engine consulted by the query compiler. Owned by the host; the compiler never
 * resolves roles or shares itself.
 */
public interface PermissionEvaluator {

  RolePermissions rolePermissions(String entityType, String user);

  /** @param parentEntity parent document type when {@code entityType} is a child table, else null */
  boolean hasPermission(String entityType, PermissionType type, String user, String parentEntity);

  /** True when the user holds select but not read on the entity type. */
  boolean onlyHasSelect(String entityType, String user);

  /** Per-record grants of the user, keyed by the granted entity type. */
  Map<String, List<UserPermission>> userPermissions(String user);

  /** Ids of records of {@code entityType} explicitly shared with the user. */
  List<String> sharedWith(String entityType, String user);

  /** System setting: when true, rows with an empty link value are not visible through a grant. */
  default boolean applyStrictUserPermissions() {
    return false;
  }
}
