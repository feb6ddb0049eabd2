package io.intellixity.vellum.permission;

import java.util.EnumSet;
import java.util.Set;

/**
 * Role-level permissions of one user on one entity type.\n
 *
 * {@code ifOwner} lists the permission types that are granted only for records the user owns.
 */
public final class RolePermissions {
  private final Set<PermissionType> granted;
  private final Set<PermissionType> ifOwner;

  public RolePermissions(Set<PermissionType> granted, Set<PermissionType> ifOwner) {
    this.granted = granted == null || granted.isEmpty() ? EnumSet.noneOf(PermissionType.class) : EnumSet.copyOf(granted);
    this.ifOwner = ifOwner == null || ifOwner.isEmpty() ? EnumSet.noneOf(PermissionType.class) : EnumSet.copyOf(ifOwner);
  }

  public static RolePermissions none() {
    return new RolePermissions(Set.of(), Set.of());
  }

  public static RolePermissions of(PermissionType... granted) {
    return new RolePermissions(Set.of(granted), Set.of());
  }

  public static RolePermissions ownerOnly(PermissionType... granted) {
    return new RolePermissions(Set.of(granted), Set.of(granted));
  }

  public boolean has(PermissionType type) { return granted.contains(type); }

  public boolean canSelectOrRead() {
    return has(PermissionType.SELECT) || has(PermissionType.READ);
  }

  /**
   * True when select and read are only available on owned records, so every query must be
   * restricted to {@code owner = user}.
   */
  public boolean requiresOwnerConstraint() {
    if (ifOwner.isEmpty()) return false;
    for (PermissionType t : new PermissionType[] {PermissionType.SELECT, PermissionType.READ}) {
      if (granted.contains(t) && !ifOwner.contains(t)) return false;
    }
    return true;
  }
}
