package io.intellixity.vellum.permission;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class RolePermissionsTest {

  @Test
  void ownerConstraint_whenReadOnlyIfOwner() {
    assertTrue(RolePermissions.ownerOnly(PermissionType.READ).requiresOwnerConstraint());
  }

  @Test
  void noOwnerConstraint_whenSelectGrantedOutright() {
    RolePermissions p = new RolePermissions(Set.of(PermissionType.READ, PermissionType.SELECT), Set.of(PermissionType.READ));
    assertFalse(p.requiresOwnerConstraint());
  }

  @Test
  void noOwnerConstraint_withoutIfOwnerRules() {
    assertFalse(RolePermissions.of(PermissionType.READ).requiresOwnerConstraint());
    assertFalse(RolePermissions.none().canSelectOrRead());
  }

  @Test
  void hooksAreOrderedAndBlankResultsDropped() {
    PermissionQueryHooks hooks = PermissionQueryHooks.builder()
        .register("Task", user -> "`tabTask`.`project` = 'P1'")
        .register("Task", user -> "")
        .register("Task", user -> "`tabTask`.`owner` != '" + user + "'")
        .register("Note", user -> "1=0")
        .build();

    assertEquals(2, hooks.conditions("Task", "u@x").size());
    assertEquals("`tabTask`.`owner` != 'u@x'", hooks.conditions("Task", "u@x").get(1));
    assertTrue(hooks.conditions("Project", "u@x").isEmpty());
  }
}
