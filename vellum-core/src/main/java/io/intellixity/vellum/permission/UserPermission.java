package io.intellixity.vellum.permission;

import java.util.Objects;

/**
 * Per-record grant: the user may see records linked to {@code doc}.
 *
 * @param applicableFor when set, the grant only applies while querying this entity type
 */
public record UserPermission(String doc, String applicableFor) {
  public UserPermission {
    Objects.requireNonNull(doc, "doc");
  }

  public static UserPermission of(String doc) { return new UserPermission(doc, null); }

  public boolean appliesToAll() {
    return applicableFor == null || applicableFor.isBlank();
  }
}
