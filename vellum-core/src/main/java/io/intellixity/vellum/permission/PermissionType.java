package io.intellixity.vellum.permission;

public enum PermissionType {
  SELECT,
  READ
}
