package io.intellixity.vellum.permission;

/** The acting user has no path to the requested rows or tables. Never retried. */
public final class PermissionDeniedException extends RuntimeException {
  private final String entityType;

  public PermissionDeniedException(String entityType, String message) {
    super(message);
    this.entityType = entityType;
  }

  public String entityType() { return entityType; }

  public static PermissionDeniedException insufficient(String entityType) {
    return new PermissionDeniedException(entityType, "Insufficient Permission for " + entityType);
  }
}
