package io.intellixity.vellum.meta;

/** The backing table for an entity type does not exist in the live schema. */
public final class MissingTableException extends RuntimeException {
  private final String entityType;

  public MissingTableException(String entityType) {
    super("Table for entity type '" + entityType + "' does not exist");
    this.entityType = entityType;
  }

  public String entityType() { return entityType; }
}
