package io.intellixity.vellum.meta;

import java.util.Set;

/**
 * Schema introspection used by the query compiler.\n
 *
 * Implementations are owned by the host (ORM / metadata layer) and are expected to cache.
 */
public interface MetadataProvider {

  /** Metadata for an entity type; never null for a known type. */
  EntityMeta meta(String entityType);

  /**
   * Columns physically present in the entity's table.
   *
   * @throws MissingTableException when the table does not exist
   */
  Set<String> tableColumns(String entityType);
}
