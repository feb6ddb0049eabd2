package io.intellixity.vellum.hierarchy;

import java.util.List;
import java.util.Optional;

/** Nested-set lookups for tree-structured entity types. */
public interface HierarchyResolver {

  /** Bounds of {@code id}, empty when the record does not exist. */
  Optional<NestedSetBounds> bounds(String entityType, String id);

  /** Ids strictly inside {@code anchor}, ordered by lft ascending. */
  List<String> descendants(String entityType, NestedSetBounds anchor);

  /** Ids strictly enclosing {@code anchor}, ordered by lft descending. */
  List<String> ancestors(String entityType, NestedSetBounds anchor);
}
