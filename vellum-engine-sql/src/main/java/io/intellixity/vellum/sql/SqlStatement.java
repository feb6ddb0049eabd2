package io.intellixity.vellum.sql;

import java.util.Objects;

/** Rendered select statement for one entity type. Literals are already inlined and escaped. */
public record SqlStatement(String sql, String entityType) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(entityType, "entityType");
  }
}
