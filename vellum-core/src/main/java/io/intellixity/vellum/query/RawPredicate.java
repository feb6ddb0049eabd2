package io.intellixity.vellum.query;

import java.util.Objects;

/**
 * Verbatim SQL predicate supplied by trusted server-side code.\n
 *
 * Raw predicates bypass the condition builder entirely; they must never be built from end-user input.
 */
public record RawPredicate(String sql) implements FilterElement {
  public RawPredicate {
    Objects.requireNonNull(sql, "sql");
    if (sql.isBlank()) throw new QueryValidationException("Raw predicate must not be blank");
  }
}
