package io.intellixity.vellum.query;

import java.util.Objects;

/**
 * Filter value marker meaning "compare against this column of the same table" instead of a literal.
 */
public record ColumnRef(String column) {
  public ColumnRef {
    Objects.requireNonNull(column, "column");
    if (!Filter.isValidFieldName(column)) {
      throw new QueryValidationException("Invalid column reference: " + column);
    }
  }

  public static ColumnRef of(String column) { return new ColumnRef(column); }
}
