package io.intellixity.vellum.sql.dialect;

import io.intellixity.vellum.sql.QueryPlan;

/**
 * SQL dialect contract used by the query assembler.\n
 *
 * Covers identifier quoting, literal escaping, null fallback and id casting, and the final
 * select rendering including LIMIT/OFFSET.
 */
public interface SqlDialect {
  String id();

  String quoteIdent(String ident);

  /** Quoted and escaped string literal safe for inlining. */
  String literal(String value);

  /** Quoted table name of an entity type ({@code tab<Entity>}). */
  default String table(String entityType) {
    return quoteIdent("tab" + entityType);
  }

  default String column(String entityType, String field) {
    return table(entityType) + "." + quoteIdent(field);
  }

  /** {@code expr} with nulls replaced by {@code fallback}. */
  String ifNull(String expr, String fallback);

  /** Rewrite id column references for dialects that store ids as non-text types. */
  String castName(String clause);

  String likeOperator(boolean negated);

  /** True when ORDER BY columns must appear in the projection of a grouped select. */
  boolean requiresOrderColumnsInSelect();

  String renderSelect(QueryPlan plan);

  String limit(int start, Integer pageLength);
}
