package io.intellixity.vellum.sql.dialect;

import io.intellixity.vellum.sql.QueryPlan;

/**
 * Generic SQL dialect base.\n
 *
 * Provides the select template: fields, tables with joins, WHERE, GROUP BY, ORDER BY, LIMIT.\n
 * DB-specific dialects override hooks for quoting, literal escaping, null fallback, casting and paging.\n
 */
public abstract class AbstractSqlDialect implements SqlDialect {

  @Override
  public final String renderSelect(QueryPlan plan) {
    StringBuilder sql = new StringBuilder("select ")
        .append(plan.fields())
        .append(" from ")
        .append(plan.tables());
    if (!plan.conditions().isBlank()) sql.append(" where ").append(plan.conditions());
    if (!plan.groupBy().isBlank()) sql.append(" group by ").append(plan.groupBy());
    if (!plan.orderBy().isBlank()) sql.append(" order by ").append(plan.orderBy());
    if (!plan.limit().isBlank()) sql.append(" ").append(plan.limit());
    return sql.toString();
  }

  @Override
  public final String literal(String value) {
    if (value == null) return "''";
    return "'" + escapeLiteralBody(value) + "'";
  }

  @Override
  public String ifNull(String expr, String fallback) {
    return "coalesce(" + expr + ", " + fallback + ")";
  }

  @Override
  public String castName(String clause) {
    return clause;
  }

  @Override
  public String likeOperator(boolean negated) {
    return negated ? "not like" : "like";
  }

  @Override
  public boolean requiresOrderColumnsInSelect() {
    return false;
  }

  @Override
  public String limit(int start, Integer pageLength) {
    if (pageLength == null || pageLength <= 0) return "";
    return applyLimit(start, pageLength);
  }

  protected String applyLimit(int start, int pageLength) {
    return "limit " + pageLength + " offset " + Math.max(start, 0);
  }

  /** Escape the body of a single-quoted literal (without surrounding quotes). */
  protected abstract String escapeLiteralBody(String value);
}
