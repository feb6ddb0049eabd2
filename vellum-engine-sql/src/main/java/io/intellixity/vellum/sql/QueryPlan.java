package io.intellixity.vellum.sql;

import java.util.Objects;

/**
 * Assembled clause strings of one select, before rendering.\n
 *
 * Optional clauses are empty strings, never null.
 */
public record QueryPlan(String fields,
                        String tables,
                        String conditions,
                        String groupBy,
                        String orderBy,
                        String limit) {
  public QueryPlan {
    Objects.requireNonNull(fields, "fields");
    Objects.requireNonNull(tables, "tables");
    conditions = conditions == null ? "" : conditions;
    groupBy = groupBy == null ? "" : groupBy;
    orderBy = orderBy == null ? "" : orderBy;
    limit = limit == null ? "" : limit;
  }

  public QueryPlan withFields(String fields) {
    return new QueryPlan(fields, tables, conditions, groupBy, orderBy, limit);
  }

  public QueryPlan withOrderBy(String orderBy) {
    return new QueryPlan(fields, tables, conditions, groupBy, orderBy, limit);
  }
}
