package io.intellixity.vellum.sql;

import io.intellixity.vellum.meta.EntityMeta;
import io.intellixity.vellum.meta.MissingTableException;
import io.intellixity.vellum.permission.PermissionDeniedException;
import io.intellixity.vellum.permission.PermissionType;
import io.intellixity.vellum.query.Filter;
import io.intellixity.vellum.query.FilterElement;
import io.intellixity.vellum.query.QueryRequest;
import io.intellixity.vellum.query.QueryValidationException;
import io.intellixity.vellum.query.RawPredicate;
import io.intellixity.vellum.sql.dialect.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Assembles one select statement for one entity type and one request.\n
 *
 * Steps, in order:\n
 * - role-level select/read check on the primary entity\n
 * - live column lookup (missing table is an empty result when {@code ignoreDdl})\n
 * - link field resolution, field sanitizing, table extraction, optional column removal\n
 * - filter conditions (AND), or-filters (one OR group), permission clauses\n
 * - child-name projections, joins, qualification, id casting, quoting\n
 * - ORDER BY / GROUP BY, validated; distinct; dialect projection rule; LIMIT\n
 *
 * Not reusable: create one per query.
 */
public final class DatabaseQuery {
  private static final Logger log = LoggerFactory.getLogger(DatabaseQuery.class);
  private static final Pattern ORDER_DIRECTION = Pattern.compile(" order by | asc| desc", Pattern.CASE_INSENSITIVE);

  private final QueryEngine engine;
  private final SqlDialect dialect;
  private final String entityType;
  private final QueryRequest request;
  private final String user;

  DatabaseQuery(QueryEngine engine, String entityType, QueryRequest request) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.dialect = engine.dialect();
    this.entityType = Objects.requireNonNull(entityType, "entityType");
    this.request = Objects.requireNonNull(request, "request");
    this.user = request.user() == null || request.user().isBlank() ? engine.defaultUser() : request.user();
  }

  /**
   * Renders the statement without running it.
   *
   * @return empty when the table is missing and the request ignores DDL errors
   * @throws PermissionDeniedException when the user cannot see the primary or a joined entity
   * @throws QueryValidationException on malformed or disallowed input
   */
  public Optional<SqlStatement> build() {
    checkPrimaryPermission();

    Set<String> columns;
    try {
      columns = engine.metadata().tableColumns(entityType);
    } catch (MissingTableException e) {
      if (request.ignoreDdl()) {
        log.debug("vellum.sql op=select entity={} table missing, ignoreDdl", entityType);
        return Optional.empty();
      }
      throw e;
    }

    FieldResolver resolver = new FieldResolver(
        dialect, engine.metadata(), engine.permissions(), entityType, user, request.ignorePermissions());

    List<String> fields = new ArrayList<>(request.fields());
    fields.removeIf(f -> f == null || f.isBlank());
    if (fields.isEmpty()) {
      String pluck = request.pluck() == null || request.pluck().isBlank() ? "name" : request.pluck();
      fields.add(dialect.column(entityType, pluck));
    }

    fields = resolver.resolveLinkFields(fields);
    FieldSanitizer.validateFields(fields, request.strict());
    resolver.extractTables(fields);
    fields = FieldResolver.removeOptionalFields(fields, columns);
    List<FilterElement> filters = FieldResolver.removeOptionalFilters(request.filters(), columns);

    String conditions = buildConditions(resolver, filters);

    if (request.withChildNames()) {
      for (String child : resolver.childTables()) {
        fields.add(dialect.table(child) + "." + dialect.quoteIdent("name") + " as " + dialect.quoteIdent(child + ":name"));
      }
    }

    String tables = buildTables(resolver);
    fields = resolver.wrap(resolver.qualify(fields));
    String projection = String.join(", ", fields);

    String orderBy = orderBy(fields);
    String groupBy = request.groupBy() == null ? "" : request.groupBy().strip();
    FieldSanitizer.validateOrderOrGroup(orderBy, resolver.joinedTableNames());
    FieldSanitizer.validateOrderOrGroup(groupBy, resolver.joinedTableNames());

    QueryPlan plan = new QueryPlan(projection, tables, conditions, groupBy, orderBy,
        dialect.limit(request.limitStart(), request.limitPageLength()));

    if (request.distinct()) {
      plan = plan.withFields("distinct " + plan.fields()).withOrderBy("");
    }
    if (dialect.requiresOrderColumnsInSelect() && !plan.orderBy().isBlank() && !plan.groupBy().isBlank()) {
      plan = projectOrderColumns(plan);
    }

    String sql = dialect.renderSelect(plan);
    if (log.isDebugEnabled()) {
      log.debug("vellum.sql op=select entity={} dialect={} tables={} sql={}",
          entityType, dialect.id(), resolver.tables().size() + resolver.linkJoins().size(), sql);
    }
    return Optional.of(new SqlStatement(sql, entityType));
  }

  private void checkPrimaryPermission() {
    if (request.ignorePermissions()) return;
    String parent = request.parentEntity();
    if (!engine.permissions().hasPermission(entityType, PermissionType.SELECT, user, parent)
        && !engine.permissions().hasPermission(entityType, PermissionType.READ, user, parent)) {
      throw PermissionDeniedException.insufficient(entityType);
    }
  }

  private String buildConditions(FieldResolver resolver, List<FilterElement> filters) {
    ConditionBuilder builder = new ConditionBuilder(
        dialect, engine.metadata(), engine.hierarchy(), engine.dateRanges(), request.ignoreIfNull());

    List<String> conditions = new ArrayList<>();
    for (FilterElement e : filters) {
      conditions.add(condition(builder, resolver, e));
    }

    if (!request.ignorePermissions()) {
      PermissionClauseBuilder permissionClauses =
          new PermissionClauseBuilder(dialect, engine.metadata(), engine.permissions(), engine.hooks());
      conditions.addAll(permissionClauses.build(entityType, user, request.referenceEntity()));
    }

    List<String> grouped = new ArrayList<>();
    for (FilterElement e : request.orFilters()) {
      grouped.add(condition(builder, resolver, e));
    }
    if (!grouped.isEmpty()) {
      conditions.add("(" + String.join(" or ", grouped) + ")");
    }
    return String.join(" and ", conditions);
  }

  private String condition(ConditionBuilder builder, FieldResolver resolver, FilterElement e) {
    if (e instanceof RawPredicate raw) return raw.sql();
    if (e instanceof Filter f) {
      Filter bound = resolver.resolveLinkFilter(f.withDefaultEntity(entityType));
      if (!bound.entityType().equals(entityType)) resolver.addTable(bound.entityType());
      return builder.build(bound);
    }
    throw new QueryValidationException("Unsupported filter element: " + e);
  }

  private String buildTables(FieldResolver resolver) {
    String primaryTable = dialect.table(entityType);
    StringBuilder sb = new StringBuilder(primaryTable);
    String join = request.join();
    for (String child : resolver.childTables()) {
      String t = dialect.table(child);
      sb.append(' ').append(join).append(' ').append(t)
          .append(" on (").append(t).append('.').append(dialect.quoteIdent("parenttype"))
          .append(" = ").append(dialect.literal(entityType))
          .append(" and ").append(t).append('.').append(dialect.quoteIdent("parent"))
          .append(" = ").append(dialect.castName(dialect.column(entityType, "name"))).append(')');
    }
    for (FieldResolver.LinkJoin link : resolver.linkJoins()) {
      String t = dialect.table(link.entityType());
      sb.append(' ').append(join).append(' ').append(t)
          .append(" on (").append(dialect.column(link.entityType(), "name"))
          .append(" = ").append(dialect.column(entityType, link.fieldName())).append(')');
    }
    return sb.toString();
  }

  private String orderBy(List<String> fields) {
    if (request.orderBy() != null) return request.orderBy().strip();

    String first = fields.size() == 1 ? fields.get(0).strip().toLowerCase(Locale.ROOT) : "";
    boolean groupFunctionWithoutGroupBy = (first.startsWith("count(") || first.startsWith("min(") || first.startsWith("max("))
        && (request.groupBy() == null || request.groupBy().isBlank());
    if (groupFunctionWithoutGroupBy) return "";

    EntityMeta meta = engine.metadata().meta(entityType);
    String order;
    String sortField = meta.sortField();
    if (sortField != null && sortField.contains(",")) {
      List<String> terms = new ArrayList<>();
      for (String term : sortField.split(",")) {
        String[] parts = term.strip().split("\\s+");
        String dir = parts.length > 1 ? parts[1] : "desc";
        terms.add(dialect.column(entityType, parts[0]) + " " + dir);
      }
      order = String.join(", ", terms);
    } else {
      boolean configured = sortField != null && !sortField.isBlank();
      String field = configured ? sortField.strip() : "modified";
      String dir = configured && meta.sortOrder() != null && !meta.sortOrder().isBlank() ? meta.sortOrder() : "desc";
      order = dialect.column(entityType, field) + " " + dir;
    }
    if (meta.submittable()) {
      order = dialect.column(entityType, "docstatus") + " asc, " + order;
    }
    return order;
  }

  /**
   * Grouped selects on dialects that reject ordering by unselected columns: each order column
   * missing from the projection is selected as {@code MAX(column)} and ordered by its alias.
   */
  private QueryPlan projectOrderColumns(QueryPlan plan) {
    String fields = plan.fields();
    List<String> terms = new ArrayList<>();
    for (String term : plan.orderBy().split(",")) {
      String orderField = ORDER_DIRECTION.matcher(term).replaceAll("").strip();
      if (orderField.isEmpty() || fields.contains(orderField)) {
        terms.add(term.strip());
        continue;
      }
      String orderColumn = orderField.replace("`", "").replace("\"", "");
      String extracted = orderColumn.contains(".") ? orderColumn.substring(orderColumn.indexOf('.') + 1) : orderColumn;
      fields += ", MAX(" + extracted + ") as " + dialect.quoteIdent(orderColumn);
      terms.add(term.strip().replace(orderField, dialect.quoteIdent(orderColumn)));
    }
    return plan.withFields(fields).withOrderBy(String.join(", ", terms));
  }
}
