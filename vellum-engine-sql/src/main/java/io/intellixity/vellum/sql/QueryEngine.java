package io.intellixity.vellum.sql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.vellum.hierarchy.HierarchyResolver;
import io.intellixity.vellum.meta.MetadataProvider;
import io.intellixity.vellum.permission.PermissionEvaluator;
import io.intellixity.vellum.permission.PermissionQueryHooks;
import io.intellixity.vellum.query.QueryRequest;
import io.intellixity.vellum.query.QueryValidationException;
import io.intellixity.vellum.sql.dialect.SqlDialect;
import io.intellixity.vellum.temporal.DateRanges;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the query compiler: owns the collaborators and creates one
 * {@link DatabaseQuery} per call.
 */
public final class QueryEngine {
  public static final String GUEST = "Guest";
  static final String COMMENT_COUNT = "_comment_count";

  private static final ObjectMapper JSON = new ObjectMapper();

  private final SqlDialect dialect;
  private final MetadataProvider metadata;
  private final PermissionEvaluator permissions;
  private final HierarchyResolver hierarchy;
  private final PermissionQueryHooks hooks;
  private final DateRanges dateRanges;
  private final StatementRunner runner;
  private final String defaultUser;

  public QueryEngine(SqlDialect dialect,
                     MetadataProvider metadata,
                     PermissionEvaluator permissions,
                     HierarchyResolver hierarchy,
                     PermissionQueryHooks hooks,
                     DateRanges dateRanges,
                     StatementRunner runner,
                     String defaultUser) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.permissions = Objects.requireNonNull(permissions, "permissions");
    this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    this.hooks = hooks == null ? PermissionQueryHooks.empty() : hooks;
    this.dateRanges = dateRanges == null ? DateRanges.systemDefault() : dateRanges;
    this.runner = Objects.requireNonNull(runner, "runner");
    this.defaultUser = defaultUser == null || defaultUser.isBlank() ? GUEST : defaultUser;
  }

  public SqlDialect dialect() { return dialect; }
  public MetadataProvider metadata() { return metadata; }
  public PermissionEvaluator permissions() { return permissions; }
  public HierarchyResolver hierarchy() { return hierarchy; }
  public PermissionQueryHooks hooks() { return hooks; }
  public DateRanges dateRanges() { return dateRanges; }
  public String defaultUser() { return defaultUser; }

  public DatabaseQuery query(String entityType, QueryRequest request) {
    return new DatabaseQuery(this, entityType, request);
  }

  /** Renders without running. Empty when the table is missing and {@code ignoreDdl} is set. */
  public Optional<SqlStatement> build(String entityType, QueryRequest request) {
    return query(entityType, request).build();
  }

  /** Rows keyed by column label; adds {@code _comment_count} when requested. */
  public List<Map<String, Object>> execute(String entityType, QueryRequest request) {
    Optional<SqlStatement> st = build(entityType, request);
    if (st.isEmpty()) return List.of();
    List<Map<String, Object>> rows = runner.queryForMaps(st.get());
    return request.withCommentCount() ? addCommentCount(rows) : rows;
  }

  public List<List<Object>> executeAsList(String entityType, QueryRequest request) {
    Optional<SqlStatement> st = build(entityType, request);
    if (st.isEmpty()) return List.of();
    return runner.queryForLists(st.get());
  }

  /** Values of the {@code pluck} column, one per row. */
  public List<Object> pluck(String entityType, QueryRequest request) {
    String column = request.pluck();
    if (column == null || column.isBlank()) {
      throw new QueryValidationException("pluck column is required");
    }
    List<Object> out = new ArrayList<>();
    for (Map<String, Object> row : execute(entityType, request)) out.add(row.get(column));
    return out;
  }

  static List<Map<String, Object>> addCommentCount(List<Map<String, Object>> rows) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      Object name = row.get("name");
      if (name == null || name.toString().isEmpty()) {
        out.add(row);
        continue;
      }
      Map<String, Object> r = new LinkedHashMap<>(row);
      r.put(COMMENT_COUNT, commentCount(row.get("_comments")));
      out.add(r);
    }
    return out;
  }

  private static int commentCount(Object comments) {
    if (comments == null || comments.toString().isBlank()) return 0;
    try {
      JsonNode node = JSON.readTree(comments.toString());
      return node.isArray() ? node.size() : 0;
    } catch (JsonProcessingException e) {
      throw new QueryValidationException("Malformed _comments value", e);
    }
  }
}
