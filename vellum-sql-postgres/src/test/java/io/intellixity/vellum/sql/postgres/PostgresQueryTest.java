package io.intellixity.vellum.sql.postgres;

import io.intellixity.vellum.hierarchy.HierarchyResolver;
import io.intellixity.vellum.hierarchy.NestedSetBounds;
import io.intellixity.vellum.meta.EntityMeta;
import io.intellixity.vellum.meta.FieldDef;
import io.intellixity.vellum.meta.FieldType;
import io.intellixity.vellum.meta.MetadataProvider;
import io.intellixity.vellum.permission.PermissionEvaluator;
import io.intellixity.vellum.permission.PermissionQueryHooks;
import io.intellixity.vellum.permission.PermissionType;
import io.intellixity.vellum.permission.RolePermissions;
import io.intellixity.vellum.permission.UserPermission;
import io.intellixity.vellum.query.Filter;
import io.intellixity.vellum.query.Operator;
import io.intellixity.vellum.query.QueryRequest;
import io.intellixity.vellum.sql.QueryEngine;
import io.intellixity.vellum.sql.SqlStatement;
import io.intellixity.vellum.sql.StatementRunner;
import io.intellixity.vellum.temporal.DateRanges;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresQueryTest {

  private final MetadataProvider metadata = new MetadataProvider() {
    @Override public EntityMeta meta(String entityType) {
      return EntityMeta.of(entityType, List.of(FieldDef.of("subject", FieldType.DATA), FieldDef.of("status", FieldType.DATA)));
    }
    @Override public Set<String> tableColumns(String entityType) { return Set.of("name", "subject", "status"); }
  };

  private final PermissionEvaluator permissions = new PermissionEvaluator() {
    @Override public RolePermissions rolePermissions(String entityType, String user) { return RolePermissions.of(PermissionType.READ); }
    @Override public boolean hasPermission(String entityType, PermissionType type, String user, String parentEntity) { return true; }
    @Override public boolean onlyHasSelect(String entityType, String user) { return false; }
    @Override public Map<String, List<UserPermission>> userPermissions(String user) { return Map.of(); }
    @Override public List<String> sharedWith(String entityType, String user) { return List.of(); }
  };

  private final HierarchyResolver hierarchy = new HierarchyResolver() {
    @Override public Optional<NestedSetBounds> bounds(String entityType, String id) { return Optional.empty(); }
    @Override public List<String> descendants(String entityType, NestedSetBounds anchor) { return List.of(); }
    @Override public List<String> ancestors(String entityType, NestedSetBounds anchor) { return List.of(); }
  };

  private final StatementRunner runner = new StatementRunner() {
    @Override public List<Map<String, Object>> queryForMaps(SqlStatement statement) { throw new UnsupportedOperationException(); }
    @Override public List<List<Object>> queryForLists(SqlStatement statement) { throw new UnsupportedOperationException(); }
  };

  private final QueryEngine engine = new QueryEngine(new PostgresDialect(), metadata, permissions, hierarchy,
      PermissionQueryHooks.empty(), new DateRanges(Clock.fixed(Instant.parse("2024-05-15T10:00:00Z"), ZoneOffset.UTC)),
      runner, "jane@example.com");

  private String sql(QueryRequest request) {
    return engine.build("Task", request).orElseThrow().sql();
  }

  @Test
  void defaultProjection_castsIdColumn() {
    assertEquals("select cast(\"tabTask\".\"name\" as varchar) from \"tabTask\" order by \"tabTask\".\"modified\" desc",
        sql(QueryRequest.create()));
  }

  @Test
  void idAndLikeFilters() {
    QueryRequest request = QueryRequest.create()
        .withFields("subject")
        .withFilter(Filter.eq("name", "T-1"))
        .withFilter(Filter.of("subject", Operator.LIKE, "%docs%"))
        .withoutOrdering();

    assertEquals("select \"subject\" from \"tabTask\""
            + " where cast(\"tabTask\".\"name\" as varchar) = 'T-1' and \"tabTask\".\"subject\" ilike '%docs%'",
        sql(request));
  }

  @Test
  void groupedQuery_projectsOrderColumnAsMax() {
    QueryRequest request = QueryRequest.create()
        .withFields("status", "count(*) as total")
        .withGroupBy("\"tabTask\".\"status\"");

    assertEquals("select \"status\", count(*) as total, MAX(modified) as \"tabTask.modified\""
            + " from \"tabTask\" group by \"tabTask\".\"status\" order by \"tabTask.modified\" desc",
        sql(request));
  }

  @Test
  void groupedQuery_orderBySelectedColumn_isLeftAlone() {
    QueryRequest request = QueryRequest.create()
        .withFields("status", "count(*) as total")
        .withGroupBy("status")
        .withOrderBy("status asc");

    assertEquals("select \"status\", count(*) as total from \"tabTask\" group by status order by status asc",
        sql(request));
  }
}
