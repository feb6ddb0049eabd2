package io.intellixity.vellum.sql;

import io.intellixity.vellum.meta.EntityMeta;
import io.intellixity.vellum.meta.FieldDef;
import io.intellixity.vellum.meta.FieldType;
import io.intellixity.vellum.meta.MissingTableException;
import io.intellixity.vellum.permission.PermissionDeniedException;
import io.intellixity.vellum.permission.PermissionQueryHooks;
import io.intellixity.vellum.permission.PermissionType;
import io.intellixity.vellum.permission.RolePermissions;
import io.intellixity.vellum.query.Filter;
import io.intellixity.vellum.query.Filters;
import io.intellixity.vellum.query.Operator;
import io.intellixity.vellum.query.QueryRequest;
import io.intellixity.vellum.query.QueryValidationException;
import io.intellixity.vellum.query.RawPredicate;
import io.intellixity.vellum.sql.dialect.MariaDbDialect;
import io.intellixity.vellum.temporal.DateRanges;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

final class DatabaseQueryTest {
  private static final String TASK_TABLES = "`tabTask`";

  private final TestCatalog catalog = new TestCatalog()
      .entity(new EntityMeta("Task", List.of(
          FieldDef.of("subject", FieldType.DATA),
          FieldDef.of("status", FieldType.DATA),
          FieldDef.link("project", "Project"),
          new FieldDef("items", FieldType.TABLE, "Task Item", false)), false, false, null, null),
          "name", "subject", "status", "project", "modified")
      .entity(new EntityMeta("Task Item", List.of(FieldDef.of("qty", FieldType.FLOAT)), true, false, null, null),
          "name", "qty", "parent", "parenttype")
      .entity(new EntityMeta("Project", List.of(FieldDef.of("title", FieldType.DATA)), false, false, null, null),
          "name", "title")
      .entity(new EntityMeta("Invoice", List.of(), false, true, "idx desc, modified desc", null), "name");

  private final StatementRunner runner = mock(StatementRunner.class);

  private QueryEngine engine(PermissionQueryHooks hooks) {
    DateRanges ranges = new DateRanges(Clock.fixed(Instant.parse("2024-05-15T10:00:00Z"), ZoneOffset.UTC));
    return new QueryEngine(new MariaDbDialect(), catalog, catalog, catalog, hooks, ranges, runner, "jane@example.com");
  }

  private String sql(String entity, QueryRequest request) {
    return engine(PermissionQueryHooks.empty()).build(entity, request).orElseThrow().sql();
  }

  @Test
  void defaultQuery_selectsIdOrderedByModified() {
    assertEquals("select `tabTask`.`name` from `tabTask` order by `tabTask`.`modified` desc",
        sql("Task", QueryRequest.create()));
  }

  @Test
  void filtersAreAndedAndOrFiltersGrouped() {
    QueryRequest request = QueryRequest.create()
        .withFields("subject", "status")
        .withFilter(Filter.eq("status", "Open"))
        .withOrFilters(List.of(Filter.eq("project", "P-1"), Filter.eq("project", "P-2")))
        .withLimit(0, 20);

    assertEquals("select `subject`, `status` from " + TASK_TABLES
            + " where `tabTask`.`status` = 'Open' and (`tabTask`.`project` = 'P-1' or `tabTask`.`project` = 'P-2')"
            + " order by `tabTask`.`modified` desc limit 20 offset 0",
        sql("Task", request));
  }

  @Test
  void rawPredicatesPassThrough() {
    QueryRequest request = QueryRequest.create().withFilter(new RawPredicate("`tabTask`.`status` is not null"));
    assertEquals("select `tabTask`.`name` from `tabTask` where `tabTask`.`status` is not null"
            + " order by `tabTask`.`modified` desc",
        sql("Task", request));
  }

  @Test
  void distinct_dropsOrdering() {
    assertEquals("select distinct `subject` from `tabTask`",
        sql("Task", QueryRequest.create().withFields("subject").withDistinct(true)));
  }

  @Test
  void blankOrderBy_meansNoOrdering() {
    assertEquals("select `subject` from `tabTask`",
        sql("Task", QueryRequest.create().withFields("subject").withoutOrdering()));
  }

  @Test
  void linkAndChildFields_addJoins() {
    QueryRequest request = QueryRequest.create()
        .withFields("subject", "project.title as project_title", "`tabTask Item`.`qty`");

    assertEquals("select `tabTask`.`subject`, `tabProject`.`title` as project_title, `tabTask Item`.`qty`"
            + " from `tabTask`"
            + " left join `tabTask Item` on (`tabTask Item`.`parenttype` = 'Task' and `tabTask Item`.`parent` = `tabTask`.`name`)"
            + " left join `tabProject` on (`tabProject`.`name` = `tabTask`.`project`)"
            + " order by `tabTask`.`modified` desc",
        sql("Task", request));
  }

  @Test
  void childTableField_viaTableFieldReference() {
    QueryRequest request = QueryRequest.create()
        .withFields("items.qty")
        .withJoin("inner join")
        .withChildNames(true)
        .withoutOrdering();

    assertEquals("select `tabTask Item`.`qty`, `tabTask Item`.`name` as `Task Item:name`"
            + " from `tabTask`"
            + " inner join `tabTask Item` on (`tabTask Item`.`parenttype` = 'Task' and `tabTask Item`.`parent` = `tabTask`.`name`)",
        sql("Task", request));
  }

  @Test
  void filterOnChildEntity_joinsChildTable() {
    QueryRequest request = QueryRequest.create()
        .withFilter(Filter.of("Task Item", "qty", Operator.GT, 2))
        .withoutOrdering();

    assertEquals("select `tabTask`.`name` from `tabTask`"
            + " left join `tabTask Item` on (`tabTask Item`.`parenttype` = 'Task' and `tabTask Item`.`parent` = `tabTask`.`name`)"
            + " where `tabTask Item`.`qty` > 2",
        sql("Task", request));
  }

  @Test
  void linkPathFilter_joinsLinkedEntity() {
    String expected = "select `tabTask`.`name` from `tabTask`"
        + " left join `tabProject` on (`tabProject`.`name` = `tabTask`.`project`)"
        + " where `tabProject`.`title` = 'Apollo'";

    QueryRequest listShape = QueryRequest.create()
        .withFilters(Filters.parse("Task", List.of(List.of("project.title", "=", "Apollo"))))
        .withoutOrdering();
    QueryRequest mapShape = QueryRequest.create()
        .withFilters(Filters.parse("Task", Map.of("project.title", "Apollo")))
        .withoutOrdering();

    assertEquals(expected, sql("Task", listShape));
    assertEquals(expected, sql("Task", mapShape));
  }

  @Test
  void linkPathFilter_andLinkField_shareOneJoin() {
    QueryRequest request = QueryRequest.create()
        .withFields("subject", "project.title")
        .withFilter(Filter.eq("project.title", "Apollo"))
        .withoutOrdering();

    String sql = sql("Task", request);
    assertEquals(sql.indexOf("left join `tabProject`"), sql.lastIndexOf("left join `tabProject`"));
    assertTrue(sql.endsWith(" where `tabProject`.`title` = 'Apollo'"), sql);
  }

  @Test
  void linkPathFilter_onUnknownLinkField_isRejected() {
    QueryRequest request = QueryRequest.create().withFilter(Filter.eq("status.title", "x"));
    assertThrows(QueryValidationException.class, () -> sql("Task", request));
  }

  @Test
  void optionalColumnsMissingFromTable_areDropped() {
    QueryRequest request = QueryRequest.create()
        .withStrict(false)
        .withFields("subject", "_comments", "_liked_by as likes")
        .withFilter(Filter.of("_assign", Operator.LIKE, "%jane%"))
        .withoutOrdering();

    assertEquals("select `subject` from `tabTask`", sql("Task", request));
  }

  @Test
  void aggregateWithoutGroupBy_skipsDefaultOrdering() {
    assertEquals("select count(*) as total from `tabTask`",
        sql("Task", QueryRequest.create().withFields("count(*) as total")));
  }

  @Test
  void submittableEntity_sortsDraftsFirstThenConfiguredFields() {
    assertEquals("select `tabInvoice`.`name` from `tabInvoice`"
            + " order by `tabInvoice`.`docstatus` asc, `tabInvoice`.`idx` desc, `tabInvoice`.`modified` desc",
        sql("Invoice", QueryRequest.create()));
  }

  @Test
  void groupBy_isRendered() {
    assertEquals("select `status`, count(*) as total from `tabTask` group by `tabTask`.`status`"
            + " order by `tabTask`.`modified` desc",
        sql("Task", QueryRequest.create().withFields("status", "count(*) as total").withGroupBy("`tabTask`.`status`")));
  }

  @Test
  void orderByForeignTable_isRejected() {
    QueryRequest request = QueryRequest.create().withOrderBy("`tabUser`.`name` desc");
    QueryValidationException e = assertThrows(QueryValidationException.class, () -> sql("Task", request));
    assertEquals("Please select atleast 1 column from User to sort/group", e.getMessage());
  }

  @Test
  void bannedFunctionInField_isRejectedBeforeExecution() {
    QueryRequest request = QueryRequest.create().withFields("name, version()");
    assertThrows(QueryValidationException.class, () -> engine(PermissionQueryHooks.empty()).execute("Task", request));
    verifyNoInteractions(runner);
  }

  @Test
  void userWithoutReadOrShares_isDeniedBeforeAnySql() {
    catalog.role("Task", RolePermissions.none());
    PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
        () -> engine(PermissionQueryHooks.empty()).execute("Task", QueryRequest.create()));
    assertEquals("Insufficient Permission for Task", e.getMessage());
    verifyNoInteractions(runner);
  }

  @Test
  void linkedEntityWithoutPermission_isDenied() {
    catalog.role("Project", RolePermissions.none());
    QueryRequest request = QueryRequest.create().withFields("project.title");
    PermissionDeniedException e = assertThrows(PermissionDeniedException.class, () -> sql("Task", request));
    assertEquals("Project", e.entityType());
  }

  @Test
  void ignorePermissions_skipsChecksAndClauses() {
    catalog.role("Task", RolePermissions.none());
    assertEquals("select `tabTask`.`name` from `tabTask` order by `tabTask`.`modified` desc",
        sql("Task", QueryRequest.create().withIgnorePermissions(true)));
  }

  @Test
  void ownerRestrictedUser_getsOwnerAndHookClauses() {
    catalog.role("Task", RolePermissions.ownerOnly(PermissionType.READ));
    PermissionQueryHooks hooks = PermissionQueryHooks.builder()
        .register("Task", user -> "`tabTask`.`status` != 'Cancelled'")
        .build();

    String sql = engine(hooks).build("Task", QueryRequest.create().withUser("bob@example.com")).orElseThrow().sql();
    assertTrue(sql.contains("where (((`tabTask`.`owner` = 'bob@example.com')) and `tabTask`.`status` != 'Cancelled')"), sql);
  }

  @Test
  void missingTable_isEmptyOnlyWhenIgnoringDdl() {
    QueryEngine engine = engine(PermissionQueryHooks.empty());
    QueryRequest ignoring = QueryRequest.create().withIgnorePermissions(true).withIgnoreDdl(true);
    assertTrue(engine.build("Ghost", ignoring).isEmpty());
    assertEquals(List.of(), engine.execute("Ghost", ignoring));
    verifyNoInteractions(runner);

    assertThrows(MissingTableException.class,
        () -> engine.build("Ghost", QueryRequest.create().withIgnorePermissions(true)));
  }

  @Test
  void execute_addsCommentCount() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("name", "T-1");
    row.put("_comments", "[{\"comment\":\"a\"},{\"comment\":\"b\"}]");
    Map<String, Object> noComments = new LinkedHashMap<>();
    noComments.put("name", "T-2");
    when(runner.queryForMaps(any())).thenReturn(List.of(row, noComments));

    List<Map<String, Object>> rows = engine(PermissionQueryHooks.empty())
        .execute("Task", QueryRequest.create().withCommentCount(true));

    assertEquals(2, rows.get(0).get(QueryEngine.COMMENT_COUNT));
    assertEquals(0, rows.get(1).get(QueryEngine.COMMENT_COUNT));
  }

  @Test
  void pluck_returnsOneColumn() {
    when(runner.queryForMaps(any())).thenReturn(List.of(Map.of("subject", "A"), Map.of("subject", "B")));

    List<Object> values = engine(PermissionQueryHooks.empty()).pluck("Task", QueryRequest.create().withPluck("subject"));

    assertEquals(List.of("A", "B"), values);
    ArgumentCaptor<SqlStatement> captor = ArgumentCaptor.forClass(SqlStatement.class);
    verify(runner).queryForMaps(captor.capture());
    assertEquals("select `tabTask`.`subject` from `tabTask` order by `tabTask`.`modified` desc", captor.getValue().sql());
    assertEquals("Task", captor.getValue().entityType());
  }
}
