package io.intellixity.vellum.sql;

import io.intellixity.vellum.meta.EntityMeta;
import io.intellixity.vellum.meta.FieldDef;
import io.intellixity.vellum.meta.FieldType;
import io.intellixity.vellum.query.QueryValidationException;
import io.intellixity.vellum.sql.dialect.MariaDbDialect;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class FieldResolverTest {
  private final TestCatalog catalog = new TestCatalog()
      .entity(new EntityMeta("Task", List.of(
          FieldDef.link("project", "Project"),
          FieldDef.of("subject", FieldType.DATA)), false, false, null, null), "name")
      .entity(EntityMeta.of("Project", List.of()), "name")
      .entity(new EntityMeta("Task Item", List.of(), true, false, null, null), "name");

  private FieldResolver resolver() {
    return new FieldResolver(new MariaDbDialect(), catalog, catalog, "Task", "jane@example.com", false);
  }

  @Test
  void linkFields_areDeduplicatedJoins() {
    FieldResolver r = resolver();
    List<String> fields = r.resolveLinkFields(List.of("project.title", "project.status as project_status"));

    assertEquals(List.of("`tabProject`.`title`", "`tabProject`.`status` as project_status"), fields);
    assertEquals(List.of(new FieldResolver.LinkJoin("Project", "project")), r.linkJoins());
    assertEquals(Set.of("tabTask", "tabProject"), r.joinedTableNames());
  }

  @Test
  void unknownLinkField_isRejected() {
    assertThrows(QueryValidationException.class, () -> resolver().resolveLinkFields(List.of("owner_doc.title")));
  }

  @Test
  void aggregatesOverJoinedTables_doNotAddTables() {
    FieldResolver r = resolver();
    r.extractTables(List.of("count(`tabTask Item`.`name`)", "`tabTask Item`.`qty`"));
    assertEquals(List.of("Task", "Task Item"), r.tables());
  }

  @Test
  void groupConcatPrefix_isStripped() {
    FieldResolver r = resolver();
    r.extractTables(List.of("group_concat(`tabTask Item`.`qty`) as qtys"));
    assertEquals(List.of("Task Item"), r.childTables());
  }

  @Test
  void qualify_onlyWhenAmbiguous() {
    FieldResolver r = resolver();
    assertEquals(List.of("subject", "count(name)"), r.qualify(List.of("subject", "count(name)")));

    r.addTable("Task Item");
    assertEquals(List.of("`tabTask`.`subject`", "count(name)", "`tabTask`.subject as s", "`tabTask Item`.`qty`"),
        r.qualify(List.of("subject", "count(name)", "subject as s", "`tabTask Item`.`qty`")));
  }

  @Test
  void wrap_quotesPlainIdentifiersOnly() {
    assertEquals(List.of("`order`", "`desc` as d", "`tabTask`.`name`", "*", "sum(qty)", "distinct status", "`tabTask`.*"),
        resolver().wrap(List.of("order", "desc as d", "tabTask.name", "*", "sum(qty)", "distinct status", "tabTask.*")));
  }
}
