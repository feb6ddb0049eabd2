package io.intellixity.vellum.sql;

import io.intellixity.vellum.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class FieldSanitizerTest {

  @Test
  void acceptsOrdinaryProjections() {
    assertDoesNotThrow(() -> FieldSanitizer.validateFields(List.of(
        "subject",
        "*",
        "`tabTask`.`name`",
        "count(subject) as total",
        "sum(`tabTask`.`amount`)",
        "subject as title"), true));
  }

  @Test
  void rejectsBannedFunctionsNextToSeparators() {
    for (String field : List.of(
        "`tabTask`.`name`, version()",
        "name, database()",
        "concat(name, owner)",
        "ifnull(name, '')",
        "user()")) {
      QueryValidationException e = assertThrows(QueryValidationException.class,
          () -> FieldSanitizer.validateField(field, false), field);
      assertEquals("Use of sub-query or function is restricted", e.getMessage());
    }
  }

  @Test
  void rejectsSubQueriesAndStatements() {
    for (String field : List.of(
        "(select name from tabUser)",
        "name, (delete from tabTask)",
        "select name",
        "name from tabUser",
        "@@version",
        "name'",
        "name,")) {
      assertThrows(QueryValidationException.class, () -> FieldSanitizer.validateField(field, false), field);
    }
  }

  @Test
  void strictMode_rejectsCommentsAndUnion() {
    QueryValidationException comment = assertThrows(QueryValidationException.class,
        () -> FieldSanitizer.validateField("name /* x */", true));
    assertEquals("Illegal SQL Query", comment.getMessage());
    assertThrows(QueryValidationException.class, () -> FieldSanitizer.validateField("name union all x ", true));
    assertDoesNotThrow(() -> FieldSanitizer.validateField("name /* x */", false));
  }

  @Test
  void strictMode_probeRejectsWhatTheRegexesMiss() {
    assertThrows(QueryValidationException.class, () -> FieldSanitizer.validateField("`name` where 1=1", true));
    assertThrows(QueryValidationException.class, () -> FieldSanitizer.validateField("`a`; drop table x", true));
    assertThrows(QueryValidationException.class, () -> FieldSanitizer.validateField("`name` limit 1", true));
  }

  @Test
  void orderBy_allowsQualifiedColumnsOfJoinedTables() {
    Set<String> joined = Set.of("tabTask", "tabProject");
    assertDoesNotThrow(() -> FieldSanitizer.validateOrderOrGroup("`tabTask`.`modified` desc, `tabProject`.name asc", joined));
    assertDoesNotThrow(() -> FieldSanitizer.validateOrderOrGroup("modified desc", joined));
  }

  @Test
  void orderBy_rejectsSubQueryIllegalCharsAndForeignTables() {
    Set<String> joined = Set.of("tabTask");
    assertEquals("Cannot use sub-query in order by",
        assertThrows(QueryValidationException.class,
            () -> FieldSanitizer.validateOrderOrGroup("(select 1 from tabUser)", joined)).getMessage());
    assertEquals("Illegal SQL Query",
        assertThrows(QueryValidationException.class,
            () -> FieldSanitizer.validateOrderOrGroup("modified; drop table tabTask", joined)).getMessage());
    assertEquals("Please select atleast 1 column from User to sort/group",
        assertThrows(QueryValidationException.class,
            () -> FieldSanitizer.validateOrderOrGroup("`tabUser`.`name` desc", joined)).getMessage());
  }
}
