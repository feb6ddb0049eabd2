package io.intellixity.vellum.sql.postgres;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  @Test
  void quotesIdentifiersWithDoubleQuotes() {
    assertEquals("\"tabSales Order\".\"name\"", d.column("Sales Order", "name"));
    assertEquals("\"a\"\"b\"", d.quoteIdent("a\"b"));
  }

  @Test
  void escapesLiteralsStandardConforming() {
    assertEquals("'it''s'", d.literal("it's"));
    assertEquals("'a\\b'", d.literal("a\\b"));
  }

  @Test
  void likeIsCaseInsensitive() {
    assertEquals("ilike", d.likeOperator(false));
    assertEquals("not ilike", d.likeOperator(true));
    assertEquals("coalesce(x, 0)", d.ifNull("x", "0"));
    assertTrue(d.requiresOrderColumnsInSelect());
  }

  @Test
  void castName_qualifiedIdColumn() {
    assertEquals("ifnull(cast(`tabBlog Post`.`name` as varchar), '')=''",
        d.castName("ifnull(`tabBlog Post`.`name`, '')=''"));
    assertEquals("cast(\"tabTask\".\"name\" as varchar) in ('T-1')",
        d.castName("\"tabTask\".\"name\" in ('T-1')"));
  }

  @Test
  void castName_locateAndFirstArgumentShapes() {
    assertEquals("locate('x', cast(name as varchar))", d.castName("locate('x', name)"));
    assertEquals("strpos(cast(\"name\" as varchar), 'x')", d.castName("strpos(\"name\", 'x')"));
    assertEquals("coalesce(cast(name as varchar), '')", d.castName("coalesce(name, '')"));
  }

  @Test
  void castName_leavesOtherColumnsAndExistingCastsAlone() {
    assertEquals("\"tabTask\".\"name_prefix\"", d.castName("\"tabTask\".\"name_prefix\""));
    assertEquals("\"tabTask\".\"subject\"", d.castName("\"tabTask\".\"subject\""));
    assertEquals("cast(\"tabTask\".\"name\" as text)", d.castName("cast(\"tabTask\".\"name\" as text)"));
    assertEquals("\"tabTask\".\"name\"::text", d.castName("\"tabTask\".\"name\"::text"));
  }
}
