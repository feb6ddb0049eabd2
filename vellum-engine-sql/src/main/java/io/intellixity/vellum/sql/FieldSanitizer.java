package io.intellixity.vellum.sql;

import io.intellixity.vellum.query.QueryValidationException;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.util.TablesNamesFinder;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Denylist / allowlist validation of caller supplied projection, ORDER BY and GROUP BY text.\n
 *
 * Validation only: expressions are never rewritten. Every check fails with
 * {@link QueryValidationException} before any SQL is assembled.
 */
public final class FieldSanitizer {
  static final String PROBE_TABLE = "vellum_probe";

  private static final Pattern SUB_QUERY = Pattern.compile("^.*[,();@].*", Pattern.DOTALL);
  private static final Pattern IS_QUERY = Pattern.compile("^(select|delete|update|drop|create)\\s", Pattern.CASE_INSENSITIVE);
  private static final Pattern IS_QUERY_PREDICATE =
      Pattern.compile("\\s*[0-9a-zA-Z]*\\s*( from | group by | order by | where | join )");
  private static final Pattern FIELD_QUOTE = Pattern.compile("[0-9a-zA-Z]+\\s*'");
  private static final Pattern FIELD_COMMA = Pattern.compile("[0-9a-zA-Z]+\\s*,");
  private static final Pattern STRICT_COMMENT = Pattern.compile(".*/\\*.*", Pattern.DOTALL);
  private static final Pattern STRICT_UNION = Pattern.compile(".*\\s(union).*\\s", Pattern.DOTALL);
  private static final Pattern ORDER_GROUP = Pattern.compile(".*[^a-z0-9\\-_ ,`'\".()].*", Pattern.DOTALL);

  private static final List<String> BANNED_KEYWORDS =
      List.of("select", "create", "insert", "delete", "drop", "update", "case", "show");
  private static final List<String> BANNED_FUNCTIONS = List.of(
      "concat", "concat_ws", "if", "ifnull", "nullif", "coalesce", "connection_id", "current_user",
      "database", "last_insert_id", "session_user", "system_user", "user", "version", "global");

  private static final String RESTRICTED = "Use of sub-query or function is restricted";
  private static final String ILLEGAL = "Illegal SQL Query";

  private FieldSanitizer() {}

  public static void validateFields(List<String> fields, boolean strict) {
    for (String field : fields) validateField(field, strict);
  }

  public static void validateField(String field, boolean strict) {
    if (field == null || field.isBlank()) return;
    String lower = field.toLowerCase(Locale.ROOT);

    if (SUB_QUERY.matcher(field).lookingAt()) {
      for (String kw : BANNED_KEYWORDS) {
        if (lower.contains("(" + kw)) throw new QueryValidationException(RESTRICTED);
      }
      for (String fn : BANNED_FUNCTIONS) {
        if (lower.contains(fn + "(")) throw new QueryValidationException(RESTRICTED);
      }
      // Session / global variable access.
      if (lower.contains("@")) throw new QueryValidationException(RESTRICTED);
    }

    if (FIELD_QUOTE.matcher(field).lookingAt() || FIELD_COMMA.matcher(field).lookingAt()) {
      throw new QueryValidationException(RESTRICTED);
    }
    if (IS_QUERY.matcher(field).lookingAt() || IS_QUERY_PREDICATE.matcher(field).lookingAt()) {
      throw new QueryValidationException(RESTRICTED);
    }

    if (strict) {
      if (STRICT_COMMENT.matcher(field).lookingAt() || STRICT_UNION.matcher(lower).lookingAt()) {
        throw new QueryValidationException(ILLEGAL);
      }
      probe(field);
    }
  }

  /**
   * Parses {@code SELECT <field> FROM probe} and accepts only a single plain projection over the
   * probe table: no extra tables, filters, joins, grouping, ordering or limits.
   */
  static void probe(String field) {
    if (field.indexOf(';') >= 0) {
      throw new QueryValidationException(ILLEGAL);
    }
    Statement st;
    try {
      st = CCJSqlParserUtil.parse("SELECT " + field + " FROM " + PROBE_TABLE);
    } catch (JSQLParserException e) {
      throw new QueryValidationException(ILLEGAL + ": cannot parse field '" + field + "'", e);
    }
    if (!(st instanceof PlainSelect ps)) {
      throw new QueryValidationException(ILLEGAL);
    }
    boolean single = ps.getSelectItems() != null && ps.getSelectItems().size() == 1;
    boolean bare = ps.getWhere() == null
        && (ps.getJoins() == null || ps.getJoins().isEmpty())
        && ps.getGroupBy() == null
        && (ps.getOrderByElements() == null || ps.getOrderByElements().isEmpty())
        && ps.getLimit() == null
        && ps.getOffset() == null
        && ps.getHaving() == null;
    if (!single || !bare) {
      throw new QueryValidationException(ILLEGAL);
    }
    Set<String> tables = new TablesNamesFinder().getTables(st);
    if (tables.size() != 1 || !PROBE_TABLE.equalsIgnoreCase(tables.iterator().next())) {
      throw new QueryValidationException(RESTRICTED);
    }
  }

  /**
   * Validates an ORDER BY or GROUP BY expression.
   *
   * @param joinedTables unquoted names ({@code tabX}) of every table in the FROM clause
   */
  public static void validateOrderOrGroup(String expression, Set<String> joinedTables) {
    if (expression == null || expression.isBlank()) return;
    String lower = expression.toLowerCase(Locale.ROOT);
    if (lower.contains("select") && lower.contains("from")) {
      throw new QueryValidationException("Cannot use sub-query in order by");
    }
    if (ORDER_GROUP.matcher(lower).lookingAt()) {
      throw new QueryValidationException(ILLEGAL);
    }
    for (String part : expression.split(",")) {
      String p = part.strip();
      if (!p.contains(".")) continue;
      String table = unquote(p.substring(0, p.indexOf('.')));
      if (table.startsWith("tab") && !joinedTables.contains(table)) {
        throw new QueryValidationException(
            "Please select atleast 1 column from " + table.substring(3) + " to sort/group");
      }
    }
  }

  static String unquote(String ident) {
    String s = ident.strip();
    if (s.length() >= 2) {
      char first = s.charAt(0);
      char last = s.charAt(s.length() - 1);
      if ((first == '`' || first == '"') && first == last) return s.substring(1, s.length() - 1);
    }
    return s;
  }
}
