package io.intellixity.vellum.sql.postgres;

import io.intellixity.vellum.query.QueryValidationException;
import io.intellixity.vellum.sql.dialect.AbstractSqlDialect;
import org.postgresql.core.Utils;

import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Postgres dialect for the query assembler.
 *
 * Keeps only Postgres-specific overrides: double-quoted identifiers, standard-conforming literal
 * escaping, case-insensitive LIKE, the id cast pass and the grouped ORDER BY projection rule.\n
 * Generic select rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  private static final Pattern LOCATE =
      Pattern.compile("locate\\(([^,]+),\\s*([`\"]?name[`\"]?)\\s*\\)", Pattern.CASE_INSENSITIVE);
  private static final Pattern FUNC_IFNULL =
      Pattern.compile("(strpos|ifnull|coalesce)\\(\\s*([`\"]?name[`\"]?)\\s*,", Pattern.CASE_INSENSITIVE);
  private static final Pattern CAST_VARCHAR =
      Pattern.compile("([`\"]?tab[\\w`\" -]+\\.[`\"]?name[`\"]?)(?!\\w)", Pattern.CASE_INSENSITIVE);

  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String escapeLiteralBody(String value) {
    try {
      return Utils.escapeLiteral(null, value, true).toString();
    } catch (SQLException e) {
      throw new QueryValidationException("Value cannot be used as a SQL literal", e);
    }
  }

  @Override
  public String likeOperator(boolean negated) {
    return negated ? "not ilike" : "ilike";
  }

  /** Ids are compared as text; never casts an expression that already carries a cast. */
  @Override
  public String castName(String clause) {
    if (clause == null) return null;
    String lower = clause.toLowerCase(Locale.ROOT);
    if (lower.contains("cast(") || clause.contains("::")) return clause;

    Matcher locate = LOCATE.matcher(clause);
    if (locate.find()) {
      return locate.replaceAll("locate($1, cast($2 as varchar))");
    }
    Matcher func = FUNC_IFNULL.matcher(clause);
    if (func.find()) {
      return func.replaceAll("$1(cast($2 as varchar),");
    }
    return CAST_VARCHAR.matcher(clause).replaceAll("cast($1 as varchar)");
  }

  @Override
  public boolean requiresOrderColumnsInSelect() {
    return true;
  }
}
