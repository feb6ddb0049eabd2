package io.intellixity.vellum.sql.dialect;

/**
 * MariaDB / MySQL dialect: backtick identifiers, backslash escapes, {@code ifnull}.
 */
public final class MariaDbDialect extends AbstractSqlDialect {
  @Override public String id() { return "mariadb"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  public String ifNull(String expr, String fallback) {
    return "ifnull(" + expr + ", " + fallback + ")";
  }

  @Override
  protected String escapeLiteralBody(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\0' -> sb.append("\\0");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\\' -> sb.append("\\\\");
        case '\'' -> sb.append("\\'");
        case '"' -> sb.append("\\\"");
        case '\u001a' -> sb.append("\\Z");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }
}
