package io.intellixity.vellum.query;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Closed set of filter operators accepted by the query compiler.\n
 *
 * Tokens are the lowercase SQL-ish spellings callers send; anything else is rejected
 * before a statement is rendered.
 */
public enum Operator {
  EQ("="),
  NE("!="),
  GT(">"),
  LT("<"),
  GE(">="),
  LE("<="),
  LIKE("like"),
  NOT_LIKE("not like"),
  IN("in"),
  NOT_IN("not in"),
  BETWEEN("between"),
  IS("is"),

  // Nested-set hierarchy operators, compiled to IN / NOT IN over resolved ids.
  ANCESTORS_OF("ancestors of"),
  DESCENDANTS_OF("descendants of"),
  NOT_ANCESTORS_OF("not ancestors of"),
  NOT_DESCENDANTS_OF("not descendants of"),

  // Relative date windows, compiled to BETWEEN.
  PREVIOUS("previous"),
  NEXT("next"),
  TIMESPAN("timespan");

  private final String token;

  Operator(String token) {
    this.token = token;
  }

  public String token() { return token; }

  public boolean isHierarchy() {
    return this == ANCESTORS_OF || this == DESCENDANTS_OF || this == NOT_ANCESTORS_OF || this == NOT_DESCENDANTS_OF;
  }

  public boolean isRelativeDate() {
    return this == PREVIOUS || this == NEXT || this == TIMESPAN;
  }

  public boolean isSetMembership() {
    return this == IN || this == NOT_IN;
  }

  public boolean isLike() {
    return this == LIKE || this == NOT_LIKE;
  }

  /** True for the hierarchy operators that exclude the resolved set. */
  public boolean isNegatedHierarchy() {
    return this == NOT_ANCESTORS_OF || this == NOT_DESCENDANTS_OF;
  }

  /**
   * Resolve a caller-supplied token (case and inner whitespace insensitive).
   *
   * @throws QueryValidationException when the token is not one of the supported operators
   */
  public static Operator fromToken(String token) {
    if (token == null || token.isBlank()) {
      throw new QueryValidationException("Operator must not be empty");
    }
    String normalized = token.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    if ("==".equals(normalized)) return EQ;
    if ("<>".equals(normalized)) return NE;
    for (Operator op : values()) {
      if (op.token.equals(normalized)) return op;
    }
    throw new QueryValidationException("Operator must be one of " + supportedTokens() + ", got '" + token + "'");
  }

  public static String supportedTokens() {
    return Arrays.stream(values()).map(Operator::token).collect(Collectors.joining(", "));
  }
}
