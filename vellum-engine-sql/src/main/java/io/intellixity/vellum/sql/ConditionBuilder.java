package io.intellixity.vellum.sql;

import io.intellixity.vellum.hierarchy.HierarchyResolver;
import io.intellixity.vellum.meta.FieldDef;
import io.intellixity.vellum.meta.FieldType;
import io.intellixity.vellum.meta.MetadataProvider;
import io.intellixity.vellum.query.ColumnRef;
import io.intellixity.vellum.query.Filter;
import io.intellixity.vellum.query.Operator;
import io.intellixity.vellum.query.QueryValidationException;
import io.intellixity.vellum.sql.dialect.SqlDialect;
import io.intellixity.vellum.temporal.DateRange;
import io.intellixity.vellum.temporal.DateRanges;
import io.intellixity.vellum.temporal.TemporalValues;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles one {@link Filter} into a predicate fragment.\n
 *
 * Rules are applied in order, first match wins:\n
 * 1. hierarchy operators: resolved to IN / NOT IN over the nested-set ids\n
 * 2. IN / NOT IN: comma split strings, escaped list, empty list is {@code ('')}\n
 * 3. previous / next / timespan: resolved to a date range, then compiled as BETWEEN\n
 * 4. {@code >} / {@code <} on creation / modified: raw string comparison\n
 * 5. BETWEEN on temporal or audit columns: half-open {@code [from, to + 1 day)}\n
 * 6. IS set / not set: {@code !=} / {@code =} against the empty string, always null-coalesced\n
 * 7. Date / Datetime / Time columns: canonical literal formatting\n
 * 8. LIKE, or string values on non-numeric columns: string literal\n
 * 9. equality on Link / Data columns or on the id column: string literal\n
 * 10. anything else: numeric literal, fallback 0\n
 * 11. {@link ColumnRef} values: column-to-column comparison, never coalesced\n
 *
 * Unless disabled, nullable columns are wrapped as {@code coalesce(column, fallback)} so that
 * empty-value comparisons also match physically null rows.
 */
public final class ConditionBuilder {
  private static final Set<String> AUDIT_COLUMNS = Set.of("creation", "modified");
  private static final Set<Operator> COLUMN_REF_OPERATORS = EnumSet.of(
      Operator.EQ, Operator.NE, Operator.GT, Operator.LT, Operator.GE, Operator.LE, Operator.LIKE, Operator.NOT_LIKE);
  private static final String EMPTY = "''";

  private final SqlDialect dialect;
  private final MetadataProvider metadata;
  private final HierarchyResolver hierarchy;
  private final DateRanges dateRanges;
  private final boolean ignoreIfNull;

  public ConditionBuilder(SqlDialect dialect,
                          MetadataProvider metadata,
                          HierarchyResolver hierarchy,
                          DateRanges dateRanges,
                          boolean ignoreIfNull) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
    this.dateRanges = Objects.requireNonNull(dateRanges, "dateRanges");
    this.ignoreIfNull = ignoreIfNull;
  }

  public String build(Filter filter) {
    String entity = Objects.requireNonNull(filter.entityType(), "filter.entityType");
    if (filter.isLinkPath()) {
      throw new QueryValidationException("Link path '" + filter.fieldName() + "' must be resolved to a join first");
    }
    String field = filter.fieldName();
    String column = dialect.castName(dialect.column(entity, field));
    FieldDef df = metadata.meta(entity).field(field);
    Operator op = filter.operator();
    Object value = filter.value();

    if (value instanceof ColumnRef ref) {
      if (!COLUMN_REF_OPERATORS.contains(op)) {
        throw new QueryValidationException("Operator '" + op.token() + "' cannot compare against a column");
      }
      return column + " " + operatorToken(op) + " " + dialect.column(entity, ref.column());
    }

    if (op.isHierarchy()) {
      List<String> ids = hierarchyIds(entity, df, op, value);
      Operator target = op.isNegatedHierarchy() ? Operator.NOT_IN : Operator.IN;
      return render(column, target, value, inList(ids), EMPTY, !ids.isEmpty());
    }

    if (op.isSetMembership()) {
      List<String> values = listValues(value);
      boolean canBeNull = !values.isEmpty()
          && (op == Operator.NOT_IN || values.stream().anyMatch(String::isEmpty));
      return render(column, op, value, inList(values), EMPTY, canBeNull);
    }

    boolean canBeNull = df == null || !df.type().nonNullable();

    if (op.isRelativeDate()) {
      DateRange range = dateRanges.resolve(op, value);
      return temporalBetween(column, df, List.of(range.from(), range.to()));
    }

    if ((op == Operator.GT || op == Operator.LT) && AUDIT_COLUMNS.contains(field)) {
      String raw = isTemporal(value) ? TemporalValues.formatDateTime(value) : value == null ? "" : str(value);
      return render(column, op, value, dialect.literal(raw), quoted(TemporalValues.FALLBACK_DATETIME), canBeNull);
    }

    if (op == Operator.BETWEEN) {
      if (AUDIT_COLUMNS.contains(field) || (df != null && (df.type() == FieldType.DATE || df.type() == FieldType.DATETIME))) {
        return temporalBetween(column, df, betweenBounds(value));
      }
      return plainBetween(column, df, betweenBounds(value), canBeNull);
    }

    if (op == Operator.IS) {
      Operator target = isOperator(value);
      String col = alreadyCoalesced(column) ? column : dialect.ifNull(column, EMPTY);
      return col + " " + operatorToken(target) + " " + EMPTY;
    }

    String literal;
    String fallback;
    if (df != null && df.type() == FieldType.DATE) {
      literal = quoted(TemporalValues.formatDate(value));
      fallback = quoted(TemporalValues.FALLBACK_DATE);
    } else if ((df != null && df.type() == FieldType.DATETIME) || isTemporal(value)) {
      literal = quoted(TemporalValues.formatDateTime(value));
      fallback = quoted(TemporalValues.FALLBACK_DATETIME);
    } else if (df != null && df.type() == FieldType.TIME) {
      literal = quoted(TemporalValues.formatTime(value));
      fallback = quoted(TemporalValues.FALLBACK_TIME);
    } else if (op.isLike() || (value instanceof String && (df == null || !df.type().numeric()))) {
      String s = value == null ? "" : str(value);
      // Backslash is the LIKE escape character; keep it literal.
      if (op.isLike()) s = s.replace("\\", "\\\\");
      literal = dialect.literal(s);
      fallback = EMPTY;
    } else if ((op == Operator.EQ && df != null && (df.type() == FieldType.LINK || df.type() == FieldType.DATA))
        || "name".equals(field)) {
      literal = dialect.literal(isPresent(value) ? str(value) : "");
      fallback = EMPTY;
    } else {
      literal = number(value);
      fallback = "0";
    }
    return render(column, op, value, literal, fallback, canBeNull);
  }

  private String render(String column, Operator op, Object value, String literal, String fallback, boolean canBeNull) {
    String col = coalesce(column, op, value, canBeNull) ? dialect.ifNull(column, fallback) : column;
    return col + " " + operatorToken(op) + " " + literal;
  }

  private boolean coalesce(String column, Operator op, Object value, boolean canBeNull) {
    if (ignoreIfNull || !canBeNull) return false;
    if (isPresent(value) && (op == Operator.EQ || op == Operator.LIKE)) return false;
    return !alreadyCoalesced(column);
  }

  private static boolean alreadyCoalesced(String column) {
    String c = column.toLowerCase(Locale.ROOT);
    return c.contains("ifnull(") || c.contains("coalesce(");
  }

  private String operatorToken(Operator op) {
    if (op.isLike()) return dialect.likeOperator(op == Operator.NOT_LIKE);
    return op.token();
  }

  private String temporalBetween(String column, FieldDef df, List<Object> bounds) {
    boolean dateOnly = df != null && df.type() == FieldType.DATE;
    LocalDate today = dateRanges.today();
    Object fromRaw = bounds.size() > 0 && !TemporalValues.isEmpty(bounds.get(0)) ? bounds.get(0) : today;
    Object toRaw = bounds.size() > 1 && !TemporalValues.isEmpty(bounds.get(1)) ? bounds.get(1) : today;

    LocalDateTime from = TemporalValues.toDateTime(fromRaw);
    LocalDateTime upper = TemporalValues.toDateTime(toRaw).plusDays(1);

    String lo = dateOnly ? TemporalValues.formatDate(from.toLocalDate()) : TemporalValues.formatDateTime(from);
    String hi = dateOnly ? TemporalValues.formatDate(upper.toLocalDate()) : TemporalValues.formatDateTime(upper);
    String fallback = dateOnly ? quoted(TemporalValues.FALLBACK_DATE) : quoted(TemporalValues.FALLBACK_DATETIME);

    String col = ignoreIfNull || alreadyCoalesced(column) ? column : dialect.ifNull(column, fallback);
    return "(" + col + " >= " + quoted(lo) + " and " + col + " < " + quoted(hi) + ")";
  }

  private String plainBetween(String column, FieldDef df, List<Object> bounds, boolean canBeNull) {
    if (bounds.size() != 2) {
      throw new QueryValidationException("between expects two values, got " + bounds);
    }
    boolean numeric = df != null && df.type().numeric();
    String lo = numeric ? number(bounds.get(0)) : dialect.literal(str(bounds.get(0)));
    String hi = numeric ? number(bounds.get(1)) : dialect.literal(str(bounds.get(1)));
    String fallback = numeric ? "0" : EMPTY;
    String col = canBeNull && !ignoreIfNull && !alreadyCoalesced(column) ? dialect.ifNull(column, fallback) : column;
    return col + " between " + lo + " and " + hi;
  }

  private List<String> hierarchyIds(String entity, FieldDef df, Operator op, Object value) {
    if (value instanceof Collection<?> || value instanceof Object[]) {
      throw new QueryValidationException("Hierarchy operators take a single record id, got " + value);
    }
    if (!isPresent(value)) return List.of();
    String refEntity = df != null && df.options() != null && !df.options().isBlank() ? df.options() : entity;
    return hierarchy.bounds(refEntity, str(value).trim())
        .map(anchor -> descendantsOperator(op)
            ? hierarchy.descendants(refEntity, anchor)
            : hierarchy.ancestors(refEntity, anchor))
        .orElse(List.of());
  }

  private static boolean descendantsOperator(Operator op) {
    return op == Operator.DESCENDANTS_OF || op == Operator.NOT_DESCENDANTS_OF;
  }

  private static Operator isOperator(Object value) {
    String v = value == null ? "" : str(value).trim().toLowerCase(Locale.ROOT);
    if ("set".equals(v)) return Operator.NE;
    if ("not set".equals(v)) return Operator.EQ;
    throw new QueryValidationException("Value for 'is' must be 'set' or 'not set', got '" + value + "'");
  }

  private String inList(List<String> values) {
    if (values.isEmpty()) return "(" + EMPTY + ")";
    List<String> escaped = new ArrayList<>(values.size());
    for (String v : values) escaped.add(dialect.literal(v));
    return "(" + String.join(", ", escaped) + ")";
  }

  private static List<String> listValues(Object value) {
    List<String> out = new ArrayList<>();
    if (value == null) return out;
    Collection<?> items;
    if (value instanceof Collection<?> c) items = c;
    else if (value instanceof Object[] arr) items = Arrays.asList(arr);
    else if (value instanceof String s) items = s.isEmpty() ? List.of() : Arrays.asList(s.split(","));
    else items = List.of(value);
    for (Object o : items) out.add(o == null ? "" : str(o).trim());
    return out;
  }

  private static List<Object> betweenBounds(Object value) {
    if (value == null) return List.of();
    if (value instanceof DateRange r) return List.of(r.from(), r.to());
    if (value instanceof Collection<?> c) return new ArrayList<>(c);
    if (value instanceof Object[] arr) return Arrays.asList(arr);
    if (value instanceof String s) {
      List<Object> out = new ArrayList<>();
      for (String part : s.split(",")) out.add(part.trim());
      return out;
    }
    return List.of(value);
  }

  static String number(Object value) {
    if (value instanceof Boolean b) return b ? "1" : "0";
    if (value == null) return "0";
    try {
      BigDecimal bd = new BigDecimal(str(value).trim());
      return bd.signum() == 0 ? "0" : bd.stripTrailingZeros().toPlainString();
    } catch (NumberFormatException e) {
      return "0";
    }
  }

  private static boolean isTemporal(Object value) {
    return value instanceof LocalDate || value instanceof LocalDateTime || value instanceof LocalTime
        || value instanceof OffsetDateTime || value instanceof ZonedDateTime || value instanceof java.util.Date;
  }

  static boolean isPresent(Object value) {
    if (value == null) return false;
    if (value instanceof String s) return !s.isEmpty();
    if (value instanceof Collection<?> c) return !c.isEmpty();
    if (value instanceof Map<?, ?> m) return !m.isEmpty();
    if (value instanceof Boolean b) return b;
    if (value instanceof Number n) return n.doubleValue() != 0d;
    return true;
  }

  private static String str(Object value) {
    return String.valueOf(value);
  }

  private static String quoted(String s) {
    return "'" + s + "'";
  }
}
