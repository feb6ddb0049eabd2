package io.intellixity.vellum.sql;

import io.intellixity.vellum.meta.FieldDef;
import io.intellixity.vellum.meta.FieldType;
import io.intellixity.vellum.meta.MetadataProvider;
import io.intellixity.vellum.meta.OptionalFields;
import io.intellixity.vellum.permission.PermissionDeniedException;
import io.intellixity.vellum.permission.PermissionEvaluator;
import io.intellixity.vellum.permission.PermissionType;
import io.intellixity.vellum.query.Filter;
import io.intellixity.vellum.query.FilterElement;
import io.intellixity.vellum.query.QueryValidationException;
import io.intellixity.vellum.sql.dialect.SqlDialect;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the projection of one query and tracks the tables it touches.\n
 *
 * Tables are identified by entity type. The primary entity is always first; further entries are
 * child tables (joined on parent / parenttype). Link joins are kept apart and deduplicated by
 * (entity type, link field). Every table other than the primary one passes a read check first.
 */
public final class FieldResolver {
  private static final Pattern BARE_IDENT = Pattern.compile("^[A-Za-z0-9_]+$");
  private static final List<String> TABLE_FREE_FUNCTIONS =
      List.of("dayofyear(", "extract(", "locate(", "strpos(", "count(", "sum(", "avg(");
  private static final List<String> UNQUALIFIED_FUNCTIONS =
      List.of("count(", "avg(", "sum(", "extract(", "dayofyear(");

  /** Implicit join on a linked document: {@code tabEntity.name = primary.field}. */
  public record LinkJoin(String entityType, String fieldName) {}

  private final SqlDialect dialect;
  private final MetadataProvider metadata;
  private final PermissionEvaluator permissions;
  private final String primary;
  private final String user;
  private final boolean ignorePermissions;

  private final List<String> tables = new ArrayList<>();
  private final List<LinkJoin> linkJoins = new ArrayList<>();

  public FieldResolver(SqlDialect dialect,
                       MetadataProvider metadata,
                       PermissionEvaluator permissions,
                       String primary,
                       String user,
                       boolean ignorePermissions) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.permissions = Objects.requireNonNull(permissions, "permissions");
    this.primary = Objects.requireNonNull(primary, "primary");
    this.user = user;
    this.ignorePermissions = ignorePermissions;
    this.tables.add(primary);
  }

  public String primary() { return primary; }
  public List<String> tables() { return List.copyOf(tables); }
  public List<String> childTables() { return List.copyOf(tables.subList(1, tables.size())); }
  public List<LinkJoin> linkJoins() { return List.copyOf(linkJoins); }

  /** Unquoted table names ({@code tabX}) of every table in the FROM clause. */
  public Set<String> joinedTableNames() {
    Set<String> out = new LinkedHashSet<>();
    for (String t : tables) out.add("tab" + t);
    for (LinkJoin l : linkJoins) out.add("tab" + l.entityType());
    return out;
  }

  public boolean isJoined(String entityType) {
    if (tables.contains(entityType)) return true;
    for (LinkJoin l : linkJoins) {
      if (l.entityType().equals(entityType)) return true;
    }
    return false;
  }

  /**
   * Rewrites {@code linkfield.field [as alias]} into a column of the linked (or child) entity,
   * registering a link join for Link fields.
   */
  public List<String> resolveLinkFields(List<String> fields) {
    List<String> out = new ArrayList<>(fields.size());
    for (String field : fields) {
      if (field == null || field.isBlank()) continue;
      if (!field.contains(".") || field.contains("tab")) {
        out.add(field);
        continue;
      }
      String expr = field;
      String alias = null;
      int as = field.indexOf(" as ");
      if (as >= 0) {
        expr = field.substring(0, as).strip();
        alias = field.substring(as + 4).strip();
      }
      String[] parts = expr.split("\\.");
      if (parts.length != 2) {
        throw new QueryValidationException("Invalid field reference: '" + field + "'");
      }
      FieldDef linkField = linkField(parts[0].strip());
      String linked = linkField.options();
      if (linkField.type() == FieldType.LINK) {
        addLinkJoin(linked, linkField.name());
      }
      String column = dialect.column(linked, parts[1].strip());
      out.add(alias == null ? column : column + " as " + alias);
    }
    return out;
  }

  /**
   * Rebinds a {@code linkfield.field} filter on the primary entity to the linked entity, joining it
   * as a link join (Link fields) or as a child table (Table fields). Other filters pass through.
   */
  public Filter resolveLinkFilter(Filter filter) {
    if (!filter.isLinkPath()) return filter;
    if (!primary.equals(filter.entityType())) {
      throw new QueryValidationException("Link path filters apply to " + primary + " only: '" + filter.fieldName() + "'");
    }
    String path = filter.fieldName();
    int dot = path.indexOf('.');
    FieldDef linkField = linkField(path.substring(0, dot));
    String linked = linkField.options();
    if (linkField.type() == FieldType.LINK) {
      addLinkJoin(linked, linkField.name());
    } else {
      addTable(linked);
    }
    return Filter.of(linked, path.substring(dot + 1), filter.operator(), filter.value());
  }

  private FieldDef linkField(String name) {
    FieldDef linkField = metadata.meta(primary).field(name);
    if (linkField == null || linkField.options() == null || linkField.options().isBlank()) {
      throw new QueryValidationException("Unknown link field '" + name + "' on " + primary);
    }
    return linkField;
  }

  /** Registers every {@code tabX.field} table referenced by the projection. */
  public void extractTables(List<String> fields) {
    for (String field : fields) {
      if (!(field.contains("tab") && field.contains("."))) continue;
      String lower = field.toLowerCase(Locale.ROOT);
      if (TABLE_FREE_FUNCTIONS.stream().anyMatch(lower::contains)) continue;

      String tableName = field.substring(0, field.indexOf('.')).strip();
      if (tableName.toLowerCase(Locale.ROOT).startsWith("group_concat(")) {
        tableName = tableName.substring("group_concat(".length());
      }
      tableName = FieldSanitizer.unquote(tableName);
      if (!tableName.startsWith("tab")) continue;
      String entity = tableName.substring(3);
      if (!isJoined(entity)) addTable(entity);
    }
  }

  /** Adds a child table after a read check; no-op when already joined. */
  public void addTable(String entityType) {
    if (isJoined(entityType)) return;
    checkReadPermission(entityType);
    tables.add(entityType);
  }

  void addLinkJoin(String entityType, String fieldName) {
    for (LinkJoin l : linkJoins) {
      if (l.entityType().equals(entityType) && l.fieldName().equals(fieldName)) return;
    }
    checkReadPermission(entityType);
    linkJoins.add(new LinkJoin(entityType, fieldName));
  }

  private void checkReadPermission(String entityType) {
    if (ignorePermissions) return;
    PermissionType type = permissions.onlyHasSelect(entityType, user) ? PermissionType.SELECT : PermissionType.READ;
    if (!permissions.hasPermission(entityType, type, user, primary)) {
      throw PermissionDeniedException.insufficient(entityType);
    }
  }

  /** Drops projections that mention an optional column missing from {@code columns}. */
  public static List<String> removeOptionalFields(List<String> fields, Set<String> columns) {
    List<String> out = new ArrayList<>(fields.size());
    for (String field : fields) {
      boolean missing = false;
      for (String optional : OptionalFields.NAMES) {
        if (field.contains(optional) && !columns.contains(optional)) {
          missing = true;
          break;
        }
      }
      if (!missing) out.add(field);
    }
    return out;
  }

  /** Drops filters on an optional column missing from {@code columns}. Raw predicates are kept. */
  public static List<FilterElement> removeOptionalFilters(List<FilterElement> filters, Set<String> columns) {
    List<FilterElement> out = new ArrayList<>(filters.size());
    for (FilterElement e : filters) {
      if (e instanceof Filter f && OptionalFields.isOptional(f.fieldName()) && !columns.contains(f.fieldName())) {
        continue;
      }
      out.add(e);
    }
    return out;
  }

  /**
   * Qualifies bare fields with the primary table once more than one table participates, then
   * applies the dialect id cast.
   */
  public List<String> qualify(List<String> fields) {
    boolean ambiguous = tables.size() > 1 || !linkJoins.isEmpty();
    List<String> out = new ArrayList<>(fields.size());
    for (String field : fields) {
      String f = field;
      String lower = f.strip().toLowerCase(Locale.ROOT);
      if (ambiguous && !f.contains(".") && UNQUALIFIED_FUNCTIONS.stream().noneMatch(lower::startsWith)) {
        f = BARE_IDENT.matcher(f.strip()).matches()
            ? dialect.column(primary, f.strip())
            : dialect.table(primary) + "." + f.strip();
      }
      out.add(dialect.castName(f));
    }
    return out;
  }

  /**
   * Quotes plain identifiers so reserved words work as column names. Quoted text, {@code *},
   * function calls and {@code distinct} pass through.
   */
  public List<String> wrap(List<String> fields) {
    List<String> out = new ArrayList<>(fields.size());
    for (String field : fields) {
      String stripped = field.strip();
      String lower = stripped.toLowerCase(Locale.ROOT);
      if (stripped.startsWith("`") || stripped.startsWith("*") || stripped.startsWith("\"") || stripped.startsWith("'")
          || lower.contains("(") || lower.contains("distinct")) {
        out.add(field);
        continue;
      }
      String[] tokens = stripped.split("\\s+");
      if (tokens.length == 3 && "as".equalsIgnoreCase(tokens[1])) {
        out.add(quotePath(tokens[0]) + " as " + tokens[2]);
      } else {
        out.add(quotePath(stripped));
      }
    }
    return out;
  }

  private String quotePath(String path) {
    if (path.endsWith(".*")) {
      return quotePath(path.substring(0, path.length() - 2)) + ".*";
    }
    String[] parts = path.split("\\.");
    List<String> quoted = new ArrayList<>(parts.length);
    for (String p : parts) quoted.add(dialect.quoteIdent(FieldSanitizer.unquote(p)));
    return String.join(".", quoted);
  }
}
