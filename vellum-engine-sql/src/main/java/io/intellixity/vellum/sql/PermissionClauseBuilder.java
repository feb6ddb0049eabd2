package io.intellixity.vellum.sql;

import io.intellixity.vellum.meta.EntityMeta;
import io.intellixity.vellum.meta.FieldDef;
import io.intellixity.vellum.meta.MetadataProvider;
import io.intellixity.vellum.permission.PermissionDeniedException;
import io.intellixity.vellum.permission.PermissionEvaluator;
import io.intellixity.vellum.permission.PermissionQueryHooks;
import io.intellixity.vellum.permission.RolePermissions;
import io.intellixity.vellum.permission.UserPermission;
import io.intellixity.vellum.sql.dialect.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the row-visibility predicate for one entity type and user.\n
 *
 * Composition:\n
 * - no select/read, no applicable grant: shared records only, or {@link PermissionDeniedException}\n
 * - owner-restricted read: {@code owner = user}\n
 * - per-record grants, only with role select/read: one {@code (empty or in (...))} group per link field, AND-ed\n
 * - permission query hooks: AND-ed\n
 * - shares: OR-ed against everything above\n
 */
public final class PermissionClauseBuilder {
  private static final Logger log = LoggerFactory.getLogger(PermissionClauseBuilder.class);

  private final SqlDialect dialect;
  private final MetadataProvider metadata;
  private final PermissionEvaluator permissions;
  private final PermissionQueryHooks hooks;

  public PermissionClauseBuilder(SqlDialect dialect,
                                 MetadataProvider metadata,
                                 PermissionEvaluator permissions,
                                 PermissionQueryHooks hooks) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.permissions = Objects.requireNonNull(permissions, "permissions");
    this.hooks = Objects.requireNonNull(hooks, "hooks");
  }

  /**
   * Predicates to AND into the WHERE clause; empty when every row is visible.
   *
   * @param referenceEntity entity whose link field is being filled, or null for {@code entityType} itself
   * @throws PermissionDeniedException when the user has no path to any row
   */
  public List<String> build(String entityType, String user, String referenceEntity) {
    EntityMeta meta = metadata.meta(entityType);
    RolePermissions role = permissions.rolePermissions(entityType, user);
    List<String> shared = permissions.sharedWith(entityType, user);
    String reference = referenceEntity == null || referenceEntity.isBlank() ? entityType : referenceEntity;

    List<String> out = new ArrayList<>();
    List<String> match = new ArrayList<>();
    boolean onlyIfShared = false;

    if (!meta.childTable() && !role.canSelectOrRead() && !hasAnyUserPermission(entityType, user, reference)) {
      onlyIfShared = true;
      if (shared.isEmpty()) {
        throw new PermissionDeniedException(entityType, "No permission to read " + entityType);
      }
      out.add(shareCondition(entityType, shared));
    } else if (role.requiresOwnerConstraint()) {
      match.add(dialect.column(entityType, "owner") + " = " + dialect.literal(user));
    } else if (role.canSelectOrRead()) {
      String grants = userPermissionCondition(meta, user, reference);
      if (!grants.isEmpty()) match.add(grants);
    }

    String conditions = match.isEmpty() ? "" : "((" + String.join(") or (", match) + "))";

    List<String> hookConditions = hooks.conditions(entityType, user);
    if (!hookConditions.isEmpty()) {
      String h = String.join(" and ", hookConditions);
      conditions = conditions.isEmpty() ? h : conditions + " and " + h;
    }

    if (!onlyIfShared && !shared.isEmpty() && !conditions.isEmpty()) {
      conditions = "(" + conditions + ") or (" + shareCondition(entityType, shared) + ")";
    }
    if (!conditions.isEmpty()) out.add("(" + conditions + ")");

    if (log.isDebugEnabled()) {
      log.debug("vellum.permission entity={} user={} onlyIfShared={} clauses={}", entityType, user, onlyIfShared, out.size());
    }
    return out;
  }

  private boolean hasAnyUserPermission(String entityType, String user, String reference) {
    for (UserPermission p : permissions.userPermissions(user).getOrDefault(entityType, List.of())) {
      if (p.appliesToAll() || reference.equals(p.applicableFor())) return true;
    }
    return false;
  }

  private String userPermissionCondition(EntityMeta meta, String user, String reference) {
    String entityType = meta.name();
    Map<String, List<UserPermission>> grants = permissions.userPermissions(user);
    boolean strict = permissions.applyStrictUserPermissions();

    List<FieldDef> linkFields = new ArrayList<>(meta.linkFields());
    // The record itself, as a self-link on its id column.
    linkFields.add(FieldDef.link("name", entityType));

    List<String> groups = new ArrayList<>();
    for (FieldDef df : linkFields) {
      if (df.ignoreUserPermissions()) continue;
      List<UserPermission> values = grants.getOrDefault(df.options(), List.of());
      if (values.isEmpty()) continue;

      List<String> docs = new ArrayList<>();
      for (UserPermission p : values) {
        if (p.appliesToAll()) {
          docs.add(p.doc());
        } else if ("name".equals(df.name())) {
          if (reference.equals(p.applicableFor())) docs.add(p.doc());
        } else if (entityType.equals(p.applicableFor())) {
          docs.add(p.doc());
        }
      }
      if (docs.isEmpty()) continue;

      String column = dialect.column(entityType, df.name());
      String condition = strict ? "" : dialect.castName(dialect.ifNull(column, "''") + "=''") + " or ";
      condition += dialect.castName(column) + " in (" + literals(docs) + ")";
      groups.add("(" + condition + ")");
    }
    return String.join(" and ", groups);
  }

  private String shareCondition(String entityType, List<String> shared) {
    return dialect.castName(dialect.column(entityType, "name")) + " in (" + literals(shared) + ")";
  }

  private String literals(List<String> values) {
    List<String> out = new ArrayList<>(values.size());
    for (String v : values) out.add(dialect.literal(v));
    return String.join(", ", out);
  }
}
