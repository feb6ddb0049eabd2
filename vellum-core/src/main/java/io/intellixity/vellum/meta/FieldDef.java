package io.intellixity.vellum.meta;

import java.util.Objects;

/**
 * Field metadata.
 *
 * @param options for {@link FieldType#LINK} and {@link FieldType#TABLE} fields, the target entity type
 * @param ignoreUserPermissions when true, per-record grants on the linked entity do not restrict rows
 */
public record FieldDef(String name, FieldType type, String options, boolean ignoreUserPermissions) {
  public FieldDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public static FieldDef of(String name, FieldType type) {
    return new FieldDef(name, type, null, false);
  }

  public static FieldDef link(String name, String targetEntity) {
    return new FieldDef(name, FieldType.LINK, targetEntity, false);
  }
}
