package io.intellixity.vellum.meta;

import java.util.List;
import java.util.Objects;

/**
 * Entity-level metadata consumed by the query compiler.
 *
 * @param childTable rows live inside a parent document (parent / parenttype columns)
 * @param submittable rows carry a draft/submitted status; drafts sort first by default
 * @param sortField configured default sort column, or a comma separated list of {@code column dir} pairs
 */
public record EntityMeta(String name,
                         List<FieldDef> fields,
                         boolean childTable,
                         boolean submittable,
                         String sortField,
                         String sortOrder) {
  public EntityMeta {
    Objects.requireNonNull(name, "name");
    fields = List.copyOf(fields == null ? List.of() : fields);
  }

  public static EntityMeta of(String name, List<FieldDef> fields) {
    return new EntityMeta(name, fields, false, false, null, null);
  }

  public FieldDef field(String fieldName) {
    for (FieldDef f : fields) {
      if (f.name().equals(fieldName)) return f;
    }
    return null;
  }

  public List<FieldDef> linkFields() {
    return fields.stream().filter(f -> f.type() == FieldType.LINK).toList();
  }
}
