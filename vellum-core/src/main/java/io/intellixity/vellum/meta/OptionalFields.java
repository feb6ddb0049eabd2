package io.intellixity.vellum.meta;

import java.util.Set;

/** Soft columns that may be absent from a table; references to them are dropped instead of failing. */
public final class OptionalFields {
  public static final Set<String> NAMES = Set.of("_user_tags", "_comments", "_assign", "_liked_by", "_seen");

  private OptionalFields() {}

  public static boolean isOptional(String column) {
    return NAMES.contains(column);
  }
}
