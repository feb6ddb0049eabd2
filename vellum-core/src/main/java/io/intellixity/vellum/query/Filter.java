package io.intellixity.vellum.query;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Structured filter: (entity type, field, operator, value).\n
 *
 * The entity type is optional; a filter without one applies to the primary entity of the query.\n
 * The field may be a {@code linkfield.field} path into a linked document.\n
 * Values may be scalars, collections, temporal values or a {@link ColumnRef}.
 */
public final class Filter implements FilterElement {
  private static final Pattern FIELD_NAME = Pattern.compile("^[A-Za-z0-9_]+$");
  private static final Pattern LINK_PATH = Pattern.compile("^[A-Za-z0-9_]+\\.[A-Za-z0-9_]+$");
  private static final Pattern ENTITY_NAME = Pattern.compile("^[A-Za-z0-9_][A-Za-z0-9_ \\-]*$");

  private final String entityType;
  private final String fieldName;
  private final Operator operator;
  private final Object value;

  public Filter(String entityType, String fieldName, Operator operator, Object value) {
    this.fieldName = Objects.requireNonNull(fieldName, "fieldName").trim();
    this.operator = Objects.requireNonNull(operator, "operator");
    this.entityType = entityType == null || entityType.isBlank() ? null : entityType.trim();
    this.value = value;
    if (!isValidFieldName(this.fieldName) && !LINK_PATH.matcher(this.fieldName).matches()) {
      throw new QueryValidationException("Invalid field name in filter: '" + fieldName + "'");
    }
    if (this.entityType != null && !isValidEntityName(this.entityType)) {
      throw new QueryValidationException("Invalid entity type in filter: '" + entityType + "'");
    }
  }

  public String entityType() { return entityType; }
  public String fieldName() { return fieldName; }
  public Operator operator() { return operator; }
  public Object value() { return value; }

  public boolean isLinkPath() { return fieldName.indexOf('.') >= 0; }

  /** Bind this filter to {@code primaryEntity} when no entity type was given. */
  public Filter withDefaultEntity(String primaryEntity) {
    if (entityType != null) return this;
    return new Filter(primaryEntity, fieldName, operator, value);
  }

  public static Filter of(String fieldName, Operator operator, Object value) {
    return new Filter(null, fieldName, operator, value);
  }

  public static Filter of(String entityType, String fieldName, Operator operator, Object value) {
    return new Filter(entityType, fieldName, operator, value);
  }

  public static Filter eq(String fieldName, Object value) { return of(fieldName, Operator.EQ, value); }

  static boolean isValidFieldName(String name) {
    return name != null && FIELD_NAME.matcher(name).matches();
  }

  public static boolean isValidEntityName(String name) {
    return name != null && ENTITY_NAME.matcher(name).matches();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Filter f)) return false;
    return Objects.equals(entityType, f.entityType)
        && fieldName.equals(f.fieldName)
        && operator == f.operator
        && Objects.equals(value, f.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(entityType, fieldName, operator, value);
  }

  @Override
  public String toString() {
    return "Filter[" + (entityType == null ? "" : entityType + ".") + fieldName + " " + operator.token() + " " + value + "]";
  }
}
