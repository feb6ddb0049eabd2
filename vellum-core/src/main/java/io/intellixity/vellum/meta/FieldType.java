package io.intellixity.vellum.meta;

/** Declared type of an entity field, as reported by the metadata layer. */
public enum FieldType {
  DATA,
  LINK,
  DYNAMIC_LINK,
  SELECT,
  TEXT,
  SMALL_TEXT,
  LONG_TEXT,
  CHECK,
  INT,
  FLOAT,
  CURRENCY,
  PERCENT,
  DATE,
  DATETIME,
  TIME,
  TABLE,
  OTHER;

  /** Numeric and boolean columns are stored NOT NULL with a zero default. */
  public boolean nonNullable() {
    return this == CHECK || this == INT || this == FLOAT || this == CURRENCY || this == PERCENT;
  }

  public boolean numeric() {
    return nonNullable();
  }

  public boolean temporal() {
    return this == DATE || this == DATETIME || this == TIME;
  }
}
