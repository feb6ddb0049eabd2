package io.intellixity.vellum.temporal;

import java.time.LocalDate;
import java.util.Objects;

/** Inclusive calendar date range. */
public record DateRange(LocalDate from, LocalDate to) {
  public DateRange {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }
}
