package io.intellixity.vellum.query;

/** One entry of a filter list: either a structured {@link Filter} or a trusted {@link RawPredicate}. */
public interface FilterElement {
}
