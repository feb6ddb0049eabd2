package io.intellixity.vellum.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Normalizes loosely shaped filter input into {@link FilterElement}s.\n
 *
 * Accepted shapes:\n
 * - map: {@code {field: value}} (equality) or {@code {field: [op, value]}}\n
 * - list entries: {@code [field, op, value]} or {@code [entity, field, op, value]}\n
 * - list entries that are strings: trusted raw predicates\n
 * - already-typed {@link FilterElement}s pass through\n
 */
public final class Filters {
  private Filters() {}

  public static List<FilterElement> parse(String entityType, Object raw) {
    if (raw == null) return List.of();
    if (raw instanceof FilterElement fe) return List.of(fe);
    if (raw instanceof Map<?, ?> m) return fromMap(entityType, m);
    if (raw instanceof Collection<?> c) {
      List<FilterElement> out = new ArrayList<>();
      for (Object o : c) {
        if (o == null) continue;
        out.addAll(parseElement(entityType, o));
      }
      return out;
    }
    throw new QueryValidationException("Unsupported filter input: " + raw.getClass().getSimpleName());
  }

  private static List<FilterElement> parseElement(String entityType, Object o) {
    if (o instanceof FilterElement fe) return List.of(fe);
    if (o instanceof String s) return List.of(new RawPredicate(s));
    if (o instanceof Map<?, ?> m) return fromMap(entityType, m);
    if (o instanceof List<?> l) return List.of(fromList(entityType, l));
    if (o instanceof Object[] arr) return List.of(fromList(entityType, Arrays.asList(arr)));
    throw new QueryValidationException("Unsupported filter element: " + o);
  }

  private static List<FilterElement> fromMap(String entityType, Map<?, ?> m) {
    List<FilterElement> out = new ArrayList<>();
    for (var e : m.entrySet()) {
      out.add(entry(entityType, String.valueOf(e.getKey()), e.getValue()));
    }
    return out;
  }

  /** One {@code field: value} or {@code field: [op, value]} pair. */
  public static Filter entry(String entityType, String field, Object value) {
    if (value instanceof List<?> l) {
      if (l.size() < 2) {
        throw new QueryValidationException("Filter on '" + field + "' must be [operator, value], got " + l);
      }
      return new Filter(entityType, field, Operator.fromToken(String.valueOf(l.get(0))), l.get(1));
    }
    if (value instanceof Object[] arr) return entry(entityType, field, Arrays.asList(arr));
    return new Filter(entityType, field, Operator.EQ, value);
  }

  private static Filter fromList(String entityType, List<?> l) {
    if (l.size() == 3) {
      return new Filter(entityType, str(l.get(0)), Operator.fromToken(str(l.get(1))), l.get(2));
    }
    if (l.size() == 4) {
      return new Filter(str(l.get(0)), str(l.get(1)), Operator.fromToken(str(l.get(2))), l.get(3));
    }
    throw new QueryValidationException("Filter must have 3 or 4 elements, got " + l.size() + ": " + l);
  }

  private static String str(Object o) {
    if (o == null) throw new QueryValidationException("Filter element must not be null");
    return String.valueOf(o);
  }
}
