package io.intellixity.vellum.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Boundary adapter for the permissive legacy calling convention.\n
 *
 * Accepts fields and filters as JSON strings, comma separated strings, maps or nested lists, and
 * swaps the two arguments when their shapes say they were passed in the wrong order:\n
 * - fields is a map, or a list whose first element is a list: it is really a filter\n
 * - filters is a list of more than one plain string: it is really a field list\n
 *
 * The core only ever sees the typed {@link QueryRequest} this produces.
 */
public final class LegacyQueryArgs {
  private static final Logger log = LoggerFactory.getLogger(LegacyQueryArgs.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private LegacyQueryArgs() {}

  public static QueryRequest toRequest(String entityType, Object fields, Object filters, Object orFilters) {
    Object f = fields;
    Object flt = filters;
    boolean swap = looksLikeFilters(f)
        || (isPresent(f) && flt instanceof List<?> l && l.size() > 1 && l.get(0) instanceof String);
    if (swap) {
      log.debug("vellum.legacy entity={} swapped fields and filters by argument shape", entityType);
      Object tmp = f;
      f = flt;
      flt = tmp;
    }

    return QueryRequest.create()
        .withFields(parseFields(f))
        .withFilters(Filters.parse(entityType, parseJson(flt)))
        .withOrFilters(Filters.parse(entityType, parseJson(orFilters)));
  }

  /** {@code "*"}, a JSON array, a comma separated list or a collection; blank entries are dropped. */
  public static List<String> parseFields(Object fields) {
    List<String> out = new ArrayList<>();
    if (fields == null) return out;
    if (fields instanceof String s) {
      String t = s.trim();
      if (t.isEmpty()) return out;
      if ("*".equals(t)) return new ArrayList<>(List.of("*"));
      if (t.startsWith("[")) return parseFields(readJson(t));
      for (String part : t.split(",")) {
        if (!part.isBlank()) out.add(part.trim());
      }
      return out;
    }
    if (fields instanceof Collection<?> c) {
      for (Object o : c) {
        if (o == null) continue;
        String v = String.valueOf(o);
        if (!v.isBlank()) out.add(v);
      }
      return out;
    }
    throw new QueryValidationException("Unsupported fields argument: " + fields.getClass().getSimpleName());
  }

  private static boolean looksLikeFilters(Object fields) {
    if (fields instanceof Map<?, ?>) return true;
    return fields instanceof List<?> l && !l.isEmpty() && l.get(0) instanceof List<?>;
  }

  private static boolean isPresent(Object o) {
    if (o == null) return false;
    if (o instanceof String s) return !s.isBlank();
    if (o instanceof Collection<?> c) return !c.isEmpty();
    if (o instanceof Map<?, ?> m) return !m.isEmpty();
    return true;
  }

  private static Object parseJson(Object raw) {
    if (raw instanceof String s) {
      if (s.isBlank()) return null;
      return readJson(s);
    }
    return raw;
  }

  private static Object readJson(String json) {
    try {
      return MAPPER.readValue(json, Object.class);
    } catch (JsonProcessingException e) {
      throw new QueryValidationException("Malformed JSON argument: " + e.getOriginalMessage(), e);
    }
  }
}
