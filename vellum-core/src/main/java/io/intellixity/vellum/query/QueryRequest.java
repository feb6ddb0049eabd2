package io.intellixity.vellum.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Typed arguments for one list query.\n
 *
 * Ordering semantics:\n
 * - {@code orderBy == null}: entity default ordering (configured sort field, else modified desc)\n
 * - {@code orderBy} blank: no ORDER BY clause\n
 * - otherwise: the given expression, validated against the order/group allowlist\n
 */
public final class QueryRequest {
  public static final String DEFAULT_JOIN = "left join";
  private static final Set<String> JOINS = Set.of("left join", "inner join", "join", "left outer join");

  private List<String> fields = new ArrayList<>();
  private List<FilterElement> filters = new ArrayList<>();
  private List<FilterElement> orFilters = new ArrayList<>();
  private String orderBy;
  private String groupBy;
  private int limitStart;
  private Integer limitPageLength;
  private boolean distinct;
  private boolean ignorePermissions;
  private boolean strict = true;
  private boolean ignoreIfNull;
  private boolean withChildNames;
  private boolean withCommentCount;
  private boolean ignoreDdl;
  private String user;
  private String referenceEntity;
  private String parentEntity;
  private String join = DEFAULT_JOIN;
  private String pluck;

  public QueryRequest() {}

  public static QueryRequest create() { return new QueryRequest(); }

  public List<String> fields() { return fields; }
  public List<FilterElement> filters() { return filters; }
  public List<FilterElement> orFilters() { return orFilters; }
  public String orderBy() { return orderBy; }
  public String groupBy() { return groupBy; }
  public int limitStart() { return limitStart; }
  public Integer limitPageLength() { return limitPageLength; }
  public boolean distinct() { return distinct; }
  public boolean ignorePermissions() { return ignorePermissions; }
  /** Strict mode rejects inline comments and UNION in field expressions. */
  public boolean strict() { return strict; }
  public boolean ignoreIfNull() { return ignoreIfNull; }
  public boolean withChildNames() { return withChildNames; }
  public boolean withCommentCount() { return withCommentCount; }
  public boolean ignoreDdl() { return ignoreDdl; }
  public String user() { return user; }
  /** Entity whose link field is being populated; selects per-record grants applicable to it. */
  public String referenceEntity() { return referenceEntity; }
  public String parentEntity() { return parentEntity; }
  public String join() { return join; }
  public String pluck() { return pluck; }

  public QueryRequest withFields(List<String> fields) { this.fields = new ArrayList<>(fields == null ? List.of() : fields); return this; }
  public QueryRequest withFields(String... fields) { return withFields(List.of(fields)); }
  public QueryRequest withFilters(List<? extends FilterElement> filters) { this.filters = new ArrayList<>(filters == null ? List.of() : filters); return this; }
  public QueryRequest withFilter(FilterElement filter) { this.filters.add(filter); return this; }
  public QueryRequest withOrFilters(List<? extends FilterElement> orFilters) { this.orFilters = new ArrayList<>(orFilters == null ? List.of() : orFilters); return this; }
  public QueryRequest withOrderBy(String orderBy) { this.orderBy = orderBy; return this; }
  public QueryRequest withoutOrdering() { this.orderBy = ""; return this; }
  public QueryRequest withGroupBy(String groupBy) { this.groupBy = groupBy; return this; }
  public QueryRequest withDistinct(boolean distinct) { this.distinct = distinct; return this; }
  public QueryRequest withIgnorePermissions(boolean ignorePermissions) { this.ignorePermissions = ignorePermissions; return this; }
  public QueryRequest withStrict(boolean strict) { this.strict = strict; return this; }
  public QueryRequest withIgnoreIfNull(boolean ignoreIfNull) { this.ignoreIfNull = ignoreIfNull; return this; }
  public QueryRequest withChildNames(boolean withChildNames) { this.withChildNames = withChildNames; return this; }
  public QueryRequest withCommentCount(boolean withCommentCount) { this.withCommentCount = withCommentCount; return this; }
  public QueryRequest withIgnoreDdl(boolean ignoreDdl) { this.ignoreDdl = ignoreDdl; return this; }
  public QueryRequest withUser(String user) { this.user = user; return this; }
  public QueryRequest withReferenceEntity(String referenceEntity) { this.referenceEntity = referenceEntity; return this; }
  public QueryRequest withParentEntity(String parentEntity) { this.parentEntity = parentEntity; return this; }
  public QueryRequest withPluck(String pluck) { this.pluck = pluck; return this; }

  public QueryRequest withLimit(int start, Integer pageLength) {
    if (start < 0) throw new QueryValidationException("limitStart must be >= 0");
    if (pageLength != null && pageLength < 0) throw new QueryValidationException("limitPageLength must be >= 0");
    this.limitStart = start;
    this.limitPageLength = pageLength;
    return this;
  }

  public QueryRequest withJoin(String join) {
    String j = join == null ? DEFAULT_JOIN : join.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    if (!JOINS.contains(j)) throw new QueryValidationException("Unsupported join kind: " + join);
    this.join = j;
    return this;
  }
}
