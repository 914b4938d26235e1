package io.intellixity.dynaq.query;

/**
 * Closed set of comparison operators. Every renderer maps every constant.
 * <p>
 * A constant is described by its {@link Family}, whether it negates the family's positive test and
 * whether text comparison ignores case.
 */
public enum Operator {
  EQ(Family.COMPARISON, false, false, "="),
  NEQ(Family.COMPARISON, false, false, "!="),
  LT(Family.COMPARISON, false, false, "<"),
  LTE(Family.COMPARISON, false, false, "<="),
  GT(Family.COMPARISON, false, false, ">"),
  GTE(Family.COMPARISON, false, false, ">="),

  LIKE(Family.LIKE, false, false, "LIKE"),
  ILIKE(Family.LIKE, false, true, "ILIKE"),
  NOT_LIKE(Family.LIKE, true, false, "NOT LIKE"),
  NOT_ILIKE(Family.LIKE, true, true, "NOT ILIKE"),

  CONTAINS(Family.CONTAINS, false, false, "CONTAINS"),
  ICONTAINS(Family.CONTAINS, false, true, "ICONTAINS"),
  NOT_CONTAINS(Family.CONTAINS, true, false, "NOT CONTAINS"),
  NOT_ICONTAINS(Family.CONTAINS, true, true, "NOT ICONTAINS"),

  BEGINS_WITH(Family.BEGINS_WITH, false, false, "BEGINSWITH"),
  IBEGINS_WITH(Family.BEGINS_WITH, false, true, "IBEGINSWITH"),
  NOT_BEGINS_WITH(Family.BEGINS_WITH, true, false, "NOT BEGINSWITH"),
  NOT_IBEGINS_WITH(Family.BEGINS_WITH, true, true, "NOT IBEGINSWITH"),

  ENDS_WITH(Family.ENDS_WITH, false, false, "ENDSWITH"),
  IENDS_WITH(Family.ENDS_WITH, false, true, "IENDSWITH"),
  NOT_ENDS_WITH(Family.ENDS_WITH, true, false, "NOT ENDSWITH"),
  NOT_IENDS_WITH(Family.ENDS_WITH, true, true, "NOT IENDSWITH"),

  IS_NULL(Family.NULL_CHECK, false, false, "IS NULL"),
  IS_NOT_NULL(Family.NULL_CHECK, true, false, "IS NOT NULL"),

  IN(Family.MEMBERSHIP, false, false, "IN"),
  NOT_IN(Family.MEMBERSHIP, true, false, "NOT IN"),

  BETWEEN(Family.RANGE, false, false, "BETWEEN"),
  NOT_BETWEEN(Family.RANGE, true, false, "NOT BETWEEN");

  public enum Family {
    COMPARISON,
    LIKE,
    CONTAINS,
    BEGINS_WITH,
    ENDS_WITH,
    NULL_CHECK,
    MEMBERSHIP,
    RANGE
  }

  private final Family family;
  private final boolean negated;
  private final boolean caseInsensitive;
  private final String keyword;

  Operator(Family family, boolean negated, boolean caseInsensitive, String keyword) {
    this.family = family;
    this.negated = negated;
    this.caseInsensitive = caseInsensitive;
    this.keyword = keyword;
  }

  public Family family() { return family; }
  public boolean negated() { return negated; }
  public boolean caseInsensitive() { return caseInsensitive; }
  /** DSL spelling; the SQL symbol for comparisons. */
  public String keyword() { return keyword; }

  /** LIKE, CONTAINS, BEGINSWITH and ENDSWITH with their variants. */
  public boolean isPattern() {
    return family == Family.LIKE || family == Family.CONTAINS
        || family == Family.BEGINS_WITH || family == Family.ENDS_WITH;
  }

  public boolean requiresValue() { return family != Family.NULL_CHECK; }

  public boolean takesList() { return family == Family.MEMBERSHIP || family == Family.RANGE; }

  public static Operator of(Family family, boolean negated, boolean caseInsensitive) {
    for (Operator op : values()) {
      if (op.family == family && op.negated == negated && op.caseInsensitive == caseInsensitive) return op;
    }
    throw new IllegalArgumentException("No operator for " + family + " negated=" + negated + " ci=" + caseInsensitive);
  }
}
