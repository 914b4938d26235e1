package io.intellixity.dynaq.query;

import java.util.Locale;
import java.util.Objects;

/** Projected expression with an optional explicit alias. */
public record Column(String expression, String alias) {
  public static final String STAR = "*";

  public Column {
    Objects.requireNonNull(expression, "expression");
    if (alias != null && alias.isBlank()) alias = null;
  }

  public static Column star() { return new Column(STAR, null); }

  public boolean isStar() { return STAR.equals(expression); }

  public boolean hasAlias() { return alias != null; }

  /** True for a bare (possibly qualified) column name. */
  public boolean isPlainColumn() {
    return !isStar() && expression.indexOf('(') < 0 && expression.indexOf('\'') < 0;
  }

  /** The key this column is exposed under in result rows. */
  public String outputName() {
    if (alias != null) return alias;
    if (isPlainColumn()) return lastSegment(expression);
    return defaultAlias(expression);
  }

  /** {@code COUNT(users.id)} becomes {@code count_users_id_}. */
  public static String defaultAlias(String expression) {
    StringBuilder sb = new StringBuilder(expression.length());
    for (char c : expression.trim().toLowerCase(Locale.ROOT).toCharArray()) {
      switch (c) {
        case '*' -> sb.append('a');
        case '.', '(', ')', ',', '-', ' ' -> sb.append('_');
        case '\'' -> { }
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  public static String lastSegment(String column) {
    int dot = column.lastIndexOf('.');
    return dot < 0 ? column : column.substring(dot + 1);
  }
}
