package io.intellixity.dynaq.query;

import java.util.Locale;

public enum JoinKind {
  LEFT,
  INNER,
  RIGHT,
  FULL;

  /** Null when {@code s} is not a join kind keyword. */
  public static JoinKind parse(String s) {
    if (s == null) return null;
    return switch (s.trim().toUpperCase(Locale.ROOT)) {
      case "LEFT" -> LEFT;
      case "INNER" -> INNER;
      case "RIGHT" -> RIGHT;
      case "FULL" -> FULL;
      default -> null;
    };
  }
}
