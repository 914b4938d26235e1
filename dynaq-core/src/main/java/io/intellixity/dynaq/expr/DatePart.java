package io.intellixity.dynaq.expr;

import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.scan.Scanner;

import java.util.Locale;

public enum DatePart {
  YEAR,
  QUARTER,
  MONTH,
  WEEK,
  DAY,
  HOUR,
  MINUTE,
  SECOND,
  DAYOFWEEK,
  DAYOFYEAR;

  /** Accepts quoted or bare, any case, singular or plural ({@code 'days'}). */
  public static DatePart parse(String raw) {
    if (raw == null) return null;
    String s = Scanner.unquote(raw.trim()).trim().toUpperCase(Locale.ROOT);
    if (s.startsWith("\"") && s.endsWith("\"") && s.length() >= 2) s = s.substring(1, s.length() - 1);
    for (DatePart p : values()) {
      if (p.name().equals(s) || (p.name() + "S").equals(s)) return p;
    }
    return null;
  }

  public static DatePart require(String raw, String function) {
    DatePart p = parse(raw);
    if (p == null) {
      throw new UnsupportedFunctionException(function, "Invalid date part '" + raw + "' for " + function);
    }
    return p;
  }

  public String lower() { return name().toLowerCase(Locale.ROOT); }
}
