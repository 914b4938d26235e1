package io.intellixity.dynaq.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote, parenthesis and brace aware primitives shared by the clause extractor, the filter parser
 * and the renderers.
 * <p>
 * Inside a single-quoted literal ({@code ''} is an embedded quote) parentheses, commas and keyword
 * text are inert.
 */
public final class Scanner {
  /** Depth reported by {@link #depthMask(String)} for characters inside a quoted literal. */
  public static final int QUOTED = -1;

  private Scanner() {}

  /** Index of the quote closing the literal opened at {@code openIndex}, or -1 when unterminated. */
  public static int findClosingQuote(String s, int openIndex) {
    for (int i = openIndex + 1; i < s.length(); i++) {
      if (s.charAt(i) != '\'') continue;
      if (i + 1 < s.length() && s.charAt(i + 1) == '\'') {
        i++;
        continue;
      }
      return i;
    }
    return -1;
  }

  /** Index of the {@code )} matching the {@code (} at {@code openIndex}, or -1. */
  public static int findMatchingClose(String s, int openIndex) {
    int depth = 0;
    for (int i = openIndex; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\'') {
        int close = findClosingQuote(s, i);
        if (close < 0) return -1;
        i = close;
        continue;
      }
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) return i;
      }
    }
    return -1;
  }

  public static boolean isBalanced(String s) {
    if (s == null) return true;
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\'') {
        int close = findClosingQuote(s, i);
        if (close < 0) break;
        i = close;
        continue;
      }
      if (c == '(') depth++;
      else if (c == ')' && --depth < 0) return false;
    }
    return depth == 0;
  }

  /** Index of the first quote that is never closed, or -1. */
  public static int findUnterminatedQuote(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) != '\'') continue;
      int close = findClosingQuote(s, i);
      if (close < 0) return i;
      i = close;
    }
    return -1;
  }

  /**
   * Parenthesis depth for every character, {@link #QUOTED} inside literals (quotes included).
   * An opening parenthesis carries the depth outside of it.
   */
  public static int[] depthMask(String s) {
    int[] mask = new int[s.length()];
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\'') {
        int close = findClosingQuote(s, i);
        int end = close < 0 ? s.length() - 1 : close;
        for (int j = i; j <= end; j++) mask[j] = QUOTED;
        i = end;
        continue;
      }
      if (c == '(') {
        mask[i] = depth++;
      } else if (c == ')') {
        depth = Math.max(0, depth - 1);
        mask[i] = depth;
      } else {
        mask[i] = depth;
      }
    }
    return mask;
  }

  /** Index of the last {@code (} outside any literal, or -1. */
  public static int lastUnquotedOpen(String s) {
    int last = -1;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\'') {
        int close = findClosingQuote(s, i);
        if (close < 0) break;
        i = close;
      } else if (c == '(') {
        last = i;
      }
    }
    return last;
  }

  /** Splits on {@code delimiter} at depth 0; quotes, parentheses and braces are opaque. */
  public static List<String> splitTopLevel(String s, char delimiter) {
    List<String> out = new ArrayList<>();
    if (s == null || s.isBlank()) return out;
    int depth = 0;
    StringBuilder cur = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\'') {
        int close = findClosingQuote(s, i);
        int end = close < 0 ? s.length() - 1 : close;
        cur.append(s, i, end + 1);
        i = end;
        continue;
      }
      if (c == '(' || c == '{') depth++;
      else if (c == ')' || c == '}') depth--;

      if (c == delimiter && depth == 0) {
        addTrimmed(out, cur);
        cur.setLength(0);
      } else {
        cur.append(c);
      }
    }
    addTrimmed(out, cur);
    return out;
  }

  /** Splits on runs of whitespace at depth 0; quotes, parentheses and braces are opaque. */
  public static List<String> splitWhitespace(String s) {
    List<String> out = new ArrayList<>();
    if (s == null || s.isBlank()) return out;
    int depth = 0;
    StringBuilder cur = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\'') {
        int close = findClosingQuote(s, i);
        int end = close < 0 ? s.length() - 1 : close;
        cur.append(s, i, end + 1);
        i = end;
        continue;
      }
      if (c == '(' || c == '{') depth++;
      else if (c == ')' || c == '}') depth--;

      if (Character.isWhitespace(c) && depth == 0) {
        addTrimmed(out, cur);
        cur.setLength(0);
      } else {
        cur.append(c);
      }
    }
    addTrimmed(out, cur);
    return out;
  }

  /** True when {@code s} is exactly one single-quoted literal. */
  public static boolean isQuoted(String s) {
    if (s == null || s.length() < 2 || s.charAt(0) != '\'') return false;
    return findClosingQuote(s, 0) == s.length() - 1;
  }

  /** Strips one pair of outer quotes and undoubles {@code ''}; other input is returned as-is. */
  public static String unquote(String s) {
    if (!isQuoted(s)) return s;
    return s.substring(1, s.length() - 1).replace("''", "'");
  }

  /** Quotes {@code s} as a literal, doubling embedded quotes. */
  public static String quote(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  /** Removes parentheses that wrap the whole string, repeatedly. */
  public static String stripOuterParens(String s) {
    String cur = s.trim();
    while (cur.length() >= 2 && cur.charAt(0) == '(' && findMatchingClose(cur, 0) == cur.length() - 1) {
      cur = cur.substring(1, cur.length() - 1).trim();
    }
    return cur;
  }

  private static void addTrimmed(List<String> out, StringBuilder cur) {
    String t = cur.toString().trim();
    if (!t.isEmpty()) out.add(t);
  }
}
