package io.intellixity.dynaq.parse;

import io.intellixity.dynaq.scan.Scanner;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw clause bodies of one DSL string. A keyword only counts at parenthesis depth 0 and outside
 * quotes; the first occurrence of each clause wins. Absent clauses are null.
 */
public record Clauses(String from,
                      String fetch,
                      boolean distinct,
                      String include,
                      String filter,
                      String groupBy,
                      String having,
                      String orderBy,
                      String take,
                      String skip) {
  private static final Pattern FROM =
      Pattern.compile("\\bFROM(?:\\s*\\(\\s*([\\w.\\-]+)\\s*\\)|\\s+([\\w.\\-]+))", Pattern.CASE_INSENSITIVE);
  private static final Pattern FETCH =
      Pattern.compile("\\bFETCH(\\s+DISTINCT|DISTINCT|D)?\\s*\\(", Pattern.CASE_INSENSITIVE);
  private static final Pattern INCLUDE = keyword("INCLUDE");
  private static final Pattern FILTER = keyword("FILTER");
  private static final Pattern GROUP_BY = keyword("GROUPBY");
  private static final Pattern HAVING = keyword("HAVING");
  private static final Pattern ORDER_BY = keyword("ORDERBY");
  private static final Pattern TAKE = keyword("TAKE|LIMIT");
  private static final Pattern SKIP = keyword("SKIP|OFFSET");

  /** Callers check balance first; bodies are located with {@link Scanner#findMatchingClose}. */
  public static Clauses extract(String dsl) {
    int[] mask = Scanner.depthMask(dsl);

    String from = null;
    Matcher fm = FROM.matcher(dsl);
    while (fm.find()) {
      if (mask[fm.start()] != 0) continue;
      from = fm.group(1) != null ? fm.group(1) : fm.group(2);
      break;
    }

    String fetch = null;
    boolean distinct = false;
    Matcher fe = FETCH.matcher(dsl);
    while (fe.find()) {
      if (mask[fe.start()] != 0) continue;
      fetch = body(dsl, fe.end() - 1);
      distinct = fe.group(1) != null;
      break;
    }

    return new Clauses(from, fetch, distinct,
        find(dsl, mask, INCLUDE),
        find(dsl, mask, FILTER),
        find(dsl, mask, GROUP_BY),
        find(dsl, mask, HAVING),
        find(dsl, mask, ORDER_BY),
        find(dsl, mask, TAKE),
        find(dsl, mask, SKIP));
  }

  private static Pattern keyword(String alternatives) {
    return Pattern.compile("\\b(?:" + alternatives + ")\\s*\\(", Pattern.CASE_INSENSITIVE);
  }

  private static String find(String dsl, int[] mask, Pattern p) {
    Matcher m = p.matcher(dsl);
    while (m.find()) {
      if (mask[m.start()] == 0) return body(dsl, m.end() - 1);
    }
    return null;
  }

  private static String body(String dsl, int open) {
    int close = Scanner.findMatchingClose(dsl, open);
    if (close < 0) return dsl.substring(open + 1).trim();
    return dsl.substring(open + 1, close).trim();
  }
}
