package io.intellixity.dynaq.parse;

import io.intellixity.dynaq.error.SyntaxException;
import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.expr.FunctionCall;
import io.intellixity.dynaq.query.*;
import io.intellixity.dynaq.scan.Scanner;

import java.util.*;

/**
 * Parses FILTER and HAVING bodies into a {@link FilterNode} tree.
 * <p>
 * Parenthesised spans are first replaced by placeholders (innermost first) so that only top-level
 * {@code AND}/{@code OR} separators remain visible. Operands are then folded with AND binding tighter
 * than OR; both folds are left-leaning.
 */
public final class FilterParser {
  private static final char PH_OPEN = '\u0001';
  private static final char PH_CLOSE = '\u0002';

  /** Symbolic operators, longest first. */
  private static final String[] SYMBOLS = {"==", "!=", "<>", "<=", ">=", "=", "<", ">"};

  /** Word operators, longest spelling first within a shared prefix. */
  private static final List<WordOp> WORDS = List.of(
      new WordOp("IS NOT NULL", Operator.IS_NOT_NULL),
      new WordOp("IS NULL", Operator.IS_NULL),
      new WordOp("NOT LIKE", Operator.NOT_LIKE),
      new WordOp("NOT ILIKE", Operator.NOT_ILIKE),
      new WordOp("NOT CONTAINS", Operator.NOT_CONTAINS),
      new WordOp("NOT ICONTAINS", Operator.NOT_ICONTAINS),
      new WordOp("NOT BEGINSWITH", Operator.NOT_BEGINS_WITH),
      new WordOp("NOT IBEGINSWITH", Operator.NOT_IBEGINS_WITH),
      new WordOp("NOT ENDSWITH", Operator.NOT_ENDS_WITH),
      new WordOp("NOT IENDSWITH", Operator.NOT_IENDS_WITH),
      new WordOp("NOT IN", Operator.NOT_IN),
      new WordOp("NOT BETWEEN", Operator.NOT_BETWEEN),
      new WordOp("LIKE", Operator.LIKE),
      new WordOp("ILIKE", Operator.ILIKE),
      new WordOp("CONTAINS", Operator.CONTAINS),
      new WordOp("ICONTAINS", Operator.ICONTAINS),
      new WordOp("BEGINSWITH", Operator.BEGINS_WITH),
      new WordOp("IBEGINSWITH", Operator.IBEGINS_WITH),
      new WordOp("ENDSWITH", Operator.ENDS_WITH),
      new WordOp("IENDSWITH", Operator.IENDS_WITH),
      new WordOp("IN", Operator.IN),
      new WordOp("BETWEEN", Operator.BETWEEN));

  private record WordOp(String text, Operator op) {}

  private record Match(int start, int length, Operator op) {}

  private final ColumnQualifier qualifier;
  private final ExpressionResolver resolver;

  public FilterParser(ColumnQualifier qualifier, ExpressionResolver resolver) {
    this.qualifier = Objects.requireNonNull(qualifier, "qualifier");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  /** FILTER body; aggregates are rejected. */
  public FilterNode parseFilter(String body) {
    return parse(body, false);
  }

  /** HAVING body; aggregates are allowed. */
  public FilterNode parseHaving(String body) {
    return parse(body, true);
  }

  private FilterNode parse(String body, boolean allowAggregates) {
    String s = Scanner.stripOuterParens(body == null ? "" : body);
    if (s.isEmpty()) throw new SyntaxException("Empty filter expression");

    List<String> spans = new ArrayList<>();
    String flat = s;
    int open;
    while ((open = Scanner.lastUnquotedOpen(flat)) >= 0) {
      int close = Scanner.findMatchingClose(flat, open);
      if (close < 0) throw new SyntaxException("Query string has unbalanced parentheses.");
      spans.add(flat.substring(open, close + 1));
      flat = flat.substring(0, open) + PH_OPEN + (spans.size() - 1) + PH_CLOSE + flat.substring(close + 1);
    }

    List<String> operands = new ArrayList<>();
    List<Clause> separators = new ArrayList<>();
    splitLogical(flat, operands, separators);

    if (operands.size() == 1) return parseCondition(s, allowAggregates);

    List<FilterNode> nodes = new ArrayList<>(operands.size());
    for (String op : operands) {
      String expanded = expand(op, spans).trim();
      if (expanded.isEmpty()) throw new SyntaxException("Could not parse logical filter expression: " + s);
      nodes.add(parse(expanded, allowAggregates));
    }
    return fold(nodes, separators);
  }

  /** AND pairs first, then OR pairs, each left to right. */
  private static FilterNode fold(List<FilterNode> nodes, List<Clause> separators) {
    List<FilterNode> ored = new ArrayList<>();
    FilterNode acc = nodes.get(0);
    for (int i = 0; i < separators.size(); i++) {
      FilterNode next = nodes.get(i + 1);
      if (separators.get(i) == Clause.AND) {
        acc = new Logical(Clause.AND, acc, next);
      } else {
        ored.add(acc);
        acc = next;
      }
    }
    ored.add(acc);

    FilterNode out = ored.get(0);
    for (int i = 1; i < ored.size(); i++) out = new Logical(Clause.OR, out, ored.get(i));
    return out;
  }

  private static void splitLogical(String flat, List<String> operands, List<Clause> separators) {
    int start = 0;
    int i = 0;
    while (i < flat.length()) {
      char c = flat.charAt(i);
      if (c == '\'') {
        int close = Scanner.findClosingQuote(flat, i);
        if (close < 0) break;
        i = close + 1;
        continue;
      }
      Clause sep = separatorAt(flat, i);
      if (sep != null) {
        operands.add(flat.substring(start, i));
        separators.add(sep);
        i += sep == Clause.AND ? 3 : 2;
        start = i;
        continue;
      }
      i++;
    }
    operands.add(flat.substring(start));
  }

  private static Clause separatorAt(String s, int i) {
    Clause sep;
    int len;
    if (s.regionMatches(true, i, "AND", 0, 3)) {
      sep = Clause.AND;
      len = 3;
    } else if (s.regionMatches(true, i, "OR", 0, 2)) {
      sep = Clause.OR;
      len = 2;
    } else {
      return null;
    }
    if (i > 0 && !isBoundary(s.charAt(i - 1))) return null;
    if (i + len < s.length() && !isBoundary(s.charAt(i + len))) return null;
    return sep;
  }

  private static boolean isBoundary(char c) {
    return Character.isWhitespace(c) || c == '(' || c == ')' || c == '\'' || c == PH_OPEN || c == PH_CLOSE;
  }

  private static String expand(String s, List<String> spans) {
    String out = s;
    while (out.indexOf(PH_OPEN) >= 0) {
      int a = out.indexOf(PH_OPEN);
      int b = out.indexOf(PH_CLOSE, a);
      int idx = Integer.parseInt(out.substring(a + 1, b));
      out = out.substring(0, a) + spans.get(idx) + out.substring(b + 1);
    }
    return out;
  }

  // ---------------- condition leaf ----------------

  private Condition parseCondition(String text, boolean allowAggregates) {
    String leaf = Scanner.stripOuterParens(text);
    Match m = findOperator(leaf);
    if (m == null) throw new SyntaxException("Could not parse condition: '" + leaf + "'");

    String lhs = leaf.substring(0, m.start()).trim();
    String rhs = leaf.substring(m.start() + m.length()).trim();
    if (lhs.isEmpty()) throw new SyntaxException("Could not parse condition: '" + leaf + "'");

    String column = qualifier.qualify(lhs);
    if (!allowAggregates) rejectAggregate(column);

    Operator op = m.op();
    switch (op.family()) {
      case NULL_CHECK -> {
        if (!rhs.isEmpty()) throw new SyntaxException("Could not parse condition: '" + leaf + "'");
        return new Condition(column, op, null, null, false);
      }
      case MEMBERSHIP, RANGE -> {
        List<String> items = listItems(rhs, op, leaf);
        List<String> qualified = new ArrayList<>(items.size());
        for (String item : items) qualified.add(valueText(item, allowAggregates));
        return new Condition(column, op, null, qualified, false);
      }
      default -> {
        if (rhs.isEmpty()) throw new SyntaxException("Could not parse condition: '" + leaf + "'");
        if (Scanner.isQuoted(rhs)) return new Condition(column, op, Scanner.unquote(rhs), null, true);
        if (rhs.equalsIgnoreCase("NULL") && op == Operator.EQ) return Condition.isNull(column);
        if (rhs.equalsIgnoreCase("NULL") && op == Operator.NEQ) return Condition.isNotNull(column);
        return new Condition(column, op, valueText(rhs, allowAggregates), null, false);
      }
    }
  }

  /** Unquoted functions and column paths are qualified; everything else is kept verbatim. */
  private String valueText(String raw, boolean allowAggregates) {
    if (ExpressionResolver.isColumnPath(raw)) return qualifier.qualify(raw);
    if (ExpressionResolver.functionSyntax(raw) == null) return raw;
    String q = qualifier.qualify(raw);
    if (!allowAggregates) rejectAggregate(q);
    return q;
  }

  private void rejectAggregate(String expression) {
    if (ExpressionResolver.functionSyntax(expression) == null) return;
    FunctionCall agg = ExpressionResolver.firstAggregate(resolver.classify(expression));
    if (agg != null) {
      throw new UnsupportedFunctionException(agg.name(),
          "Aggregate function " + agg.name() + " is not allowed in FILTER");
    }
  }

  private static List<String> listItems(String rhs, Operator op, String leaf) {
    if (rhs.isEmpty() || rhs.charAt(0) != '(' || Scanner.findMatchingClose(rhs, 0) != rhs.length() - 1) {
      throw new SyntaxException(op.keyword() + " requires a parenthesised value list: '" + leaf + "'");
    }
    List<String> items = Scanner.splitTopLevel(rhs.substring(1, rhs.length() - 1), ',');
    if (op.family() == Operator.Family.RANGE && items.size() != 2) {
      throw new SyntaxException(op.keyword() + " requires exactly two bounds: '" + leaf + "'");
    }
    if (items.isEmpty()) throw new SyntaxException(op.keyword() + " requires at least one value: '" + leaf + "'");
    return items;
  }

  /** First operator at depth 0 outside quotes; position 0 never holds one. */
  private static Match findOperator(String leaf) {
    int[] mask = Scanner.depthMask(leaf);
    for (int i = 1; i < leaf.length(); i++) {
      if (mask[i] != 0) continue;
      for (String sym : SYMBOLS) {
        if (leaf.startsWith(sym, i)) return new Match(i, sym.length(), symbolOperator(sym));
      }
      if (!Character.isWhitespace(leaf.charAt(i - 1)) && leaf.charAt(i - 1) != ')') continue;
      for (WordOp w : WORDS) {
        int end = wordEnd(leaf, i, w.text());
        if (end > 0) return new Match(i, end - i, w.op());
      }
    }
    return null;
  }

  /** End index of {@code word} at {@code i} (any whitespace between its parts), or -1. */
  private static int wordEnd(String s, int i, String word) {
    String[] parts = word.split(" ");
    int pos = i;
    for (int p = 0; p < parts.length; p++) {
      if (p > 0) {
        int ws = pos;
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        if (pos == ws) return -1;
      }
      if (!s.regionMatches(true, pos, parts[p], 0, parts[p].length())) return -1;
      pos += parts[p].length();
    }
    if (pos == s.length()) return pos;
    char next = s.charAt(pos);
    return (Character.isWhitespace(next) || next == '(' || next == '\'') ? pos : -1;
  }

  private static Operator symbolOperator(String sym) {
    return switch (sym) {
      case "=", "==" -> Operator.EQ;
      case "!=", "<>" -> Operator.NEQ;
      case "<" -> Operator.LT;
      case "<=" -> Operator.LTE;
      case ">" -> Operator.GT;
      case ">=" -> Operator.GTE;
      default -> throw new IllegalArgumentException(sym);
    };
  }
}
