package io.intellixity.dynaq.expr;

import io.intellixity.dynaq.error.SyntaxException;
import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.scan.Scanner;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies tokens into {@link Literal}, {@link ColumnRef} or {@link FunctionCall}, validating
 * function names and arities against the {@link FunctionCatalog}.
 */
public final class ExpressionResolver {
  private static final Pattern COLUMN_PATH = Pattern.compile("[A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)+");
  private static final Pattern FUNCTION_HEAD = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\s*\\(");
  private static final ExpressionResolver STANDARD = new ExpressionResolver(FunctionCatalog.standard());

  private final FunctionCatalog catalog;

  public ExpressionResolver(FunctionCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "catalog");
  }

  public static ExpressionResolver standard() { return STANDARD; }

  public FunctionCatalog catalog() { return catalog; }

  /** Name and argument text of a call spanning the whole token. */
  public record FunctionSyntax(String name, String inner) {}

  public static FunctionSyntax functionSyntax(String token) {
    if (token == null) return null;
    String s = token.trim();
    Matcher m = FUNCTION_HEAD.matcher(s);
    if (!m.find()) return null;
    int open = m.end() - 1;
    int close = Scanner.findMatchingClose(s, open);
    if (close != s.length() - 1) return null;
    return new FunctionSyntax(m.group(1).toUpperCase(Locale.ROOT), s.substring(open + 1, close).trim());
  }

  /** Classifies a token in column position: bare words are column references. */
  public Expression classify(String token) {
    String s = token == null ? "" : token.trim();
    if (s.isEmpty()) throw new SyntaxException("Empty expression");
    if (s.equals("*")) return new ColumnRef(null, "*");
    if (Scanner.isQuoted(s)) return quotedLiteral(Scanner.unquote(s));

    Literal lit = Values.literalOf(s);
    if (lit != null) return lit;

    FunctionSyntax fs = functionSyntax(s);
    if (fs != null) return function(fs);

    return columnRef(s);
  }

  /**
   * Classifies the right-hand side of a condition: a dotted path ({@code orders.total}) is a column
   * reference, other bare words are text.
   */
  public Expression classifyValue(String raw, boolean quoted) {
    if (raw == null) return new Literal(Literal.Type.NULL, null);
    if (quoted) return quotedLiteral(raw);
    String s = raw.trim();
    Literal lit = Values.literalOf(s);
    if (lit != null) return lit;
    FunctionSyntax fs = functionSyntax(s);
    if (fs != null) return function(fs);
    if (isColumnPath(s)) return columnRef(s);
    return Literal.string(s);
  }

  /** {@code a.b} or longer identifier path. */
  public static boolean isColumnPath(String s) {
    return s != null && COLUMN_PATH.matcher(s.trim()).matches();
  }

  /**
   * Classifies one IN/BETWEEN item. Items keep their quotes in the model, so a quoted item is text
   * and an unquoted one follows {@link #classifyValue(String, boolean)}.
   */
  public Expression classifyItem(String raw) {
    String s = raw == null ? "" : raw.trim();
    if (Scanner.isQuoted(s)) return quotedLiteral(Scanner.unquote(s));
    return classifyValue(s, false);
  }

  /** First aggregate call found depth-first in {@code e}, or null. */
  public static FunctionCall firstAggregate(Expression e) {
    if (!(e instanceof FunctionCall fc)) return null;
    if (fc.def().isAggregate()) return fc;
    for (Expression a : fc.args()) {
      FunctionCall found = firstAggregate(a);
      if (found != null) return found;
    }
    return null;
  }

  public FunctionCall function(FunctionSyntax fs) {
    FunctionDef def = catalog.require(fs.name());
    List<String> rawArgs = Scanner.splitTopLevel(fs.inner(), ',');
    def.checkArity(rawArgs.size(), fs.name());

    List<Expression> args = new ArrayList<>(rawArgs.size());
    for (int i = 0; i < rawArgs.size(); i++) {
      String a = rawArgs.get(i);
      if (i == 0 && def.leadingDatePart()) {
        args.add(Literal.string(DatePart.require(a, fs.name()).lower()));
      } else {
        args.add(classify(a));
      }
    }
    FunctionCall call = new FunctionCall(def, fs.name(), args);
    validate(call);
    return call;
  }

  private static void validate(FunctionCall call) {
    String name = call.def().name();
    if (name.equals("SUBSTRING")) {
      for (int i = 1; i < call.arity(); i++) {
        if (!(call.arg(i) instanceof Literal l) || (l.type() != Literal.Type.INTEGER && l.type() != Literal.Type.LONG)) {
          throw new UnsupportedFunctionException(call.name(), call.name() + " requires integer start and length");
        }
      }
    }
    if (call.def().isAggregate() && call.arg(0) instanceof ColumnRef c && c.isStar() && !name.equals("COUNT")) {
      throw new UnsupportedFunctionException(call.name(), call.name() + " does not accept *");
    }
  }

  private static Literal quotedLiteral(String text) {
    if (!Values.isValidTemporal(text)) return Literal.string(text);
    return new Literal(Values.isDate(text) ? Literal.Type.DATE : Literal.Type.TIMESTAMP, text);
  }

  private static ColumnRef columnRef(String s) {
    String[] parts = s.split("\\.");
    if (parts.length == 1) return new ColumnRef(null, s);
    return new ColumnRef(parts[parts.length - 2], parts[parts.length - 1]);
  }
}
