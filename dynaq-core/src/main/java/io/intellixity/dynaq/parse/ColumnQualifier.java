package io.intellixity.dynaq.parse;

import io.intellixity.dynaq.expr.ExpressionResolver;
import io.intellixity.dynaq.expr.FunctionDef;
import io.intellixity.dynaq.expr.Values;
import io.intellixity.dynaq.scan.Scanner;

import java.util.*;

/**
 * Table-qualifies column names relative to the root table.
 * <ul>
 *   <li>{@code *}, numbers, booleans and quoted text pass through</li>
 *   <li>FETCH aliases pass through (case-insensitive)</li>
 *   <li>functions are validated and their arguments qualified; the name is upper-cased</li>
 *   <li>{@code col} becomes {@code table.col}; {@code a.b.c} keeps its last two segments</li>
 * </ul>
 * Qualifying an already qualified expression returns it unchanged.
 */
public final class ColumnQualifier {
  private final String table;
  private final Set<String> aliases;
  private final ExpressionResolver resolver;

  public ColumnQualifier(String table, Collection<String> aliases, ExpressionResolver resolver) {
    this.table = Objects.requireNonNull(table, "table");
    Set<String> a = new HashSet<>();
    if (aliases != null) for (String s : aliases) a.add(s.toLowerCase(Locale.ROOT));
    this.aliases = Set.copyOf(a);
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  public String table() { return table; }

  public boolean isAlias(String name) {
    return name != null && aliases.contains(name.trim().toLowerCase(Locale.ROOT));
  }

  public String qualify(String expression) {
    String s = expression == null ? "" : expression.trim();
    if (s.isEmpty() || s.equals("*")) return s;
    if (Scanner.isQuoted(s)) return s;
    if (Values.literalOf(s) != null) return s;
    if (isAlias(s)) return s;

    ExpressionResolver.FunctionSyntax fs = ExpressionResolver.functionSyntax(s);
    if (fs != null) return qualifyFunction(fs);

    String[] parts = s.split("\\.");
    if (parts.length == 1) return table + "." + s;
    return parts[parts.length - 2] + "." + parts[parts.length - 1];
  }

  private String qualifyFunction(ExpressionResolver.FunctionSyntax fs) {
    FunctionDef def = resolver.catalog().require(fs.name());
    List<String> args = Scanner.splitTopLevel(fs.inner(), ',');
    def.checkArity(args.size(), fs.name());

    List<String> out = new ArrayList<>(args.size());
    for (int i = 0; i < args.size(); i++) {
      if (i == 0 && def.leadingDatePart()) out.add(args.get(i).trim());
      else out.add(qualify(args.get(i)));
    }
    String rebuilt = fs.name() + "(" + String.join(", ", out) + ")";
    // full validation: date parts, SUBSTRING bounds, '*' placement
    resolver.function(ExpressionResolver.functionSyntax(rebuilt));
    return rebuilt;
  }
}
