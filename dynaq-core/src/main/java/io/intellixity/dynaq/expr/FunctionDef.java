package io.intellixity.dynaq.expr;

import io.intellixity.dynaq.error.UnsupportedFunctionException;

import java.util.Objects;
import java.util.Set;

/**
 * Catalog entry. {@code maxArgs} is {@link #UNBOUNDED} for variadic functions.
 * {@code leadingDatePart} marks functions whose first argument is a {@link DatePart} keyword.
 */
public record FunctionDef(String name,
                          Set<String> aliases,
                          FunctionCategory category,
                          int minArgs,
                          int maxArgs,
                          boolean leadingDatePart) {
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  public FunctionDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(category, "category");
    aliases = Set.copyOf(aliases == null ? Set.of() : aliases);
    if (minArgs < 0 || maxArgs < minArgs) throw new IllegalArgumentException("bad arity for " + name);
  }

  public boolean isAggregate() { return category == FunctionCategory.AGGREGATE; }

  public void checkArity(int count, String usedName) {
    if (count >= minArgs && count <= maxArgs) return;
    throw new UnsupportedFunctionException(usedName, usedName + " requires " + arityText());
  }

  String arityText() {
    if (maxArgs == UNBOUNDED) return "at least " + plural(minArgs);
    if (minArgs == maxArgs) return plural(minArgs);
    if (maxArgs == minArgs + 1) return minArgs + " or " + plural(maxArgs);
    return minArgs + " to " + plural(maxArgs);
  }

  private static String plural(int n) {
    return n + (n == 1 ? " argument" : " arguments");
  }
}
