package io.intellixity.dynaq.expr;

import io.intellixity.dynaq.error.UnsupportedFunctionException;

import java.util.*;

import static io.intellixity.dynaq.expr.FunctionCategory.*;
import static io.intellixity.dynaq.expr.FunctionDef.UNBOUNDED;

/**
 * The single function catalog consumed by the parser and every renderer. Immutable; names are
 * case-insensitive.
 */
public final class FunctionCatalog {
  private static final FunctionCatalog STANDARD = new FunctionCatalog(List.of(
      def("COUNT", AGGREGATE, 1, 1),
      def("SUM", AGGREGATE, 1, 1),
      def("AVG", AGGREGATE, 1, 1),
      def("MIN", AGGREGATE, 1, 1),
      def("MAX", AGGREGATE, 1, 1),

      def("ABS", NUMERIC, 1, 1),
      def("CEIL", NUMERIC, 1, 1, "CEILING"),
      def("FLOOR", NUMERIC, 1, 1),
      def("ROUND", NUMERIC, 1, 2),
      def("SQRT", NUMERIC, 1, 1),
      def("POWER", NUMERIC, 2, 2),
      def("MOD", NUMERIC, 2, 2),
      def("EXP", NUMERIC, 1, 1),
      def("LOG", NUMERIC, 1, 2),
      def("LN", NUMERIC, 1, 1),
      def("LOG10", NUMERIC, 1, 1),

      def("LENGTH", STRING, 1, 1, "LEN"),
      def("SUBSTRING", STRING, 2, 3, "SUBSTR"),
      def("CONCAT", STRING, 1, UNBOUNDED),
      def("UPPER", STRING, 1, 1),
      def("LOWER", STRING, 1, 1),
      def("TRIM", STRING, 1, 1),
      def("LTRIM", STRING, 1, 1),
      def("RTRIM", STRING, 1, 1),
      def("REPLACE", STRING, 3, 3),
      def("INDEXOF", STRING, 2, 3),
      def("REVERSE", STRING, 1, 1),

      def("COALESCE", NULL_COALESCING, 2, UNBOUNDED, "IFNULL", "ISNULL", "NVL"),

      def("NOW", DATE, 0, 1, "GETDATE", "CURRENT_TIMESTAMP"),
      def("CURRENT_DATE", DATE, 0, 1, "TODAY"),
      def("CURRENT_TIME", DATE, 0, 1, "TIME"),
      new FunctionDef("DATEADD", Set.of(), DATE, 3, 3, true),
      new FunctionDef("DATEDIFF", Set.of(), DATE, 3, 3, true),
      new FunctionDef("DATENAME", Set.of(), DATE, 2, 2, true),
      def("DAY", DATE, 1, 1),
      def("MONTH", DATE, 1, 1),
      def("YEAR", DATE, 1, 1)
  ));

  private final Map<String, FunctionDef> byName;

  public FunctionCatalog(Collection<FunctionDef> defs) {
    Map<String, FunctionDef> m = new HashMap<>();
    for (FunctionDef d : defs) {
      register(m, d.name(), d);
      for (String alias : d.aliases()) register(m, alias, d);
    }
    this.byName = Map.copyOf(m);
  }

  public static FunctionCatalog standard() { return STANDARD; }

  public Optional<FunctionDef> find(String name) {
    if (name == null) return Optional.empty();
    return Optional.ofNullable(byName.get(name.trim().toUpperCase(Locale.ROOT)));
  }

  public FunctionDef require(String name) {
    return find(name).orElseThrow(() -> new UnsupportedFunctionException(name, "Unknown function: " + name));
  }

  public boolean isAggregate(String name) {
    return find(name).map(FunctionDef::isAggregate).orElse(false);
  }

  private static void register(Map<String, FunctionDef> m, String key, FunctionDef d) {
    FunctionDef prev = m.put(key.toUpperCase(Locale.ROOT), d);
    if (prev != null && prev != d) throw new IllegalArgumentException("Duplicate function name: " + key);
  }

  private static FunctionDef def(String name, FunctionCategory category, int min, int max, String... aliases) {
    return new FunctionDef(name, Set.of(aliases), category, min, max, false);
  }
}
