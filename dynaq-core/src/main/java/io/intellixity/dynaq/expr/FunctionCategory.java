package io.intellixity.dynaq.expr;

public enum FunctionCategory {
  AGGREGATE,
  NUMERIC,
  STRING,
  NULL_COALESCING,
  DATE
}
