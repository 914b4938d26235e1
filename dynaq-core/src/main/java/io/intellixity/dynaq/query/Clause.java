package io.intellixity.dynaq.query;

public enum Clause {
  AND,
  OR
}
