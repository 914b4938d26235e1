package io.intellixity.dynaq.memory;

import io.intellixity.dynaq.query.Column;

import java.util.Map;

/** Row access by column name: the last dot segment is the key, matched exactly then ignoring case. */
final class Rows {
  private Rows() {}

  static Object get(Map<String, Object> row, String column) {
    if (row == null) return null;
    String key = Column.lastSegment(column);
    if (row.containsKey(key)) return row.get(key);
    for (Map.Entry<String, Object> e : row.entrySet()) {
      if (e.getKey().equalsIgnoreCase(key)) return e.getValue();
    }
    return null;
  }
}
