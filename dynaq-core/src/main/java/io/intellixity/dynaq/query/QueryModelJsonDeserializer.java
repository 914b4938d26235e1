package io.intellixity.dynaq.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link QueryModel}. */
public final class QueryModelJsonDeserializer extends JsonDeserializer<QueryModel> {
  @Override
  public QueryModel deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("QueryModel JSON must be an object");

    String table = textOrNull(root.get("table"));
    if (table == null) throw new IllegalArgumentException("QueryModel JSON requires 'table'");

    List<Column> columns = new ArrayList<>();
    JsonNode cols = root.get("columns");
    if (cols != null && cols.isArray()) {
      for (JsonNode c : cols) {
        String expr = textOrNull(c.get("expression"));
        if (expr != null) columns.add(new Column(expr, textOrNull(c.get("alias"))));
      }
    }

    List<Include> includes = new ArrayList<>();
    JsonNode incs = root.get("includes");
    if (incs != null && incs.isArray()) {
      for (JsonNode i : incs) {
        includes.add(new Include(
            textOrNull(i.get("parentTable")),
            textOrNull(i.get("parentKey")),
            textOrNull(i.get("childTable")),
            textOrNull(i.get("childKey")),
            JoinKind.parse(textOrNull(i.get("joinKind")))));
      }
    }

    List<SortField> orderBy = new ArrayList<>();
    JsonNode sort = root.get("orderBy");
    if (sort != null && sort.isArray()) {
      for (JsonNode s : sort) {
        String col = textOrNull(s.get("column"));
        if (col == null) continue;
        String dir = textOrNull(s.get("dir"));
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        orderBy.add(new SortField(col, d));
      }
    }

    return new QueryModel(
        table,
        columns,
        root.path("distinct").asBoolean(false),
        includes,
        parseNode(root.get("filter")),
        textList(root.get("groupBy")),
        parseNode(root.get("having")),
        orderBy,
        intOrNull(root.get("limit")),
        intOrNull(root.get("offset")));
  }

  static FilterNode parseNode(JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new IllegalArgumentException("Filter node must be an object");
    if (n.has("logical")) {
      Clause clause = Clause.valueOf(n.get("logical").asText().toUpperCase(Locale.ROOT));
      return new Logical(clause, parseNode(n.get("left")), parseNode(n.get("right")));
    }
    String column = textOrNull(n.get("column"));
    String op = textOrNull(n.get("operator"));
    if (column == null || op == null) {
      throw new IllegalArgumentException("Condition node requires 'column' and 'operator'");
    }
    return new Condition(
        column,
        Operator.valueOf(op.toUpperCase(Locale.ROOT)),
        textOrNull(n.get("value")),
        textList(n.get("values")),
        n.path("quoted").asBoolean(false));
  }

  private static List<String> textList(JsonNode n) {
    List<String> out = new ArrayList<>();
    if (n == null || !n.isArray()) return out;
    for (JsonNode x : n) if (x.isValueNode() && !x.isNull()) out.add(x.asText());
    return out;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Integer intOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asInt();
  }
}
