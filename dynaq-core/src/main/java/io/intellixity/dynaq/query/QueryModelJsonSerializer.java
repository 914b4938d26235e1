package io.intellixity.dynaq.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link QueryModel}. */
public final class QueryModelJsonSerializer extends JsonSerializer<QueryModel> {
  @Override
  public void serialize(QueryModel q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("table", q.table());
    if (q.distinct()) g.writeBooleanField("distinct", true);

    g.writeArrayFieldStart("columns");
    for (Column c : q.columns()) {
      g.writeStartObject();
      g.writeStringField("expression", c.expression());
      if (c.hasAlias()) g.writeStringField("alias", c.alias());
      g.writeEndObject();
    }
    g.writeEndArray();

    if (!q.includes().isEmpty()) {
      g.writeArrayFieldStart("includes");
      for (Include inc : q.includes()) {
        g.writeStartObject();
        g.writeStringField("parentTable", inc.parentTable());
        g.writeStringField("parentKey", inc.parentKey());
        g.writeStringField("childTable", inc.childTable());
        g.writeStringField("childKey", inc.childKey());
        g.writeStringField("joinKind", inc.joinKind().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeNode(q.filter(), g);
    }

    if (!q.groupBy().isEmpty()) {
      g.writeArrayFieldStart("groupBy");
      for (String col : q.groupBy()) g.writeString(col);
      g.writeEndArray();
    }

    if (q.having() != null) {
      g.writeFieldName("having");
      writeNode(q.having(), g);
    }

    if (!q.orderBy().isEmpty()) {
      g.writeArrayFieldStart("orderBy");
      for (SortField sf : q.orderBy()) {
        g.writeStartObject();
        g.writeStringField("column", sf.column());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.limit() != null) g.writeNumberField("limit", q.limit());
    if (q.offset() != null) g.writeNumberField("offset", q.offset());
    g.writeEndObject();
  }

  private static void writeNode(FilterNode node, JsonGenerator g) throws IOException {
    if (node instanceof Logical l) {
      g.writeStartObject();
      g.writeStringField("logical", l.clause().name());
      g.writeFieldName("left");
      writeNode(l.left(), g);
      g.writeFieldName("right");
      writeNode(l.right(), g);
      g.writeEndObject();
      return;
    }
    Condition c = (Condition) node;
    g.writeStartObject();
    g.writeStringField("column", c.column());
    g.writeStringField("operator", c.operator().name());
    if (c.value() != null) g.writeStringField("value", c.value());
    if (!c.values().isEmpty()) {
      g.writeArrayFieldStart("values");
      for (String v : c.values()) g.writeString(v);
      g.writeEndArray();
    }
    if (c.quoted()) g.writeBooleanField("quoted", true);
    g.writeEndObject();
  }
}
