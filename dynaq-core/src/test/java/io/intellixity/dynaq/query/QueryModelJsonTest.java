package io.intellixity.dynaq.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.dynaq.parse.DslParser;
import io.intellixity.dynaq.schema.MapSchemaLookup;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QueryModelJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void writesCanonicalShape() throws Exception {
    QueryModel q = QueryModel.builder("users")
        .column("users.name", "n")
        .filter(QueryFilters.or(QueryFilters.eqText("users.status", "A"), QueryFilters.in("users.id", "1", "2")))
        .orderBy("users.name", SortField.Direction.DESC)
        .limit(5)
        .build();

    JsonNode n = JSON.readTree(QueryModelJson.toJson(q));
    assertEquals("users", n.get("table").asText());
    assertEquals("n", n.get("columns").get(0).get("alias").asText());
    assertEquals("OR", n.get("filter").get("logical").asText());
    assertEquals("EQ", n.get("filter").get("left").get("operator").asText());
    assertTrue(n.get("filter").get("left").get("quoted").asBoolean());
    assertEquals(2, n.get("filter").get("right").get("values").size());
    assertEquals("DESC", n.get("orderBy").get(0).get("dir").asText());
    assertEquals(5, n.get("limit").asInt());
    assertFalse(n.has("offset"));
  }

  @Test
  void parsedModelSurvivesJson() {
    DslParser parser = new DslParser(MapSchemaLookup.builder().relate("users", "id", "orders", "user_id").build());
    QueryModel q = parser.parse("FROM users FETCHD(name AS n, COUNT(*)) INCLUDE(orders INNER) "
        + "FILTER(name ICONTAINS 'o''b' OR age BETWEEN (1, 9) AND nick IS NULL) GROUPBY(name) "
        + "HAVING(COUNT(*) > 1) ORDERBY(n) TAKE(3) SKIP(1)");

    assertEquals(q, QueryModelJson.fromJson(QueryModelJson.toJson(q)));
  }

  @Test
  void rejectsUnknownOperator() {
    assertThrows(IllegalArgumentException.class,
        () -> QueryModelJson.fromJson("{\"table\":\"t\",\"filter\":{\"column\":\"t.a\",\"operator\":\"NEAR\",\"value\":\"1\"}}"));
  }
}
