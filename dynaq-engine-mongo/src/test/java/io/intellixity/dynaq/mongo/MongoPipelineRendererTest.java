package io.intellixity.dynaq.mongo;

import io.intellixity.dynaq.error.RenderException;
import io.intellixity.dynaq.error.UnsupportedFunctionException;
import io.intellixity.dynaq.error.UnsupportedOperatorException;
import io.intellixity.dynaq.expr.Literal;
import io.intellixity.dynaq.parse.DslParser;
import io.intellixity.dynaq.schema.MapSchemaLookup;
import io.intellixity.dynaq.schema.SchemaLookup;
import io.intellixity.dynaq.spi.render.Rendered;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

final class MongoPipelineRendererTest {
  private final MongoPipelineRenderer r = new MongoPipelineRenderer();

  private Rendered<MongoPipeline> render(String dsl) {
    return r.render(new DslParser(SchemaLookup.NONE).parse(dsl));
  }

  private MongoPipeline pipeline(String dsl) {
    return render(dsl).artifact();
  }

  private static Document doc(String key, Object value) {
    return new Document(key, value);
  }

  private static List<Object> list(Object... items) {
    return Arrays.asList(items);
  }

  private static Document present(String field) {
    return doc("$ne", list(doc("$ifNull", list(field, null)), null));
  }

  /** Second operand of the {@code $and} that pairs a predicate with its presence check. */
  private Document guarded(String dsl, String field) {
    Document and = (Document) ((Document) pipeline(dsl).stage("$match")).get("$expr");
    List<?> parts = (List<?>) and.get("$and");
    assertEquals(2, parts.size(), and.toJson());
    assertEquals(present(field), parts.get(0));
    return (Document) parts.get(1);
  }

  @Test
  void emitsStagesInOrder() {
    MongoPipeline p = pipeline("FROM users FETCH(name, COUNT(*) AS cnt) FILTER(age >= 18) GROUPBY(name) "
        + "HAVING(cnt > 1) ORDERBY(cnt DESC) TAKE(10) SKIP(5)");
    assertEquals("users", p.collection());
    assertEquals(List.of("$match", "$group", "$addFields", "$match", "$project", "$sort", "$skip", "$limit"), p.operators());

    assertEquals(doc("$expr", doc("$gte", list("$age", 18))), p.stages().get(0).get("$match"));
    assertEquals(doc("_id", doc("name", "$name")).append("cnt", doc("$sum", 1)), p.stage("$group"));
    assertEquals(doc("name", "$_id.name"), p.stage("$addFields"));
    assertEquals(doc("$expr", doc("$gt", list("$cnt", 1))), p.stages().get(3).get("$match"));
    assertEquals(doc("_id", 0).append("name", "$name").append("cnt", "$cnt"), p.stage("$project"));
    assertEquals(doc("cnt", -1), p.stage("$sort"));
    assertEquals(5, p.stage("$skip"));
    assertEquals(10, p.stage("$limit"));
  }

  @Test
  void selectAllElidesEmptyStages() {
    MongoPipeline p = pipeline("FROM users");
    assertTrue(p.stages().isEmpty());
    assertEquals("users.aggregate([])", p.toString());
  }

  @Test
  void includesBecomeLookupAndUnwind() {
    DslParser parser = new DslParser(MapSchemaLookup.builder().relate("users", "id", "orders", "user_id").build());
    MongoPipeline p = r.render(parser.parse("FROM users INCLUDE(orders LEFT) FETCH(name, orders.total)")).artifact();
    assertEquals(List.of("$lookup", "$unwind", "$project"), p.operators());
    assertEquals(doc("from", "orders").append("localField", "id").append("foreignField", "user_id").append("as", "orders"),
        p.stage("$lookup"));
    assertEquals(doc("path", "$orders").append("preserveNullAndEmptyArrays", true), p.stage("$unwind"));
    assertEquals(doc("_id", 0).append("name", "$name").append("total", "$orders.total"), p.stage("$project"));
  }

  @Test
  void innerIncludeDropsUnmatchedRows() {
    DslParser parser = new DslParser(MapSchemaLookup.builder().relate("users", "id", "orders", "user_id").build());
    MongoPipeline p = r.render(parser.parse("FROM users INCLUDE(orders INNER)")).artifact();
    assertEquals(doc("path", "$orders").append("preserveNullAndEmptyArrays", false), p.stage("$unwind"));
  }

  @Test
  void rightAndFullJoinsAreRejected() {
    DslParser parser = new DslParser(MapSchemaLookup.builder().relate("users", "id", "orders", "user_id").build());
    UnsupportedOperatorException e = assertThrows(UnsupportedOperatorException.class,
        () -> r.render(parser.parse("FROM users INCLUDE(orders RIGHT)")));
    assertEquals("RIGHT JOIN", e.operator());
    assertEquals("mongo", e.target());
  }

  @Test
  void functionsBecomeNamedComputedFieldsAndAreReused() {
    MongoPipeline p = pipeline("FROM users FETCH(UPPER(name), LOWER(name) AS low) FILTER(UPPER(name) = 'BOB')");
    assertEquals(List.of("$addFields", "$match", "$project"), p.operators());
    assertEquals(doc("UPPER_1", doc("$toUpper", "$name")).append("low", doc("$toLower", "$name")), p.stage("$addFields"));
    assertEquals(doc("$expr", doc("$eq", list("$UPPER_1", "BOB"))), p.stage("$match"));
    assertEquals(doc("_id", 0).append("upper_users_name_", "$UPPER_1").append("low", "$low"), p.stage("$project"));
  }

  @Test
  void computedFieldNeverShadowsAReadColumn() {
    MongoPipeline p = pipeline("FROM users FETCH(UPPER(name) AS name)");
    assertEquals(doc("UPPER_1", doc("$toUpper", "$name")), p.stage("$addFields"));
    assertEquals(doc("_id", 0).append("name", "$UPPER_1"), p.stage("$project"));
  }

  @Test
  void groupIdHoldsExactlyTheGroupKeys() {
    MongoPipeline p = pipeline("FROM users FETCH(status, SUM(age) AS total, COUNT(*)) GROUPBY(status)");
    Document group = (Document) p.stage("$group");
    assertEquals(doc("status", "$status"), group.get("_id"));
    assertEquals(List.of("_id", "total", "COUNT_1"), List.copyOf(group.keySet()));
    assertEquals(doc("$sum", "$age"), group.get("total"));
    assertEquals(doc("$sum", 1), group.get("COUNT_1"));
    assertEquals(doc("_id", 0).append("status", "$status").append("total", "$total").append("count_a_", "$COUNT_1"),
        p.stage("$project"));
  }

  @Test
  void aggregateWithoutGroupByUsesNullId() {
    MongoPipeline p = pipeline("FROM users FETCH(COUNT(*) AS n)");
    assertEquals(List.of("$group", "$project"), p.operators());
    assertEquals(doc("_id", null).append("n", doc("$sum", 1)), p.stage("$group"));
  }

  @Test
  void countOfColumnSkipsNullsOnly() {
    MongoPipeline p = pipeline("FROM users FETCH(COUNT(nick) AS c)");
    Document notNull = doc("$eq", list(doc("$ifNull", list("$nick", null)), null));
    assertEquals(doc("$sum", doc("$cond", list(notNull, 0, 1))), ((Document) p.stage("$group")).get("c"));
  }

  @Test
  void aggregateOutsideGroupContextFails() {
    RenderException e = assertThrows(RenderException.class,
        () -> render("FROM users FETCH(name) ORDERBY(COUNT(*) DESC)"));
    assertEquals("mongo", e.target());
    assertTrue(e.getMessage().contains("group context"), e.getMessage());
  }

  @Test
  void ungroupedColumnAfterGroupFails() {
    RenderException e = assertThrows(RenderException.class,
        () -> render("FROM users FETCH(name, COUNT(*)) GROUPBY(status)"));
    assertTrue(e.getMessage().contains("must appear in GROUPBY"), e.getMessage());
  }

  @Test
  void distinctGroupsOnFetchedColumns() {
    Rendered<MongoPipeline> rendered = render("FROM users FETCH DISTINCT(status)");
    MongoPipeline p = rendered.artifact();
    assertEquals(List.of("$group", "$addFields", "$project"), p.operators());
    assertEquals(doc("_id", doc("status", "$status")), p.stage("$group"));
    assertFalse(rendered.hasWarnings());
  }

  @Test
  void distinctWithGroupByWarns() {
    Rendered<MongoPipeline> rendered = render("FROM users FETCH DISTINCT(status) GROUPBY(status)");
    assertTrue(rendered.hasWarnings());
  }

  @Test
  void sortOnDroppedFieldRunsBeforeProjection() {
    MongoPipeline p = pipeline("FROM users FETCH(name) ORDERBY(age DESC) TAKE(3)");
    assertEquals(List.of("$sort", "$project", "$limit"), p.operators());
    assertEquals(doc("age", -1), p.stage("$sort"));
  }

  @Test
  void takeZeroMatchesNothing() {
    MongoPipeline p = pipeline("FROM users TAKE(0)");
    assertEquals(List.of("$match"), p.operators());
    assertEquals(doc("$expr", false), p.stage("$match"));
  }

  @Test
  void patternOperatorsUseRegexMatch() {
    assertEquals(doc("$expr", doc("$regexMatch", doc("input", "$name").append("regex", "^" + Pattern.quote("a") + ".*$")
            .append("options", "i"))),
        pipeline("FROM users FILTER(name ILIKE 'a%')").stage("$match"));
    assertEquals(doc("$expr", doc("$and", list(present("$name"), doc("$not", list(doc("$regexMatch", doc("input", "$name")
            .append("regex", Pattern.quote("x")).append("options", ""))))))),
        pipeline("FROM users FILTER(name NOT CONTAINS 'x')").stage("$match"));
    assertEquals(doc("$expr", doc("$regexMatch", doc("input", "$name").append("regex", Pattern.quote("son") + "$")
            .append("options", ""))),
        pipeline("FROM users FILTER(name ENDSWITH 'son')").stage("$match"));
  }

  @Test
  void likeRegexQuotesLiteralRuns() {
    assertEquals("^" + Pattern.quote("a.b") + "." + Pattern.quote("c") + ".*$", MongoPredicates.likeRegex("a.b_c%"));
    assertTrue(Pattern.matches(MongoPredicates.likeRegex("J%n_"), "Jonny"));
    assertFalse(Pattern.matches(MongoPredicates.likeRegex("J%n_"), "Jon"));
  }

  @Test
  void columnRightHandSideUsesIndexOf() {
    assertEquals(doc("$expr", doc("$eq", list(doc("$indexOfCP", list(doc("$toLower", "$name"), doc("$toLower", "$nick"))), 0))),
        pipeline("FROM users FILTER(name IBEGINSWITH users.nick)").stage("$match"));
  }

  @Test
  void negatedOperatorsExcludeNullFields() {
    assertEquals(doc("$ne", list("$nick", "x")), guarded("FROM users FILTER(nick != 'x')", "$nick"));
    assertEquals(doc("$not", list(doc("$in", list("$nick", list("x"))))), guarded("FROM users FILTER(nick NOT IN ('x'))", "$nick"));
    assertEquals(doc("$or", list(doc("$lt", list("$age", 1)), doc("$gt", list("$age", 2)))),
        guarded("FROM users FILTER(age NOT BETWEEN (1, 2))", "$age"));
    assertEquals("$not", guarded("FROM users FILTER(nick NOT LIKE 'x%')", "$nick").keySet().iterator().next());
    assertEquals("$not", guarded("FROM users FILTER(nick NOT ICONTAINS 'x')", "$nick").keySet().iterator().next());
    assertEquals("$not", guarded("FROM users FILTER(nick NOT BEGINSWITH 'x')", "$nick").keySet().iterator().next());
    assertEquals("$not", guarded("FROM users FILTER(nick NOT IENDSWITH 'x')", "$nick").keySet().iterator().next());
  }

  @Test
  void positiveOperatorsCarryNoPresenceCheck() {
    assertEquals(doc("$expr", doc("$eq", list("$nick", "x"))), pipeline("FROM users FILTER(nick = 'x')").stage("$match"));
  }

  @Test
  void upperBoundsExcludeNull() {
    assertEquals(doc("$expr", doc("$and", list(doc("$gt", list("$age", null)), doc("$lt", list("$age", 30))))),
        pipeline("FROM users FILTER(age < 30)").stage("$match"));
  }

  @Test
  void nullChecksMembershipAndRanges() {
    Document isNull = doc("$eq", list(doc("$ifNull", list("$nick", null)), null));
    Document statusPresent = doc("$ne", list(doc("$ifNull", list("$status", null)), null));
    Document notIn = doc("$and", list(statusPresent, doc("$not", list(doc("$in", list("$status", list("A", "B")))))));
    assertEquals(doc("$expr", doc("$or", list(isNull, notIn))),
        pipeline("FROM users FILTER(nick IS NULL OR status NOT IN ('A', 'B'))").stage("$match"));
    assertEquals(doc("$expr", doc("$and", list(doc("$gte", list("$age", 18)), doc("$lte", list("$age", 65))))),
        pipeline("FROM users FILTER(age BETWEEN (18, 65))").stage("$match"));
  }

  @Test
  void impossibleDateStaysText() {
    assertEquals(doc("$expr", doc("$eq", list("$created", "2023-02-30"))),
        pipeline("FROM users FILTER(created = '2023-02-30')").stage("$match"));
    assertEquals(doc("$expr", doc("$eq", list("$created", new Date(1675036800000L)))),
        pipeline("FROM users FILTER(created = '2023-01-30')").stage("$match"));
    assertThrows(RenderException.class,
        () -> MongoFunctions.literal(new Literal(Literal.Type.DATE, "2023-02-30")));
  }

  @Test
  void dollarTextIsLiteral() {
    assertEquals(doc("$expr", doc("$eq", list("$name", doc("$literal", "$x")))),
        pipeline("FROM users FILTER(name = '$x')").stage("$match"));
  }

  @Test
  void functionMapping() {
    Document computed = (Document) pipeline("FROM users FETCH(SUBSTRING(name, 1) AS s, ROUND(score) AS r, "
        + "DATEADD(month, created, 2) AS d, COALESCE(nick, name, 'x') AS c)").stage("$addFields");
    assertEquals(doc("$substrCP", list("$name", 1, MongoFunctions.TO_END)), computed.get("s"));
    assertEquals(doc("$round", list("$score", 0)), computed.get("r"));
    assertEquals(doc("$dateAdd", doc("startDate", "$created").append("unit", "month").append("amount", 2)), computed.get("d"));
    assertEquals(doc("$ifNull", list("$nick", doc("$ifNull", list("$name", "x")))), computed.get("c"));
  }

  @Test
  void dateNameOfQuarterIsComputed() {
    Document computed = (Document) pipeline("FROM users FETCH(DATENAME(quarter, created) AS q)").stage("$addFields");
    assertEquals(doc("$toString", doc("$ceil", doc("$divide", list(doc("$month", "$created"), 3)))), computed.get("q"));
  }

  @Test
  void literalsInFetchAreWrapped() {
    assertEquals(doc("_id", 0).append("one", doc("$literal", 1)), pipeline("FROM users FETCH(1 AS one)").stage("$project"));
  }

  @Test
  void rendersJson() {
    MongoPipeline p = pipeline("FROM users FETCH(name) TAKE(1)");
    assertEquals("[{\"$project\": {\"_id\": 0, \"name\": \"$name\"}}, {\"$limit\": 1}]", p.toJson());
  }

  @Test
  void mapsEveryCatalogFunctionOrRejects() {
    assertDoesNotThrow(() -> render("FROM users FETCH(REVERSE(name) AS r, LOG(score, 2) AS l, NOW() AS n, "
        + "CURRENT_DATE() AS d, CURRENT_TIME() AS t, DATEDIFF(day, created, NOW()) AS dd, DAY(created) AS dy)"));
    Document computed = (Document) pipeline("FROM users FETCH(LOG(score, 2) AS l, LOG(score) AS ln)").stage("$addFields");
    assertEquals(doc("$log", list("$score", 2)), computed.get("l"));
    assertEquals(doc("$ln", "$score"), computed.get("ln"));
  }

  @Test
  void unknownFunctionIsRejected() {
    assertThrows(UnsupportedFunctionException.class, () -> render("FROM users FETCH(SOUNDEX(name))"));
  }
}
