package io.intellixity.dynaq.mongo;

import io.intellixity.dynaq.error.RenderException;
import io.intellixity.dynaq.expr.Expression;
import io.intellixity.dynaq.expr.Literal;
import io.intellixity.dynaq.query.*;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static io.intellixity.dynaq.mongo.MongoFunctions.list;
import static io.intellixity.dynaq.mongo.MongoFunctions.op;

/**
 * Renders FILTER and HAVING trees as {@code $expr} predicates, so that document fields, computed
 * fields and literals compare the same way.
 */
final class MongoPredicates {
  private final FieldResolver fields;

  MongoPredicates(FieldResolver fields) {
    this.fields = fields;
  }

  Document build(FilterNode node, PipelineContext ctx) {
    return node.accept(new FilterVisitor<Document>() {
      @Override
      public Document visit(Logical logical) {
        String op = logical.clause() == Clause.OR ? "$or" : "$and";
        return op(op, list(logical.left().accept(this), logical.right().accept(this)));
      }

      @Override
      public Document visit(Condition c) {
        return condition(c, ctx);
      }
    });
  }

  private Document condition(Condition c, PipelineContext ctx) {
    Operator op = c.operator();
    Object lhs = fields.field(fields.classify(c.column()), null, ctx);
    switch (op.family()) {
      case NULL_CHECK -> {
        Document isNull = op("$eq", list(op("$ifNull", list(lhs, null)), null));
        return op == Operator.IS_NULL ? isNull : not(isNull);
      }
      case MEMBERSHIP -> {
        List<Object> items = new ArrayList<>(c.values().size());
        for (String item : c.values()) items.add(operand(fields.resolver().classifyItem(item), ctx));
        Document in = op("$in", list(lhs, items));
        return op.negated() ? present(lhs, not(in)) : in;
      }
      case RANGE -> {
        Object lo = operand(fields.resolver().classifyItem(c.values().get(0)), ctx);
        Object hi = operand(fields.resolver().classifyItem(c.values().get(1)), ctx);
        if (op.negated()) return present(lhs, op("$or", list(op("$lt", list(lhs, lo)), op("$gt", list(lhs, hi)))));
        return op("$and", list(op("$gte", list(lhs, lo)), op("$lte", list(lhs, hi))));
      }
      case COMPARISON -> {
        return comparison(op, lhs, operand(fields.resolver().classifyValue(c.value(), c.quoted()), ctx));
      }
      default -> {
        Document positive = pattern(op, lhs, fields.resolver().classifyValue(c.value(), c.quoted()), ctx);
        return op.negated() ? present(lhs, not(positive)) : positive;
      }
    }
  }

  private Object operand(Expression e, PipelineContext ctx) {
    return fields.field(e, null, ctx);
  }

  private static Document comparison(Operator op, Object lhs, Object rhs) {
    return switch (op) {
      case EQ -> op("$eq", list(lhs, rhs));
      case NEQ -> present(lhs, op("$ne", list(lhs, rhs)));
      case GT -> op("$gt", list(lhs, rhs));
      case GTE -> op("$gte", list(lhs, rhs));
      // null sorts below every value in BSON order, so an upper bound alone would match it
      case LT -> op("$and", list(op("$gt", list(lhs, null)), op("$lt", list(lhs, rhs))));
      case LTE -> op("$and", list(op("$gt", list(lhs, null)), op("$lte", list(lhs, rhs))));
      default -> throw new IllegalArgumentException("Not a comparison: " + op);
    };
  }

  private Document pattern(Operator op, Object lhs, Expression rhs, PipelineContext ctx) {
    if (rhs instanceof Literal l && l.type() != Literal.Type.NULL) {
      String v = l.text();
      String regex = switch (op.family()) {
        case LIKE -> likeRegex(v);
        case CONTAINS -> Pattern.quote(v);
        case BEGINS_WITH -> "^" + Pattern.quote(v);
        case ENDS_WITH -> Pattern.quote(v) + "$";
        default -> throw new IllegalArgumentException("Not a pattern operator: " + op);
      };
      return op("$regexMatch", new Document("input", lhs).append("regex", regex)
          .append("options", op.caseInsensitive() ? "i" : ""));
    }

    if (op.family() == Operator.Family.LIKE) {
      throw new RenderException(MongoPipelineRenderer.ID, op.keyword() + " needs a literal pattern on " + MongoPipelineRenderer.ID);
    }
    Object s = lhs;
    Object find = operand(rhs, ctx);
    if (op.caseInsensitive()) {
      s = op("$toLower", s);
      find = op("$toLower", find);
    }
    return switch (op.family()) {
      case CONTAINS -> op("$gte", list(op("$indexOfCP", list(s, find)), 0));
      case BEGINS_WITH -> op("$eq", list(op("$indexOfCP", list(s, find)), 0));
      default -> {
        Document sLen = op("$strLenCP", s);
        Document fLen = op("$strLenCP", find);
        Document tail = op("$substrCP", list(s, op("$subtract", list(sLen, fLen)), fLen));
        yield op("$cond", list(op("$gte", list(sLen, fLen)), op("$eq", list(tail, find)), false));
      }
    };
  }

  /** Anchored regex for a LIKE pattern: {@code %} is any run, {@code _} one character. */
  static String likeRegex(String likePattern) {
    StringBuilder re = new StringBuilder("^");
    StringBuilder run = new StringBuilder();
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%' || ch == '_') {
        if (run.length() > 0) re.append(Pattern.quote(run.toString()));
        run.setLength(0);
        re.append(ch == '%' ? ".*" : ".");
      } else {
        run.append(ch);
      }
    }
    if (run.length() > 0) re.append(Pattern.quote(run.toString()));
    return re.append('$').toString();
  }

  /** A null or missing field fails every comparison, negated ones included. */
  private static Document present(Object lhs, Document predicate) {
    return op("$and", list(op("$ne", list(op("$ifNull", list(lhs, null)), null)), predicate));
  }

  private static Document not(Document positive) {
    return op("$not", list(positive));
  }
}
