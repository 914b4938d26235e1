package io.intellixity.dynaq.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoDatabase;
import io.intellixity.dynaq.error.QueryExecutionException;
import io.intellixity.dynaq.spi.exec.QueryExecutor;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.*;

/** Runs a {@link MongoPipeline} with {@code aggregate} on its collection. */
public final class MongoQueryExecutor implements QueryExecutor<MongoPipeline> {
  private static final Logger log = LoggerFactory.getLogger(MongoQueryExecutor.class);
  private final MongoDatabase db;

  public MongoQueryExecutor(MongoDatabase db) {
    this.db = Objects.requireNonNull(db, "db");
  }

  @Override
  public List<Map<String, Object>> execute(MongoPipeline pipeline) {
    Objects.requireNonNull(pipeline, "pipeline");
    if (log.isDebugEnabled()) {
      log.debug("dynaq.mongo collection={} stages={}", pipeline.collection(), pipeline.toJson());
    }
    List<Document> docs;
    try {
      docs = db.getCollection(pipeline.collection()).aggregate(pipeline.stages()).into(new ArrayList<>());
    } catch (MongoException e) {
      throw new QueryExecutionException("Aggregation failed on collection " + pipeline.collection() + ": "
          + pipeline.toJson(), e);
    }

    List<Map<String, Object>> out = new ArrayList<>(docs.size());
    for (Document d : docs) {
      Map<String, Object> row = new LinkedHashMap<>(d.size() * 2);
      for (Map.Entry<String, Object> e : d.entrySet()) row.put(e.getKey(), value(e.getValue()));
      out.add(row);
    }
    return out;
  }

  /** BSON ids become hex strings and dates UTC {@link LocalDateTime}s. */
  private static Object value(Object v) {
    if (v instanceof ObjectId id) return id.toHexString();
    if (v instanceof Date d) return LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC);
    return v;
  }
}
