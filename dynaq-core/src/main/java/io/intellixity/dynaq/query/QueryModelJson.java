package io.intellixity.dynaq.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Shared mapper for the canonical query model JSON. */
public final class QueryModelJson {
  private static final ObjectMapper JSON = new ObjectMapper();

  private QueryModelJson() {}

  public static String toJson(QueryModel model) {
    try {
      return JSON.writeValueAsString(model);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize query model for table " + model.table(), e);
    }
  }

  public static QueryModel fromJson(String json) {
    try {
      return JSON.readValue(json, QueryModel.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid query model JSON: " + e.getOriginalMessage(), e);
    }
  }
}
