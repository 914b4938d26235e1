package io.intellixity.dynaq.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Loads a JSON array of objects into rows (fixtures, local data files). */
public final class JsonRowSource {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};

  private JsonRowSource() {}

  public static List<Map<String, Object>> fromString(String json) {
    try {
      return JSON.readValue(json, ROWS);
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid row JSON: " + e.getMessage(), e);
    }
  }

  public static List<Map<String, Object>> fromStream(InputStream in) {
    try (InputStream s = in) {
      return JSON.readValue(s, ROWS);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read rows", e);
    }
  }

  public static List<Map<String, Object>> fromPath(Path path) {
    try {
      return fromStream(Files.newInputStream(path));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to open " + path, e);
    }
  }

  /** Classpath resource, resolved against the context class loader. */
  public static List<Map<String, Object>> fromResource(String name) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = JsonRowSource.class.getClassLoader();
    InputStream in = cl.getResourceAsStream(name);
    if (in == null) throw new IllegalArgumentException("Row resource not found: " + name);
    return fromStream(in);
  }
}
