package io.intellixity.dynaq.config;

import io.intellixity.dynaq.query.JoinKind;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Compiler settings.
 * <p>
 * {@link #load()} reads {@code dynaq.properties} from the classpath; system properties with the same
 * keys override it:
 * <pre>
 * dynaq.join.default=LEFT
 * dynaq.pagination.without-order=ERROR   # or OMIT
 * dynaq.limit.max=1000
 * </pre>
 */
public record CompilerOptions(JoinKind defaultJoinKind, PaginationPolicy paginationWithoutOrder, Integer maxLimit) {
  public static final String RESOURCE = "dynaq.properties";
  public static final String JOIN_DEFAULT = "dynaq.join.default";
  public static final String PAGINATION_WITHOUT_ORDER = "dynaq.pagination.without-order";
  public static final String LIMIT_MAX = "dynaq.limit.max";

  /** What OFFSET/FETCH dialects do with TAKE/SKIP when there is no ORDERBY. */
  public enum PaginationPolicy {
    /** Fail the render. */
    ERROR,
    /** Drop pagination and report a warning with the rendered statement. */
    OMIT
  }

  public CompilerOptions {
    Objects.requireNonNull(defaultJoinKind, "defaultJoinKind");
    Objects.requireNonNull(paginationWithoutOrder, "paginationWithoutOrder");
    if (maxLimit != null && maxLimit <= 0) throw new IllegalArgumentException(LIMIT_MAX + " must be > 0");
  }

  public static CompilerOptions defaults() {
    return new CompilerOptions(JoinKind.LEFT, PaginationPolicy.ERROR, null);
  }

  public CompilerOptions withPaginationWithoutOrder(PaginationPolicy policy) {
    return new CompilerOptions(defaultJoinKind, policy, maxLimit);
  }

  public CompilerOptions withMaxLimit(Integer max) {
    return new CompilerOptions(defaultJoinKind, paginationWithoutOrder, max);
  }

  public static CompilerOptions load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static CompilerOptions load(ClassLoader cl) {
    if (cl == null) cl = CompilerOptions.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE, e);
    }
    for (String key : new String[] {JOIN_DEFAULT, PAGINATION_WITHOUT_ORDER, LIMIT_MAX}) {
      String sys = System.getProperty(key);
      if (sys != null) p.setProperty(key, sys);
    }
    return fromProperties(p);
  }

  public static CompilerOptions fromProperties(Properties p) {
    CompilerOptions d = defaults();

    JoinKind join = d.defaultJoinKind();
    String rawJoin = trimmed(p.getProperty(JOIN_DEFAULT));
    if (rawJoin != null) {
      join = JoinKind.parse(rawJoin);
      if (join == null) throw new IllegalArgumentException("Invalid " + JOIN_DEFAULT + ": " + rawJoin);
    }

    PaginationPolicy policy = d.paginationWithoutOrder();
    String rawPolicy = trimmed(p.getProperty(PAGINATION_WITHOUT_ORDER));
    if (rawPolicy != null) {
      try {
        policy = PaginationPolicy.valueOf(rawPolicy.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid " + PAGINATION_WITHOUT_ORDER + ": " + rawPolicy, e);
      }
    }

    Integer max = null;
    String rawMax = trimmed(p.getProperty(LIMIT_MAX));
    if (rawMax != null) {
      try {
        max = Integer.parseInt(rawMax);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid " + LIMIT_MAX + ": " + rawMax, e);
      }
    }
    return new CompilerOptions(join, policy, max);
  }

  private static String trimmed(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }
}
