package io.intellixity.dynaq.spi.render;

import io.intellixity.dynaq.util.DynaqFactoriesLoader;

import java.util.*;

/**
 * Renderer registry built via discovery (META-INF/dynaq.factories).
 * <p>
 * Ids and aliases are case-insensitive. When two renderers claim the same id the first discovered
 * wins.
 */
public final class RendererRegistry {
  private final Map<String, QueryRenderer<?>> byId;
  private final List<QueryRenderer<?>> ordered;

  @SuppressWarnings("unchecked")
  public RendererRegistry() {
    this((List<? extends QueryRenderer<?>>) (List<?>) DynaqFactoriesLoader.load(QueryRenderer.class));
  }

  public RendererRegistry(List<? extends QueryRenderer<?>> renderers) {
    Map<String, QueryRenderer<?>> m = new LinkedHashMap<>();
    List<QueryRenderer<?>> all = new ArrayList<>();
    for (QueryRenderer<?> r : renderers) {
      if (r == null) continue;
      all.add(r);
      m.putIfAbsent(normalize(r.id()), r);
      for (String alias : r.aliases()) m.putIfAbsent(normalize(alias), r);
    }
    this.byId = Collections.unmodifiableMap(m);
    this.ordered = List.copyOf(all);
  }

  public Optional<QueryRenderer<?>> find(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(byId.get(normalize(id)));
  }

  public QueryRenderer<?> require(String id) {
    return find(id).orElseThrow(() -> new IllegalArgumentException(
        "No renderer registered for id=" + id + ", known=" + ids()));
  }

  /** Primary ids in discovery order. */
  public List<String> ids() {
    List<String> out = new ArrayList<>(ordered.size());
    for (QueryRenderer<?> r : ordered) out.add(r.id());
    return out;
  }

  public List<QueryRenderer<?>> renderers() { return ordered; }

  private static String normalize(String id) {
    return id.trim().toLowerCase(Locale.ROOT);
  }
}
