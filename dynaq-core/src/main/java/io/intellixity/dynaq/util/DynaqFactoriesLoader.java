package io.intellixity.dynaq.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Discovers SPI implementations listed in {@code META-INF/dynaq.factories}.
 * <p>
 * Every such resource on the classpath is read as a properties file keyed by the SPI interface name:
 * <pre>
 * io.intellixity.dynaq.spi.render.QueryRenderer=\
 *   com.acme.render.AcmeSqlDialect,\
 *   com.acme.render.AcmePipelineRenderer
 * </pre>
 * Resources are merged in classpath order and a class listed twice is created once.
 */
public final class DynaqFactoriesLoader {
  public static final String RESOURCE = "META-INF/dynaq.factories";

  private DynaqFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    ClassLoader loader = cl == null ? DynaqFactoriesLoader.class.getClassLoader() : cl;
    Set<String> names = implementationNames(spiType, loader);
    List<T> out = new ArrayList<>(names.size());
    for (String name : names) out.add(instantiate(name, spiType, loader));
    return out;
  }

  /** Implementation class names registered for {@code spiType}, in discovery order. */
  public static Set<String> implementationNames(Class<?> spiType, ClassLoader loader) {
    Objects.requireNonNull(spiType, "spiType");
    Set<String> names = new LinkedHashSet<>();
    for (URL url : resources(loader)) {
      String listed = read(url).getProperty(spiType.getName());
      if (listed == null) continue;
      for (String part : listed.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }
    return names;
  }

  private static List<URL> resources(ClassLoader loader) {
    try {
      return Collections.list(loader.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(String name, Class<T> spiType, ClassLoader loader) {
    Class<?> raw;
    try {
      raw = Class.forName(name, true, loader);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(RESOURCE + " lists " + name + " for " + spiType.getSimpleName()
          + " but it is not on the classpath", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalStateException(name + " is registered as " + spiType.getName() + " but does not implement it");
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (NoSuchMethodException e) {
      throw new IllegalStateException(name + " needs a public no-arg constructor", e);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot create " + name, e);
    }
  }
}
