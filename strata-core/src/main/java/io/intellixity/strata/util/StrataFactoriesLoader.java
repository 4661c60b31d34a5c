package io.intellixity.strata.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style discovery of SPI implementations.\n
 *
 * Reads every {@code META-INF/strata.factories} resource on the classpath. Each resource is a Java Properties file:\n
 *\n
 * <pre>\n
 * io.intellixity.strata.validation.ReferenceGraphProvider=com.acme.GeometryGraph,com.acme.ToricGraph\n
 * </pre>\n
 *
 * Values are comma-separated; whitespace is ignored; duplicates keep their first position.\n
 */
public final class StrataFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(StrataFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/strata.factories";

  private StrataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = StrataFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(instantiate(implName, spiType, cl));
    }
    if (log.isDebugEnabled()) {
      log.debug("strata.factories spi={} implementations={}", spiType.getName(), implNames);
    }
    return out;
  }

  /** Load, initialize and instantiate {@code implName} through its no-arg constructor. */
  public static <T> T instantiate(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Class not found: " + implName + " (for " + spiType.getName() + ")", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }
}
