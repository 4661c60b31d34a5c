package io.intellixity.strata.deferred;

import io.intellixity.strata.util.StrataFactoriesLoader;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Resolution functions that name the referenced unit by string.\n
 *
 * The referencing class then holds no constant-pool link to the referenced class, so loading it cannot pull the
 * referenced unit in; the class is loaded and initialized when the supplier first runs.\n
 */
public final class Facilities {
  private Facilities() {}

  /** Instantiate {@code className} through its no-arg constructor, checked against {@code facilityType}. */
  public static <T> Supplier<T> byClassName(String className, Class<T> facilityType) {
    return byClassName(className, facilityType, null);
  }

  public static <T> Supplier<T> byClassName(String className, Class<T> facilityType, ClassLoader cl) {
    Objects.requireNonNull(className, "className");
    Objects.requireNonNull(facilityType, "facilityType");
    if (className.isBlank()) throw new IllegalArgumentException("className is blank");
    return () -> StrataFactoriesLoader.instantiate(className.trim(), facilityType, classLoader(cl));
  }

  private static ClassLoader classLoader(ClassLoader cl) {
    if (cl != null) return cl;
    ClassLoader ctx = Thread.currentThread().getContextClassLoader();
    return ctx != null ? ctx : Facilities.class.getClassLoader();
  }
}
