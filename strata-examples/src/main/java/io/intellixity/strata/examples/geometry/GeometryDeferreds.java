package io.intellixity.strata.examples.geometry;

import io.intellixity.strata.deferred.DeferredReference;
import io.intellixity.strata.deferred.DeferredReferenceResolver;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/** The resolver shared by the geometric types; holds no references itself. */
final class GeometryDeferreds {
  private GeometryDeferreds() {}

  private static final DeferredReferenceResolver RESOLVER = new DeferredReferenceResolver();

  static DeferredReferenceResolver resolver() {
    return RESOLVER;
  }

  /**
   * The reference kept in {@code slot}, declaring it on first use. Callers then share one cached resolution.
   * Racing first calls may each declare; only the first stored reference is used.
   */
  static <T> DeferredReference<T> once(AtomicReference<DeferredReference<T>> slot,
                                       Supplier<DeferredReference<T>> declaration) {
    DeferredReference<T> ref = slot.get();
    if (ref != null) return ref;
    slot.compareAndSet(null, declaration.get());
    return slot.get();
  }

  static String unit(String simpleName) {
    return GeometryDeferreds.class.getPackageName() + "." + simpleName;
  }
}
