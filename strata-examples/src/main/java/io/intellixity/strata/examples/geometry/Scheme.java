package io.intellixity.strata.examples.geometry;

import io.intellixity.strata.deferred.DeferredReference;
import io.intellixity.strata.deferred.Facilities;
import io.intellixity.strata.deferred.ReferenceScope;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import static io.intellixity.strata.layer.CanonicalLayers.SCHEME;
import static io.intellixity.strata.layer.CanonicalLayers.SPEC;

/** Layer 1. A scheme over an optional base scheme. */
public class Scheme {
  /** Ring whose spectrum is the default base scheme. */
  public static final String BASE_RING = "ZZ";

  /** Builds the default base scheme for a ring; implemented by a higher layer. */
  public interface BaseFactory {
    Scheme over(String ring);
  }

  static final AtomicReference<DeferredReference<BaseFactory>> DEFAULT_BASE = new AtomicReference<>();

  private final String name;
  private final Scheme base;

  public Scheme(String name) {
    this(name, null);
  }

  public Scheme(String name, Scheme base) {
    this.name = Objects.requireNonNull(name, "name");
    this.base = base;
  }

  public String name() {
    return name;
  }

  /** The explicit base scheme, or Spec(ZZ) when none was given. */
  public Scheme baseScheme() {
    if (base != null) return base;
    BaseFactory spec = GeometryDeferreds.once(DEFAULT_BASE, () -> GeometryDeferreds.resolver()
        .declareDeferred(SCHEME, SPEC, ReferenceScope.METHOD,
            Facilities.byClassName(GeometryDeferreds.unit("Spec$DefaultBase"), BaseFactory.class)))
        .get();
    return spec.over(BASE_RING);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || o.getClass() != getClass()) return false;
    Scheme s = (Scheme) o;
    return name.equals(s.name) && Objects.equals(base, s.base);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), name, base);
  }

  @Override
  public String toString() {
    return name;
  }
}
