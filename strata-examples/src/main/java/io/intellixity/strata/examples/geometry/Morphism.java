package io.intellixity.strata.examples.geometry;

import io.intellixity.strata.deferred.DeferredReference;
import io.intellixity.strata.deferred.Facilities;
import io.intellixity.strata.deferred.ReferenceScope;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import static io.intellixity.strata.layer.CanonicalLayers.HOMSET;
import static io.intellixity.strata.layer.CanonicalLayers.MORPHISM;

/**
 * Layer 2. A named morphism between schemes.\n
 *
 * Its parent homset lives on layer 4 and is reached through {@link Parent}, which the homset implements.\n
 */
public final class Morphism {

  /** What a morphism needs to know about the set of morphisms it belongs to. */
  public interface Parent {
    Scheme domain();
    Scheme codomain();
    boolean contains(Morphism m);
  }

  public interface ParentFactory {
    Parent of(Scheme domain, Scheme codomain);
  }

  static final AtomicReference<DeferredReference<ParentFactory>> HOMSETS = new AtomicReference<>();

  private final Scheme domain;
  private final Scheme codomain;
  private final String name;

  public Morphism(Scheme domain, Scheme codomain, String name) {
    this.domain = Objects.requireNonNull(domain, "domain");
    this.codomain = Objects.requireNonNull(codomain, "codomain");
    this.name = Objects.requireNonNull(name, "name");
  }

  public Scheme domain() { return domain; }
  public Scheme codomain() { return codomain; }
  public String name() { return name; }

  public Parent parent() {
    ParentFactory homsets = GeometryDeferreds.once(HOMSETS, () -> GeometryDeferreds.resolver()
        .declareDeferred(MORPHISM, HOMSET, ReferenceScope.METHOD,
            Facilities.byClassName(GeometryDeferreds.unit("Homset$Factory"), ParentFactory.class)))
        .get();
    return homsets.of(domain, codomain);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Morphism m
        && domain.equals(m.domain) && codomain.equals(m.codomain) && name.equals(m.name));
  }

  @Override
  public int hashCode() {
    return Objects.hash(domain, codomain, name);
  }

  @Override
  public String toString() {
    return name + ": " + domain + " -> " + codomain;
  }
}
