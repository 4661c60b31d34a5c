package io.intellixity.strata.examples.geometry;

import java.util.Objects;

/** Layer 4. All morphisms from one scheme to another. Morphisms and homsets refer to each other at runtime. */
public final class Homset implements Morphism.Parent {
  private final Scheme domain;
  private final Scheme codomain;

  public Homset(Scheme domain, Scheme codomain) {
    this.domain = Objects.requireNonNull(domain, "domain");
    this.codomain = Objects.requireNonNull(codomain, "codomain");
  }

  @Override public Scheme domain() { return domain; }
  @Override public Scheme codomain() { return codomain; }

  public Morphism morphism(String name) {
    return new Morphism(domain, codomain, name);
  }

  public Morphism identity() {
    if (!domain.equals(codomain)) throw new IllegalStateException("No identity in " + this);
    return morphism("id");
  }

  @Override
  public boolean contains(Morphism m) {
    return m != null && domain.equals(m.domain()) && codomain.equals(m.codomain());
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Homset h && domain.equals(h.domain) && codomain.equals(h.codomain));
  }

  @Override
  public int hashCode() {
    return Objects.hash(domain, codomain);
  }

  @Override
  public String toString() {
    return "Hom(" + domain + ", " + codomain + ")";
  }

  public static final class Factory implements Morphism.ParentFactory {
    public Factory() {}

    @Override
    public Morphism.Parent of(Scheme domain, Scheme codomain) {
      return new Homset(domain, codomain);
    }
  }
}
