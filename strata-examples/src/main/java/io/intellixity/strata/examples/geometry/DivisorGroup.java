package io.intellixity.strata.examples.geometry;

import java.util.Map;
import java.util.Objects;

/** Layer 9. The group of divisors on a scheme. */
public final class DivisorGroup implements Divisor.Group {
  private final Scheme scheme;

  public DivisorGroup(Scheme scheme) {
    this.scheme = Objects.requireNonNull(scheme, "scheme");
  }

  @Override
  public Scheme scheme() {
    return scheme;
  }

  public Divisor divisor(Map<String, Integer> coefficients) {
    return new Divisor(scheme, coefficients);
  }

  public Divisor zero() {
    return divisor(Map.of());
  }

  @Override
  public boolean contains(Divisor d) {
    return d != null && scheme.equals(d.scheme());
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof DivisorGroup g && scheme.equals(g.scheme));
  }

  @Override
  public int hashCode() {
    return scheme.hashCode();
  }

  @Override
  public String toString() {
    return "Div(" + scheme + ")";
  }

  public static final class Factory implements Divisor.GroupFactory {
    public Factory() {}

    @Override
    public Divisor.Group on(Scheme scheme) {
      return new DivisorGroup(scheme);
    }
  }
}
