package io.intellixity.strata.examples.geometry;

import io.intellixity.strata.deferred.DeferredReference;
import io.intellixity.strata.deferred.Facilities;
import io.intellixity.strata.deferred.ReferenceScope;

import java.util.*;
import java.util.concurrent.atomic.AtomicReference;

import static io.intellixity.strata.layer.CanonicalLayers.DIVISOR;
import static io.intellixity.strata.layer.CanonicalLayers.DIVISOR_GROUP;

/** Layer 8. A formal sum of named prime divisors on a scheme. Zero coefficients are dropped. */
public class Divisor {

  /** The view of a divisor group that a divisor needs; implemented on layer 9. */
  public interface Group {
    Scheme scheme();
    boolean contains(Divisor d);
  }

  public interface GroupFactory {
    Group on(Scheme scheme);
  }

  static final AtomicReference<DeferredReference<GroupFactory>> GROUPS = new AtomicReference<>();

  private final Scheme scheme;
  private final SortedMap<String, Integer> coefficients;

  public Divisor(Scheme scheme, Map<String, Integer> coefficients) {
    this.scheme = Objects.requireNonNull(scheme, "scheme");
    SortedMap<String, Integer> c = new TreeMap<>();
    for (Map.Entry<String, Integer> e : Objects.requireNonNull(coefficients, "coefficients").entrySet()) {
      if (e.getValue() != null && e.getValue() != 0) c.put(e.getKey(), e.getValue());
    }
    this.coefficients = Collections.unmodifiableSortedMap(c);
  }

  public Scheme scheme() { return scheme; }
  public SortedMap<String, Integer> coefficients() { return coefficients; }

  public int degree() {
    int d = 0;
    for (int c : coefficients.values()) d += c;
    return d;
  }

  public Group parent() {
    GroupFactory groups = GeometryDeferreds.once(GROUPS, () -> GeometryDeferreds.resolver()
        .declareDeferred(DIVISOR, DIVISOR_GROUP, ReferenceScope.METHOD,
            Facilities.byClassName(GeometryDeferreds.unit("DivisorGroup$Factory"), GroupFactory.class)))
        .get();
    return groups.on(scheme);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || o.getClass() != getClass()) return false;
    Divisor d = (Divisor) o;
    return scheme.equals(d.scheme) && coefficients.equals(d.coefficients);
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), scheme, coefficients);
  }

  @Override
  public String toString() {
    if (coefficients.isEmpty()) return "0";
    StringJoiner j = new StringJoiner(" + ");
    coefficients.forEach((k, v) -> j.add(v == 1 ? k : v + "*" + k));
    return j.toString();
  }
}
